package github.sarthakdev143.render_farm.model;

import github.sarthakdev143.render_farm.model.graph.OutputGraph;

public record RenderRequest(
        String jobId,
        SceneRef sceneRef,
        FrameSpec frameSpec,
        int concurrencyLimit,
        boolean gpu,
        OutputGraph outputGraph) {

    public RenderRequest {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be at least 1.");
        }
        if (frameSpec == null) {
            throw new IllegalArgumentException("frameSpec is required.");
        }
    }
}
