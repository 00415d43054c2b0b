package github.sarthakdev143.render_farm.model;

import github.sarthakdev143.render_farm.model.graph.OutputGraph;

public record SceneDescription(
        int frameStart,
        int frameEnd,
        int frameCurrent,
        OutputGraph outputGraph) {

    public SceneDescription {
        outputGraph = outputGraph == null ? new OutputGraph(null) : outputGraph;
    }
}
