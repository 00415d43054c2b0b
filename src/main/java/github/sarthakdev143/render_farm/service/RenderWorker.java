package github.sarthakdev143.render_farm.service;

import github.sarthakdev143.render_farm.exception.RenderException;
import github.sarthakdev143.render_farm.model.SceneRef;
import github.sarthakdev143.render_farm.model.graph.OutputGraph;

/**
 * Renders one frame of a prepared scene, writing through the graph's current paths.
 */
public interface RenderWorker {

    void render(SceneRef sceneRef, int frame, OutputGraph graph, boolean gpu) throws RenderException;
}
