package github.sarthakdev143.render_farm.service;

import github.sarthakdev143.render_farm.exception.PreparationException;
import github.sarthakdev143.render_farm.model.SceneDescription;
import github.sarthakdev143.render_farm.model.SceneRef;

public interface SceneInspector {

    SceneDescription inspect(SceneRef sceneRef) throws PreparationException;
}
