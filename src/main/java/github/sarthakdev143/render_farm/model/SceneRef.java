package github.sarthakdev143.render_farm.model;

import java.nio.file.Path;

public record SceneRef(
        Path path,
        String sceneName,
        String contentHash) {
}
