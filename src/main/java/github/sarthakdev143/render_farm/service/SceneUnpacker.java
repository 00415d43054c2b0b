package github.sarthakdev143.render_farm.service;

import java.io.IOException;
import java.nio.file.Path;

public interface SceneUnpacker {

    /**
     * Unpacks packed resources next to the scene and saves it in place.
     */
    void unpackAndResave(Path scenePath) throws IOException, InterruptedException;
}
