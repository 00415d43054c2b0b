package github.sarthakdev143.render_farm.exception;

import java.io.IOException;
import java.nio.file.Path;

public class RedirectException extends IOException {

    private final Path scratchDirectory;

    public RedirectException(Path scratchDirectory, Throwable cause) {
        super("Could not create scratch directory " + scratchDirectory, cause);
        this.scratchDirectory = scratchDirectory;
    }

    public Path getScratchDirectory() {
        return scratchDirectory;
    }
}
