package github.sarthakdev143.render_farm.model;

import java.nio.file.Path;

public record ReconciledArtifact(
        int frame,
        Path sourceTempPath,
        Path resolvedFinalPath,
        boolean fallback) {
}
