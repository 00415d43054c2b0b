package github.sarthakdev143.render_farm.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public record RenderJobStatus(
        String jobId,
        RenderJobState state,
        String message,
        Instant createdAt,
        Instant updatedAt,
        String sceneName,
        RenderType renderType,
        Integer frameStart,
        Integer frameEnd,
        int framesRequested,
        int framesSucceeded,
        int framesFailed,
        Map<Integer, String> failedFrames,
        List<String> outputs,
        int uploadedFiles,
        String warningMessage) {

    public RenderJobStatus {
        failedFrames = failedFrames == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(failedFrames));
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }
}
