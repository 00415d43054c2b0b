package github.sarthakdev143.render_farm.dto;

import github.sarthakdev143.render_farm.model.RenderJobState;

public record RenderJobSubmissionResponse(
        String jobId,
        RenderJobState state,
        String message) {
}
