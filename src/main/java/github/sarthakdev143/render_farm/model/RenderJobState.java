package github.sarthakdev143.render_farm.model;

public enum RenderJobState {
    QUEUED,
    PREPARING,
    RENDERING,
    RECONCILING,
    UPLOADING,
    COMPLETED,
    FAILED
}
