package github.sarthakdev143.render_farm.model;

public enum UploadSinkAvailability {
    AVAILABLE,
    UNAVAILABLE,
    DISABLED
}
