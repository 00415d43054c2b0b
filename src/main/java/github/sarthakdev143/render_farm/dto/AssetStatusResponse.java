package github.sarthakdev143.render_farm.dto;

public record AssetStatusResponse(
        String path,
        String recordedHash,
        boolean needsUpload) {
}
