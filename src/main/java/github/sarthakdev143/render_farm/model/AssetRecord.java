package github.sarthakdev143.render_farm.model;

public record AssetRecord(
        String path,
        String contentHash,
        double modifiedTime) {
}
