package github.sarthakdev143.render_farm.model.graph;

public record ImageFormat(
        String kind,
        Integer bitDepth,
        String colorMode) {
}
