package github.sarthakdev143.render_farm.dto;

public record ImageFormatRequest(
        String fileFormat,
        Integer colorDepth,
        String colorMode) {
}
