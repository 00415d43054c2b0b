package github.sarthakdev143.render_farm.dto;

public record OutputSlotRequest(
        String name,
        String path,
        ImageFormatRequest format) {
}
