package github.sarthakdev143.render_farm.dto;

import java.util.List;

public record OutputNodeRequest(
        String name,
        String basePath,
        ImageFormatRequest format,
        List<OutputSlotRequest> slots) {
}
