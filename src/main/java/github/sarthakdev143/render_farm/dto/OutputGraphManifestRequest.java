package github.sarthakdev143.render_farm.dto;

import java.util.List;

public record OutputGraphManifestRequest(
        Integer frameStart,
        Integer frameEnd,
        Integer frameCurrent,
        List<OutputNodeRequest> nodes) {
}
