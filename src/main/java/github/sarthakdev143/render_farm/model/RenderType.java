package github.sarthakdev143.render_farm.model;

import java.util.Locale;

public enum RenderType {
    FRAME,
    ANIMATION,
    RANGE;

    public static RenderType fromInput(String input) {
        if (input == null || input.isBlank()) {
            return FRAME;
        }

        try {
            return RenderType.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("renderType must be one of FRAME, ANIMATION, RANGE.");
        }
    }
}
