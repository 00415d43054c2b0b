package github.sarthakdev143.render_farm.model;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Inclusive frame range; a single frame is a range whose start equals its end.
 */
public record FrameSpec(int start, int end) {

    public FrameSpec {
        if (start < 0) {
            throw new IllegalArgumentException("Frame numbers must not be negative.");
        }
        if (end < start) {
            throw new IllegalArgumentException("Frame range end must not be before its start.");
        }
    }

    public static FrameSpec single(int frame) {
        return new FrameSpec(frame, frame);
    }

    public static FrameSpec range(int start, int end) {
        return new FrameSpec(start, end);
    }

    public int count() {
        return end - start + 1;
    }

    public List<Integer> frames() {
        return IntStream.rangeClosed(start, end).boxed().toList();
    }
}
