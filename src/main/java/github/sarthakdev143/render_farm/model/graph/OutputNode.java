package github.sarthakdev143.render_farm.model.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A compositor File Output node: a base path plus an ordered list of slots.
 * Base and slot paths are mutable so a worker can redirect its own copy.
 */
public final class OutputNode {

    private final String name;
    private final ImageFormat format;
    private final List<OutputSlot> slots;
    private String basePath;

    public OutputNode(String name, String basePath, ImageFormat format, List<OutputSlot> slots) {
        this.name = name;
        this.basePath = basePath;
        this.format = format;
        this.slots = slots == null ? new ArrayList<>() : new ArrayList<>(slots);
    }

    public String name() {
        return name;
    }

    public String basePath() {
        return basePath;
    }

    public void setBasePath(String basePath) {
        this.basePath = basePath;
    }

    public ImageFormat format() {
        return format;
    }

    public List<OutputSlot> slots() {
        return Collections.unmodifiableList(slots);
    }

    OutputNode copy() {
        List<OutputSlot> copiedSlots = new ArrayList<>(slots.size());
        for (OutputSlot slot : slots) {
            copiedSlots.add(slot.copy());
        }
        return new OutputNode(name, basePath, format, copiedSlots);
    }
}
