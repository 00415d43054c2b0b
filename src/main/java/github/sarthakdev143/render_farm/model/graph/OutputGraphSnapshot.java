package github.sarthakdev143.render_farm.model.graph;

import java.util.List;

public record OutputGraphSnapshot(List<NodeSnapshot> nodes) {

    public OutputGraphSnapshot {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public record NodeSnapshot(String name, String basePath, List<SlotSnapshot> slots) {

        public NodeSnapshot {
            slots = slots == null ? List.of() : List.copyOf(slots);
        }
    }

    public record SlotSnapshot(String name, String path, ImageFormat format) {
    }
}
