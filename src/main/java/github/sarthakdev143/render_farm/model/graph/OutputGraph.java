package github.sarthakdev143.render_farm.model.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered set of File Output nodes. Node index is the identity used when restoring
 * paths and when matching produced files, so the order never changes after construction.
 */
public final class OutputGraph {

    private final List<OutputNode> nodes;

    public OutputGraph(List<OutputNode> nodes) {
        this.nodes = nodes == null ? new ArrayList<>() : new ArrayList<>(nodes);
    }

    public List<OutputNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Deep copy; mutating the copy's paths leaves this graph untouched.
     */
    public OutputGraph copy() {
        List<OutputNode> copiedNodes = new ArrayList<>(nodes.size());
        for (OutputNode node : nodes) {
            copiedNodes.add(node.copy());
        }
        return new OutputGraph(copiedNodes);
    }

    public OutputGraphSnapshot snapshot() {
        List<OutputGraphSnapshot.NodeSnapshot> nodeSnapshots = new ArrayList<>(nodes.size());
        for (OutputNode node : nodes) {
            List<OutputGraphSnapshot.SlotSnapshot> slotSnapshots = new ArrayList<>(node.slots().size());
            for (OutputSlot slot : node.slots()) {
                slotSnapshots.add(new OutputGraphSnapshot.SlotSnapshot(slot.name(), slot.path(), slot.format()));
            }
            nodeSnapshots.add(new OutputGraphSnapshot.NodeSnapshot(node.name(), node.basePath(), slotSnapshots));
        }
        return new OutputGraphSnapshot(nodeSnapshots);
    }
}
