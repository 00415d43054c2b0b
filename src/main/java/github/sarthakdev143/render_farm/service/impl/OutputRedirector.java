package github.sarthakdev143.render_farm.service.impl;

import github.sarthakdev143.render_farm.exception.RedirectException;
import github.sarthakdev143.render_farm.model.graph.OutputGraph;
import github.sarthakdev143.render_farm.model.graph.OutputGraphSnapshot;
import github.sarthakdev143.render_farm.model.graph.OutputNode;
import github.sarthakdev143.render_farm.model.graph.OutputSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Points every File Output node of a worker's graph at a scratch directory and puts the
 * original paths back afterwards.
 */
@Component
public class OutputRedirector {

    private static final Logger logger = LoggerFactory.getLogger(OutputRedirector.class);

    /**
     * Creates {@code scratchDirectory}, snapshots the graph's paths and redirects every node's
     * base path there. Slot paths are left alone. The graph is untouched when the directory
     * cannot be created.
     */
    public OutputGraphSnapshot redirect(OutputGraph graph, Path scratchDirectory) throws RedirectException {
        try {
            Files.createDirectories(scratchDirectory);
        } catch (IOException e) {
            throw new RedirectException(scratchDirectory, e);
        }

        OutputGraphSnapshot snapshot = graph.snapshot();
        String redirectedBase = scratchDirectory.toAbsolutePath().toString();
        for (OutputNode node : graph.nodes()) {
            node.setBasePath(redirectedBase);
        }
        logger.debug("Redirected {} output nodes to {}", graph.nodes().size(), redirectedBase);
        return snapshot;
    }

    /**
     * Writes the snapshot's paths back by node and slot index. Safe to call more than once.
     */
    public void restore(OutputGraph graph, OutputGraphSnapshot snapshot) {
        if (graph == null || snapshot == null) {
            return;
        }

        List<OutputNode> nodes = graph.nodes();
        List<OutputGraphSnapshot.NodeSnapshot> savedNodes = snapshot.nodes();
        if (nodes.size() != savedNodes.size()) {
            logger.warn(
                    "Output graph has {} nodes but snapshot has {}; restoring the overlapping nodes only",
                    nodes.size(),
                    savedNodes.size());
        }

        int nodeCount = Math.min(nodes.size(), savedNodes.size());
        for (int nodeIndex = 0; nodeIndex < nodeCount; nodeIndex++) {
            OutputNode node = nodes.get(nodeIndex);
            OutputGraphSnapshot.NodeSnapshot savedNode = savedNodes.get(nodeIndex);
            node.setBasePath(savedNode.basePath());

            List<OutputSlot> slots = node.slots();
            List<OutputGraphSnapshot.SlotSnapshot> savedSlots = savedNode.slots();
            if (slots.size() != savedSlots.size()) {
                logger.warn(
                        "Output node {} has {} slots but snapshot has {}; restoring the overlapping slots only",
                        node.name(),
                        slots.size(),
                        savedSlots.size());
            }
            int slotCount = Math.min(slots.size(), savedSlots.size());
            for (int slotIndex = 0; slotIndex < slotCount; slotIndex++) {
                slots.get(slotIndex).setPath(savedSlots.get(slotIndex).path());
            }
        }
    }

    /**
     * Every regular file under {@code scratchDirectory}, keyed by its {@code /}-separated
     * relative path, in sorted order.
     */
    public Map<String, Path> collect(Path scratchDirectory) throws IOException {
        Map<String, Path> produced = new TreeMap<>();
        if (Files.notExists(scratchDirectory)) {
            return produced;
        }

        try (Stream<Path> paths = Files.walk(scratchDirectory)) {
            paths.filter(Files::isRegularFile).forEach(file -> {
                String relative = scratchDirectory.relativize(file).toString().replace('\\', '/');
                produced.put(relative, file);
            });
        }
        return produced;
    }
}
