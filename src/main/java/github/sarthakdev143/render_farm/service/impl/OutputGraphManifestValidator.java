package github.sarthakdev143.render_farm.service.impl;

import github.sarthakdev143.render_farm.dto.ImageFormatRequest;
import github.sarthakdev143.render_farm.dto.OutputGraphManifestRequest;
import github.sarthakdev143.render_farm.dto.OutputNodeRequest;
import github.sarthakdev143.render_farm.dto.OutputSlotRequest;
import github.sarthakdev143.render_farm.model.SceneDescription;
import github.sarthakdev143.render_farm.model.graph.ImageFormat;
import github.sarthakdev143.render_farm.model.graph.OutputGraph;
import github.sarthakdev143.render_farm.model.graph.OutputNode;
import github.sarthakdev143.render_farm.model.graph.OutputSlot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
public class OutputGraphManifestValidator {

    private static final int MAX_NODES = 32;
    private static final int MAX_SLOTS_PER_NODE = 64;
    private static final Set<Integer> ALLOWED_COLOR_DEPTHS = Set.of(16, 32);
    private static final int DEFAULT_FRAME_START = 1;
    private static final String DEFAULT_NODE_NAME = "File Output";

    public SceneDescription normalizeAndValidate(OutputGraphManifestRequest manifest) {
        if (manifest == null) {
            throw new IllegalArgumentException("manifest is required.");
        }

        int frameStart = manifest.frameStart() != null ? manifest.frameStart() : DEFAULT_FRAME_START;
        int frameEnd = manifest.frameEnd() != null ? manifest.frameEnd() : frameStart;
        int frameCurrent = manifest.frameCurrent() != null ? manifest.frameCurrent() : frameStart;
        if (frameStart < 0) {
            throw new IllegalArgumentException("manifest.frameStart must be 0 or greater.");
        }
        if (frameEnd < frameStart) {
            throw new IllegalArgumentException("manifest.frameEnd must not be before manifest.frameStart.");
        }
        if (frameCurrent < 0) {
            throw new IllegalArgumentException("manifest.frameCurrent must be 0 or greater.");
        }

        List<OutputNodeRequest> nodes = manifest.nodes();
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("manifest.nodes must contain at least one File Output node.");
        }
        if (nodes.size() > MAX_NODES) {
            throw new IllegalArgumentException("manifest.nodes supports at most " + MAX_NODES + " nodes.");
        }

        List<OutputNode> outputNodes = new ArrayList<>(nodes.size());
        for (int index = 0; index < nodes.size(); index++) {
            outputNodes.add(normalizeNode(nodes.get(index), index));
        }

        return new SceneDescription(frameStart, frameEnd, frameCurrent, new OutputGraph(outputNodes));
    }

    private OutputNode normalizeNode(OutputNodeRequest node, int index) {
        String fieldPrefix = "manifest.nodes[" + index + "]";
        if (node == null) {
            throw new IllegalArgumentException(fieldPrefix + " is required.");
        }
        if (node.basePath() == null || node.basePath().isBlank()) {
            throw new IllegalArgumentException(fieldPrefix + ".basePath is required.");
        }

        List<OutputSlotRequest> slots = node.slots();
        if (slots == null || slots.isEmpty()) {
            throw new IllegalArgumentException(fieldPrefix + ".slots must contain at least one slot.");
        }
        if (slots.size() > MAX_SLOTS_PER_NODE) {
            throw new IllegalArgumentException(
                    fieldPrefix + ".slots supports at most " + MAX_SLOTS_PER_NODE + " slots.");
        }

        ImageFormat nodeFormat = normalizeFormat(node.format(), fieldPrefix + ".format");
        Set<String> seenNames = new HashSet<>();
        List<OutputSlot> outputSlots = new ArrayList<>(slots.size());
        for (int slotIndex = 0; slotIndex < slots.size(); slotIndex++) {
            String slotPrefix = fieldPrefix + ".slots[" + slotIndex + "]";
            OutputSlotRequest slot = slots.get(slotIndex);
            if (slot == null) {
                throw new IllegalArgumentException(slotPrefix + " is required.");
            }
            if (slot.path() == null || slot.path().isBlank()) {
                throw new IllegalArgumentException(slotPrefix + ".path is required.");
            }

            String path = slot.path().trim();
            String name = slot.name() == null || slot.name().isBlank() ? path : slot.name().trim();
            if (!seenNames.add(name)) {
                throw new IllegalArgumentException(slotPrefix + ".name '" + name + "' is duplicated.");
            }

            ImageFormat slotFormat = slot.format() == null
                    ? nodeFormat
                    : normalizeFormat(slot.format(), slotPrefix + ".format");
            outputSlots.add(new OutputSlot(name, path, slotFormat));
        }

        String name = node.name() == null || node.name().isBlank()
                ? defaultNodeName(index)
                : node.name().trim();
        return new OutputNode(name, node.basePath().trim(), nodeFormat, outputSlots);
    }

    private ImageFormat normalizeFormat(ImageFormatRequest format, String field) {
        if (format == null) {
            return null;
        }
        if (format.colorDepth() != null && !ALLOWED_COLOR_DEPTHS.contains(format.colorDepth())) {
            throw new IllegalArgumentException(field + ".colorDepth must be 16 or 32.");
        }

        String fileFormat = format.fileFormat() == null || format.fileFormat().isBlank()
                ? null
                : format.fileFormat().trim().toUpperCase(Locale.ROOT);
        String colorMode = format.colorMode() == null || format.colorMode().isBlank()
                ? null
                : format.colorMode().trim().toUpperCase(Locale.ROOT);
        return new ImageFormat(fileFormat, format.colorDepth(), colorMode);
    }

    // Matches Blender's own naming for duplicated nodes.
    private String defaultNodeName(int index) {
        return index == 0 ? DEFAULT_NODE_NAME : String.format(Locale.ROOT, "%s.%03d", DEFAULT_NODE_NAME, index);
    }
}
