package github.sarthakdev143.render_farm.service.impl;

import github.sarthakdev143.render_farm.model.FrameResult;
import github.sarthakdev143.render_farm.model.ReconciledArtifact;
import github.sarthakdev143.render_farm.model.graph.OutputGraphSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Copies a frame's scratch files to the locations its File Output slots originally pointed at.
 */
@Component
public class ResultReconciler {

    private static final Logger logger = LoggerFactory.getLogger(ResultReconciler.class);
    static final String FALLBACK_DIRECTORY = "farm_render_output";

    private final Counter fallbackCounter;

    public ResultReconciler(MeterRegistry meterRegistry) {
        this.fallbackCounter = meterRegistry.counter("render_farm.reconcile.fallbacks");
    }

    /**
     * Resolves and copies every produced file of {@code result}.
     *
     * @param jobRoot directory that {@code //} and relative base paths resolve against
     * @throws IOException when a destination cannot be created or written
     */
    public List<ReconciledArtifact> reconcile(FrameResult result, Path jobRoot) throws IOException {
        List<ReconciledArtifact> artifacts = new ArrayList<>();
        OutputGraphSnapshot snapshot = result.originalOutputSnapshot();
        int frame = result.frame();

        for (Map.Entry<String, Path> produced : result.producedFiles().entrySet()) {
            String relativePath = produced.getKey();
            Path target = matchSlot(snapshot, relativePath, frame, jobRoot);
            boolean fallback = target == null;
            if (fallback) {
                target = fallbackTarget(snapshot, relativePath, frame, jobRoot);
                fallbackCounter.increment();
                logger.warn(
                        "Frame {} file {} matched no output slot; saving to fallback location {}",
                        frame,
                        relativePath,
                        target);
            }

            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(produced.getValue(), target, StandardCopyOption.REPLACE_EXISTING);
            logger.info("Saved frame {} file to {}", frame, target);
            artifacts.add(new ReconciledArtifact(frame, produced.getValue(), target, fallback));
        }
        return artifacts;
    }

    // First slot in snapshot order with the same basename wins.
    private Path matchSlot(OutputGraphSnapshot snapshot, String relativePath, int frame, Path jobRoot) {
        String producedName = FramePathTemplates.basename(relativePath);
        for (OutputGraphSnapshot.NodeSnapshot node : snapshot.nodes()) {
            for (OutputGraphSnapshot.SlotSnapshot slot : node.slots()) {
                String slotPath = FramePathTemplates.substitute(slot.path(), frame);
                if (producedName.equals(FramePathTemplates.basename(slotPath))) {
                    return FramePathTemplates.resolveBasePath(node.basePath(), frame, jobRoot).resolve(slotPath);
                }
            }
        }
        return null;
    }

    private Path fallbackTarget(OutputGraphSnapshot snapshot, String relativePath, int frame, Path jobRoot) {
        if (snapshot.isEmpty()) {
            return jobRoot.resolve(FALLBACK_DIRECTORY).resolve(relativePath);
        }
        String firstBase = snapshot.nodes().get(0).basePath();
        return FramePathTemplates.resolveBasePath(firstBase, frame, jobRoot).resolve(relativePath);
    }
}
