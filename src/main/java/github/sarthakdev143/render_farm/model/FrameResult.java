package github.sarthakdev143.render_farm.model;

import github.sarthakdev143.render_farm.model.graph.OutputGraphSnapshot;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public record FrameResult(
        int frame,
        Map<String, Path> producedFiles,
        OutputGraphSnapshot originalOutputSnapshot,
        String failureMessage) {

    public FrameResult {
        producedFiles = producedFiles == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(producedFiles));
        originalOutputSnapshot = originalOutputSnapshot == null
                ? new OutputGraphSnapshot(null)
                : originalOutputSnapshot;
    }

    public static FrameResult succeeded(int frame, Map<String, Path> producedFiles, OutputGraphSnapshot snapshot) {
        return new FrameResult(frame, producedFiles, snapshot, null);
    }

    public static FrameResult failed(int frame, String failureMessage) {
        return new FrameResult(frame, Map.of(), null, failureMessage);
    }

    public boolean succeeded() {
        return failureMessage == null;
    }
}
