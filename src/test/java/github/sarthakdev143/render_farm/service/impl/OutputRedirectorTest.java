package github.sarthakdev143.render_farm.service.impl;

import github.sarthakdev143.render_farm.exception.RedirectException;
import github.sarthakdev143.render_farm.model.graph.OutputGraph;
import github.sarthakdev143.render_farm.model.graph.OutputGraphSnapshot;
import github.sarthakdev143.render_farm.model.graph.OutputNode;
import github.sarthakdev143.render_farm.model.graph.OutputSlot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutputRedirectorTest {

    private final OutputRedirector redirector = new OutputRedirector();

    @TempDir
    Path tempDir;

    @Test
    void redirectPointsEveryNodeAtScratchAndLeavesSlotsAlone() throws Exception {
        OutputGraph graph = twoNodeGraph();
        Path scratch = tempDir.resolve("scratch/frame-1");

        OutputGraphSnapshot snapshot = redirector.redirect(graph, scratch);

        assertThat(Files.isDirectory(scratch)).isTrue();
        assertThat(graph.nodes()).allSatisfy(node ->
                assertThat(node.basePath()).isEqualTo(scratch.toAbsolutePath().toString()));
        assertThat(graph.nodes().get(0).slots().get(0).path()).isEqualTo("beauty_####.exr");
        assertThat(snapshot.nodes()).extracting(OutputGraphSnapshot.NodeSnapshot::basePath)
                .containsExactly("//renders/main/", "//renders/data/");
    }

    @Test
    void restoreAfterRedirectRestoresEveryBaseAndSlotPath() throws Exception {
        OutputGraph graph = twoNodeGraph();
        OutputGraphSnapshot before = graph.snapshot();

        OutputGraphSnapshot snapshot = redirector.redirect(graph, tempDir.resolve("frame-5"));
        graph.nodes().get(1).slots().get(0).setPath("changed.exr");
        redirector.restore(graph, snapshot);

        assertThat(graph.snapshot()).isEqualTo(before);
    }

    @Test
    void restoreIsIdempotent() throws Exception {
        OutputGraph graph = twoNodeGraph();
        OutputGraphSnapshot before = graph.snapshot();
        OutputGraphSnapshot snapshot = redirector.redirect(graph, tempDir.resolve("frame-2"));

        redirector.restore(graph, snapshot);
        redirector.restore(graph, snapshot);

        assertThat(graph.snapshot()).isEqualTo(before);
    }

    @Test
    void restoreWithShorterSnapshotRestoresOverlappingNodesOnly() throws Exception {
        OutputGraph graph = twoNodeGraph();
        OutputGraphSnapshot partial = new OutputGraphSnapshot(List.of(graph.snapshot().nodes().get(0)));
        redirector.redirect(graph, tempDir.resolve("frame-3"));

        redirector.restore(graph, partial);

        assertThat(graph.nodes().get(0).basePath()).isEqualTo("//renders/main/");
        assertThat(graph.nodes().get(1).basePath()).isEqualTo(tempDir.resolve("frame-3").toAbsolutePath().toString());
    }

    @Test
    void redirectFailsWithoutTouchingGraphWhenScratchCannotBeCreated() throws Exception {
        OutputGraph graph = twoNodeGraph();
        OutputGraphSnapshot before = graph.snapshot();
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "file");

        assertThatThrownBy(() -> redirector.redirect(graph, blocker.resolve("frame-1")))
                .isInstanceOf(RedirectException.class)
                .hasMessageContaining("Could not create scratch directory");
        assertThat(graph.snapshot()).isEqualTo(before);
    }

    @Test
    void collectReturnsRegularFilesKeyedBySortedRelativePath() throws Exception {
        Path scratch = Files.createDirectories(tempDir.resolve("frame-7"));
        Files.createDirectories(scratch.resolve("sub"));
        Files.writeString(scratch.resolve("b.exr"), "b");
        Files.writeString(scratch.resolve("a.exr"), "a");
        Files.writeString(scratch.resolve("sub/c.exr"), "c");

        Map<String, Path> collected = redirector.collect(scratch);

        assertThat(collected.keySet()).containsExactly("a.exr", "b.exr", "sub/c.exr");
        assertThat(collected.get("sub/c.exr")).isEqualTo(scratch.resolve("sub/c.exr"));
    }

    @Test
    void collectOfMissingDirectoryIsEmpty() throws Exception {
        assertThat(redirector.collect(tempDir.resolve("missing"))).isEmpty();
    }

    private OutputGraph twoNodeGraph() {
        return new OutputGraph(List.of(
                new OutputNode("main", "//renders/main/", null, List.of(
                        new OutputSlot("beauty", "beauty_####.exr", null),
                        new OutputSlot("diffuse", "diffuse_####.exr", null))),
                new OutputNode("data", "//renders/data/", null, List.of(
                        new OutputSlot("depth", "depth_####.exr", null)))));
    }
}
