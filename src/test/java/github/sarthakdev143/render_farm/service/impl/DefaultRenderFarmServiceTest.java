package github.sarthakdev143.render_farm.service.impl;

import github.sarthakdev143.render_farm.config.RenderFarmProperties;
import github.sarthakdev143.render_farm.exception.PreparationException;
import github.sarthakdev143.render_farm.model.FrameResult;
import github.sarthakdev143.render_farm.model.FrameSpec;
import github.sarthakdev143.render_farm.model.ReconciledArtifact;
import github.sarthakdev143.render_farm.model.RenderJobOptions;
import github.sarthakdev143.render_farm.model.RenderJobState;
import github.sarthakdev143.render_farm.model.RenderJobStatus;
import github.sarthakdev143.render_farm.model.RenderRequest;
import github.sarthakdev143.render_farm.model.RenderType;
import github.sarthakdev143.render_farm.model.SceneDescription;
import github.sarthakdev143.render_farm.model.SceneRef;
import github.sarthakdev143.render_farm.model.UploadSinkAvailability;
import github.sarthakdev143.render_farm.model.graph.OutputGraph;
import github.sarthakdev143.render_farm.model.graph.OutputGraphSnapshot;
import github.sarthakdev143.render_farm.model.graph.OutputNode;
import github.sarthakdev143.render_farm.model.graph.OutputSlot;
import github.sarthakdev143.render_farm.service.SceneInspector;
import github.sarthakdev143.render_farm.service.UploadSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.mock.web.MockMultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultRenderFarmServiceTest {

    @TempDir
    Path tempDir;

    @Mock
    private ScenePreparer scenePreparer;

    @Mock
    private SceneInspector sceneInspector;

    @Mock
    private FarmDispatcher farmDispatcher;

    @Mock
    private ResultReconciler resultReconciler;

    @Mock
    private UploadSink uploadSink;

    private SimpleMeterRegistry meterRegistry;
    private DefaultRenderFarmService service;
    private SceneRef sceneRef;

    @BeforeEach
    void setUp() {
        RenderFarmProperties properties = new RenderFarmProperties();
        properties.getStorage().setSubmitterDir(tempDir.resolve("submitter").toString());
        meterRegistry = new SimpleMeterRegistry();
        TaskExecutor directExecutor = Runnable::run;
        service = new DefaultRenderFarmService(
                scenePreparer,
                sceneInspector,
                farmDispatcher,
                resultReconciler,
                uploadSink,
                directExecutor,
                properties,
                meterRegistry);
        sceneRef = new SceneRef(tempDir.resolve("assets/shot.blend"), "shot", "hash");
    }

    @Test
    void submitJobRendersCurrentFrameAndCompletes() throws Exception {
        SceneDescription manifest = description(5, 20, 7);
        when(scenePreparer.prepare(any())).thenReturn(sceneRef);
        when(farmDispatcher.submit(any())).thenReturn(List.of(succeeded(7)));
        Path output = tempDir.resolve("out/main.0007.exr");
        when(resultReconciler.reconcile(any(), any()))
                .thenReturn(List.of(new ReconciledArtifact(7, tempDir.resolve("tmp"), output, false)));

        String jobId = service.submitJob(scene(), options(RenderType.FRAME, null, null, null, false), manifest);

        RenderJobStatus status = service.getJobStatus(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(RenderJobState.COMPLETED);
        assertThat(status.message()).isEqualTo("Render completed successfully.");
        assertThat(status.framesRequested()).isEqualTo(1);
        assertThat(status.framesSucceeded()).isEqualTo(1);
        assertThat(status.outputs()).containsExactly(output.toString());
        assertThat(status.warningMessage()).isNull();
        verifyNoInteractions(sceneInspector, uploadSink);

        ArgumentCaptor<RenderRequest> requestCaptor = ArgumentCaptor.forClass(RenderRequest.class);
        verify(farmDispatcher).submit(requestCaptor.capture());
        assertThat(requestCaptor.getValue().frameSpec()).isEqualTo(FrameSpec.single(7));
        assertThat(requestCaptor.getValue().concurrencyLimit()).isEqualTo(4);

        Path storedScene = tempDir.resolve("submitter").toAbsolutePath().resolve(jobId).resolve("shot.blend");
        assertThat(Files.readString(storedScene)).isEqualTo("blend-bytes");
        verify(scenePreparer).prepare(storedScene);
        verify(resultReconciler).reconcile(any(), eq(storedScene.getParent()));
    }

    @Test
    void animationUsesInspectedSceneRangeAndOutputRoot() throws Exception {
        when(scenePreparer.prepare(any())).thenReturn(sceneRef);
        when(sceneInspector.inspect(sceneRef)).thenReturn(description(1, 3, 1));
        when(farmDispatcher.submit(any())).thenReturn(List.of(succeeded(1), succeeded(2), succeeded(3)));
        when(resultReconciler.reconcile(any(), any())).thenReturn(List.of());

        RenderJobOptions options = new RenderJobOptions(
                RenderType.ANIMATION, null, null, null, 2, true, false, null, tempDir.resolve("shots").toString());
        String jobId = service.submitJob(scene(), options, null);

        ArgumentCaptor<RenderRequest> requestCaptor = ArgumentCaptor.forClass(RenderRequest.class);
        verify(farmDispatcher).submit(requestCaptor.capture());
        assertThat(requestCaptor.getValue().frameSpec()).isEqualTo(FrameSpec.range(1, 3));
        verify(resultReconciler, times(3)).reconcile(any(), eq(tempDir.resolve("shots")));
        RenderJobStatus status = service.getJobStatus(jobId).orElseThrow();
        assertThat(status.frameStart()).isEqualTo(1);
        assertThat(status.frameEnd()).isEqualTo(3);
        assertThat(status.framesSucceeded()).isEqualTo(3);
    }

    @Test
    void preparationFailureFailsJobBeforeDispatch() throws Exception {
        when(scenePreparer.prepare(any())).thenThrow(new PreparationException("Blender failed during stage unpack"));

        String jobId = service.submitJob(scene(), options(RenderType.FRAME, 1, null, null, false), description(1, 1, 1));

        RenderJobStatus status = service.getJobStatus(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(RenderJobState.FAILED);
        assertThat(status.message()).contains("Scene preparation failed");
        assertThat(meterRegistry.counter("render_farm.jobs.preparation_failures").count()).isEqualTo(1.0);
        verify(farmDispatcher, never()).submit(any());
    }

    @Test
    void sceneWithoutOutputNodesFailsJob() throws Exception {
        when(scenePreparer.prepare(any())).thenReturn(sceneRef);
        when(sceneInspector.inspect(sceneRef)).thenReturn(new SceneDescription(1, 10, 1, new OutputGraph(List.of())));

        String jobId = service.submitJob(scene(), options(RenderType.FRAME, null, null, null, false), null);

        RenderJobStatus status = service.getJobStatus(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(RenderJobState.FAILED);
        assertThat(status.message()).contains("No File Output nodes found in the compositor");
        verify(farmDispatcher, never()).submit(any());
    }

    @Test
    void partialFailureCompletesWithWarningsAndUploads() throws Exception {
        when(scenePreparer.prepare(any())).thenReturn(sceneRef);
        when(farmDispatcher.submit(any())).thenReturn(List.of(
                succeeded(10),
                FrameResult.failed(11, "Blender exited with code 1"),
                succeeded(12)));
        Path first = tempDir.resolve("out/main.0010.exr");
        Path second = tempDir.resolve("out/main.0012.exr");
        when(resultReconciler.reconcile(any(), any()))
                .thenReturn(List.of(new ReconciledArtifact(10, tempDir.resolve("a"), first, false)))
                .thenReturn(List.of(new ReconciledArtifact(12, tempDir.resolve("b"), second, true)));
        when(uploadSink.availability()).thenReturn(UploadSinkAvailability.AVAILABLE);
        when(uploadSink.put(first, "/Renders/shot")).thenReturn(true);
        when(uploadSink.put(second, "/Renders/shot")).thenReturn(false);

        RenderJobOptions options = new RenderJobOptions(
                RenderType.RANGE, null, 10, 12, 3, false, true, "/Renders/shot", null);
        String jobId = service.submitJob(scene(), options, description(1, 100, 1));

        RenderJobStatus status = service.getJobStatus(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(RenderJobState.COMPLETED);
        assertThat(status.message()).isEqualTo("Render completed with warnings.");
        assertThat(status.framesSucceeded()).isEqualTo(2);
        assertThat(status.framesFailed()).isEqualTo(1);
        assertThat(status.failedFrames()).containsEntry(11, "Blender exited with code 1");
        assertThat(status.uploadedFiles()).isEqualTo(1);
        assertThat(status.warningMessage())
                .contains("1 of 3 frames failed.")
                .contains("1 files matched no output slot")
                .contains("1 files failed to upload.");
    }

    @Test
    void unavailableUploadSinkSkipsUploadWithWarning() throws Exception {
        when(scenePreparer.prepare(any())).thenReturn(sceneRef);
        when(farmDispatcher.submit(any())).thenReturn(List.of(succeeded(1)));
        when(resultReconciler.reconcile(any(), any())).thenReturn(List.of(
                new ReconciledArtifact(1, tempDir.resolve("a"), tempDir.resolve("out/main.0001.exr"), false)));
        when(uploadSink.availability()).thenReturn(UploadSinkAvailability.UNAVAILABLE);

        String jobId = service.submitJob(scene(), options(RenderType.FRAME, 1, null, null, true), description(1, 1, 1));

        RenderJobStatus status = service.getJobStatus(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(RenderJobState.COMPLETED);
        assertThat(status.warningMessage()).contains("UNAVAILABLE");
        verify(uploadSink, never()).put(any(), any());
    }

    @Test
    void allFramesFailingFailsJob() throws Exception {
        when(scenePreparer.prepare(any())).thenReturn(sceneRef);
        when(farmDispatcher.submit(any())).thenReturn(List.of(
                FrameResult.failed(1, "boom"),
                FrameResult.failed(2, "boom")));

        String jobId = service.submitJob(scene(), options(RenderType.RANGE, null, 1, 2, false), description(1, 2, 1));

        RenderJobStatus status = service.getJobStatus(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(RenderJobState.FAILED);
        assertThat(status.message()).isEqualTo("All 2 frames failed to render.");
        assertThat(status.failedFrames()).containsOnlyKeys(1, 2);
        verifyNoInteractions(resultReconciler);
    }

    @Test
    void reconcileFailureCountsAsFrameFailure() throws Exception {
        when(scenePreparer.prepare(any())).thenReturn(sceneRef);
        when(farmDispatcher.submit(any())).thenReturn(List.of(succeeded(1)));
        when(resultReconciler.reconcile(any(), any())).thenThrow(new IOException("disk full"));

        String jobId = service.submitJob(scene(), options(RenderType.FRAME, 1, null, null, false), description(1, 1, 1));

        RenderJobStatus status = service.getJobStatus(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(RenderJobState.FAILED);
        assertThat(status.failedFrames().get(1)).contains("disk full");
    }

    @Test
    void scratchDirectoryIsRemovedAfterJob() throws Exception {
        Path scratch = Files.createDirectories(tempDir.resolve("renders/temp/job/frame-1"));
        Files.writeString(scratch.resolve("main.0001.exr"), "x");
        when(scenePreparer.prepare(any())).thenReturn(sceneRef);
        when(farmDispatcher.submit(any())).thenReturn(List.of(FrameResult.failed(1, "boom")));
        when(farmDispatcher.scratchDirectory(any())).thenReturn(tempDir.resolve("renders/temp/job"));

        service.submitJob(scene(), options(RenderType.FRAME, 1, null, null, false), description(1, 1, 1));

        assertThat(Files.exists(tempDir.resolve("renders/temp/job"))).isFalse();
    }

    @Test
    void getJobStatusReturnsEmptyForUnknownJob() {
        assertThat(service.getJobStatus("missing")).isEmpty();
    }

    private MockMultipartFile scene() {
        return new MockMultipartFile("scene", "shot.blend", "application/octet-stream", "blend-bytes".getBytes());
    }

    private RenderJobOptions options(RenderType type, Integer frame, Integer start, Integer end, boolean upload) {
        return new RenderJobOptions(type, frame, start, end, 4, true, upload, null, null);
    }

    private SceneDescription description(int start, int end, int current) {
        OutputGraph graph = new OutputGraph(List.of(new OutputNode(
                "main",
                "//renders/",
                null,
                List.of(new OutputSlot("rgba", "main.####.exr", null)))));
        return new SceneDescription(start, end, current, graph);
    }

    private FrameResult succeeded(int frame) {
        return FrameResult.succeeded(
                frame,
                Map.of("main." + frame + ".exr", tempDir.resolve("scratch-" + frame)),
                new OutputGraphSnapshot(List.of()));
    }
}
