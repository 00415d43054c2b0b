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
import github.sarthakdev143.render_farm.model.SceneDescription;
import github.sarthakdev143.render_farm.model.SceneRef;
import github.sarthakdev143.render_farm.model.UploadSinkAvailability;
import github.sarthakdev143.render_farm.service.RenderFarmService;
import github.sarthakdev143.render_farm.service.SceneInspector;
import github.sarthakdev143.render_farm.service.UploadSink;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

@Service
public class DefaultRenderFarmService implements RenderFarmService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultRenderFarmService.class);
    private static final String DEFAULT_SCENE_FILENAME = "scene.blend";
    static final String NO_OUTPUT_NODES_MESSAGE =
            "No File Output nodes found in the compositor. Set up File Output nodes before rendering.";

    private final ScenePreparer scenePreparer;
    private final SceneInspector sceneInspector;
    private final FarmDispatcher farmDispatcher;
    private final ResultReconciler resultReconciler;
    private final UploadSink uploadSink;
    private final TaskExecutor taskExecutor;
    private final Path submitterDirectory;
    private final Map<String, RenderJobStatus> jobs = new ConcurrentHashMap<>();
    private final Counter preparationFailureCounter;

    public DefaultRenderFarmService(
            ScenePreparer scenePreparer,
            SceneInspector sceneInspector,
            FarmDispatcher farmDispatcher,
            ResultReconciler resultReconciler,
            UploadSink uploadSink,
            @Qualifier("jobTaskExecutor") TaskExecutor taskExecutor,
            RenderFarmProperties properties,
            MeterRegistry meterRegistry) {
        this.scenePreparer = scenePreparer;
        this.sceneInspector = sceneInspector;
        this.farmDispatcher = farmDispatcher;
        this.resultReconciler = resultReconciler;
        this.uploadSink = uploadSink;
        this.taskExecutor = taskExecutor;
        this.submitterDirectory = properties.getStorage().submitterPath().toAbsolutePath();
        this.preparationFailureCounter = meterRegistry.counter("render_farm.jobs.preparation_failures");
    }

    @Override
    public String submitJob(MultipartFile scene, RenderJobOptions options, SceneDescription manifest)
            throws IOException {
        String jobId = UUID.randomUUID().toString();
        Path jobDirectory = submitterDirectory.resolve(jobId);
        Path scenePath = jobDirectory.resolve(resolveSceneFilename(scene.getOriginalFilename()));

        try {
            Files.createDirectories(jobDirectory);
            scene.transferTo(scenePath);
        } catch (IOException e) {
            deleteRecursively(jobDirectory);
            throw e;
        }

        Instant now = Instant.now();
        jobs.put(jobId, new RenderJobStatus(
                jobId,
                RenderJobState.QUEUED,
                "Job queued.",
                now,
                now,
                scenePath.getFileName().toString(),
                options.renderType(),
                null,
                null,
                0,
                0,
                0,
                Map.of(),
                List.of(),
                0,
                null));

        logger.info(
                "Accepted render job {} scene={} renderType={} concurrencyLimit={} gpu={} upload={} manifest={}",
                jobId,
                scenePath.getFileName(),
                options.renderType(),
                options.concurrencyLimit(),
                options.gpu(),
                options.upload(),
                manifest != null);

        taskExecutor.execute(() -> processJob(jobId, scenePath, options, manifest));
        return jobId;
    }

    @Override
    public Optional<RenderJobStatus> getJobStatus(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    private void processJob(String jobId, Path scenePath, RenderJobOptions options, SceneDescription manifest) {
        updateJobState(jobId, RenderJobState.PREPARING, "Preparing scene in shared storage.");

        try {
            SceneRef sceneRef;
            SceneDescription description;
            try {
                sceneRef = scenePreparer.prepare(scenePath);
                description = manifest != null ? manifest : sceneInspector.inspect(sceneRef);
            } catch (PreparationException e) {
                preparationFailureCounter.increment();
                logger.error("Scene preparation failed for job {}", jobId, e);
                markJobFailed(jobId, "Scene preparation failed: " + e.getMessage());
                return;
            }

            if (description.outputGraph().isEmpty()) {
                logger.warn("Render job {} has no File Output nodes", jobId);
                markJobFailed(jobId, NO_OUTPUT_NODES_MESSAGE);
                return;
            }

            FrameSpec frameSpec = options.resolveFrameSpec(description);
            markJobRendering(jobId, frameSpec);

            List<FrameResult> results = farmDispatcher.submit(new RenderRequest(
                    jobId,
                    sceneRef,
                    frameSpec,
                    options.concurrencyLimit(),
                    options.gpu(),
                    description.outputGraph()));

            updateJobState(jobId, RenderJobState.RECONCILING, "Copying rendered files to their output locations.");
            Path jobRoot = options.outputRoot() != null ? Path.of(options.outputRoot()) : scenePath.getParent();
            Map<Integer, String> failedFrames = new TreeMap<>();
            List<ReconciledArtifact> artifacts = new ArrayList<>();
            int framesSucceeded = 0;
            for (FrameResult result : results) {
                if (!result.succeeded()) {
                    failedFrames.put(result.frame(), result.failureMessage());
                    continue;
                }
                try {
                    artifacts.addAll(resultReconciler.reconcile(result, jobRoot));
                    framesSucceeded++;
                } catch (IOException e) {
                    logger.error("Could not save output of frame {} for job {}", result.frame(), jobId, e);
                    failedFrames.put(result.frame(), "Could not save rendered files: " + e.getMessage());
                }
            }

            String warningMessage = null;
            if (!failedFrames.isEmpty()) {
                warningMessage = combineWarnings(
                        warningMessage,
                        failedFrames.size() + " of " + frameSpec.count() + " frames failed.");
            }
            long fallbackCount = artifacts.stream().filter(ReconciledArtifact::fallback).count();
            if (fallbackCount > 0) {
                warningMessage = combineWarnings(
                        warningMessage,
                        fallbackCount + " files matched no output slot and were saved to a fallback location.");
            }

            int uploadedFiles = 0;
            if (options.upload() && framesSucceeded > 0) {
                updateJobState(jobId, RenderJobState.UPLOADING, "Uploading rendered files.");
                UploadSinkAvailability availability = uploadSink.availability();
                if (availability == UploadSinkAvailability.AVAILABLE) {
                    for (ReconciledArtifact artifact : artifacts) {
                        if (uploadSink.put(artifact.resolvedFinalPath(), options.uploadFolder())) {
                            uploadedFiles++;
                        }
                    }
                    if (uploadedFiles < artifacts.size()) {
                        warningMessage = combineWarnings(
                                warningMessage,
                                (artifacts.size() - uploadedFiles) + " files failed to upload.");
                    }
                } else {
                    warningMessage = combineWarnings(
                            warningMessage,
                            "Upload skipped because the upload sink is " + availability + ".");
                }
            }

            List<String> outputs = artifacts.stream()
                    .map(artifact -> artifact.resolvedFinalPath().toString())
                    .toList();
            if (framesSucceeded > 0) {
                markJobCompleted(jobId, framesSucceeded, failedFrames, outputs, uploadedFiles, warningMessage);
            } else {
                markJobFinishedWithoutFrames(jobId, failedFrames, warningMessage);
            }

            logger.info(
                    "Finished render job {} frames={} succeeded={} failed={} outputs={} uploaded={} warning={}",
                    jobId,
                    frameSpec.count(),
                    framesSucceeded,
                    failedFrames.size(),
                    outputs.size(),
                    uploadedFiles,
                    warningMessage != null);
        } catch (Exception e) {
            logger.error("Render job {} failed", jobId, e);
            markJobFailed(jobId, "Render job failed: " + e.getMessage());
        } finally {
            deleteRecursively(farmDispatcher.scratchDirectory(jobId));
        }
    }

    private void updateJobState(String jobId, RenderJobState state, String message) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new RenderJobStatus(
                current.jobId(),
                state,
                message,
                current.createdAt(),
                Instant.now(),
                current.sceneName(),
                current.renderType(),
                current.frameStart(),
                current.frameEnd(),
                current.framesRequested(),
                current.framesSucceeded(),
                current.framesFailed(),
                current.failedFrames(),
                current.outputs(),
                current.uploadedFiles(),
                current.warningMessage()));
    }

    private void markJobRendering(String jobId, FrameSpec frameSpec) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new RenderJobStatus(
                current.jobId(),
                RenderJobState.RENDERING,
                "Rendering " + frameSpec.count() + " frames.",
                current.createdAt(),
                Instant.now(),
                current.sceneName(),
                current.renderType(),
                frameSpec.start(),
                frameSpec.end(),
                frameSpec.count(),
                0,
                0,
                Map.of(),
                List.of(),
                0,
                current.warningMessage()));
    }

    private void markJobCompleted(
            String jobId,
            int framesSucceeded,
            Map<Integer, String> failedFrames,
            List<String> outputs,
            int uploadedFiles,
            String warningMessage) {
        String completionMessage = warningMessage == null
                ? "Render completed successfully."
                : "Render completed with warnings.";

        jobs.computeIfPresent(jobId, (ignored, current) -> new RenderJobStatus(
                current.jobId(),
                RenderJobState.COMPLETED,
                completionMessage,
                current.createdAt(),
                Instant.now(),
                current.sceneName(),
                current.renderType(),
                current.frameStart(),
                current.frameEnd(),
                current.framesRequested(),
                framesSucceeded,
                failedFrames.size(),
                failedFrames,
                outputs,
                uploadedFiles,
                warningMessage));
    }

    private void markJobFinishedWithoutFrames(String jobId, Map<Integer, String> failedFrames, String warningMessage) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new RenderJobStatus(
                current.jobId(),
                RenderJobState.FAILED,
                "All " + failedFrames.size() + " frames failed to render.",
                current.createdAt(),
                Instant.now(),
                current.sceneName(),
                current.renderType(),
                current.frameStart(),
                current.frameEnd(),
                current.framesRequested(),
                0,
                failedFrames.size(),
                failedFrames,
                List.of(),
                0,
                warningMessage));
    }

    private void markJobFailed(String jobId, String message) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new RenderJobStatus(
                current.jobId(),
                RenderJobState.FAILED,
                message,
                current.createdAt(),
                Instant.now(),
                current.sceneName(),
                current.renderType(),
                current.frameStart(),
                current.frameEnd(),
                current.framesRequested(),
                current.framesSucceeded(),
                current.framesFailed(),
                current.failedFrames(),
                current.outputs(),
                current.uploadedFiles(),
                current.warningMessage()));
    }

    private String resolveSceneFilename(String originalFilename) {
        if (originalFilename == null || originalFilename.isBlank()) {
            return DEFAULT_SCENE_FILENAME;
        }
        // Browsers may send a full client path.
        String filename = FramePathTemplates.basename(originalFilename.trim());
        return filename.isBlank() || filename.equals("..") ? DEFAULT_SCENE_FILENAME : filename;
    }

    private String combineWarnings(String existingWarning, String newWarning) {
        if (existingWarning == null || existingWarning.isBlank()) {
            return newWarning;
        }
        if (newWarning == null || newWarning.isBlank()) {
            return existingWarning;
        }
        return existingWarning + " " + newWarning;
    }

    private void deleteRecursively(Path directory) {
        if (directory == null || Files.notExists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    logger.debug("Could not delete {}", path, e);
                }
            });
        } catch (IOException e) {
            logger.warn("Could not clean up {}", directory, e);
        }
    }
}
