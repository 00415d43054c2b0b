package github.sarthakdev143.render_farm.service.impl;

import github.sarthakdev143.render_farm.config.RenderFarmProperties;
import github.sarthakdev143.render_farm.exception.RedirectException;
import github.sarthakdev143.render_farm.exception.RenderException;
import github.sarthakdev143.render_farm.model.FrameResult;
import github.sarthakdev143.render_farm.model.RenderRequest;
import github.sarthakdev143.render_farm.model.graph.OutputGraph;
import github.sarthakdev143.render_farm.model.graph.OutputGraphSnapshot;
import github.sarthakdev143.render_farm.service.RenderWorker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Fans a render request out into one unit of work per frame. Each unit renders against its
 * own copy of the output graph, redirected into a per-frame scratch directory, and at most
 * {@code concurrencyLimit} units of a request are in flight at once.
 */
@Component
public class FarmDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(FarmDispatcher.class);
    private static final String TEMP_DIR = "temp";

    private final RenderWorker renderWorker;
    private final OutputRedirector outputRedirector;
    private final Executor frameTaskExecutor;
    private final Path rendersDirectory;
    private final Counter framesRenderedCounter;
    private final Counter framesFailedCounter;

    public FarmDispatcher(
            RenderWorker renderWorker,
            OutputRedirector outputRedirector,
            @Qualifier("frameTaskExecutor") Executor frameTaskExecutor,
            RenderFarmProperties properties,
            MeterRegistry meterRegistry) {
        this.renderWorker = renderWorker;
        this.outputRedirector = outputRedirector;
        this.frameTaskExecutor = frameTaskExecutor;
        this.rendersDirectory = properties.getStorage().rendersPath().toAbsolutePath();
        this.framesRenderedCounter = meterRegistry.counter("render_farm.frames.rendered");
        this.framesFailedCounter = meterRegistry.counter("render_farm.frames.failed");
    }

    /**
     * Renders every frame of the request and blocks until each one has succeeded or failed.
     * A failed frame never cancels its siblings.
     */
    public List<FrameResult> submit(RenderRequest request) {
        List<Integer> frames = request.frameSpec().frames();
        Semaphore permits = new Semaphore(request.concurrencyLimit());
        List<CompletableFuture<FrameResult>> futures = new ArrayList<>(frames.size());
        logger.info(
                "Dispatching job {} frames {}..{} concurrencyLimit={} gpu={}",
                request.jobId(),
                request.frameSpec().start(),
                request.frameSpec().end(),
                request.concurrencyLimit(),
                request.gpu());

        for (int frame : frames) {
            try {
                permits.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.add(CompletableFuture.completedFuture(
                        recordFailure(request.jobId(), FrameResult.failed(frame, "Dispatch interrupted before frame started."))));
                continue;
            }

            try {
                futures.add(CompletableFuture
                        .supplyAsync(() -> renderFrame(request, frame), frameTaskExecutor)
                        .whenComplete((result, error) -> permits.release()));
            } catch (RejectedExecutionException e) {
                permits.release();
                logger.error("Frame {} of job {} could not be scheduled", frame, request.jobId(), e);
                futures.add(CompletableFuture.completedFuture(
                        recordFailure(request.jobId(), FrameResult.failed(frame, "Frame could not be scheduled: " + e.getMessage()))));
            }
        }

        List<FrameResult> results = new ArrayList<>(futures.size());
        for (int index = 0; index < futures.size(); index++) {
            CompletableFuture<FrameResult> future = futures.get(index);
            try {
                results.add(future.join());
            } catch (RuntimeException e) {
                int frame = frames.get(index);
                logger.error("Frame {} of job {} ended unexpectedly", frame, request.jobId(), e);
                results.add(recordFailure(request.jobId(), FrameResult.failed(frame, "Unexpected failure: " + e.getMessage())));
            }
        }
        return results;
    }

    public Path scratchDirectory(String jobId) {
        return rendersDirectory.resolve(TEMP_DIR).resolve(jobId);
    }

    Path frameScratchDirectory(String jobId, int frame) {
        return scratchDirectory(jobId).resolve("frame-" + frame);
    }

    private FrameResult renderFrame(RenderRequest request, int frame) {
        OutputGraph graph = request.outputGraph() == null
                ? new OutputGraph(null)
                : request.outputGraph().copy();
        Path scratch = frameScratchDirectory(request.jobId(), frame);
        OutputGraphSnapshot snapshot = null;

        try {
            snapshot = outputRedirector.redirect(graph, scratch);
            renderWorker.render(request.sceneRef(), frame, graph, request.gpu());

            Map<String, Path> producedFiles = outputRedirector.collect(scratch);
            if (producedFiles.isEmpty()) {
                return recordFailure(request.jobId(), FrameResult.failed(frame, "Render produced no output files."));
            }

            framesRenderedCounter.increment();
            logger.info("Frame {} of job {} rendered {} files", frame, request.jobId(), producedFiles.size());
            return FrameResult.succeeded(frame, producedFiles, snapshot);
        } catch (RedirectException e) {
            logger.error("Frame {} of job {} could not be redirected", frame, request.jobId(), e);
            return recordFailure(request.jobId(), FrameResult.failed(frame, e.getMessage()));
        } catch (RenderException e) {
            logger.error("Frame {} of job {} failed to render: {}", frame, request.jobId(), e.getMessage());
            return recordFailure(request.jobId(), FrameResult.failed(frame, e.getMessage()));
        } catch (IOException e) {
            logger.error("Frame {} of job {} output could not be collected", frame, request.jobId(), e);
            return recordFailure(request.jobId(), FrameResult.failed(frame, "Could not collect output: " + e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Frame {} of job {} failed unexpectedly", frame, request.jobId(), e);
            return recordFailure(request.jobId(), FrameResult.failed(frame, "Unexpected failure: " + e.getMessage()));
        } finally {
            if (snapshot != null) {
                outputRedirector.restore(graph, snapshot);
            }
        }
    }

    private FrameResult recordFailure(String jobId, FrameResult failed) {
        framesFailedCounter.increment();
        logger.warn("Frame {} of job {} failed: {}", failed.frame(), jobId, failed.failureMessage());
        return failed;
    }
}
