package github.sarthakdev143.render_farm.controller;

import github.sarthakdev143.render_farm.dto.AssetStatusResponse;
import github.sarthakdev143.render_farm.dto.OutputGraphManifestRequest;
import github.sarthakdev143.render_farm.dto.RenderJobSubmissionResponse;
import github.sarthakdev143.render_farm.model.RenderJobOptions;
import github.sarthakdev143.render_farm.model.RenderJobState;
import github.sarthakdev143.render_farm.model.RenderType;
import github.sarthakdev143.render_farm.model.SceneDescription;
import github.sarthakdev143.render_farm.service.RenderFarmService;
import github.sarthakdev143.render_farm.service.impl.AssetTracker;
import github.sarthakdev143.render_farm.service.impl.OutputGraphManifestValidator;
import github.sarthakdev143.render_farm.service.impl.VfxAovPreset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

@RestController
@RequestMapping("/api/render")
public class RenderJobController {

    private static final Logger logger = LoggerFactory.getLogger(RenderJobController.class);
    private static final int MIN_CONTAINERS = 1;
    private static final int MAX_CONTAINERS = 100;
    private static final int DEFAULT_CONTAINERS = 10;
    private static final int MAX_FRAMES_PER_JOB = 10_000;
    private static final String DEFAULT_UPLOAD_FOLDER = "/Renders";
    private static final String SCENE_EXTENSION = ".blend";

    private final RenderFarmService renderFarmService;
    private final OutputGraphManifestValidator manifestValidator;
    private final AssetTracker assetTracker;
    private final ObjectMapper objectMapper;

    public RenderJobController(
            RenderFarmService renderFarmService,
            OutputGraphManifestValidator manifestValidator,
            AssetTracker assetTracker,
            ObjectMapper objectMapper) {
        this.renderFarmService = renderFarmService;
        this.manifestValidator = manifestValidator;
        this.assetTracker = assetTracker;
        this.objectMapper = objectMapper;
    }

    @PostMapping(value = "/jobs", consumes = "multipart/form-data")
    public ResponseEntity<?> submitRender(
            @RequestParam("scene") MultipartFile scene,
            @RequestParam(value = "renderType", required = false) String renderTypeInput,
            @RequestParam(value = "frame", required = false) Integer frame,
            @RequestParam(value = "startFrame", required = false) Integer startFrame,
            @RequestParam(value = "endFrame", required = false) Integer endFrame,
            @RequestParam(value = "maxContainers", required = false) Integer maxContainers,
            @RequestParam(value = "gpu", required = false) Boolean gpu,
            @RequestParam(value = "upload", required = false) Boolean upload,
            @RequestParam(value = "uploadFolder", required = false) String uploadFolder,
            @RequestParam(value = "outputRoot", required = false) String outputRoot,
            @RequestParam(value = "manifest", required = false) String manifestJson) {

        try {
            validateScene(scene);
            RenderType renderType = RenderType.fromInput(renderTypeInput);
            validateFrames(renderType, frame, startFrame, endFrame);
            SceneDescription manifest = parseManifest(manifestJson);
            if (manifest != null && renderType == RenderType.ANIMATION) {
                validateFrameCount(manifest.frameStart(), manifest.frameEnd());
            }

            RenderJobOptions options = new RenderJobOptions(
                    renderType,
                    frame,
                    startFrame,
                    endFrame,
                    validateContainers(maxContainers),
                    gpu == null || gpu,
                    upload != null && upload,
                    validateUploadFolder(uploadFolder),
                    validateOutputRoot(outputRoot));

            String jobId = renderFarmService.submitJob(scene, options, manifest);
            return ResponseEntity.accepted()
                    .body(new RenderJobSubmissionResponse(
                            jobId,
                            RenderJobState.QUEUED,
                            "Render job accepted. Poll /api/render/jobs/{jobId} for progress."));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Render job submission failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to submit render job. Please try again.");
        }
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<?> getStatus(@PathVariable String jobId) {
        return renderFarmService.getJobStatus(jobId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId));
    }

    @GetMapping("/aov-preset")
    public OutputGraphManifestRequest getAovPreset(
            @RequestParam(value = "basePath", required = false, defaultValue = VfxAovPreset.DEFAULT_BASE_PATH)
            String basePath) {
        return VfxAovPreset.manifest(basePath);
    }

    @GetMapping("/assets/status")
    public ResponseEntity<?> getAssetStatus(
            @RequestParam("path") String path,
            @RequestParam(value = "hash", required = false) String hash) {
        if (path == null || path.isBlank()) {
            return ResponseEntity.badRequest().body("Invalid request: path is required.");
        }

        try {
            Optional<String> recordedHash = assetTracker.lookup(path);
            boolean needsUpload = hash == null || hash.isBlank()
                    ? recordedHash.isEmpty()
                    : assetTracker.needsUpload(path, hash.trim());
            return ResponseEntity.ok(new AssetStatusResponse(path, recordedHash.orElse(null), needsUpload));
        } catch (Exception e) {
            logger.error("Asset status lookup failed for {}", path, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to read asset status. Please try again.");
        }
    }

    private void validateScene(MultipartFile scene) {
        if (scene == null || scene.isEmpty()) {
            throw new IllegalArgumentException("Scene file is required.");
        }
        String filename = scene.getOriginalFilename();
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(SCENE_EXTENSION)) {
            throw new IllegalArgumentException("Scene must be a " + SCENE_EXTENSION + " file.");
        }
    }

    private void validateFrames(RenderType renderType, Integer frame, Integer startFrame, Integer endFrame) {
        if (frame != null && frame < 0) {
            throw new IllegalArgumentException("frame must be 0 or greater.");
        }
        if (renderType != RenderType.RANGE) {
            return;
        }
        if (startFrame == null || endFrame == null) {
            throw new IllegalArgumentException("startFrame and endFrame are required for RANGE renders.");
        }
        if (startFrame < 0) {
            throw new IllegalArgumentException("startFrame must be 0 or greater.");
        }
        if (endFrame < startFrame) {
            throw new IllegalArgumentException("endFrame must not be before startFrame.");
        }
        validateFrameCount(startFrame, endFrame);
    }

    private void validateFrameCount(int start, int end) {
        if ((long) end - start + 1 > MAX_FRAMES_PER_JOB) {
            throw new IllegalArgumentException("A job can render at most " + MAX_FRAMES_PER_JOB + " frames.");
        }
    }

    private int validateContainers(Integer maxContainers) {
        if (maxContainers == null) {
            return DEFAULT_CONTAINERS;
        }
        if (maxContainers < MIN_CONTAINERS || maxContainers > MAX_CONTAINERS) {
            throw new IllegalArgumentException(
                    "maxContainers must be between " + MIN_CONTAINERS + " and " + MAX_CONTAINERS + ".");
        }
        return maxContainers;
    }

    private String validateUploadFolder(String uploadFolder) {
        if (uploadFolder == null || uploadFolder.isBlank()) {
            return DEFAULT_UPLOAD_FOLDER;
        }
        String normalized = uploadFolder.trim();
        if (!normalized.startsWith("/")) {
            throw new IllegalArgumentException("uploadFolder must start with '/'.");
        }
        return normalized;
    }

    private String validateOutputRoot(String outputRoot) {
        if (outputRoot == null || outputRoot.isBlank()) {
            return null;
        }
        try {
            Path path = Path.of(outputRoot.trim());
            if (!path.isAbsolute()) {
                throw new IllegalArgumentException("outputRoot must be an absolute directory path.");
            }
            return path.normalize().toString();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("outputRoot is not a valid path.");
        }
    }

    private SceneDescription parseManifest(String manifestJson) {
        if (manifestJson == null || manifestJson.isBlank()) {
            return null;
        }

        OutputGraphManifestRequest manifest;
        try {
            manifest = objectMapper.readValue(manifestJson, OutputGraphManifestRequest.class);
        } catch (JacksonException e) {
            throw new IllegalArgumentException("manifest must be valid JSON.");
        }
        return manifestValidator.normalizeAndValidate(manifest);
    }
}
