package github.sarthakdev143.render_farm.service.impl;

import github.sarthakdev143.render_farm.config.RenderFarmProperties;
import github.sarthakdev143.render_farm.exception.PreparationException;
import github.sarthakdev143.render_farm.model.SceneRef;
import github.sarthakdev143.render_farm.service.SceneUnpacker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Places a submitted scene in shared asset storage and makes it self-contained. Only one
 * preparation runs at a time because two jobs with the same filename share a target.
 */
@Component
public class ScenePreparer {

    private static final Logger logger = LoggerFactory.getLogger(ScenePreparer.class);
    private static final String BLEND_FILES_DIR = "blend_files";

    private final SceneUnpacker sceneUnpacker;
    private final AssetTracker assetTracker;
    private final AssetHasher assetHasher;
    private final Path blendFilesDirectory;

    public ScenePreparer(
            SceneUnpacker sceneUnpacker,
            AssetTracker assetTracker,
            AssetHasher assetHasher,
            RenderFarmProperties properties) {
        this.sceneUnpacker = sceneUnpacker;
        this.assetTracker = assetTracker;
        this.assetHasher = assetHasher;
        this.blendFilesDirectory = properties.getStorage().assetsPath().resolve(BLEND_FILES_DIR);
    }

    public synchronized SceneRef prepare(Path localScenePath) throws PreparationException {
        if (localScenePath == null || !Files.isRegularFile(localScenePath)) {
            throw new PreparationException("Scene file not found: " + localScenePath);
        }

        String filename = localScenePath.getFileName().toString();
        Path target = blendFilesDirectory.resolve(filename).toAbsolutePath();
        String sceneName = stripExtension(filename);

        try {
            String sourceHash = assetHasher.hash(localScenePath);
            if (Files.isRegularFile(target) && sourceHash.equals(recordedHash(target).orElse(null))) {
                logger.info("Scene {} unchanged since last preparation; reusing {}", filename, target);
                return new SceneRef(target, sceneName, sourceHash);
            }

            // The old record must never describe new, unprepared bytes.
            forgetAsset(target);
            Files.createDirectories(target.getParent());
            Files.copy(localScenePath, target, StandardCopyOption.REPLACE_EXISTING);
            try {
                sceneUnpacker.unpackAndResave(target);
            } catch (IOException | InterruptedException | RuntimeException e) {
                discardTarget(target);
                throw e;
            }

            double modifiedTime = Files.getLastModifiedTime(localScenePath).toMillis() / 1000.0;
            recordAsset(target, sourceHash, modifiedTime);
            logger.info("Prepared scene {} at {}", filename, target);
            return new SceneRef(target, sceneName, sourceHash);
        } catch (IOException e) {
            throw new PreparationException("Failed to prepare scene " + filename + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PreparationException("Scene preparation interrupted for " + filename, e);
        }
    }

    private Optional<String> recordedHash(Path target) {
        try {
            return assetTracker.lookup(target.toString());
        } catch (DataAccessException e) {
            logger.warn("Asset tracker lookup failed for {}; preparing from scratch", target, e);
            return Optional.empty();
        }
    }

    private void forgetAsset(Path target) throws IOException {
        try {
            assetTracker.forget(target.toString());
        } catch (DataAccessException e) {
            logger.warn("Could not clear asset tracker entry for {}; removing stale scene", target, e);
            Files.deleteIfExists(target);
        }
    }

    private void discardTarget(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            logger.warn("Could not remove partially prepared scene {}", target, e);
        }
    }

    private void recordAsset(Path target, String hash, double modifiedTime) {
        try {
            assetTracker.record(target.toString(), hash, modifiedTime);
        } catch (DataAccessException e) {
            logger.warn("Could not record prepared scene {} in the asset tracker", target, e);
        }
    }

    private String stripExtension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
