package github.sarthakdev143.render_farm.config;

import github.sarthakdev143.render_farm.integration.drive.DriveServiceFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "render-farm.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final String BLENDER_PATH_ENV = "BLENDER_PATH";
    private static final int BLENDER_CHECK_TIMEOUT_SECONDS = 30;

    private final RenderFarmProperties properties;

    public StartupPreflightChecks(RenderFarmProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkBlenderConfiguration();
        checkStorageDirectories();
        checkUploadConfiguration();
    }

    private void checkBlenderConfiguration() {
        String configuredPath = System.getenv(BLENDER_PATH_ENV);
        if (configuredPath != null && !configuredPath.isBlank()) {
            Path blenderPath = Path.of(configuredPath);
            if (!Files.isRegularFile(blenderPath)) {
                throw new IllegalStateException(
                        "Blender binary not found at " + blenderPath.toAbsolutePath()
                                + ". Set " + BLENDER_PATH_ENV + " to a valid blender executable path.");
            }
            return;
        }

        String binary = properties.getBlender().getBinary();
        try {
            Process process = new ProcessBuilder(binary, "--version")
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            boolean finished = process.waitFor(BLENDER_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished || process.exitValue() != 0) {
                if (!finished) {
                    process.destroyForcibly();
                }
                throw new IllegalStateException(
                        "Blender is not available as '" + binary + "'. Install Blender or set " + BLENDER_PATH_ENV + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    "Blender is not available as '" + binary + "'. Install Blender or set " + BLENDER_PATH_ENV + ".",
                    e);
        }
    }

    private void checkStorageDirectories() {
        RenderFarmProperties.Storage storage = properties.getStorage();
        for (Path directory : List.of(storage.submitterPath(), storage.assetsPath(), storage.rendersPath())) {
            try {
                Files.createDirectories(directory);
            } catch (IOException e) {
                throw new IllegalStateException("Storage directory is not writable: " + directory.toAbsolutePath(), e);
            }
        }
    }

    // Uploads are optional, so missing credentials only disable them.
    private void checkUploadConfiguration() {
        RenderFarmProperties.Upload upload = properties.getUpload();
        if (!upload.isEnabled()) {
            logger.info("Drive upload is disabled");
            return;
        }

        Path credentialsPath = DriveServiceFactory.resolveCredentialsPath(upload);
        if (!Files.isReadable(credentialsPath)) {
            logger.warn(
                    "Drive credentials file not found at {}. Uploads will be skipped until it is provided.",
                    credentialsPath.toAbsolutePath());
        }
    }
}
