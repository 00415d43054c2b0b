package github.sarthakdev143.render_farm.integration.blender;

import github.sarthakdev143.render_farm.config.RenderFarmProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs headless Blender processes. Output goes to a log file instead of a pipe so a
 * chatty process can never block on a full buffer before the timeout fires.
 */
@Component
public class BlenderCommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(BlenderCommandRunner.class);
    static final String BLENDER_PATH_ENV = "BLENDER_PATH";
    private static final int MAX_OUTPUT_IN_ERROR = 4000;

    private final String configuredBinary;

    public BlenderCommandRunner(RenderFarmProperties properties) {
        this.configuredBinary = properties.getBlender().getBinary();
    }

    /**
     * Runs Blender with {@code arguments} and returns its combined output.
     *
     * @throws IOException when the process times out or exits with a non-zero code
     */
    public String run(List<String> arguments, Duration timeout, String stage) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>(arguments.size() + 1);
        command.add(resolveBlenderBinary());
        command.addAll(arguments);

        Path logFile = Files.createTempFile("render-farm-blender-", ".log");
        try {
            logger.info("Running Blender for stage {}", stage);
            logger.debug("Blender command for stage {}: {}", stage, String.join(" ", command));
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(logFile.toFile())
                    .start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new IOException("Blender timed out after " + timeout + " during stage: " + stage);
            }

            String output = Files.readString(logFile, StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new IOException(
                        "Blender failed during stage "
                                + stage
                                + " with exit code "
                                + process.exitValue()
                                + ". Output: "
                                + tail(output));
            }
            return output;
        } finally {
            Files.deleteIfExists(logFile);
        }
    }

    String resolveBlenderBinary() {
        String configuredPath = System.getenv(BLENDER_PATH_ENV);
        if (configuredPath != null && !configuredPath.isBlank()) {
            return configuredPath;
        }
        return configuredBinary;
    }

    private String tail(String output) {
        if (output.length() <= MAX_OUTPUT_IN_ERROR) {
            return output;
        }
        return "..." + output.substring(output.length() - MAX_OUTPUT_IN_ERROR);
    }
}
