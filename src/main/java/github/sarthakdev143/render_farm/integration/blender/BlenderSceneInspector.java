package github.sarthakdev143.render_farm.integration.blender;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import github.sarthakdev143.render_farm.config.RenderFarmProperties;
import github.sarthakdev143.render_farm.exception.PreparationException;
import github.sarthakdev143.render_farm.model.SceneDescription;
import github.sarthakdev143.render_farm.model.SceneRef;
import github.sarthakdev143.render_farm.model.graph.ImageFormat;
import github.sarthakdev143.render_farm.model.graph.OutputGraph;
import github.sarthakdev143.render_farm.model.graph.OutputNode;
import github.sarthakdev143.render_farm.model.graph.OutputSlot;
import github.sarthakdev143.render_farm.service.SceneInspector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads frame range and File Output nodes from a prepared scene with a headless Blender run.
 */
@Component
public class BlenderSceneInspector implements SceneInspector {

    private static final Logger logger = LoggerFactory.getLogger(BlenderSceneInspector.class);

    private final BlenderCommandRunner commandRunner;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public BlenderSceneInspector(
            BlenderCommandRunner commandRunner,
            ObjectMapper objectMapper,
            RenderFarmProperties properties) {
        this.commandRunner = commandRunner;
        this.objectMapper = objectMapper;
        this.timeout = properties.getBlender().getPrepareTimeout();
    }

    @Override
    public SceneDescription inspect(SceneRef sceneRef) throws PreparationException {
        String output;
        try {
            output = commandRunner.run(
                    List.of(
                            "-b",
                            sceneRef.path().toString(),
                            "--python-exit-code",
                            "1",
                            "--python-expr",
                            BlenderPythonScripts.INSPECT_SCENE),
                    timeout,
                    "inspect scene " + sceneRef.sceneName());
        } catch (IOException e) {
            throw new PreparationException("Could not inspect scene " + sceneRef.sceneName() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PreparationException("Scene inspection interrupted for " + sceneRef.sceneName(), e);
        }

        SceneDescription description = parseInspectionOutput(output);
        logger.info(
                "Inspected scene {} frames={}..{} outputNodes={}",
                sceneRef.sceneName(),
                description.frameStart(),
                description.frameEnd(),
                description.outputGraph().nodes().size());
        return description;
    }

    SceneDescription parseInspectionOutput(String output) throws PreparationException {
        String payload = null;
        for (String line : output.split("\\R")) {
            if (line.startsWith(BlenderPythonScripts.SCENE_LINE_PREFIX)) {
                payload = line.substring(BlenderPythonScripts.SCENE_LINE_PREFIX.length());
            }
        }
        if (payload == null) {
            throw new PreparationException("Blender did not report scene details.");
        }

        InspectedScene scene;
        try {
            scene = objectMapper.readValue(payload, InspectedScene.class);
        } catch (JacksonException e) {
            throw new PreparationException("Blender reported unreadable scene details.", e);
        }

        List<OutputNode> nodes = new ArrayList<>();
        if (scene.nodes() != null) {
            for (InspectedNode node : scene.nodes()) {
                ImageFormat format = toImageFormat(node.format());
                List<OutputSlot> slots = new ArrayList<>();
                if (node.slots() != null) {
                    for (InspectedSlot slot : node.slots()) {
                        slots.add(new OutputSlot(slot.name(), slot.path(), format));
                    }
                }
                nodes.add(new OutputNode(node.name(), node.basePath(), format, slots));
            }
        }
        return new SceneDescription(scene.frameStart(), scene.frameEnd(), scene.frameCurrent(), new OutputGraph(nodes));
    }

    private ImageFormat toImageFormat(InspectedFormat format) {
        if (format == null) {
            return null;
        }
        return new ImageFormat(format.fileFormat(), parseColorDepth(format.colorDepth()), format.colorMode());
    }

    // Blender reports an empty depth for 8-bit only formats.
    private Integer parseColorDepth(String colorDepth) {
        if (colorDepth == null || colorDepth.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(colorDepth.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InspectedScene(
            @JsonProperty("frame_start") int frameStart,
            @JsonProperty("frame_end") int frameEnd,
            @JsonProperty("frame_current") int frameCurrent,
            @JsonProperty("nodes") List<InspectedNode> nodes) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InspectedNode(
            @JsonProperty("name") String name,
            @JsonProperty("base_path") String basePath,
            @JsonProperty("format") InspectedFormat format,
            @JsonProperty("slots") List<InspectedSlot> slots) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InspectedFormat(
            @JsonProperty("file_format") String fileFormat,
            @JsonProperty("color_depth") String colorDepth,
            @JsonProperty("color_mode") String colorMode) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InspectedSlot(
            @JsonProperty("name") String name,
            @JsonProperty("path") String path) {
    }
}
