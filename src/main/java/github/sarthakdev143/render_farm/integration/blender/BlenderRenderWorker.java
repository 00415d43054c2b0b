package github.sarthakdev143.render_farm.integration.blender;

import github.sarthakdev143.render_farm.config.RenderFarmProperties;
import github.sarthakdev143.render_farm.exception.RenderException;
import github.sarthakdev143.render_farm.model.SceneRef;
import github.sarthakdev143.render_farm.model.graph.OutputGraph;
import github.sarthakdev143.render_farm.model.graph.OutputNode;
import github.sarthakdev143.render_farm.model.graph.OutputSlot;
import github.sarthakdev143.render_farm.service.RenderWorker;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class BlenderRenderWorker implements RenderWorker {

    private static final String GPU_DEVICE = "CUDA";
    private static final String CPU_DEVICE = "CPU";

    private final BlenderCommandRunner commandRunner;
    private final ObjectMapper objectMapper;
    private final Duration frameTimeout;

    public BlenderRenderWorker(
            BlenderCommandRunner commandRunner,
            ObjectMapper objectMapper,
            RenderFarmProperties properties) {
        this.commandRunner = commandRunner;
        this.objectMapper = objectMapper;
        this.frameTimeout = properties.getBlender().getFrameTimeout();
    }

    @Override
    public void render(SceneRef sceneRef, int frame, OutputGraph graph, boolean gpu) throws RenderException {
        List<String> arguments;
        try {
            arguments = buildRenderArguments(sceneRef, frame, graph, gpu);
        } catch (JacksonException e) {
            throw new RenderException(frame, "Could not encode output graph for frame " + frame, e);
        }

        try {
            commandRunner.run(arguments, frameTimeout, "render frame " + frame);
        } catch (IOException e) {
            throw new RenderException(frame, "Frame " + frame + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderException(frame, "Frame " + frame + " was interrupted", e);
        }
    }

    List<String> buildRenderArguments(SceneRef sceneRef, int frame, OutputGraph graph, boolean gpu) {
        List<String> arguments = new ArrayList<>();
        arguments.add("-b");
        arguments.add(sceneRef.path().toString());
        arguments.add("-E");
        arguments.add("CYCLES");
        arguments.add("--python-exit-code");
        arguments.add("1");
        arguments.add("--python-expr");
        arguments.add(buildApplyGraphScript(graph));
        arguments.add("-f");
        arguments.add(String.valueOf(frame));
        arguments.add("--");
        arguments.add("--cycles-device");
        arguments.add(gpu ? GPU_DEVICE : CPU_DEVICE);
        return arguments;
    }

    String buildApplyGraphScript(OutputGraph graph) {
        List<Map<String, Object>> nodes = new ArrayList<>();
        for (OutputNode node : graph.nodes()) {
            List<String> slotPaths = new ArrayList<>(node.slots().size());
            for (OutputSlot slot : node.slots()) {
                slotPaths.add(slot.path());
            }
            Map<String, Object> encoded = new LinkedHashMap<>();
            encoded.put("name", node.name());
            encoded.put("base_path", node.basePath());
            encoded.put("slots", slotPaths);
            nodes.add(encoded);
        }

        String graphJson = objectMapper.writeValueAsString(nodes);
        // A JSON string literal is also a valid Python string literal.
        return BlenderPythonScripts.applyGraph(objectMapper.writeValueAsString(graphJson));
    }
}
