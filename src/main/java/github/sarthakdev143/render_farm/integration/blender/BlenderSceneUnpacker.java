package github.sarthakdev143.render_farm.integration.blender;

import github.sarthakdev143.render_farm.config.RenderFarmProperties;
import github.sarthakdev143.render_farm.service.SceneUnpacker;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

@Component
public class BlenderSceneUnpacker implements SceneUnpacker {

    private final BlenderCommandRunner commandRunner;
    private final Duration timeout;

    public BlenderSceneUnpacker(BlenderCommandRunner commandRunner, RenderFarmProperties properties) {
        this.commandRunner = commandRunner;
        this.timeout = properties.getBlender().getPrepareTimeout();
    }

    @Override
    public void unpackAndResave(Path scenePath) throws IOException, InterruptedException {
        commandRunner.run(
                List.of(
                        "-b",
                        scenePath.toString(),
                        "--python-exit-code",
                        "1",
                        "--python-expr",
                        BlenderPythonScripts.UNPACK_AND_SAVE),
                timeout,
                "unpack " + scenePath.getFileName());
    }
}
