package github.sarthakdev143.render_farm.service;

import github.sarthakdev143.render_farm.model.RenderJobOptions;
import github.sarthakdev143.render_farm.model.RenderJobStatus;
import github.sarthakdev143.render_farm.model.SceneDescription;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Optional;

public interface RenderFarmService {

    /**
     * Stores the uploaded scene and queues the job.
     *
     * @param manifest explicit scene description, or {@code null} to inspect the scene with Blender
     * @return the new job id
     */
    String submitJob(MultipartFile scene, RenderJobOptions options, SceneDescription manifest) throws IOException;

    Optional<RenderJobStatus> getJobStatus(String jobId);
}
