package github.sarthakdev143.render_farm.service;

import github.sarthakdev143.render_farm.model.UploadSinkAvailability;

import java.nio.file.Path;

public interface UploadSink {

    UploadSinkAvailability availability();

    /**
     * @return {@code false} when the upload failed; failures are logged, never thrown
     */
    boolean put(Path localPath, String remoteFolder);
}
