package github.sarthakdev143.render_farm.integration.drive;

import github.sarthakdev143.render_farm.config.RenderFarmProperties;
import github.sarthakdev143.render_farm.factory.DriveUploaderFactory;
import github.sarthakdev143.render_farm.model.UploadSinkAvailability;
import github.sarthakdev143.render_farm.service.UploadSink;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
public class DriveUploadSink implements UploadSink {

    private static final Logger logger = LoggerFactory.getLogger(DriveUploadSink.class);

    private final DriveServiceProvider driveServiceProvider;
    private final DriveUploaderFactory uploaderFactory;
    private final RenderFarmProperties.Upload uploadProperties;
    private final Counter uploadFailureCounter;
    private final AtomicBoolean missingCredentialsReported = new AtomicBoolean();

    public DriveUploadSink(
            DriveServiceProvider driveServiceProvider,
            DriveUploaderFactory uploaderFactory,
            RenderFarmProperties properties,
            MeterRegistry meterRegistry) {
        this.driveServiceProvider = driveServiceProvider;
        this.uploaderFactory = uploaderFactory;
        this.uploadProperties = properties.getUpload();
        this.uploadFailureCounter = meterRegistry.counter("render_farm.upload.failures");
    }

    @Override
    public UploadSinkAvailability availability() {
        if (!uploadProperties.isEnabled()) {
            return UploadSinkAvailability.DISABLED;
        }

        Path credentialsPath = DriveServiceFactory.resolveCredentialsPath(uploadProperties);
        if (!Files.isReadable(credentialsPath)) {
            if (missingCredentialsReported.compareAndSet(false, true)) {
                logger.warn(
                        "Drive credentials not found at {}; rendered files will not be uploaded",
                        credentialsPath.toAbsolutePath());
            }
            return UploadSinkAvailability.UNAVAILABLE;
        }
        return UploadSinkAvailability.AVAILABLE;
    }

    @Override
    public boolean put(Path localPath, String remoteFolder) {
        try {
            String fileId = uploaderFactory.create(driveServiceProvider.getService()).uploadFile(localPath, remoteFolder);
            logger.info("Uploaded {} to Drive folder {} fileId={}", localPath.getFileName(), remoteFolder, fileId);
            return true;
        } catch (Exception e) {
            uploadFailureCounter.increment();
            logger.error("Drive upload failed for {} into {}", localPath, remoteFolder, e);
            return false;
        }
    }
}
