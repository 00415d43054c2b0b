package github.sarthakdev143.render_farm.integration.drive;

import com.google.api.services.drive.Drive;
import github.sarthakdev143.render_farm.config.RenderFarmProperties;
import github.sarthakdev143.render_farm.factory.DriveUploaderFactory;
import github.sarthakdev143.render_farm.model.UploadSinkAvailability;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DriveUploadSinkTest {

    @Mock
    private DriveServiceProvider driveServiceProvider;

    @Mock
    private DriveUploaderFactory uploaderFactory;

    @Mock
    private DriveUploader driveUploader;

    @Mock
    private Drive driveService;

    @TempDir
    private Path tempDir;

    private RenderFarmProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private DriveUploadSink uploadSink;

    @BeforeEach
    void setUp() {
        properties = new RenderFarmProperties();
        meterRegistry = new SimpleMeterRegistry();
        uploadSink = new DriveUploadSink(driveServiceProvider, uploaderFactory, properties, meterRegistry);
    }

    @Test
    void availabilityIsDisabledWhenUploadsAreTurnedOff() {
        properties.getUpload().setEnabled(false);

        assertThat(uploadSink.availability()).isEqualTo(UploadSinkAvailability.DISABLED);
        verifyNoInteractions(driveServiceProvider);
    }

    @Test
    void availabilityIsUnavailableWithoutCredentials() {
        properties.getUpload().setCredentialsPath(tempDir.resolve("missing.json").toString());

        assertThat(uploadSink.availability()).isEqualTo(UploadSinkAvailability.UNAVAILABLE);
        assertThat(uploadSink.availability()).isEqualTo(UploadSinkAvailability.UNAVAILABLE);
    }

    @Test
    void availabilityIsAvailableWithReadableCredentials() throws IOException {
        Path credentials = Files.writeString(tempDir.resolve("credentials.json"), "{\"installed\":{}}");
        properties.getUpload().setCredentialsPath(credentials.toString());

        assertThat(uploadSink.availability()).isEqualTo(UploadSinkAvailability.AVAILABLE);
    }

    @Test
    void putUploadsThroughDriveClient() throws Exception {
        Path frame = tempDir.resolve("main.0001.exr");
        when(driveServiceProvider.getService()).thenReturn(driveService);
        when(uploaderFactory.create(driveService)).thenReturn(driveUploader);
        when(driveUploader.uploadFile(frame, "/Renders")).thenReturn("file-1");

        assertThat(uploadSink.put(frame, "/Renders")).isTrue();
        assertThat(meterRegistry.counter("render_farm.upload.failures").count()).isZero();
    }

    @Test
    void putReportsFailureWithoutThrowing() throws Exception {
        Path frame = tempDir.resolve("main.0001.exr");
        when(driveServiceProvider.getService()).thenReturn(driveService);
        when(uploaderFactory.create(driveService)).thenReturn(driveUploader);
        when(driveUploader.uploadFile(frame, "/Renders")).thenThrow(new IOException("quota exceeded"));

        assertThat(uploadSink.put(frame, "/Renders")).isFalse();
        assertThat(meterRegistry.counter("render_farm.upload.failures").count()).isEqualTo(1.0);
    }

    @Test
    void putReportsFailureWhenAuthorizationFails() throws Exception {
        when(driveServiceProvider.getService()).thenThrow(new IOException("Drive credentials file not found"));

        assertThat(uploadSink.put(tempDir.resolve("main.0001.exr"), "/Renders")).isFalse();
        assertThat(meterRegistry.counter("render_farm.upload.failures").count()).isEqualTo(1.0);
        verifyNoInteractions(uploaderFactory);
    }
}
