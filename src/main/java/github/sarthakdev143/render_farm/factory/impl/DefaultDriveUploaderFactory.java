package github.sarthakdev143.render_farm.factory.impl;

import com.google.api.services.drive.Drive;
import github.sarthakdev143.render_farm.factory.DriveUploaderFactory;
import github.sarthakdev143.render_farm.integration.drive.DriveUploader;
import org.springframework.stereotype.Component;

@Component
public class DefaultDriveUploaderFactory implements DriveUploaderFactory {

    @Override
    public DriveUploader create(Drive driveService) {
        return new DriveUploader(driveService);
    }
}
