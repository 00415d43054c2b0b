package github.sarthakdev143.render_farm.factory;

import com.google.api.services.drive.Drive;
import github.sarthakdev143.render_farm.integration.drive.DriveUploader;

public interface DriveUploaderFactory {

    DriveUploader create(Drive driveService);
}
