package github.sarthakdev143.render_farm.integration.drive;

import com.google.api.services.drive.Drive;

public interface DriveServiceProvider {

    Drive getService() throws Exception;
}
