package github.sarthakdev143.render_farm.integration.drive;

import com.google.api.services.drive.Drive;
import github.sarthakdev143.render_farm.config.RenderFarmProperties;
import org.springframework.stereotype.Component;

/**
 * Authorizes on first use and keeps the client for later uploads.
 */
@Component
public class DefaultDriveServiceProvider implements DriveServiceProvider {

    private final DriveServiceFactory serviceFactory;
    private Drive service;

    public DefaultDriveServiceProvider(RenderFarmProperties properties) {
        this.serviceFactory = new DriveServiceFactory(properties.getUpload());
    }

    @Override
    public synchronized Drive getService() throws Exception {
        if (service == null) {
            service = serviceFactory.createService();
        }
        return service;
    }
}
