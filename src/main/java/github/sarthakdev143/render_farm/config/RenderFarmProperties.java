package github.sarthakdev143.render_farm.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Storage locations, dispatch limits, Blender process settings and upload settings.
 */
@ConfigurationProperties(prefix = "render-farm")
public class RenderFarmProperties {

    private Storage storage = new Storage();
    private Dispatch dispatch = new Dispatch();
    private Jobs jobs = new Jobs();
    private Blender blender = new Blender();
    private Upload upload = new Upload();

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public void setDispatch(Dispatch dispatch) {
        this.dispatch = dispatch;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs;
    }

    public Blender getBlender() {
        return blender;
    }

    public void setBlender(Blender blender) {
        this.blender = blender;
    }

    public Upload getUpload() {
        return upload;
    }

    public void setUpload(Upload upload) {
        this.upload = upload;
    }

    public static class Storage {
        private String submitterDir = "./data/submitter";
        private String assetsDir = "./data/assets";
        private String rendersDir = "./data/renders";

        public String getSubmitterDir() { return submitterDir; }
        public void setSubmitterDir(String submitterDir) { this.submitterDir = submitterDir; }

        public String getAssetsDir() { return assetsDir; }
        public void setAssetsDir(String assetsDir) { this.assetsDir = assetsDir; }

        public String getRendersDir() { return rendersDir; }
        public void setRendersDir(String rendersDir) { this.rendersDir = rendersDir; }

        public Path submitterPath() {
            return Path.of(submitterDir);
        }

        public Path assetsPath() {
            return Path.of(assetsDir);
        }

        public Path rendersPath() {
            return Path.of(rendersDir);
        }

        public Path assetTrackerDatabase() {
            return submitterPath().resolve("asset_tracker.db");
        }
    }

    public static class Dispatch {
        private int executorThreads = 10;
        private int queueCapacity = 1000;

        public int getExecutorThreads() { return executorThreads; }
        public void setExecutorThreads(int executorThreads) { this.executorThreads = executorThreads; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }

    public static class Jobs {
        private int executorThreads = 2;
        private int queueCapacity = 50;

        public int getExecutorThreads() { return executorThreads; }
        public void setExecutorThreads(int executorThreads) { this.executorThreads = executorThreads; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }

    public static class Blender {
        private String binary = "blender";
        private Duration frameTimeout = Duration.ofMinutes(30);
        private Duration prepareTimeout = Duration.ofMinutes(10);

        public String getBinary() { return binary; }
        public void setBinary(String binary) { this.binary = binary; }

        public Duration getFrameTimeout() { return frameTimeout; }
        public void setFrameTimeout(Duration frameTimeout) { this.frameTimeout = frameTimeout; }

        public Duration getPrepareTimeout() { return prepareTimeout; }
        public void setPrepareTimeout(Duration prepareTimeout) { this.prepareTimeout = prepareTimeout; }
    }

    public static class Upload {
        private boolean enabled = true;
        private String credentialsPath = "secrets/credentials.json";
        private String tokensDir = ".drive-tokens";
        private String applicationName = "RenderFarmUploader";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getCredentialsPath() { return credentialsPath; }
        public void setCredentialsPath(String credentialsPath) { this.credentialsPath = credentialsPath; }

        public String getTokensDir() { return tokensDir; }
        public void setTokensDir(String tokensDir) { this.tokensDir = tokensDir; }

        public String getApplicationName() { return applicationName; }
        public void setApplicationName(String applicationName) { this.applicationName = applicationName; }
    }
}
