package github.sarthakdev143.render_farm.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Executors for jobs and frame units, and the SQLite store behind the asset tracker.
 */
@Configuration
@EnableConfigurationProperties(RenderFarmProperties.class)
public class RenderFarmConfig {

    private static final Logger logger = LoggerFactory.getLogger(RenderFarmConfig.class);

    @Bean(name = "jobTaskExecutor")
    public ThreadPoolTaskExecutor jobTaskExecutor(RenderFarmProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getJobs().getExecutorThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getJobs().getQueueCapacity());
        executor.setThreadNamePrefix("render-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean(name = "frameTaskExecutor")
    public ThreadPoolTaskExecutor frameTaskExecutor(RenderFarmProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getDispatch().getExecutorThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getDispatch().getQueueCapacity());
        executor.setThreadNamePrefix("render-frame-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public DataSource assetTrackerDataSource(RenderFarmProperties properties) {
        Path database = properties.getStorage().assetTrackerDatabase().toAbsolutePath();
        try {
            Files.createDirectories(database.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create asset tracker directory " + database.getParent(), e);
        }

        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + database);
        logger.info("Asset tracker wired: database={}", database);
        return dataSource;
    }

    @Bean
    public JdbcTemplate assetTrackerJdbcTemplate(DataSource assetTrackerDataSource) {
        return new JdbcTemplate(assetTrackerDataSource);
    }
}
