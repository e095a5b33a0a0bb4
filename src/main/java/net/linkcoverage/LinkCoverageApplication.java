/**
 * Main application class for the link coverage service
 *
 * Features:
 * - Loads an optional .env file before the context starts
 * - Enables scheduling for monitoring and retention jobs
 * - Entry point for Spring Boot application
 */

package net.linkcoverage;

import java.io.IOException;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@SpringBootApplication
@EnableScheduling
public class LinkCoverageApplication {

    private static final Logger log = LoggerFactory.getLogger(LinkCoverageApplication.class);
    private static final int APPLICATION_SCHEDULER_POOL_SIZE = 2;
    private static final int APPLICATION_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS = 30;
    private static final String APPLICATION_SCHEDULER_THREAD_PREFIX = "CoverageScheduler-";

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile();
        SpringApplication.run(LinkCoverageApplication.class, args);
    }

    /**
     * Dedicated scheduler for {@code @Scheduled} monitoring and retention jobs so they never
     * compete with task workers for threads.
     *
     * @return application task scheduler used by Spring scheduling infrastructure
     */
    @Bean(name = "taskScheduler")
    public TaskScheduler applicationTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setThreadNamePrefix(APPLICATION_SCHEDULER_THREAD_PREFIX);
        scheduler.setPoolSize(APPLICATION_SCHEDULER_POOL_SIZE);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(APPLICATION_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS);
        return scheduler;
    }

    private static void loadDotEnvFile() {
        try {
            java.nio.file.Path envFile = java.nio.file.Paths.get(".env");
            if (java.nio.file.Files.exists(envFile)) {
                java.util.Properties props = new java.util.Properties();
                try (java.io.InputStream is = java.nio.file.Files.newInputStream(envFile)) {
                    props.load(is);
                }
                // Environment variables win over .env entries
                for (String key : props.stringPropertyNames()) {
                    if (System.getenv(key) == null) {
                        System.setProperty(key, props.getProperty(key));
                    }
                }
            }
        } catch (IOException | SecurityException e) {
            log.warn("Failed to load .env file; aborting startup", e);
            throw new IllegalStateException("Failed to load .env file", e);
        }
    }
}
