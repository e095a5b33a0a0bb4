package net.linkcoverage.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import net.linkcoverage.support.task.InMemoryTaskTransitionLog;
import net.linkcoverage.support.task.JsonLinesTaskTransitionLog;
import net.linkcoverage.support.task.TaskTransitionLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the task transition log: a JSON-lines file when {@code app.tasks.transition-log.path}
 * is set, otherwise an in-memory log that does not survive restarts.
 */
@Configuration
public class TaskInfrastructureConfig {

    private static final Logger log = LoggerFactory.getLogger(TaskInfrastructureConfig.class);

    @Bean
    public TaskTransitionLog taskTransitionLog(@Value("${app.tasks.transition-log.path:}") String path,
                                               ObjectMapper objectMapper) {
        if (path == null || path.isBlank()) {
            log.info("Task transition log kept in memory; task history is lost on restart");
            return new InMemoryTaskTransitionLog();
        }
        Path logPath = Path.of(path.trim());
        log.info("Task transition log persisted to {}", logPath.toAbsolutePath());
        return new JsonLinesTaskTransitionLog(logPath, objectMapper);
    }
}
