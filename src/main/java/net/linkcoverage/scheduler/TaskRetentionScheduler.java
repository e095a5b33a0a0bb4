package net.linkcoverage.scheduler;

import lombok.extern.slf4j.Slf4j;
import net.linkcoverage.application.task.TaskOrchestrator;
import net.linkcoverage.util.LoggingUtils;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Evicts terminal tasks older than the retention window from the task table.
 */
@Slf4j
@Component
public class TaskRetentionScheduler {

    private final TaskOrchestrator taskOrchestrator;

    public TaskRetentionScheduler(TaskOrchestrator taskOrchestrator) {
        this.taskOrchestrator = taskOrchestrator;
    }

    @Scheduled(fixedDelayString = "${app.tasks.retention-sweep-ms:3600000}",
               initialDelayString = "${app.tasks.retention-sweep-ms:3600000}")
    public void purgeExpiredTasks() {
        try {
            int removed = taskOrchestrator.purgeExpiredTasks();
            log.debug("Task retention sweep removed {} task(s)", removed);
        } catch (RuntimeException e) {
            LoggingUtils.error(log, e, "Task retention sweep failed");
        }
    }
}
