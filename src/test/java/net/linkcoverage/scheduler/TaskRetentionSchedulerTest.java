package net.linkcoverage.scheduler;

import net.linkcoverage.application.task.TaskOrchestrator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskRetentionSchedulerTest {

    @Mock
    private TaskOrchestrator taskOrchestrator;

    @Test
    void should_PurgeExpiredTasks_When_SweepRuns() {
        when(taskOrchestrator.purgeExpiredTasks()).thenReturn(3);

        new TaskRetentionScheduler(taskOrchestrator).purgeExpiredTasks();

        verify(taskOrchestrator).purgeExpiredTasks();
    }

    @Test
    void should_LogAndContinue_When_SweepThrows() {
        when(taskOrchestrator.purgeExpiredTasks()).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> new TaskRetentionScheduler(taskOrchestrator).purgeExpiredTasks());
    }
}
