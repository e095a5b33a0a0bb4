package net.linkcoverage.support.task;

import java.util.List;
import net.linkcoverage.domain.task.TaskTransition;

/**
 * Append-only record of committed task transitions, replayed on startup to rebuild the task table.
 */
public interface TaskTransitionLog {

    void append(TaskTransition transition);

    /** All transitions in append order. */
    List<TaskTransition> readAll();
}
