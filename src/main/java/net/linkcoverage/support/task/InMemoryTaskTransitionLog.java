package net.linkcoverage.support.task;

import java.util.ArrayList;
import java.util.List;
import net.linkcoverage.domain.task.TaskTransition;

/**
 * Process-local transition log. Nothing survives a restart.
 */
public class InMemoryTaskTransitionLog implements TaskTransitionLog {

    private final List<TaskTransition> transitions = new ArrayList<>();

    @Override
    public synchronized void append(TaskTransition transition) {
        transitions.add(transition);
    }

    @Override
    public synchronized List<TaskTransition> readAll() {
        return List.copyOf(transitions);
    }
}
