package io.tabsense.runtime;

import io.tabsense.model.IntelligenceTask;
import io.tabsense.model.TaskStatus;
import io.tabsense.storage.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Cancels Running tasks that have run for more than twice their estimated duration.
 */
final class StuckTaskReaper {
    private static final Logger log = LoggerFactory.getLogger(StuckTaskReaper.class);

    static final String TIMEOUT_ERROR = "Task timeout";

    private final TaskStore tasks;
    private final ExecutionSupervisor supervisor;
    private final Duration defaultEstimate;
    private final Clock clock;

    StuckTaskReaper(TaskStore tasks, ExecutionSupervisor supervisor, Duration defaultEstimate, Clock clock) {
        this.tasks = tasks;
        this.supervisor = supervisor;
        this.defaultEstimate = defaultEstimate;
        this.clock = clock;
    }

    List<String> sweep() {
        Instant now = clock.instant();
        List<String> reaped = new ArrayList<>();
        for (IntelligenceTask task : tasks.listByStatus(TaskStatus.RUNNING)) {
            if (task.startedAt() == null) {
                continue;
            }
            Duration limit = limitOf(task);
            Duration elapsed = Duration.between(task.startedAt(), now);
            if (elapsed.compareTo(limit) <= 0) {
                continue;
            }
            if (supervisor.forceCancel(task.id(), TIMEOUT_ERROR, true).isPresent()) {
                reaped.add(task.id());
                log.warn("Task {} timed out after {} ms (limit {} ms)", task.id(), elapsed.toMillis(), limit.toMillis());
            }
        }
        return reaped;
    }

    Duration limitOf(IntelligenceTask task) {
        Duration estimate = task.estimatedDuration() == null ? defaultEstimate : task.estimatedDuration();
        return estimate.multipliedBy(2);
    }
}
