package com.commandcenter.backend.repo;

import com.commandcenter.backend.domain.Task;
import com.commandcenter.backend.domain.TaskPatch;
import com.commandcenter.backend.domain.Timestamps;
import com.commandcenter.backend.service.storage.JsonCollectionStore;
import com.commandcenter.backend.service.storage.PersistentDocument;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Owns the tasks document and the startedAt / completedAt stamping rules.
 * <p>
 * startedAt is stamped on the first move into in-progress, completedAt on the first move into done or
 * archive. Neither is touched by later transitions.
 */
@Component
public class TaskRepository {

    public static final String KEY = "tasks";
    private static final TypeReference<List<Task>> TYPE = new TypeReference<>() {};

    private final PersistentDocument<List<Task>> doc;
    private final Clock clock;

    public TaskRepository(JsonCollectionStore store, Clock clock) {
        this.doc = new PersistentDocument<>(store, KEY, TYPE, ArrayList::new);
        this.clock = clock;
    }

    public record TaskChange(Task task, String previousStatus, String previousAssignee, boolean statusChanged) {}

    public List<Task> findAll() {
        return Collections.unmodifiableList(doc.read());
    }

    public List<Task> findActive() {
        return doc.read().stream()
                .filter(t -> t.getStatus() != null && Task.ACTIVE_STATUSES.contains(t.getStatus()))
                .collect(Collectors.toList());
    }

    public Optional<Task> findById(String id) {
        return doc.read().stream().filter(t -> id.equals(t.getId())).findFirst();
    }

    /**
     * Stores a new task built from a request body. The id is always fresh; caller-supplied timestamps
     * are kept so older work can be back-filled.
     */
    public Task create(Task draft) {
        return doc.update(tasks -> {
            String now = Timestamps.now(clock);
            draft.setId(ShortIds.next(tasks.stream().map(Task::getId).collect(Collectors.toSet())));
            if (Timestamps.isBlank(draft.getStatus())) draft.setStatus(Task.TODO);
            if (Timestamps.isBlank(draft.getCreatedAt())) draft.setCreatedAt(now);
            if (Task.IN_PROGRESS.equals(draft.getStatus()) && Timestamps.isBlank(draft.getStartedAt())) {
                draft.setStartedAt(now);
            }
            if (draft.isCompleted() && Timestamps.isBlank(draft.getCompletedAt())) {
                draft.setCompletedAt(now);
            }
            tasks.add(draft);
            return draft;
        });
    }

    /**
     * Merges {@code patch} into the task. Empty when the id is unknown, in which case nothing is written.
     */
    public Optional<TaskChange> update(String id, TaskPatch patch) {
        return doc.update(tasks -> {
            for (Task t : tasks) {
                if (!id.equals(t.getId())) continue;

                String oldStatus = t.getStatus();
                String oldAssignee = t.getAssignedTo();
                boolean hadStart = !Timestamps.isBlank(t.getStartedAt());
                boolean hadCompletion = !Timestamps.isBlank(t.getCompletedAt());

                patch.applyTo(t);

                String next = patch.newStatus();
                boolean moved = next != null && !next.equals(oldStatus);
                if (moved) {
                    String now = Timestamps.now(clock);
                    if (Task.IN_PROGRESS.equals(next) && !hadStart && !patch.has(TaskPatch.Field.STARTED_AT)) {
                        t.setStartedAt(now);
                    } else if (Task.COMPLETED_STATUSES.contains(next) && !hadCompletion
                            && !patch.has(TaskPatch.Field.COMPLETED_AT)) {
                        t.setCompletedAt(now);
                    }
                }
                return Optional.of(new TaskChange(t, oldStatus, oldAssignee, moved));
            }
            return Optional.<TaskChange>empty();
        }, Optional::isPresent);
    }

    /** Removes the task; empty when it did not exist. */
    public Optional<Task> delete(String id) {
        return doc.update(tasks -> {
            Iterator<Task> it = tasks.iterator();
            while (it.hasNext()) {
                Task t = it.next();
                if (id.equals(t.getId())) {
                    it.remove();
                    return Optional.of(t);
                }
            }
            return Optional.<Task>empty();
        }, Optional::isPresent);
    }

    /**
     * Moves done tasks whose completedAt is before {@code cutoff} to archive.
     * Tasks without a parseable completedAt are left alone.
     *
     * @return number of archived tasks; nothing is written when zero
     */
    public int archiveCompletedBefore(Instant cutoff) {
        return doc.update(tasks -> {
            int count = 0;
            for (Task t : tasks) {
                if (!Task.DONE.equals(t.getStatus())) continue;
                Optional<Instant> completed = Timestamps.parse(t.getCompletedAt());
                if (completed.isPresent() && completed.get().isBefore(cutoff)) {
                    t.setStatus(Task.ARCHIVE);
                    count++;
                }
            }
            return count;
        }, count -> count > 0);
    }
}
