package com.commandcenter.backend.repo;

import com.commandcenter.backend.domain.Task;
import com.commandcenter.backend.domain.TaskPatch;
import com.commandcenter.backend.service.storage.JsonCollectionStore;
import com.commandcenter.backend.support.MutableClock;
import com.commandcenter.backend.support.TestBeans;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class TaskRepositoryTest {

    @TempDir
    Path dir;

    private MutableClock clock;
    private JsonCollectionStore store;
    private TaskRepository repo;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-02-03T10:00:00Z");
        store = TestBeans.store(dir);
        repo = new TaskRepository(store, clock);
    }

    @Test
    void createAssignsFreshIdAndDefaults() {
        Task draft = new Task();
        draft.setId("client-chosen");
        draft.setTitle("Write report");

        Task created = repo.create(draft);

        assertThat(created.getId()).hasSize(8).isNotEqualTo("client-chosen");
        assertThat(created.getStatus()).isEqualTo(Task.TODO);
        assertThat(created.getCreatedAt()).isEqualTo("2026-02-03T10:00:00.000Z");
        assertThat(created.getStartedAt()).isNull();
        assertThat(created.getCompletedAt()).isNull();
    }

    @Test
    void createInProgressOrDoneStampsMatchingTimestamp() {
        Task running = new Task();
        running.setStatus(Task.IN_PROGRESS);
        Task finished = new Task();
        finished.setStatus(Task.DONE);

        assertThat(repo.create(running).getStartedAt()).isEqualTo("2026-02-03T10:00:00.000Z");
        assertThat(repo.create(finished).getCompletedAt()).isEqualTo("2026-02-03T10:00:00.000Z");
    }

    @Test
    void reportLifecycleEndsInArchive() {
        Task draft = new Task();
        draft.setTitle("Write report");
        draft.setStatus(Task.TODO);
        String id = repo.create(draft).getId();

        clock.advance(Duration.ofMinutes(5));
        Task started = repo.update(id, status(Task.IN_PROGRESS)).orElseThrow().task();
        assertThat(started.getStartedAt()).isEqualTo("2026-02-03T10:05:00.000Z");
        assertThat(started.getCompletedAt()).isNull();

        clock.advance(Duration.ofHours(2));
        Task done = repo.update(id, status(Task.DONE)).orElseThrow().task();
        assertThat(done.getCompletedAt()).isEqualTo("2026-02-03T12:05:00.000Z");
        assertThat(done.getStartedAt()).isEqualTo("2026-02-03T10:05:00.000Z");

        clock.advance(Duration.ofDays(8));
        assertThat(repo.archiveCompletedBefore(clock.instant().minus(Duration.ofDays(7)))).isEqualTo(1);
        assertThat(repo.findById(id).orElseThrow().getStatus()).isEqualTo(Task.ARCHIVE);

        assertThat(repo.archiveCompletedBefore(clock.instant().minus(Duration.ofDays(7)))).isZero();

        TaskRepository reloaded = new TaskRepository(store, clock);
        assertThat(reloaded.findById(id).orElseThrow().getStatus()).isEqualTo(Task.ARCHIVE);
    }

    @Test
    void timestampsAreStampedOnlyOnce() {
        String id = repo.create(new Task()).getId();

        repo.update(id, status(Task.IN_PROGRESS));
        clock.advance(Duration.ofHours(1));
        repo.update(id, status(Task.TODO));
        repo.update(id, status(Task.IN_PROGRESS));
        assertThat(repo.findById(id).orElseThrow().getStartedAt()).isEqualTo("2026-02-03T10:00:00.000Z");

        repo.update(id, status(Task.ARCHIVE));
        clock.advance(Duration.ofHours(1));
        Task again = repo.update(id, status(Task.DONE)).orElseThrow().task();
        assertThat(again.getCompletedAt()).isEqualTo("2026-02-03T11:00:00.000Z");
    }

    @Test
    void updateReportsStatusChangeAndPreviousAssignee() {
        Task draft = new Task();
        draft.setAssignedTo("Jarvis");
        String id = repo.create(draft).getId();

        TaskPatch patch = new TaskPatch();
        patch.setAssignedTo("Agent:coder");
        TaskRepository.TaskChange change = repo.update(id, patch).orElseThrow();

        assertThat(change.statusChanged()).isFalse();
        assertThat(change.previousAssignee()).isEqualTo("Jarvis");
        assertThat(change.task().getAssignedTo()).isEqualTo("Agent:coder");
    }

    @Test
    void unknownIdIsNoOp() {
        assertThat(repo.update("nope", status(Task.DONE))).isEmpty();
        assertThat(repo.delete("nope")).isEmpty();
        assertThat(store.pathFor(TaskRepository.KEY)).doesNotExist();
    }

    @Test
    void unknownPatchFieldsAreKept() {
        String id = repo.create(new Task()).getId();
        TaskPatch patch = new TaskPatch();
        patch.putExtra("estimate", "2h");

        repo.update(id, patch);

        assertThat(new TaskRepository(store, clock).findById(id).orElseThrow().getExtra())
                .containsEntry("estimate", "2h");
    }

    @Test
    void sequentialUpdatesLastWriterWins() {
        String id = repo.create(new Task()).getId();

        TaskPatch a = new TaskPatch();
        a.setDescription("A");
        TaskPatch b = new TaskPatch();
        b.setDescription("B");
        repo.update(id, a);
        repo.update(id, b);

        assertThat(new TaskRepository(store, clock).findById(id).orElseThrow().getDescription()).isEqualTo("B");
    }

    @Test
    void concurrentUpdatesLeaveOneWholeValue() throws Exception {
        for (int round = 0; round < 20; round++) {
            String id = repo.create(new Task()).getId();
            String a = "A".repeat(2000);
            String b = "B".repeat(2000);
            ExecutorService pool = Executors.newFixedThreadPool(2);
            CountDownLatch go = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (String value : List.of(a, b)) {
                    futures.add(pool.submit(() -> {
                        go.await();
                        TaskPatch patch = new TaskPatch();
                        patch.setDescription(value);
                        return repo.update(id, patch);
                    }));
                }
                go.countDown();
                for (Future<?> f : futures) f.get();
            } finally {
                pool.shutdownNow();
            }

            String inMemory = repo.findById(id).orElseThrow().getDescription();
            String onDisk = new TaskRepository(store, clock).findById(id).orElseThrow().getDescription();
            assertThat(inMemory).isIn(a, b);
            assertThat(onDisk).isEqualTo(inMemory);
        }
    }

    @Test
    void concurrentCreatesAreNotLost() throws Exception {
        int writers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Task>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                int n = i;
                futures.add(pool.submit(() -> {
                    go.await();
                    Task t = new Task();
                    t.setTitle("task " + n);
                    return repo.create(t);
                }));
            }
            go.countDown();
            for (Future<Task> f : futures) f.get();
        } finally {
            pool.shutdownNow();
        }

        assertThat(repo.findAll()).hasSize(writers);
        assertThat(new TaskRepository(store, clock).findAll()).hasSize(writers);
    }

    @Test
    void activeFilterKeepsTodoAndInProgress() {
        for (String s : List.of(Task.TODO, Task.IN_PROGRESS, Task.DONE, Task.ARCHIVE)) {
            Task t = new Task();
            t.setStatus(s);
            repo.create(t);
        }

        assertThat(repo.findActive()).extracting(Task::getStatus).containsExactly(Task.TODO, Task.IN_PROGRESS);
    }

    @Test
    void sweepSkipsDoneTasksWithoutCompletion() {
        Task t = new Task();
        t.setStatus(Task.DONE);
        t.setCompletedAt("not a date");
        String id = repo.create(t).getId();

        clock.advance(Duration.ofDays(30));
        assertThat(repo.archiveCompletedBefore(clock.instant())).isZero();
        assertThat(repo.findById(id).orElseThrow().getStatus()).isEqualTo(Task.DONE);
    }

    private static TaskPatch status(String status) {
        TaskPatch p = new TaskPatch();
        p.setStatus(status);
        return p;
    }
}
