package com.commandcenter.backend.service.history;

import com.commandcenter.backend.domain.ActivityEntry;
import com.commandcenter.backend.domain.Task;
import com.commandcenter.backend.service.ServiceHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TaskArchiveServiceTest {

    @TempDir
    Path dir;

    private ServiceHarness h;
    private TaskArchiveService archive;

    @BeforeEach
    void setUp() {
        h = new ServiceHarness(dir);
        archive = new TaskArchiveService(h.tasks, h.activity, h.broadcaster, h.clock, h.props);
    }

    @Test
    void sweepArchivesOnceAndIsIdempotent() {
        Task old = new Task();
        old.setTitle("Write report");
        old.setStatus(Task.DONE);
        String id = h.tasks.create(old).getId();
        Task fresh = new Task();
        fresh.setStatus(Task.DONE);
        h.clock.advance(Duration.ofDays(6));
        String freshId = h.tasks.create(fresh).getId();

        h.clock.advance(Duration.ofDays(2));
        assertThat(archive.archiveOld()).isEqualTo(1);
        assertThat(archive.archiveOld()).isZero();

        assertThat(h.tasks.findById(id).orElseThrow().getStatus()).isEqualTo(Task.ARCHIVE);
        assertThat(h.tasks.findById(freshId).orElseThrow().getStatus()).isEqualTo(Task.DONE);
        assertThat(h.activityLog.all()).extracting(ActivityEntry::message)
                .containsExactly("📦 Auto-archived 1 completed tasks older than 7 days");
        assertThat(h.eventTypes()).containsExactly("activity", "tasks_archived");
        assertThat(h.events().get(1).path("data").path("count").asInt()).isEqualTo(1);
    }

    @Test
    void emptySweepWritesNothing() {
        assertThat(archive.archiveOld()).isZero();
        assertThat(h.eventTypes()).isEmpty();
        assertThat(h.store.pathFor("tasks")).doesNotExist();
    }
}
