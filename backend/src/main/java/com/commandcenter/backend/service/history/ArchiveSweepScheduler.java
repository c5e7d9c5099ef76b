package com.commandcenter.backend.service.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "dashboard.archive", name = "sweep-enabled", havingValue = "true", matchIfMissing = true)
public class ArchiveSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(ArchiveSweepScheduler.class);

    private final TaskArchiveService archive;

    public ArchiveSweepScheduler(TaskArchiveService archive) {
        this.archive = archive;
    }

    @Scheduled(fixedDelayString = "${dashboard.archive.sweep-interval-ms:3600000}",
            initialDelayString = "${dashboard.archive.sweep-interval-ms:3600000}")
    public void sweep() {
        try {
            archive.archiveOld();
        } catch (RuntimeException e) {
            log.warn("Background archive sweep failed: {}", e.getMessage(), e);
        }
    }
}
