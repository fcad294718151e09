package me.golemcore.worklog.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.worklog.domain.model.AutoSnapshotResult;
import me.golemcore.worklog.domain.model.SnapshotOptions;
import me.golemcore.worklog.domain.model.SnapshotResult;
import me.golemcore.worklog.domain.model.SnapshotSource;
import me.golemcore.worklog.infrastructure.config.WorklogProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Captures light snapshots as a side effect of other commands and git hooks.
 *
 * <p>
 * Background capture must never break the command that triggered it:
 * {@link #sideEffectSnapshot} reports failures in its result instead of
 * throwing, and {@link #fireAndForget} logs them at debug level. Pending
 * captures are given a short grace period to finish on shutdown.
 */
@Service
@Slf4j
public class AutoSnapshotService {

    private static final long SHUTDOWN_GRACE_SECONDS = 10;

    private final SnapshotAssemblyService assemblyService;
    private final WorklogProperties properties;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "auto-snapshot");
        t.setDaemon(true);
        return t;
    });

    public AutoSnapshotService(SnapshotAssemblyService assemblyService, WorklogProperties properties) {
        this.assemblyService = assemblyService;
        this.properties = properties;
    }

    public AutoSnapshotResult sideEffectSnapshot(SnapshotSource source, String note) {
        if (!properties.getJournal().isAutoSnapshot()) {
            return AutoSnapshotResult.skipped("auto-snapshot disabled");
        }
        try {
            if (!assemblyService.isRepository()) {
                return AutoSnapshotResult.skipped("not a git repository");
            }
            List<String> tags = new ArrayList<>();
            tags.add(source.tag());
            SnapshotResult result = assemblyService.assembleAndSave(SnapshotOptions.builder()
                    .light(true)
                    .note(note)
                    .tags(tags)
                    .build());
            log.debug("[AutoSnapshot] Captured {} for {} ({} warnings)", source.tag(),
                    result.snapshot().getProjectId(), result.warnings().size());
            return AutoSnapshotResult.taken(result);
        } catch (RuntimeException e) {
            log.debug("[AutoSnapshot] Capture {} failed: {}", source.tag(), e.getMessage());
            return AutoSnapshotResult.skipped("snapshot failed: " + e.getMessage());
        }
    }

    /**
     * Schedule {@link #sideEffectSnapshot} on the background executor. The
     * returned future always completes normally.
     */
    public CompletableFuture<AutoSnapshotResult> fireAndForget(SnapshotSource source, String note) {
        if (!properties.getJournal().isAutoSnapshot()) {
            return CompletableFuture.completedFuture(AutoSnapshotResult.skipped("auto-snapshot disabled"));
        }
        try {
            return CompletableFuture.supplyAsync(() -> sideEffectSnapshot(source, note), executor)
                    .exceptionally(e -> {
                        log.debug("[AutoSnapshot] Background capture failed: {}", e.getMessage());
                        return AutoSnapshotResult.skipped("snapshot failed: " + e.getMessage());
                    });
        } catch (RuntimeException e) {
            log.debug("[AutoSnapshot] Could not schedule capture: {}", e.getMessage());
            return CompletableFuture.completedFuture(AutoSnapshotResult.skipped("executor unavailable"));
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.debug("[AutoSnapshot] Pending capture did not finish in time");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
