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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.worklog.domain.model.CrossProjectSummary;
import me.golemcore.worklog.domain.model.DiffStats;
import me.golemcore.worklog.domain.model.JournalQueryResult;
import me.golemcore.worklog.domain.model.JournalStats;
import me.golemcore.worklog.domain.model.ProjectSummary;
import me.golemcore.worklog.domain.model.PruneResult;
import me.golemcore.worklog.domain.model.WorkCategory;
import me.golemcore.worklog.domain.model.WorkSnapshot;
import me.golemcore.worklog.infrastructure.config.WorklogProperties;
import me.golemcore.worklog.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Durable store of work snapshots, one JSON document per
 * {@code (date, projectId)} key.
 *
 * <p>
 * Layout under the journal directory:
 *
 * <pre>
 * journal/
 *   2026-02-10/
 *     acme.json
 *     owner-repo.json
 * </pre>
 *
 * <p>
 * Saves are read-merge-write cycles executed under the key's lock
 * ({@link StoragePort#updateTextLocked}), so concurrent saves to one key
 * never lose data and saves to different keys do not contend. Derived tags
 * are recomputed from the merged record on every save. Corrupt records are
 * skipped on read and replaced on write.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalService {

    static final String RECORD_SUFFIX = ".json";
    private static final int CROSS_PROJECT_TOP_FILES = 10;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final SnapshotTaggingService taggingService;
    private final WorklogProperties properties;
    private final Clock clock;

    // ==================== WRITE ====================

    /**
     * Merge the snapshot into the record stored under its key, creating the
     * record when absent.
     *
     * @return the record as stored after the merge
     */
    public WorkSnapshot save(WorkSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("Snapshot is required");
        }
        if (snapshot.getDate() == null) {
            throw new IllegalArgumentException("Snapshot date is required");
        }
        String projectId = ProjectIdentitySupport.requireProjectId(snapshot.getProjectId());

        WorkSnapshot incoming = normalize(snapshot.toBuilder()
                .projectId(projectId)
                .takenAt(snapshot.getTakenAt() != null ? snapshot.getTakenAt() : clock.instant())
                .build());
        String path = recordPath(snapshot.getDate(), projectId);

        String stored = await(storagePort.updateTextLocked(getJournalDirectory(), path, current -> {
            WorkSnapshot result = incoming;
            if (current != null && !current.isBlank()) {
                try {
                    WorkSnapshot existing = parse(current, path);
                    result = normalize(SnapshotMergeSupport.merge(existing, incoming));
                } catch (IllegalStateException e) {
                    log.warn("[Journal] Replacing corrupt record {}: {}", path, e.getMessage());
                }
            }
            return serialize(result.toBuilder().tags(taggingService.retag(result)).build());
        }));

        WorkSnapshot saved = parse(stored, path);
        log.info("[Journal] Saved snapshot {} ({} commits today, {} tags)",
                path, saved.getTodayCommits().size(), saved.getTags().size());
        return saved;
    }

    /**
     * Append a note to a project's record, creating a minimal record when the
     * day has none yet.
     */
    public WorkSnapshot addNote(String projectId, String note, LocalDate date) {
        if (note == null || note.isBlank()) {
            throw new IllegalArgumentException("Note must not be empty");
        }
        String id = ProjectIdentitySupport.requireProjectId(projectId);
        LocalDate targetDate = date != null ? date : today();

        return save(WorkSnapshot.builder()
                .date(targetDate)
                .takenAt(clock.instant())
                .projectId(id)
                .currentBranch("")
                .notes(note.trim())
                .build());
    }

    /**
     * Add tags to an existing record.
     *
     * @return false when no record exists for the key
     */
    public boolean addTags(String projectId, Collection<String> tags, LocalDate date) {
        List<String> normalized = SnapshotTaggingService.normalize(tags);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("At least one tag is required");
        }
        String id = ProjectIdentitySupport.requireProjectId(projectId);
        LocalDate targetDate = date != null ? date : today();

        if (get(targetDate, id).isEmpty()) {
            return false;
        }
        save(WorkSnapshot.builder()
                .date(targetDate)
                .takenAt(clock.instant())
                .projectId(id)
                .tags(new ArrayList<>(normalized))
                .build());
        return true;
    }

    /**
     * Remove every date strictly older than {@code today - maxAgeDays}. The
     * day exactly {@code maxAgeDays} back is kept.
     */
    public PruneResult prune(int maxAgeDays) {
        if (maxAgeDays < 1) {
            throw new IllegalArgumentException("maxAgeDays must be at least 1, got " + maxAgeDays);
        }
        LocalDate cutoff = today().minusDays(maxAgeDays);

        List<LocalDate> removedDates = new ArrayList<>();
        int removedSnapshots = 0;
        for (Map.Entry<LocalDate, String> entry : listDateDirectories().entrySet()) {
            if (!entry.getKey().isBefore(cutoff)) {
                break;
            }
            removedSnapshots += listRecordPaths(entry.getValue()).size();
            await(storagePort.deleteDirectory(getJournalDirectory(), entry.getValue()));
            removedDates.add(entry.getKey());
        }

        if (!removedDates.isEmpty()) {
            log.info("[Journal] Pruned {} day(s), {} snapshot(s) older than {}",
                    removedDates.size(), removedSnapshots, cutoff);
        }
        return new PruneResult(removedDates, removedSnapshots);
    }

    // ==================== READ ====================

    public Optional<WorkSnapshot> get(LocalDate date, String projectId) {
        return lookup(date, projectId).snapshots().stream().findFirst();
    }

    /**
     * Read the record for one key. An unreadable record yields no snapshot
     * and a warning.
     */
    public JournalQueryResult lookup(LocalDate date, String projectId) {
        if (date == null) {
            throw new IllegalArgumentException("Date is required");
        }
        String path = recordPath(date, ProjectIdentitySupport.requireProjectId(projectId));
        List<WorkSnapshot> snapshots = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        readRecord(path, warnings).ifPresent(snapshots::add);
        return new JournalQueryResult(snapshots, warnings);
    }

    public List<WorkSnapshot> getRange(String projectId, LocalDate from, LocalDate to) {
        return readRange(projectId, from, to).snapshots();
    }

    /**
     * Read all records in {@code [from, to]}, optionally for a single project,
     * ordered by date then project id. Unreadable records are reported as
     * warnings and left out.
     */
    public JournalQueryResult readRange(String projectId, LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Both range ends are required");
        }
        JournalDateSupport.requireOrderedRange(from, to);
        String projectFilter = projectId != null ? ProjectIdentitySupport.requireProjectId(projectId) : null;

        List<WorkSnapshot> snapshots = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (Map.Entry<LocalDate, String> entry : listDateDirectories().entrySet()) {
            LocalDate date = entry.getKey();
            if (date.isBefore(from) || date.isAfter(to)) {
                continue;
            }
            for (String path : listRecordPaths(entry.getValue())) {
                if (projectFilter != null && !projectFilter.equals(projectIdOf(path))) {
                    continue;
                }
                readRecord(path, warnings).ifPresent(snapshots::add);
            }
        }

        snapshots.sort(Comparator.comparing(WorkSnapshot::getDate)
                .thenComparing(WorkSnapshot::getProjectId, Comparator.nullsLast(Comparator.naturalOrder())));
        return new JournalQueryResult(snapshots, warnings);
    }

    public List<WorkSnapshot> getRecent(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("days must not be negative, got " + days);
        }
        LocalDate today = today();
        return getRange(null, today.minusDays(days), today);
    }

    public Optional<WorkSnapshot> getLatest(String projectId) {
        String id = ProjectIdentitySupport.requireProjectId(projectId);
        List<LocalDate> dates = new ArrayList<>(listDateDirectories().keySet());
        for (int i = dates.size() - 1; i >= 0; i--) {
            Optional<WorkSnapshot> snapshot = get(dates.get(i), id);
            if (snapshot.isPresent()) {
                return snapshot;
            }
        }
        return Optional.empty();
    }

    /**
     * Projects with at least one readable record, most recently active first.
     */
    public List<ProjectSummary> listProjects() {
        Map<String, List<WorkSnapshot>> byProject = new TreeMap<>();
        for (Map.Entry<LocalDate, String> entry : listDateDirectories().entrySet()) {
            for (String path : listRecordPaths(entry.getValue())) {
                readRecord(path, new ArrayList<>()).ifPresent(snapshot -> byProject
                        .computeIfAbsent(projectIdOf(path), key -> new ArrayList<>())
                        .add(snapshot));
            }
        }

        List<ProjectSummary> summaries = new ArrayList<>();
        for (Map.Entry<String, List<WorkSnapshot>> entry : byProject.entrySet()) {
            List<WorkSnapshot> snapshots = entry.getValue();
            WorkSnapshot first = snapshots.get(0);
            WorkSnapshot last = snapshots.get(snapshots.size() - 1);
            summaries.add(new ProjectSummary(
                    entry.getKey(),
                    last.getRepoPath(),
                    last.getRemoteUrl(),
                    first.getDate(),
                    last.getDate(),
                    snapshots.size()));
        }
        summaries.sort(Comparator.comparing(ProjectSummary::lastSnapshotDate, Comparator.reverseOrder())
                .thenComparing(ProjectSummary::projectId));
        return summaries;
    }

    public boolean hasProject(String projectId) {
        String id = ProjectIdentitySupport.sanitize(projectId);
        for (String directory : listDateDirectories().values()) {
            for (String path : listRecordPaths(directory)) {
                if (id.equals(projectIdOf(path))) {
                    return true;
                }
            }
        }
        return false;
    }

    public JournalStats stats() {
        int totalSnapshots = 0;
        Set<String> projects = new LinkedHashSet<>();
        LocalDate oldest = null;
        LocalDate newest = null;
        int totalDates = 0;

        for (Map.Entry<LocalDate, String> entry : listDateDirectories().entrySet()) {
            List<String> records = listRecordPaths(entry.getValue());
            if (records.isEmpty()) {
                continue;
            }
            totalDates++;
            totalSnapshots += records.size();
            records.forEach(path -> projects.add(projectIdOf(path)));
            if (oldest == null) {
                oldest = entry.getKey();
            }
            newest = entry.getKey();
        }

        long bytes = await(storagePort.sizeOf(getJournalDirectory()));
        return new JournalStats(totalSnapshots, totalDates, projects.size(), oldest, newest, bytes);
    }

    /**
     * Per-project activity for {@code [from, to]}, busiest project first.
     */
    public CrossProjectSummary crossProjectSummary(LocalDate from, LocalDate to) {
        JournalQueryResult range = readRange(null, from, to);
        List<WorkSnapshot> snapshots = range.snapshots();

        Map<String, List<WorkSnapshot>> byProject = new LinkedHashMap<>();
        for (WorkSnapshot snapshot : snapshots) {
            byProject.computeIfAbsent(snapshot.getProjectId(), key -> new ArrayList<>()).add(snapshot);
        }

        List<CrossProjectSummary.ProjectActivity> projects = new ArrayList<>();
        for (Map.Entry<String, List<WorkSnapshot>> entry : byProject.entrySet()) {
            projects.add(summarizeProject(entry.getKey(), entry.getValue()));
        }
        projects.sort(Comparator.comparingInt(CrossProjectSummary.ProjectActivity::totalCommits).reversed());

        int totalCommits = projects.stream().mapToInt(CrossProjectSummary.ProjectActivity::totalCommits).sum();
        int activeDays = (int) snapshots.stream().map(WorkSnapshot::getDate).distinct().count();
        return new CrossProjectSummary(projects, totalCommits, activeDays, from, to, range.warnings());
    }

    private CrossProjectSummary.ProjectActivity summarizeProject(String projectId, List<WorkSnapshot> snapshots) {
        int commits = 0;
        Set<String> branches = new LinkedHashSet<>();
        Map<String, Integer> fileFrequency = new LinkedHashMap<>();
        Map<String, List<Integer>> categoryPercentages = new LinkedHashMap<>();
        DiffStats diffStats = new DiffStats();

        for (WorkSnapshot snapshot : snapshots) {
            commits += snapshot.getTodayCommits().size();
            if (snapshot.getCurrentBranch() != null && !snapshot.getCurrentBranch().isBlank()) {
                branches.add(snapshot.getCurrentBranch());
            }
            snapshot.getTopChangedFiles().forEach(file -> fileFrequency.merge(file.getPath(), 1, Integer::sum));
            for (WorkCategory category : snapshot.getCategories()) {
                categoryPercentages.computeIfAbsent(category.getName(), key -> new ArrayList<>())
                        .add(category.getPercentage());
            }
            if (snapshot.getDiffStats() != null) {
                diffStats.setFilesChanged(diffStats.getFilesChanged() + snapshot.getDiffStats().getFilesChanged());
                diffStats.setInsertions(diffStats.getInsertions() + snapshot.getDiffStats().getInsertions());
                diffStats.setDeletions(diffStats.getDeletions() + snapshot.getDiffStats().getDeletions());
            }
        }

        List<String> topFiles = fileFrequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(CROSS_PROJECT_TOP_FILES)
                .map(Map.Entry::getKey)
                .toList();

        List<WorkCategory> categories = new ArrayList<>();
        for (Map.Entry<String, List<Integer>> entry : categoryPercentages.entrySet()) {
            double average = entry.getValue().stream().mapToInt(Integer::intValue).average().orElse(0);
            categories.add(new WorkCategory(entry.getKey(), (int) Math.round(average)));
        }
        categories.sort(Comparator.comparingInt(WorkCategory::getPercentage).reversed());

        return new CrossProjectSummary.ProjectActivity(
                projectId,
                snapshots.get(0).getRepoPath(),
                commits,
                snapshots.size(),
                new ArrayList<>(branches),
                topFiles,
                categories,
                diffStats);
    }

    // ==================== HELPERS ====================

    private WorkSnapshot normalize(WorkSnapshot snapshot) {
        return SnapshotMergeSupport.normalize(snapshot,
                properties.getJournal().getMaxActiveBranches(),
                properties.getJournal().getMaxTopFiles());
    }

    private Optional<WorkSnapshot> readRecord(String path, List<String> warnings) {
        String content = await(storagePort.getText(getJournalDirectory(), path));
        if (content == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(parse(content, path));
        } catch (IllegalStateException e) {
            log.warn("[Journal] Skipping corrupt record {}: {}", path, e.getMessage());
            warnings.add("Skipped unreadable record " + path);
            return Optional.empty();
        }
    }

    // Date directories in ascending order; names that are not dates are ignored.
    private TreeMap<LocalDate, String> listDateDirectories() {
        TreeMap<LocalDate, String> dates = new TreeMap<>();
        for (String name : await(storagePort.listDirectories(getJournalDirectory()))) {
            try {
                dates.put(LocalDate.parse(name), name);
            } catch (DateTimeParseException e) {
                log.trace("[Journal] Ignoring non-date directory: {}", name);
            }
        }
        return dates;
    }

    private List<String> listRecordPaths(String dateDirectory) {
        String prefix = dateDirectory + "/";
        return await(storagePort.listObjects(getJournalDirectory(), dateDirectory)).stream()
                .filter(path -> path.startsWith(prefix) && path.endsWith(RECORD_SUFFIX))
                .filter(path -> path.indexOf('/', prefix.length()) < 0)
                .sorted()
                .toList();
    }

    private static String projectIdOf(String recordPath) {
        int slash = recordPath.lastIndexOf('/');
        return recordPath.substring(slash + 1, recordPath.length() - RECORD_SUFFIX.length());
    }

    private static String recordPath(LocalDate date, String projectId) {
        return date + "/" + projectId + RECORD_SUFFIX;
    }

    private WorkSnapshot parse(String content, String path) {
        try {
            WorkSnapshot snapshot = objectMapper.readValue(content, WorkSnapshot.class);
            if (snapshot == null) {
                throw new IllegalStateException("Unreadable record " + path + ": empty document");
            }
            return normalize(snapshot);
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable record " + path + ": " + e.getMessage(), e);
        }
    }

    private String serialize(WorkSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot " + snapshot.getProjectId(), e);
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private String getJournalDirectory() {
        return properties.getJournal().getDirectory();
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
