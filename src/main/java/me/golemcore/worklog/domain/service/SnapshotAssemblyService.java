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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.worklog.domain.model.BranchStatus;
import me.golemcore.worklog.domain.model.ChangedFile;
import me.golemcore.worklog.domain.model.DiffStats;
import me.golemcore.worklog.domain.model.JournalCommit;
import me.golemcore.worklog.domain.model.PullRequestSnapshot;
import me.golemcore.worklog.domain.model.RepositoryBranch;
import me.golemcore.worklog.domain.model.RepositoryCommit;
import me.golemcore.worklog.domain.model.SnapshotOptions;
import me.golemcore.worklog.domain.model.SnapshotResult;
import me.golemcore.worklog.domain.model.TicketReference;
import me.golemcore.worklog.domain.model.TicketSnapshot;
import me.golemcore.worklog.domain.model.WorkCategory;
import me.golemcore.worklog.domain.model.WorkSnapshot;
import me.golemcore.worklog.infrastructure.config.WorklogProperties;
import me.golemcore.worklog.port.outbound.RemoteWorkPort;
import me.golemcore.worklog.port.outbound.RepositoryFactsPort;
import me.golemcore.worklog.port.outbound.RepositoryUnavailableException;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Builds a point-in-time {@link WorkSnapshot} of the current repository.
 *
 * <p>
 * Every data source is read independently. A failing source (git error,
 * timeout, unavailable remote) contributes a warning and leaves its fields
 * empty; only an unreachable repository aborts assembly. Light mode reads
 * commits and the current branch only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotAssemblyService {

    static final String UNKNOWN_BRANCH = "unknown";
    private static final String HEAD = "HEAD";

    private final RepositoryFactsPort repositoryFactsPort;
    private final RemoteWorkPort remoteWorkPort;
    private final JournalService journalService;
    private final TicketExtractor ticketExtractor;
    private final SnapshotTaggingService taggingService;
    private final WorklogProperties properties;
    private final Clock clock;

    public SnapshotResult assemble(SnapshotOptions options) {
        long startNanos = System.nanoTime();
        SnapshotOptions opts = options != null ? options : new SnapshotOptions();

        LocalDate date = JournalDateSupport.parseDateOrDefault(opts.getDate(), "date", LocalDate.now(clock));
        int recentDays = opts.getRecentDays() != null
                ? JournalDateSupport.requirePositive(opts.getRecentDays(), "recentDays")
                : properties.getJournal().getRecentDays();
        if (opts.getProjectId() != null) {
            ProjectIdentitySupport.requireProjectId(opts.getProjectId());
        }
        requireRepository();

        List<String> warnings = new ArrayList<>();
        ZoneId zone = clock.getZone();
        String baseBranch = properties.getGit().getDefaultBranch();

        String currentBranch = gather("current branch", repositoryFactsPort::currentBranch, UNKNOWN_BRANCH,
                warnings);
        if (currentBranch == null || currentBranch.isBlank()) {
            currentBranch = UNKNOWN_BRANCH;
        }
        Path root = gather("repository root", repositoryFactsPort::repositoryRoot, null, warnings);
        String remoteUrl = gather("remote url", repositoryFactsPort::remoteUrl, null, warnings);
        String projectId = ProjectIdentitySupport.resolve(opts.getProjectId(), remoteUrl, root);

        List<JournalCommit> todayCommits = gather("today's commits",
                () -> loadCommits(JournalDateSupport.startOfDay(date, zone), JournalDateSupport.endOfDay(date, zone)),
                new ArrayList<>(), warnings);
        List<JournalCommit> recentCommits = gather("recent commits",
                () -> loadCommits(JournalDateSupport.startOfDay(date.minusDays(recentDays), zone),
                        JournalDateSupport.endOfDay(date.minusDays(1), zone)),
                new ArrayList<>(), warnings);

        WorkSnapshot.WorkSnapshotBuilder builder = WorkSnapshot.builder()
                .date(date)
                .takenAt(clock.instant())
                .projectId(projectId)
                .repoPath(root != null ? root.toString() : null)
                .remoteUrl(remoteUrl)
                .currentBranch(currentBranch)
                .todayCommits(todayCommits)
                .recentCommits(recentCommits)
                .notes(blankToNull(opts.getNote()));

        if (opts.isLight()) {
            builder.activeBranches(new ArrayList<>(List.of(currentBranchStatus(currentBranch, todayCommits,
                    warnings))));
        } else {
            builder.activeBranches(loadBranches(currentBranch, baseBranch, todayCommits, warnings));

            List<String> files = loadChangedFiles(baseBranch, todayCommits, warnings);
            List<String> occurrences = new ArrayList<>();
            todayCommits.forEach(commit -> occurrences.addAll(filesOf(commit)));
            recentCommits.forEach(commit -> occurrences.addAll(filesOf(commit)));
            List<WorkCategory> categories = WorkCategorizer.categorize(files);
            List<ChangedFile> topFiles = WorkCategorizer.topFiles(files, occurrences,
                    properties.getJournal().getMaxTopFiles());
            builder.categories(new ArrayList<>(categories))
                    .topChangedFiles(topFiles)
                    .diffStats(loadDiffStats(baseBranch, todayCommits, warnings));

            List<PullRequestSnapshot> pullRequests = opts.isSkipPullRequests()
                    ? new ArrayList<>()
                    : loadPullRequests(JournalDateSupport.startOfDay(date.minusDays(recentDays), zone), warnings);
            builder.pullRequests(pullRequests);

            if (!opts.isSkipTickets()) {
                builder.tickets(loadTickets(currentBranch, todayCommits, recentCommits, pullRequests, warnings));
            }
        }

        WorkSnapshot snapshot = builder.build();
        List<String> tags = new ArrayList<>(taggingService.autoTag(snapshot));
        if (opts.getTags() != null) {
            tags.addAll(opts.getTags());
        }
        snapshot.setTags(SnapshotTaggingService.normalize(tags));

        boolean merged = gather("journal lookup", () -> journalService.get(date, projectId).isPresent(), false,
                warnings);
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        log.debug("[Snapshot] Built {}/{} in {}ms ({} warnings)", date, projectId, durationMs, warnings.size());
        return new SnapshotResult(snapshot, merged, warnings, durationMs);
    }

    /**
     * Assemble and merge the snapshot into the journal.
     *
     * @return the result carrying the snapshot as stored
     */
    public SnapshotResult assembleAndSave(SnapshotOptions options) {
        SnapshotResult result = assemble(options);
        WorkSnapshot saved = journalService.save(result.snapshot());
        return new SnapshotResult(saved, result.merged(), result.warnings(), result.durationMs());
    }

    public boolean isRepository() {
        try {
            return repositoryFactsPort.isRepository();
        } catch (RuntimeException e) {
            log.debug("[Snapshot] Repository check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Project id the current repository's snapshots are stored under.
     */
    public String currentProjectId() {
        requireRepository();
        List<String> ignored = new ArrayList<>();
        Path root = gather("repository root", repositoryFactsPort::repositoryRoot, null, ignored);
        String remoteUrl = gather("remote url", repositoryFactsPort::remoteUrl, null, ignored);
        return ProjectIdentitySupport.resolve(null, remoteUrl, root);
    }

    private void requireRepository() {
        if (!isRepository()) {
            throw new RepositoryUnavailableException(
                    "Not inside a git repository: " + properties.getGit().getWorkingDirectory());
        }
    }

    // ==================== SOURCES ====================

    private List<JournalCommit> loadCommits(Instant since, Instant until) {
        List<JournalCommit> commits = new ArrayList<>();
        for (RepositoryCommit commit : repositoryFactsPort.commitsInRange(since, until)) {
            List<String> files = null;
            try {
                files = new ArrayList<>(repositoryFactsPort.commitFiles(commit.hash()));
            } catch (RuntimeException e) {
                log.trace("[Snapshot] No file list for commit {}: {}", commit.hash(), e.getMessage());
            }
            commits.add(JournalCommit.builder()
                    .hash(commit.hash())
                    .shortHash(SnapshotMergeSupport.shortHash(commit.hash()))
                    .message(commit.message())
                    .author(commit.author())
                    .date(commit.date())
                    .filesChanged(files)
                    .build());
        }
        return commits;
    }

    private List<BranchStatus> loadBranches(String currentBranch, String baseBranch,
            List<JournalCommit> todayCommits, List<String> warnings) {
        List<RepositoryBranch> listed;
        try {
            listed = repositoryFactsPort.branchList();
        } catch (RuntimeException e) {
            warnings.add(warning("branch list", e));
            return new ArrayList<>(List.of(currentBranchStatus(currentBranch, todayCommits, warnings)));
        }

        int maxBranches = properties.getJournal().getMaxActiveBranches();
        List<BranchStatus> branches = new ArrayList<>();
        boolean currentSeen = false;
        for (RepositoryBranch branch : listed) {
            if (branches.size() >= maxBranches) {
                break;
            }
            boolean isCurrent = branch.name().equals(currentBranch);
            if (branch.name().equals(baseBranch) && !isCurrent) {
                continue;
            }
            List<String> uncommitted = isCurrent
                    ? gather("uncommitted changes", repositoryFactsPort::uncommittedFiles, List.of(), warnings)
                    : List.of();
            currentSeen |= isCurrent;
            branches.add(BranchStatus.builder()
                    .name(branch.name())
                    .lastCommitHash(branch.lastCommitHash())
                    .lastCommitMessage(branch.lastCommitMessage())
                    .lastCommitDate(branch.lastCommitDate())
                    .aheadOfBase(branch.name().equals(baseBranch) ? 0 : aheadCount(baseBranch, branch.name()))
                    .hasUncommittedChanges(!uncommitted.isEmpty())
                    .uncommittedFiles(new ArrayList<>(uncommitted))
                    .build());
        }
        if (!currentSeen && branches.size() < maxBranches && !UNKNOWN_BRANCH.equals(currentBranch)) {
            branches.add(0, currentBranchStatus(currentBranch, todayCommits, warnings));
        }
        return branches;
    }

    private BranchStatus currentBranchStatus(String currentBranch, List<JournalCommit> todayCommits,
            List<String> warnings) {
        List<String> uncommitted = gather("uncommitted changes", repositoryFactsPort::uncommittedFiles, List.of(),
                warnings);
        BranchStatus.BranchStatusBuilder status = BranchStatus.builder()
                .name(currentBranch)
                .hasUncommittedChanges(!uncommitted.isEmpty())
                .uncommittedFiles(new ArrayList<>(uncommitted));
        if (!todayCommits.isEmpty()) {
            JournalCommit latest = todayCommits.get(0);
            status.lastCommitHash(latest.getShortHash())
                    .lastCommitMessage(latest.getMessage())
                    .lastCommitDate(latest.getDate());
        }
        return status.build();
    }

    private int aheadCount(String baseBranch, String branch) {
        try {
            return repositoryFactsPort.aheadCount(baseBranch, branch);
        } catch (RuntimeException e) {
            log.trace("[Snapshot] Ahead count unavailable for {}: {}", branch, e.getMessage());
            return 0;
        }
    }

    // Falls back to today's commit files when the branch diff is empty or unavailable.
    private List<String> loadChangedFiles(String baseBranch, List<JournalCommit> todayCommits,
            List<String> warnings) {
        try {
            List<String> files = repositoryFactsPort.changedFiles(baseBranch, HEAD);
            if (files != null && !files.isEmpty()) {
                return new ArrayList<>(new LinkedHashSet<>(files));
            }
        } catch (RuntimeException e) {
            warnings.add(warning("branch diff", e));
        }
        return new ArrayList<>(distinctFiles(todayCommits));
    }

    private DiffStats loadDiffStats(String baseBranch, List<JournalCommit> todayCommits, List<String> warnings) {
        try {
            DiffStats stats = repositoryFactsPort.diffStats(baseBranch, HEAD);
            if (stats != null && (stats.getFilesChanged() > 0 || todayCommits.isEmpty())) {
                return stats;
            }
        } catch (RuntimeException e) {
            warnings.add(warning("diff stats", e));
        }
        if (todayCommits.isEmpty()) {
            return null;
        }
        return new DiffStats(distinctFiles(todayCommits).size(), 0, 0);
    }

    private List<PullRequestSnapshot> loadPullRequests(Instant mergedSince, List<String> warnings) {
        if (!isRemoteAvailable()) {
            return new ArrayList<>();
        }
        Map<Integer, PullRequestSnapshot> byNumber = new LinkedHashMap<>();
        gather("open pull requests", remoteWorkPort::listMyOpenPullRequests, List.<PullRequestSnapshot>of(),
                warnings).forEach(pr -> byNumber.putIfAbsent(pr.getNumber(), pr));
        gather("merged pull requests", () -> remoteWorkPort.listMyMergedPullRequestsSince(mergedSince),
                List.<PullRequestSnapshot>of(), warnings).forEach(pr -> byNumber.putIfAbsent(pr.getNumber(), pr));
        return new ArrayList<>(byNumber.values());
    }

    private List<TicketSnapshot> loadTickets(String currentBranch, List<JournalCommit> todayCommits,
            List<JournalCommit> recentCommits, List<PullRequestSnapshot> pullRequests, List<String> warnings) {
        List<String> texts = new ArrayList<>();
        texts.add(currentBranch);
        todayCommits.forEach(commit -> texts.add(commit.getMessage()));
        recentCommits.forEach(commit -> texts.add(commit.getMessage()));
        pullRequests.forEach(pr -> texts.add(pr.getTitle()));

        boolean lookup = isRemoteAvailable();
        boolean lookupFailed = false;
        List<TicketSnapshot> tickets = new ArrayList<>();
        for (TicketReference reference : ticketExtractor.extractAll(texts)) {
            Optional<TicketSnapshot> found = Optional.empty();
            if (lookup && !lookupFailed) {
                try {
                    found = remoteWorkPort.findTicket(reference.id());
                } catch (RuntimeException e) {
                    lookupFailed = true;
                    warnings.add(warning("ticket lookup", e));
                }
            }
            tickets.add(found.orElseGet(() -> TicketSnapshot.builder()
                    .id(reference.id())
                    .title("")
                    .status(TicketSnapshot.UNKNOWN)
                    .type(reference.type())
                    .build()));
        }
        return tickets;
    }

    // ==================== HELPERS ====================

    private boolean isRemoteAvailable() {
        try {
            return remoteWorkPort.isAvailable();
        } catch (RuntimeException e) {
            log.debug("[Snapshot] Remote availability check failed: {}", e.getMessage());
            return false;
        }
    }

    private <T> T gather(String source, Supplier<T> supplier, T fallback, List<String> warnings) {
        try {
            T value = supplier.get();
            return value != null ? value : fallback;
        } catch (RuntimeException e) {
            warnings.add(warning(source, e));
            return fallback;
        }
    }

    private static String warning(String source, RuntimeException e) {
        log.debug("[Snapshot] Source '{}' failed: {}", source, e.getMessage());
        return "Could not read " + source + ": " + e.getMessage();
    }

    private static Set<String> distinctFiles(List<JournalCommit> commits) {
        Set<String> files = new LinkedHashSet<>();
        commits.forEach(commit -> files.addAll(filesOf(commit)));
        return files;
    }

    private static List<String> filesOf(JournalCommit commit) {
        return commit.getFilesChanged() != null ? commit.getFilesChanged() : List.of();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
