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
import me.golemcore.worklog.domain.model.FileHistoryEntry;
import me.golemcore.worklog.domain.model.JournalCommit;
import me.golemcore.worklog.domain.model.JournalQueryResult;
import me.golemcore.worklog.domain.model.PullRequestSnapshot;
import me.golemcore.worklog.domain.model.RecallQuery;
import me.golemcore.worklog.domain.model.RecallResponse;
import me.golemcore.worklog.domain.model.RecallResult;
import me.golemcore.worklog.domain.model.TicketSnapshot;
import me.golemcore.worklog.domain.model.WorkSnapshot;
import me.golemcore.worklog.infrastructure.config.WorklogProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Ranked search and file history over the journal.
 *
 * <p>
 * Text matching is a case-insensitive substring test of the whole query
 * against each snapshot field. Weights reflect how directly a field
 * identifies the work:
 *
 * <pre>
 * current branch 10, PR title 8, ticket 8, active branch 7, notes 7,
 * today commit 6, AI summary 6, file in today commit 5, tag 5,
 * top changed file 5, project id 5, recent commit 4
 * </pre>
 *
 * Requested tags add 8 per exact match and a requested file path adds 6 per
 * matching commit file or top changed file. Results are ranked by score,
 * then most recent date, then project id, and truncated after ranking.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecallService {

    // Every weight stays within [4, 10] so three matching signals always outrank a single one.
    static final int WEIGHT_CURRENT_BRANCH = 10;
    static final int WEIGHT_ACTIVE_BRANCH = 7;
    static final int WEIGHT_TODAY_COMMIT = 6;
    static final int WEIGHT_COMMIT_FILE = 5;
    static final int WEIGHT_RECENT_COMMIT = 4;
    static final int WEIGHT_PULL_REQUEST = 8;
    static final int WEIGHT_TICKET = 8;
    static final int WEIGHT_NOTES = 7;
    static final int WEIGHT_AI_SUMMARY = 6;
    static final int WEIGHT_TAG_TEXT = 5;
    static final int WEIGHT_TOP_FILE = 5;
    static final int WEIGHT_PROJECT = 5;
    static final int WEIGHT_REQUESTED_TAG = 8;
    static final int WEIGHT_REQUESTED_FILE = 6;

    private static final int MESSAGE_PREVIEW_LENGTH = 50;

    static final List<String> USAGE = List.of(
            "recall <text>                 search branches, commits, PRs, tickets and notes",
            "recall --tag <tag>            snapshots carrying a tag (repeatable)",
            "recall --file <path>          when a file was last changed",
            "recall --project <id>         restrict to one project",
            "recall --from <date> --to <date>  search an explicit range (YYYY-MM-DD)",
            "recall --days <n>             look back n days (default from configuration)",
            "recall --limit <n>            maximum number of results");

    private final JournalService journalService;
    private final WorklogProperties properties;
    private final Clock clock;

    /**
     * Dispatch a recall request: usage help when nothing was asked for, file
     * history when only a path was given, ranked search otherwise.
     */
    public RecallResponse recall(RecallQuery query) {
        RecallQuery request = query != null ? query : new RecallQuery();
        if (!request.hasText() && !request.hasTags() && !request.hasFilePath()) {
            if (request.getFilePath() != null) {
                throw new IllegalArgumentException("File path must not be blank");
            }
            return RecallResponse.help(USAGE, journalService.stats());
        }
        if (request.hasFilePath() && !request.hasText() && !request.hasTags()) {
            int limit = resolveLimit(request.getLimit());
            int lookbackDays = resolveLookback(request.getLookbackDays());
            return fileHistoryResponse(request.getFilePath(), request.getProjectId(), lookbackDays, limit);
        }
        return searchResponse(request);
    }

    public List<RecallResult> search(RecallQuery query) {
        return searchResponse(query != null ? query : new RecallQuery()).results();
    }

    public List<FileHistoryEntry> findFileHistory(String filePath, String projectId, int lookbackDays) {
        return findFileHistory(filePath, projectId, lookbackDays, Integer.MAX_VALUE);
    }

    /**
     * Days on which today's commits touched a path containing
     * {@code filePath}, most recent first.
     */
    public List<FileHistoryEntry> findFileHistory(String filePath, String projectId, int lookbackDays, int limit) {
        return fileHistoryResponse(filePath, projectId, lookbackDays, limit).fileHistory();
    }

    private RecallResponse searchResponse(RecallQuery request) {
        if (request.getFilePath() != null && request.getFilePath().isBlank()) {
            throw new IllegalArgumentException("File path must not be blank");
        }
        int limit = resolveLimit(request.getLimit());
        int lookbackDays = resolveLookback(request.getLookbackDays());
        LocalDate today = LocalDate.now(clock);
        LocalDate to = JournalDateSupport.parseDateOrDefault(request.getTo(), "to", today);
        LocalDate from = JournalDateSupport.parseDateOrDefault(request.getFrom(), "from",
                to.minusDays(lookbackDays));
        JournalDateSupport.requireOrderedRange(from, to);
        String projectId = requireKnownProject(request.getProjectId());

        JournalQueryResult range = journalService.readRange(projectId, from, to);
        logWarnings(range);

        String text = request.hasText() ? request.getText().trim().toLowerCase(Locale.ROOT) : null;
        List<String> tags = request.hasTags() ? SnapshotTaggingService.normalize(request.getTags()) : List.of();
        String filePath = request.hasFilePath() ? request.getFilePath().trim().toLowerCase(Locale.ROOT) : null;
        boolean matchAll = text == null && tags.isEmpty() && filePath == null;

        List<RecallResult> results = new ArrayList<>();
        for (WorkSnapshot snapshot : range.snapshots()) {
            RecallResult result = matchAll
                    ? new RecallResult(snapshot, 1, List.of("date match"))
                    : score(snapshot, text, tags, filePath);
            if (result.score() > 0) {
                results.add(result);
            }
        }

        results.sort(Comparator.comparingInt(RecallResult::score).reversed()
                .thenComparing((RecallResult result) -> result.snapshot().getDate(), Comparator.reverseOrder())
                .thenComparing(result -> result.snapshot().getProjectId()));
        log.debug("[Recall] {} match(es) in {}..{}", results.size(), from, to);
        List<RecallResult> ranked = results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
        return RecallResponse.search(ranked, range.warnings());
    }

    private RecallResponse fileHistoryResponse(String filePath, String projectId, int lookbackDays, int limit) {
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("File path must not be blank");
        }
        JournalDateSupport.requirePositive(lookbackDays, "lookbackDays");
        JournalDateSupport.requirePositive(limit, "limit");
        String project = requireKnownProject(projectId);

        LocalDate today = LocalDate.now(clock);
        JournalQueryResult range = journalService.readRange(project, today.minusDays(lookbackDays), today);
        logWarnings(range);

        String needle = filePath.trim().toLowerCase(Locale.ROOT);
        List<FileHistoryEntry> entries = new ArrayList<>();
        for (WorkSnapshot snapshot : range.snapshots()) {
            List<JournalCommit> commits = snapshot.getTodayCommits().stream()
                    .filter(commit -> touches(commit, needle))
                    .toList();
            if (!commits.isEmpty()) {
                entries.add(new FileHistoryEntry(snapshot.getDate(), snapshot.getProjectId(), commits));
            }
        }

        entries.sort(Comparator.comparing(FileHistoryEntry::date, Comparator.reverseOrder())
                .thenComparing(FileHistoryEntry::projectId));
        List<FileHistoryEntry> recent = entries.size() > limit ? new ArrayList<>(entries.subList(0, limit)) : entries;
        return RecallResponse.fileHistory(recent, range.warnings());
    }

    // ==================== SCORING ====================

    private RecallResult score(WorkSnapshot snapshot, String text, List<String> tags, String filePath) {
        int score = 0;
        Set<String> reasons = new LinkedHashSet<>();

        for (String tag : tags) {
            if (snapshot.getTags().contains(tag)) {
                score += WEIGHT_REQUESTED_TAG;
                reasons.add("tag: " + tag);
            }
        }

        if (filePath != null) {
            for (JournalCommit commit : snapshot.getTodayCommits()) {
                for (String file : filesOf(commit)) {
                    if (contains(file, filePath)) {
                        score += WEIGHT_REQUESTED_FILE;
                        reasons.add("file: " + file);
                    }
                }
            }
            for (ChangedFile file : snapshot.getTopChangedFiles()) {
                if (contains(file.getPath(), filePath)) {
                    score += WEIGHT_REQUESTED_FILE;
                    reasons.add("changed file: " + file.getPath());
                }
            }
        }

        if (text != null) {
            score += scoreText(snapshot, text, reasons);
        }
        return new RecallResult(snapshot, score, new ArrayList<>(reasons));
    }

    private int scoreText(WorkSnapshot snapshot, String text, Set<String> reasons) {
        int score = 0;
        if (contains(snapshot.getCurrentBranch(), text)) {
            score += WEIGHT_CURRENT_BRANCH;
            reasons.add("branch: " + snapshot.getCurrentBranch());
        }
        for (BranchStatus branch : snapshot.getActiveBranches()) {
            if (contains(branch.getName(), text)) {
                score += WEIGHT_ACTIVE_BRANCH;
                reasons.add("active branch: " + branch.getName());
            }
        }
        for (JournalCommit commit : snapshot.getTodayCommits()) {
            if (contains(commit.getMessage(), text)) {
                score += WEIGHT_TODAY_COMMIT;
                reasons.add("commit: " + commit.getShortHash() + " " + preview(commit.getMessage()));
            }
            for (String file : filesOf(commit)) {
                if (contains(file, text)) {
                    score += WEIGHT_COMMIT_FILE;
                    reasons.add("file: " + file);
                }
            }
        }
        for (JournalCommit commit : snapshot.getRecentCommits()) {
            if (contains(commit.getMessage(), text)) {
                score += WEIGHT_RECENT_COMMIT;
                reasons.add("recent commit: " + commit.getShortHash() + " " + preview(commit.getMessage()));
            }
        }
        for (PullRequestSnapshot pullRequest : snapshot.getPullRequests()) {
            if (contains(pullRequest.getTitle(), text)) {
                score += WEIGHT_PULL_REQUEST;
                reasons.add("PR: #" + pullRequest.getNumber() + " " + preview(pullRequest.getTitle()));
            }
        }
        for (TicketSnapshot ticket : snapshot.getTickets()) {
            if (contains(ticket.getId(), text) || contains(ticket.getTitle(), text)) {
                score += WEIGHT_TICKET;
                reasons.add("ticket: " + ticket.getId());
            }
        }
        if (contains(snapshot.getNotes(), text)) {
            score += WEIGHT_NOTES;
            reasons.add("notes");
        }
        if (contains(snapshot.getAiSummary(), text)) {
            score += WEIGHT_AI_SUMMARY;
            reasons.add("AI summary");
        }
        for (String tag : snapshot.getTags()) {
            if (contains(tag, text)) {
                score += WEIGHT_TAG_TEXT;
                reasons.add("tag: " + tag);
            }
        }
        for (ChangedFile file : snapshot.getTopChangedFiles()) {
            if (contains(file.getPath(), text)) {
                score += WEIGHT_TOP_FILE;
                reasons.add("changed file: " + file.getPath());
            }
        }
        if (contains(snapshot.getProjectId(), text)) {
            score += WEIGHT_PROJECT;
            reasons.add("project: " + snapshot.getProjectId());
        }
        return score;
    }

    // ==================== HELPERS ====================

    private String requireKnownProject(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            return null;
        }
        String id = ProjectIdentitySupport.requireProjectId(projectId);
        if (!journalService.hasProject(id)) {
            throw new IllegalArgumentException("Unknown project: " + projectId);
        }
        return id;
    }

    private int resolveLimit(Integer limit) {
        if (limit == null) {
            return properties.getJournal().getDefaultRecallLimit();
        }
        return JournalDateSupport.requirePositive(limit, "limit");
    }

    private int resolveLookback(Integer lookbackDays) {
        if (lookbackDays == null) {
            return properties.getJournal().getDefaultRecallDays();
        }
        return JournalDateSupport.requirePositive(lookbackDays, "lookbackDays");
    }

    private static void logWarnings(JournalQueryResult range) {
        if (range.hasWarnings()) {
            log.warn("[Recall] {} unreadable record(s) skipped", range.warnings().size());
        }
    }

    private static boolean touches(JournalCommit commit, String needle) {
        return filesOf(commit).stream().anyMatch(file -> contains(file, needle));
    }

    private static List<String> filesOf(JournalCommit commit) {
        return commit.getFilesChanged() != null ? commit.getFilesChanged() : List.of();
    }

    private static boolean contains(String haystack, String lowercaseNeedle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(lowercaseNeedle);
    }

    private static String preview(String message) {
        if (message == null) {
            return "";
        }
        return message.length() > MESSAGE_PREVIEW_LENGTH ? message.substring(0, MESSAGE_PREVIEW_LENGTH) : message;
    }
}
