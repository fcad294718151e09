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

import me.golemcore.worklog.domain.model.BranchStatus;
import me.golemcore.worklog.domain.model.ChangedFile;
import me.golemcore.worklog.domain.model.JournalCommit;
import me.golemcore.worklog.domain.model.PullRequestSnapshot;
import me.golemcore.worklog.domain.model.TicketSnapshot;
import me.golemcore.worklog.domain.model.WorkSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Merge and normalization rules for snapshots stored under one
 * {@code (date, projectId)} key.
 *
 * <p>
 * {@link #merge} unions list fields by identity (commit hash, pull request
 * number, ticket id, branch name) with the incoming element winning, and
 * prefers incoming scalars when they are present. Both operations return a
 * new snapshot and never mutate their arguments. Merging a snapshot with
 * itself yields the normalized snapshot.
 */
public final class SnapshotMergeSupport {

    public static final int DEFAULT_MAX_ACTIVE_BRANCHES = 30;
    public static final int DEFAULT_MAX_TOP_FILES = 20;

    private static final int SHORT_HASH_LENGTH = 7;

    private SnapshotMergeSupport() {
    }

    public static WorkSnapshot merge(WorkSnapshot existing, WorkSnapshot incoming) {
        return WorkSnapshot.builder()
                .date(incoming.getDate())
                .takenAt(latest(existing.getTakenAt(), incoming.getTakenAt()))
                .projectId(incoming.getProjectId())
                .repoPath(prefer(incoming.getRepoPath(), existing.getRepoPath()))
                .remoteUrl(prefer(incoming.getRemoteUrl(), existing.getRemoteUrl()))
                .currentBranch(prefer(incoming.getCurrentBranch(), existing.getCurrentBranch()))
                .activeBranches(union(existing.getActiveBranches(), incoming.getActiveBranches(),
                        BranchStatus::getName))
                .todayCommits(union(existing.getTodayCommits(), incoming.getTodayCommits(), JournalCommit::getHash))
                .recentCommits(union(existing.getRecentCommits(), incoming.getRecentCommits(),
                        JournalCommit::getHash))
                .pullRequests(union(existing.getPullRequests(), incoming.getPullRequests(),
                        PullRequestSnapshot::getNumber))
                .tickets(union(existing.getTickets(), incoming.getTickets(), TicketSnapshot::getId))
                .categories(preferNonEmpty(incoming.getCategories(), existing.getCategories()))
                .topChangedFiles(preferNonEmpty(incoming.getTopChangedFiles(), existing.getTopChangedFiles()))
                .diffStats(incoming.getDiffStats() != null ? incoming.getDiffStats() : existing.getDiffStats())
                .notes(mergeNotes(existing.getNotes(), incoming.getNotes()))
                .aiSummary(prefer(incoming.getAiSummary(), existing.getAiSummary()))
                .tags(SnapshotTaggingService.normalize(concat(existing.getTags(), incoming.getTags())))
                .build();
    }

    public static WorkSnapshot normalize(WorkSnapshot snapshot) {
        return normalize(snapshot, DEFAULT_MAX_ACTIVE_BRANCHES, DEFAULT_MAX_TOP_FILES);
    }

    /**
     * Enforce the stored-record invariants: unique list elements, commits in
     * ascending date order, capped branch and file lists, lowercase tag set
     * and no null lists.
     */
    public static WorkSnapshot normalize(WorkSnapshot snapshot, int maxActiveBranches, int maxTopFiles) {
        List<BranchStatus> branches = dedupe(snapshot.getActiveBranches(), BranchStatus::getName);
        if (branches.size() > maxActiveBranches) {
            branches.sort(Comparator.comparing(BranchStatus::getLastCommitDate,
                    Comparator.nullsLast(Comparator.reverseOrder())));
            branches = new ArrayList<>(branches.subList(0, maxActiveBranches));
        }

        List<ChangedFile> topFiles = new ArrayList<>(nullSafe(snapshot.getTopChangedFiles()));
        topFiles.sort(Comparator.comparingInt(ChangedFile::getFrequency).reversed());
        if (topFiles.size() > maxTopFiles) {
            topFiles = new ArrayList<>(topFiles.subList(0, maxTopFiles));
        }

        return snapshot.toBuilder()
                .activeBranches(branches)
                .todayCommits(normalizeCommits(snapshot.getTodayCommits()))
                .recentCommits(normalizeCommits(snapshot.getRecentCommits()))
                .pullRequests(dedupe(snapshot.getPullRequests(), PullRequestSnapshot::getNumber))
                .tickets(dedupe(snapshot.getTickets(), TicketSnapshot::getId))
                .categories(new ArrayList<>(nullSafe(snapshot.getCategories())))
                .topChangedFiles(topFiles)
                .tags(SnapshotTaggingService.normalize(snapshot.getTags()))
                .build();
    }

    static String mergeNotes(String existing, String incoming) {
        if (isBlank(existing)) {
            return isBlank(incoming) ? existing : incoming;
        }
        if (isBlank(incoming) || existing.equals(incoming) || existing.endsWith("\n" + incoming)) {
            return existing;
        }
        return existing + "\n" + incoming;
    }

    private static List<JournalCommit> normalizeCommits(List<JournalCommit> commits) {
        List<JournalCommit> unique = dedupe(commits, JournalCommit::getHash);
        for (int i = 0; i < unique.size(); i++) {
            JournalCommit commit = unique.get(i);
            if (commit.getShortHash() == null && commit.getHash() != null) {
                unique.set(i, JournalCommit.builder()
                        .hash(commit.getHash())
                        .shortHash(shortHash(commit.getHash()))
                        .message(commit.getMessage())
                        .author(commit.getAuthor())
                        .date(commit.getDate())
                        .filesChanged(commit.getFilesChanged())
                        .build());
            }
        }
        unique.sort(Comparator.comparing(JournalCommit::getDate, Comparator.nullsFirst(Comparator.naturalOrder())));
        return unique;
    }

    public static String shortHash(String hash) {
        return hash.substring(0, Math.min(SHORT_HASH_LENGTH, hash.length()));
    }

    private static <T, K> List<T> union(List<T> existing, List<T> incoming, Function<T, K> identity) {
        return dedupe(concat(existing, incoming), identity);
    }

    // Later elements replace earlier ones with the same identity but keep the earlier position.
    private static <T, K> List<T> dedupe(List<T> items, Function<T, K> identity) {
        Map<K, T> byIdentity = new LinkedHashMap<>();
        List<T> anonymous = new ArrayList<>();
        for (T item : nullSafe(items)) {
            if (item == null) {
                continue;
            }
            K key = identity.apply(item);
            if (key == null) {
                anonymous.add(item);
            } else {
                byIdentity.put(key, item);
            }
        }
        List<T> result = new ArrayList<>(byIdentity.values());
        result.addAll(anonymous);
        return result;
    }

    private static <T> List<T> concat(List<T> first, List<T> second) {
        List<T> all = new ArrayList<>(nullSafe(first));
        all.addAll(nullSafe(second));
        return all;
    }

    private static <T> List<T> preferNonEmpty(List<T> preferred, List<T> fallback) {
        List<T> chosen = preferred != null && !preferred.isEmpty() ? preferred : fallback;
        return new ArrayList<>(nullSafe(chosen));
    }

    private static String prefer(String preferred, String fallback) {
        return isBlank(preferred) ? fallback : preferred;
    }

    private static Instant latest(Instant first, Instant second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        return first.isAfter(second) ? first : second;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }
}
