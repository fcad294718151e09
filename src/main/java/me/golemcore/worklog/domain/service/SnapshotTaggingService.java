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
import me.golemcore.worklog.domain.model.DiffStats;
import me.golemcore.worklog.domain.model.JournalCommit;
import me.golemcore.worklog.domain.model.PullRequestSnapshot;
import me.golemcore.worklog.domain.model.PullRequestState;
import me.golemcore.worklog.domain.model.WorkCategory;
import me.golemcore.worklog.domain.model.WorkSnapshot;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives descriptive tags from snapshot content. Pure function of the
 * snapshot: no I/O and no clock.
 *
 * <p>
 * Vocabulary:
 * <ul>
 * <li>activity - has-wip, merged-pr, open-pr, has-tickets, large-change,
 * no-commits, busy-day</li>
 * <li>branch prefix - feature, bugfix, hotfix, chore, refactor, docs, test,
 * release</li>
 * <li>conventional commit types of today's commits</li>
 * <li>ticket ids and {@code #N} references from today's commit messages</li>
 * <li>categories covering at least {@value #CATEGORY_TAG_MIN_PERCENT}% of
 * changes</li>
 * <li>pull request labels</li>
 * </ul>
 * All tags are lowercase.
 */
@Service
public class SnapshotTaggingService {

    public static final String HAS_WIP = "has-wip";
    public static final String MERGED_PR = "merged-pr";
    public static final String OPEN_PR = "open-pr";
    public static final String HAS_TICKETS = "has-tickets";
    public static final String LARGE_CHANGE = "large-change";
    public static final String NO_COMMITS = "no-commits";
    public static final String BUSY_DAY = "busy-day";

    /**
     * Tags describing the day's state rather than its history. A later
     * snapshot can contradict them, so they are recomputed on every save.
     */
    public static final Set<String> ACTIVITY_TAGS = Set.of(
            HAS_WIP, MERGED_PR, OPEN_PR, HAS_TICKETS, LARGE_CHANGE, NO_COMMITS, BUSY_DAY);

    static final int LARGE_CHANGE_LINES = 500;
    static final int LARGE_CHANGE_FILES = 20;
    static final int BUSY_DAY_COMMITS = 10;
    static final int CATEGORY_TAG_MIN_PERCENT = 20;

    private static final Map<String, String> BRANCH_PREFIX_TAGS = new LinkedHashMap<>();

    static {
        BRANCH_PREFIX_TAGS.put("feature/", "feature");
        BRANCH_PREFIX_TAGS.put("fix/", "bugfix");
        BRANCH_PREFIX_TAGS.put("bugfix/", "bugfix");
        BRANCH_PREFIX_TAGS.put("hotfix/", "hotfix");
        BRANCH_PREFIX_TAGS.put("chore/", "chore");
        BRANCH_PREFIX_TAGS.put("refactor/", "refactor");
        BRANCH_PREFIX_TAGS.put("docs/", "docs");
        BRANCH_PREFIX_TAGS.put("test/", "test");
        BRANCH_PREFIX_TAGS.put("release/", "release");
    }

    private static final Set<String> CONVENTIONAL_TYPES = Set.of(
            "feat", "fix", "docs", "style", "refactor", "test", "chore", "perf", "ci", "build");

    private static final Pattern CONVENTIONAL_PATTERN = Pattern.compile("^(\\w+)[(:!]");
    private static final Pattern TICKET_ID_PATTERN = Pattern.compile("([A-Z]{2,10}-\\d+)");
    private static final Pattern ISSUE_REF_PATTERN = Pattern.compile("(#\\d+)");

    public List<String> autoTag(WorkSnapshot snapshot) {
        Set<String> tags = new LinkedHashSet<>();
        addActivityTags(snapshot, tags);
        addBranchTag(snapshot.getCurrentBranch(), tags);

        for (JournalCommit commit : nullSafe(snapshot.getTodayCommits())) {
            addCommitTags(commit.getMessage(), tags);
        }

        for (WorkCategory category : nullSafe(snapshot.getCategories())) {
            if (category.getPercentage() >= CATEGORY_TAG_MIN_PERCENT) {
                tags.add(category.getName());
            }
        }

        for (PullRequestSnapshot pullRequest : nullSafe(snapshot.getPullRequests())) {
            tags.addAll(nullSafe(pullRequest.getLabels()));
        }
        return normalize(tags);
    }

    /**
     * Tags for a merged record: every stored tag except the activity tags,
     * then the derived tags of the merged content, activity tags last.
     */
    public List<String> retag(WorkSnapshot snapshot) {
        List<String> derived = autoTag(snapshot);
        Set<String> tags = new LinkedHashSet<>();
        for (String tag : normalize(snapshot.getTags())) {
            if (!ACTIVITY_TAGS.contains(tag)) {
                tags.add(tag);
            }
        }
        for (String tag : derived) {
            if (!ACTIVITY_TAGS.contains(tag)) {
                tags.add(tag);
            }
        }
        for (String tag : derived) {
            if (ACTIVITY_TAGS.contains(tag)) {
                tags.add(tag);
            }
        }
        return new ArrayList<>(tags);
    }

    /**
     * Trim, lowercase and de-duplicate tags, keeping first-seen order.
     */
    public static List<String> normalize(Collection<String> tags) {
        Set<String> normalized = new LinkedHashSet<>();
        if (tags != null) {
            for (String tag : tags) {
                if (tag != null && !tag.isBlank()) {
                    normalized.add(tag.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return new ArrayList<>(normalized);
    }

    private void addActivityTags(WorkSnapshot snapshot, Set<String> tags) {
        boolean wip = nullSafe(snapshot.getActiveBranches()).stream()
                .anyMatch(BranchStatus::isHasUncommittedChanges);
        if (wip) {
            tags.add(HAS_WIP);
        }

        List<PullRequestSnapshot> pullRequests = nullSafe(snapshot.getPullRequests());
        if (pullRequests.stream().anyMatch(pr -> pr.getState() == PullRequestState.MERGED)) {
            tags.add(MERGED_PR);
        }
        if (pullRequests.stream().anyMatch(pr -> pr.getState() == PullRequestState.OPEN)) {
            tags.add(OPEN_PR);
        }
        if (!nullSafe(snapshot.getTickets()).isEmpty()) {
            tags.add(HAS_TICKETS);
        }

        DiffStats diffStats = snapshot.getDiffStats();
        if (diffStats != null && (diffStats.totalLines() >= LARGE_CHANGE_LINES
                || diffStats.getFilesChanged() >= LARGE_CHANGE_FILES)) {
            tags.add(LARGE_CHANGE);
        }

        int commitCount = nullSafe(snapshot.getTodayCommits()).size();
        if (commitCount == 0) {
            tags.add(NO_COMMITS);
        } else if (commitCount >= BUSY_DAY_COMMITS) {
            tags.add(BUSY_DAY);
        }
    }

    private void addBranchTag(String branch, Set<String> tags) {
        if (branch == null) {
            return;
        }
        for (Map.Entry<String, String> entry : BRANCH_PREFIX_TAGS.entrySet()) {
            if (branch.startsWith(entry.getKey())) {
                tags.add(entry.getValue());
                return;
            }
        }
    }

    private void addCommitTags(String message, Set<String> tags) {
        if (message == null) {
            return;
        }
        Matcher conventional = CONVENTIONAL_PATTERN.matcher(message);
        if (conventional.find()) {
            String type = conventional.group(1).toLowerCase(Locale.ROOT);
            if (CONVENTIONAL_TYPES.contains(type)) {
                tags.add(type);
            }
        }

        Matcher ticket = TICKET_ID_PATTERN.matcher(message);
        while (ticket.find()) {
            tags.add(ticket.group(1));
        }
        Matcher issue = ISSUE_REF_PATTERN.matcher(message);
        while (issue.find()) {
            tags.add(issue.group(1));
        }
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }
}
