package me.golemcore.worklog.adapter.inbound.command;

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
import me.golemcore.worklog.domain.model.CrossProjectSummary;
import me.golemcore.worklog.domain.model.FileHistoryEntry;
import me.golemcore.worklog.domain.model.HookInstallResult;
import me.golemcore.worklog.domain.model.JournalCommit;
import me.golemcore.worklog.domain.model.JournalStats;
import me.golemcore.worklog.domain.model.ProjectSummary;
import me.golemcore.worklog.domain.model.PruneResult;
import me.golemcore.worklog.domain.model.PullRequestSnapshot;
import me.golemcore.worklog.domain.model.RecallResponse;
import me.golemcore.worklog.domain.model.RecallResult;
import me.golemcore.worklog.domain.model.SnapshotResult;
import me.golemcore.worklog.domain.model.TicketSnapshot;
import me.golemcore.worklog.domain.model.WorkCategory;
import me.golemcore.worklog.domain.model.WorkSnapshot;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Plain-text rendering of journal data for the command line.
 */
@Component
public class JournalOutputFormatter {

    private static final String NEWLINE = "\n";
    private static final String INDENT = "  ";
    private static final long KILOBYTE = 1024;
    private static final long MEGABYTE = KILOBYTE * KILOBYTE;

    private final DateTimeFormatter timestampFormatter;

    public JournalOutputFormatter(Clock clock) {
        this.timestampFormatter = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(clock.getZone());
    }

    public String snapshotResult(SnapshotResult result) {
        WorkSnapshot snapshot = result.snapshot();
        StringBuilder sb = new StringBuilder();
        sb.append(result.merged() ? "Updated" : "Saved").append(" snapshot ")
                .append(snapshot.getDate()).append(" / ").append(snapshot.getProjectId())
                .append(" in ").append(result.durationMs()).append("ms").append(NEWLINE);
        sb.append(INDENT).append("Branch: ").append(snapshot.getCurrentBranch()).append(NEWLINE);
        sb.append(INDENT).append("Commits today: ").append(snapshot.getTodayCommits().size())
                .append(", recent: ").append(snapshot.getRecentCommits().size()).append(NEWLINE);
        if (!snapshot.getPullRequests().isEmpty()) {
            sb.append(INDENT).append("Pull requests: ").append(snapshot.getPullRequests().size()).append(NEWLINE);
        }
        if (!snapshot.getTickets().isEmpty()) {
            sb.append(INDENT).append("Tickets: ").append(ticketIds(snapshot.getTickets())).append(NEWLINE);
        }
        if (!snapshot.getTags().isEmpty()) {
            sb.append(INDENT).append("Tags: ").append(String.join(", ", snapshot.getTags())).append(NEWLINE);
        }
        return sb.toString().trim();
    }

    public String snapshotDetail(WorkSnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        sb.append(snapshot.getDate()).append(" / ").append(snapshot.getProjectId()).append(NEWLINE);
        appendField(sb, "Repository", snapshot.getRepoPath());
        appendField(sb, "Remote", snapshot.getRemoteUrl());
        appendField(sb, "Branch", snapshot.getCurrentBranch());
        appendField(sb, "Taken at", formatInstant(snapshot.getTakenAt()));

        if (!snapshot.getTodayCommits().isEmpty()) {
            sb.append(NEWLINE).append("Commits:").append(NEWLINE);
            for (JournalCommit commit : snapshot.getTodayCommits()) {
                sb.append(INDENT).append(commit.getShortHash()).append(' ').append(commit.getMessage())
                        .append(NEWLINE);
            }
        }
        if (!snapshot.getActiveBranches().isEmpty()) {
            sb.append(NEWLINE).append("Branches:").append(NEWLINE);
            for (BranchStatus branch : snapshot.getActiveBranches()) {
                sb.append(INDENT).append(branch.getName());
                if (branch.isAhead()) {
                    sb.append(" (+").append(branch.getAheadOfBase()).append(')');
                }
                if (branch.isHasUncommittedChanges()) {
                    sb.append(" [").append(branch.getUncommittedFiles().size()).append(" uncommitted]");
                }
                sb.append(NEWLINE);
            }
        }
        if (!snapshot.getPullRequests().isEmpty()) {
            sb.append(NEWLINE).append("Pull requests:").append(NEWLINE);
            for (PullRequestSnapshot pullRequest : snapshot.getPullRequests()) {
                String state = pullRequest.getState() != null ? pullRequest.getState().jsonValue() : "unknown";
                sb.append(INDENT).append('#').append(pullRequest.getNumber()).append(' ')
                        .append(pullRequest.getTitle()).append(" (").append(state).append(')').append(NEWLINE);
            }
        }
        if (!snapshot.getTickets().isEmpty()) {
            sb.append(NEWLINE).append("Tickets:").append(NEWLINE);
            for (TicketSnapshot ticket : snapshot.getTickets()) {
                sb.append(INDENT).append(ticket.getId());
                if (ticket.getTitle() != null && !ticket.getTitle().isEmpty()) {
                    sb.append(' ').append(ticket.getTitle());
                }
                sb.append(" (").append(ticket.getStatus()).append(')').append(NEWLINE);
            }
        }
        if (!snapshot.getCategories().isEmpty()) {
            sb.append(NEWLINE).append("Work areas: ").append(categories(snapshot.getCategories())).append(NEWLINE);
        }
        if (!snapshot.getTopChangedFiles().isEmpty()) {
            sb.append(NEWLINE).append("Top files:").append(NEWLINE);
            for (ChangedFile file : snapshot.getTopChangedFiles()) {
                sb.append(INDENT).append(file.getPath()).append(" x").append(file.getFrequency()).append(NEWLINE);
            }
        }
        if (snapshot.getDiffStats() != null) {
            sb.append(NEWLINE).append(String.format(Locale.ROOT, "Diff: %d files, +%d -%d%n",
                    snapshot.getDiffStats().getFilesChanged(),
                    snapshot.getDiffStats().getInsertions(),
                    snapshot.getDiffStats().getDeletions()));
        }
        if (snapshot.getNotes() != null && !snapshot.getNotes().isBlank()) {
            sb.append(NEWLINE).append("Notes:").append(NEWLINE).append(snapshot.getNotes()).append(NEWLINE);
        }
        if (!snapshot.getTags().isEmpty()) {
            sb.append(NEWLINE).append("Tags: ").append(String.join(", ", snapshot.getTags())).append(NEWLINE);
        }
        return sb.toString().trim();
    }

    public String snapshotList(List<WorkSnapshot> snapshots) {
        if (snapshots.isEmpty()) {
            return "No snapshots in range.";
        }
        StringBuilder sb = new StringBuilder();
        for (WorkSnapshot snapshot : snapshots) {
            sb.append(snapshot.getDate()).append(INDENT).append(snapshot.getProjectId())
                    .append(INDENT).append(snapshot.getCurrentBranch())
                    .append(INDENT).append(snapshot.getTodayCommits().size()).append(" commit(s)");
            if (!snapshot.getTags().isEmpty()) {
                sb.append(INDENT).append('[').append(String.join(", ", snapshot.getTags())).append(']');
            }
            sb.append(NEWLINE);
        }
        return sb.toString().trim();
    }

    public String projects(List<ProjectSummary> projects) {
        if (projects.isEmpty()) {
            return "No projects in the journal yet.";
        }
        StringBuilder sb = new StringBuilder();
        for (ProjectSummary project : projects) {
            sb.append(project.projectId()).append(INDENT)
                    .append(project.snapshotCount()).append(" snapshot(s), ")
                    .append(project.firstSnapshotDate()).append(" .. ").append(project.lastSnapshotDate());
            if (project.repoPath() != null) {
                sb.append(INDENT).append(project.repoPath());
            }
            sb.append(NEWLINE);
        }
        return sb.toString().trim();
    }

    public String stats(JournalStats stats) {
        if (stats.isEmpty()) {
            return "Journal is empty.";
        }
        return "Snapshots: " + stats.totalSnapshots() + NEWLINE
                + "Days: " + stats.totalDates() + NEWLINE
                + "Projects: " + stats.totalProjects() + NEWLINE
                + "Range: " + stats.oldestDate() + " .. " + stats.newestDate() + NEWLINE
                + "Storage: " + formatBytes(stats.storageBytes());
    }

    public String prune(PruneResult result, int maxAgeDays) {
        if (result.removedDates().isEmpty()) {
            return "Nothing older than " + maxAgeDays + " day(s) to prune.";
        }
        return "Removed " + result.removedSnapshots() + " snapshot(s) across " + result.removedDates().size()
                + " day(s): " + result.removedDates().get(0) + " .. "
                + result.removedDates().get(result.removedDates().size() - 1);
    }

    public String recall(RecallResponse response) {
        return switch (response.mode()) {
        case HELP -> recallHelp(response);
        case FILE_HISTORY -> fileHistory(response.fileHistory());
        case SEARCH -> searchResults(response.results());
        };
    }

    public String crossProject(CrossProjectSummary summary) {
        if (summary.projects().isEmpty()) {
            return "No activity between " + summary.from() + " and " + summary.to() + ".";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(summary.from()).append(" .. ").append(summary.to()).append(": ")
                .append(summary.totalCommits()).append(" commit(s) on ")
                .append(summary.totalActiveDays()).append(" day(s)").append(NEWLINE);
        for (CrossProjectSummary.ProjectActivity project : summary.projects()) {
            sb.append(NEWLINE).append(project.projectId()).append(": ")
                    .append(project.totalCommits()).append(" commit(s), ")
                    .append(project.activeDays()).append(" day(s)").append(NEWLINE);
            if (!project.branches().isEmpty()) {
                sb.append(INDENT).append("Branches: ").append(String.join(", ", project.branches())).append(NEWLINE);
            }
            if (!project.categories().isEmpty()) {
                sb.append(INDENT).append("Work areas: ").append(categories(project.categories())).append(NEWLINE);
            }
            if (!project.topFiles().isEmpty()) {
                sb.append(INDENT).append("Top files: ").append(String.join(", ", project.topFiles()))
                        .append(NEWLINE);
            }
            sb.append(INDENT).append(String.format(Locale.ROOT, "Diff: %d files, +%d -%d%n",
                    project.diffStats().getFilesChanged(),
                    project.diffStats().getInsertions(),
                    project.diffStats().getDeletions()));
        }
        return sb.toString().trim();
    }

    public String hooks(HookInstallResult result) {
        StringBuilder sb = new StringBuilder();
        for (String hook : result.installed()) {
            sb.append("Installed ").append(hook).append(NEWLINE);
        }
        for (String hook : result.skipped()) {
            sb.append("Skipped ").append(hook).append(NEWLINE);
        }
        if (sb.length() == 0) {
            sb.append("No hooks installed.");
        }
        return sb.toString().trim();
    }

    private String recallHelp(RecallResponse response) {
        StringBuilder sb = new StringBuilder("Usage:").append(NEWLINE);
        response.usage().forEach(line -> sb.append(INDENT).append(line).append(NEWLINE));
        if (response.stats() != null) {
            sb.append(NEWLINE).append(stats(response.stats()));
        }
        return sb.toString().trim();
    }

    private String searchResults(List<RecallResult> results) {
        if (results.isEmpty()) {
            return "No matching snapshots.";
        }
        StringBuilder sb = new StringBuilder();
        for (RecallResult result : results) {
            WorkSnapshot snapshot = result.snapshot();
            sb.append(snapshot.getDate()).append(INDENT).append(snapshot.getProjectId())
                    .append(INDENT).append("score ").append(result.score()).append(NEWLINE);
            for (String reason : result.matchReasons()) {
                sb.append(INDENT).append("- ").append(reason).append(NEWLINE);
            }
        }
        return sb.toString().trim();
    }

    private String fileHistory(List<FileHistoryEntry> entries) {
        if (entries.isEmpty()) {
            return "No commits touched that file in the journal window.";
        }
        StringBuilder sb = new StringBuilder();
        for (FileHistoryEntry entry : entries) {
            sb.append(entry.date()).append(INDENT).append(entry.projectId()).append(NEWLINE);
            for (JournalCommit commit : entry.commits()) {
                sb.append(INDENT).append(commit.getShortHash()).append(' ').append(commit.getMessage())
                        .append(NEWLINE);
            }
        }
        return sb.toString().trim();
    }

    private void appendField(StringBuilder sb, String label, String value) {
        if (value != null && !value.isBlank()) {
            sb.append(INDENT).append(label).append(": ").append(value).append(NEWLINE);
        }
    }

    private String formatInstant(Instant instant) {
        return instant != null ? timestampFormatter.format(instant) : null;
    }

    private static String categories(List<WorkCategory> categories) {
        return categories.stream()
                .map(category -> category.getName() + " " + category.getPercentage() + "%")
                .collect(Collectors.joining(", "));
    }

    private static String ticketIds(List<TicketSnapshot> tickets) {
        return tickets.stream().map(TicketSnapshot::getId).collect(Collectors.joining(", "));
    }

    static String formatBytes(long bytes) {
        if (bytes >= MEGABYTE) {
            return String.format(Locale.ROOT, "%.1f MB", bytes / (double) MEGABYTE);
        }
        if (bytes >= KILOBYTE) {
            return String.format(Locale.ROOT, "%.1f KB", bytes / (double) KILOBYTE);
        }
        return bytes + " B";
    }
}
