package me.golemcore.worklog.domain.model;

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

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Point-in-time record of repository activity for one project on one calendar
 * day. The pair ({@link #date}, {@link #projectId}) identifies the record in
 * the journal; saving another snapshot for the same pair merges into it.
 *
 * <p>
 * Fields are kept as plain mutable collections so the record serializes as
 * self-describing JSON and tolerates fields added by later versions.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkSnapshot {

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate date;

    private Instant takenAt;
    private String projectId;
    private String repoPath;
    private String remoteUrl;
    private String currentBranch;

    @Builder.Default
    private List<BranchStatus> activeBranches = new ArrayList<>();

    @Builder.Default
    private List<JournalCommit> todayCommits = new ArrayList<>();

    @Builder.Default
    private List<JournalCommit> recentCommits = new ArrayList<>();

    @Builder.Default
    private List<PullRequestSnapshot> pullRequests = new ArrayList<>();

    @Builder.Default
    private List<TicketSnapshot> tickets = new ArrayList<>();

    @Builder.Default
    private List<WorkCategory> categories = new ArrayList<>();

    @Builder.Default
    private List<ChangedFile> topChangedFiles = new ArrayList<>();

    private DiffStats diffStats;
    private String notes;
    private String aiSummary;

    @Builder.Default
    private List<String> tags = new ArrayList<>();
}
