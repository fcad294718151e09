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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Options for assembling a snapshot. Unset values fall back to configuration
 * defaults: today for the date, the detected identity for the project.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotOptions {

    /** Target day as {@code YYYY-MM-DD}; null means today. */
    private String date;

    private String projectId;

    /** Lookback window for {@code recentCommits}; null uses the configured default. */
    private Integer recentDays;

    private boolean skipPullRequests;
    private boolean skipTickets;

    /**
     * Commits and current branch only: no pull requests, no tickets, no branch
     * enumeration.
     */
    private boolean light;

    private String note;

    @Builder.Default
    private List<String> tags = new ArrayList<>();
}
