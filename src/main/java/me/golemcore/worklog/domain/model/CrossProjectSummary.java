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

import java.time.LocalDate;
import java.util.List;

/**
 * Activity across projects for a date range, grouped per project.
 */
public record CrossProjectSummary(
        List<ProjectActivity> projects,
        int totalCommits,
        int totalActiveDays,
        LocalDate from,
        LocalDate to,
        List<String> warnings) {

    /**
     * One project's share of the range. Category percentages are averaged over
     * the days the category appeared.
     */
    public record ProjectActivity(
            String projectId,
            String repoPath,
            int totalCommits,
            int activeDays,
            List<String> branches,
            List<String> topFiles,
            List<WorkCategory> categories,
            DiffStats diffStats) {
    }
}
