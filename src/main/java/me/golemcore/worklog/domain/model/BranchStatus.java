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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * State of a local branch at capture time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BranchStatus {

    private String name;
    private String lastCommitHash;
    private String lastCommitMessage;
    private Instant lastCommitDate;

    /** Commits on this branch that are not on the base branch. */
    private int aheadOfBase;

    private boolean hasUncommittedChanges;

    @Builder.Default
    private List<String> uncommittedFiles = new ArrayList<>();

    @JsonIgnore
    public boolean isAhead() {
        return aheadOfBase > 0;
    }
}
