package me.golemcore.worklog.port.outbound;

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

import me.golemcore.worklog.domain.model.DiffStats;
import me.golemcore.worklog.domain.model.RepositoryBranch;
import me.golemcore.worklog.domain.model.RepositoryCommit;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Port for reading facts from the local version-control repository. Every
 * call may fail with {@link RepositoryAccessException}; callers assembling
 * snapshots treat such failures as warnings.
 */
public interface RepositoryFactsPort {

    boolean isRepository();

    Path repositoryRoot();

    /**
     * URL of the {@code origin} remote, or null when there is none.
     */
    String remoteUrl();

    String currentBranch();

    /**
     * Commits whose commit date lies in {@code [since, until]}, newest first.
     */
    List<RepositoryCommit> commitsInRange(Instant since, Instant until);

    /**
     * Paths touched by a single commit.
     */
    List<String> commitFiles(String hash);

    /**
     * Paths changed between the merge base of {@code base} and {@code head}.
     */
    List<String> changedFiles(String base, String head);

    DiffStats diffStats(String base, String head);

    /**
     * Local branches ordered by most recent commit first.
     */
    List<RepositoryBranch> branchList();

    /**
     * Number of commits on {@code branch} that are not on {@code base}.
     */
    int aheadCount(String base, String branch);

    /**
     * Modified and untracked paths in the working tree.
     */
    List<String> uncommittedFiles();

    /**
     * Directory git runs hooks from, honouring {@code core.hooksPath}.
     */
    Path hooksDirectory();
}
