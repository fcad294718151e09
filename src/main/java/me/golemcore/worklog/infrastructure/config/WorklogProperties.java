package me.golemcore.worklog.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the work journal, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code worklog.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - journal location and write locking</li>
 * <li>{@link JournalProperties} - snapshot and recall defaults</li>
 * <li>{@link GitProperties} - repository access</li>
 * <li>{@link GithubProperties} - pull request lookup via the gh CLI</li>
 * <li>{@link TicketsProperties} - ticket id detection</li>
 * </ul>
 *
 * <p>
 * Instances are passed to the services that need them; there is no static
 * configuration state.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "worklog")
@Data
public class WorklogProperties {

    private StorageProperties storage = new StorageProperties();
    private JournalProperties journal = new JournalProperties();
    private GitProperties git = new GitProperties();
    private GithubProperties github = new GithubProperties();
    private TicketsProperties tickets = new TicketsProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private LockProperties lock = new LockProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/worklog";
    }

    @Data
    public static class LockProperties {
        private int maxAttempts = 5;
        private long initialBackoffMs = 50;
    }

    @Data
    public static class JournalProperties {
        private String directory = "journal";
        private boolean autoSnapshot = true;
        private boolean quiet = true;
        private int recentDays = 7;
        private int maxActiveBranches = 30;
        private int maxTopFiles = 20;
        private int defaultRecallDays = 90;
        private int defaultRecallLimit = 10;
    }

    @Data
    public static class GitProperties {
        private String executable = "git";
        private String defaultBranch = "main";
        private String workingDirectory = ".";
        private int timeoutSeconds = 15;
    }

    @Data
    public static class GithubProperties {
        private boolean enabled = true;
        private String executable = "gh";
        private int timeoutSeconds = 15;
        private int openLimit = 20;
        private int mergedLimit = 10;
    }

    @Data
    public static class TicketsProperties {
        private String prefix;
        private String tool = "github";
    }
}
