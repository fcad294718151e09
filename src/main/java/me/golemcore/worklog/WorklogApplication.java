package me.golemcore.worklog;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the work journal.
 *
 * <p>
 * Records dated snapshots of repository activity (commits, branches, pull
 * requests, tickets, work areas) per project and answers "what was I doing
 * and when" through listing, ranked recall and file history.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → CommandLineAdapter, CommandRouter
 * Domain Layer       → SnapshotAssemblyService, JournalService, RecallService
 * Infrastructure     → Local storage, git CLI and gh CLI adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code worklog.*} prefix. Command line options belong to the journal
 * commands and are not treated as Spring properties.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class WorklogApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(WorklogApplication.class);
        application.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(application.run(args)));
    }
}
