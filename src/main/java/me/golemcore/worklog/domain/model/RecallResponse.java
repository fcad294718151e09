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

import java.util.List;

/**
 * Result of a recall request. A request without text, tags or file path
 * yields {@link Mode#HELP} with usage lines and journal stats instead of an
 * empty result list. {@code warnings} name journal records that could not be
 * read and were left out.
 */
public record RecallResponse(
        Mode mode,
        List<RecallResult> results,
        List<FileHistoryEntry> fileHistory,
        List<String> usage,
        JournalStats stats,
        List<String> warnings) {

    public enum Mode {
        HELP, SEARCH, FILE_HISTORY
    }

    public static RecallResponse help(List<String> usage, JournalStats stats) {
        return new RecallResponse(Mode.HELP, List.of(), List.of(), usage, stats, List.of());
    }

    public static RecallResponse search(List<RecallResult> results) {
        return search(results, List.of());
    }

    public static RecallResponse search(List<RecallResult> results, List<String> warnings) {
        return new RecallResponse(Mode.SEARCH, results, List.of(), List.of(), null, List.copyOf(warnings));
    }

    public static RecallResponse fileHistory(List<FileHistoryEntry> entries) {
        return fileHistory(entries, List.of());
    }

    public static RecallResponse fileHistory(List<FileHistoryEntry> entries, List<String> warnings) {
        return new RecallResponse(Mode.FILE_HISTORY, List.of(), entries, List.of(), null, List.copyOf(warnings));
    }
}
