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

/**
 * Outcome of a background snapshot attempt. {@code result} is null unless the
 * snapshot was taken; {@code skipReason} is null when it was.
 */
public record AutoSnapshotResult(boolean taken, String skipReason, SnapshotResult result) {

    public static AutoSnapshotResult taken(SnapshotResult result) {
        return new AutoSnapshotResult(true, null, result);
    }

    public static AutoSnapshotResult skipped(String reason) {
        return new AutoSnapshotResult(false, reason, null);
    }
}
