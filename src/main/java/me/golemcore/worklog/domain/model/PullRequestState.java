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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of a pull request. Serialized in lowercase, parsed
 * leniently so remote payloads ("OPEN", "Merged") map without extra mapping
 * code.
 */
public enum PullRequestState {
    OPEN, CLOSED, MERGED;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PullRequestState fromValue(String value) {
        if (value == null || value.isBlank()) {
            return OPEN;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
        case "merged" -> MERGED;
        case "closed" -> CLOSED;
        default -> OPEN;
        };
    }
}
