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
 * Search criteria for recall. Dates are {@code YYYY-MM-DD} strings; when both
 * are absent the configured lookback window ending today is searched.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RecallQuery {

    private String text;
    private String projectId;
    private String from;
    private String to;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private String filePath;
    private Integer lookbackDays;
    private Integer limit;

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public boolean hasTags() {
        return tags != null && tags.stream().anyMatch(tag -> tag != null && !tag.isBlank());
    }

    public boolean hasFilePath() {
        return filePath != null && !filePath.isBlank();
    }
}
