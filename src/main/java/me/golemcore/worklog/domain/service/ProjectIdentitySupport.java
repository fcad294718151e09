package me.golemcore.worklog.domain.service;

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

import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for deriving and normalizing the project id half of a journal key.
 *
 * <p>
 * Project ids are slugs: lowercase ASCII letters and digits separated by
 * single dashes, at most {@value #MAX_LENGTH} characters.
 */
public final class ProjectIdentitySupport {

    public static final String UNKNOWN_PROJECT = "unknown";
    public static final int MAX_LENGTH = 100;

    private static final Pattern REMOTE_PATTERN = Pattern.compile("[:/]([^/]+/[^/]+?)(?:\\.git)?$");
    private static final Pattern NON_SLUG_RUN = Pattern.compile("[^a-z0-9]+");

    private ProjectIdentitySupport() {
    }

    /**
     * Resolve the project id in priority order: explicit override, {@code
     * owner/repo} from the remote URL, repository directory name, then
     * {@value #UNKNOWN_PROJECT}.
     */
    public static String resolve(String override, String remoteUrl, Path repositoryRoot) {
        String fromOverride = sanitize(override);
        if (!fromOverride.isEmpty()) {
            return fromOverride;
        }

        String fromRemote = sanitize(parseRemote(remoteUrl));
        if (!fromRemote.isEmpty()) {
            return fromRemote;
        }

        if (repositoryRoot != null && repositoryRoot.getFileName() != null) {
            String fromDirectory = sanitize(repositoryRoot.getFileName().toString());
            if (!fromDirectory.isEmpty()) {
                return fromDirectory;
            }
        }
        return UNKNOWN_PROJECT;
    }

    /**
     * Extract {@code owner/repo} from an ssh or https remote URL.
     *
     * @return the path pair, or null when the URL has no such suffix
     */
    public static String parseRemote(String remoteUrl) {
        if (remoteUrl == null || remoteUrl.isBlank()) {
            return null;
        }
        String trimmed = remoteUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        Matcher matcher = REMOTE_PATTERN.matcher(trimmed);
        return matcher.find() ? matcher.group(1) : null;
    }

    public static String sanitize(String raw) {
        if (raw == null) {
            return "";
        }
        String slug = NON_SLUG_RUN.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll("-");
        slug = trimDashes(slug);
        if (slug.length() > MAX_LENGTH) {
            slug = trimDashes(slug.substring(0, MAX_LENGTH));
        }
        return slug;
    }

    /**
     * Normalize a caller-supplied project id for use as a storage key.
     *
     * @throws IllegalArgumentException
     *             when nothing usable remains after normalization
     */
    public static String requireProjectId(String raw) {
        String slug = sanitize(raw);
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("Invalid project id: '" + raw + "'");
        }
        return slug;
    }

    private static String trimDashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '-') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '-') {
            end--;
        }
        return value.substring(start, end);
    }
}
