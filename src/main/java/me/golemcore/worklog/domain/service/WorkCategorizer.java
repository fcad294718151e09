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

import me.golemcore.worklog.domain.model.ChangedFile;
import me.golemcore.worklog.domain.model.WorkCategory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Classifies changed paths into work areas and ranks frequently touched
 * files. Stateless.
 */
public final class WorkCategorizer {

    public static final String OTHER = "other";

    private static final int PERCENT = 100;

    // Order matters: a path belongs to the first category with a matching pattern.
    private static final Map<String, List<Pattern>> WORK_CATEGORIES = new LinkedHashMap<>();

    static {
        WORK_CATEGORIES.put("frontend", patterns(
                "\\.tsx?$", "\\.jsx?$", "\\.vue$", "\\.svelte$", "\\.css$", "\\.scss$", "\\.less$",
                "components/", "pages/", "views/", "ui/", "styles/"));
        WORK_CATEGORIES.put("backend", patterns(
                "\\.go$", "\\.py$", "\\.rb$", "\\.java$", "\\.kt$", "\\.rs$", "\\.php$",
                "api/", "server/", "services/", "handlers/", "controllers/", "routes/"));
        WORK_CATEGORIES.put("infrastructure", patterns(
                "Dockerfile", "docker-compose", "\\.ya?ml$", "\\.tf$", "\\.hcl$", "k8s/", "kubernetes/",
                "\\.github/workflows/", "\\.circleci/", "infra/", "deploy/"));
        WORK_CATEGORIES.put("database", patterns(
                "\\.sql$", "migrations/", "prisma/", "schema\\.", "models/", "entities/"));
        WORK_CATEGORIES.put("tests", patterns(
                "\\.test\\.", "\\.spec\\.", "__tests__/", "tests?/", "cypress/", "e2e/"));
        WORK_CATEGORIES.put("docs", patterns(
                "\\.md$", "\\.mdx$", "docs?/", "README", "CHANGELOG", "CONTRIBUTING"));
        WORK_CATEGORIES.put("config", patterns(
                "\\.json$", "\\.toml$", "\\.properties$", "\\.env", "config/", "\\.config\\.", "tsconfig"));
    }

    private WorkCategorizer() {
    }

    /**
     * Share of files per category in whole percent, largest first. Shares are
     * rounded with the largest remainder method, so they sum to exactly 100.
     * Categories without files are omitted.
     */
    public static List<WorkCategory> categorize(Collection<String> files) {
        if (files == null || files.isEmpty()) {
            return new ArrayList<>();
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String file : files) {
            counts.merge(categoryOf(file), 1, Integer::sum);
        }

        int total = files.size();
        List<String> names = new ArrayList<>(counts.keySet());
        int[] shares = new int[names.size()];
        int assigned = 0;
        for (int i = 0; i < names.size(); i++) {
            shares[i] = counts.get(names.get(i)) * PERCENT / total;
            assigned += shares[i];
        }

        // Leftover points go to the largest truncated fractions; ties keep first-seen order.
        List<Integer> byRemainder = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            byRemainder.add(i);
        }
        byRemainder.sort(Comparator.comparingInt(
                (Integer i) -> counts.get(names.get(i)) * PERCENT % total).reversed());
        for (int k = 0; k < PERCENT - assigned; k++) {
            shares[byRemainder.get(k)]++;
        }

        List<WorkCategory> categories = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            categories.add(WorkCategory.builder()
                    .name(names.get(i))
                    .percentage(shares[i])
                    .build());
        }
        categories.sort(Comparator.comparingInt(WorkCategory::getPercentage).reversed());
        return categories;
    }

    public static String categoryOf(String file) {
        if (file == null) {
            return OTHER;
        }
        for (Map.Entry<String, List<Pattern>> entry : WORK_CATEGORIES.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(file).find()) {
                    return entry.getKey();
                }
            }
        }
        return OTHER;
    }

    /**
     * Rank paths by how often they occur in {@code occurrences}. Every path in
     * {@code files} is counted at least once. Ties are broken by path.
     */
    public static List<ChangedFile> topFiles(Collection<String> files, Collection<String> occurrences, int max) {
        Map<String, Integer> frequency = new LinkedHashMap<>();
        for (String file : files) {
            frequency.put(file, 0);
        }
        for (String occurrence : occurrences) {
            frequency.computeIfPresent(occurrence, (path, count) -> count + 1);
        }

        return frequency.entrySet().stream()
                .map(entry -> ChangedFile.builder()
                        .path(entry.getKey())
                        .frequency(Math.max(1, entry.getValue()))
                        .build())
                .sorted(Comparator.comparingInt(ChangedFile::getFrequency).reversed()
                        .thenComparing(ChangedFile::getPath))
                .limit(Math.max(0, max))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static List<Pattern> patterns(String... regexes) {
        List<Pattern> compiled = new ArrayList<>();
        for (String regex : regexes) {
            compiled.add(Pattern.compile(regex));
        }
        return compiled;
    }
}
