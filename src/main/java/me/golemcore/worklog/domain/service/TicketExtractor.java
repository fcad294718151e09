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

import lombok.RequiredArgsConstructor;
import me.golemcore.worklog.domain.model.TicketReference;
import me.golemcore.worklog.infrastructure.config.WorklogProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds ticket ids in branch names, commit messages and pull request titles.
 *
 * <p>
 * A configured prefix ({@code worklog.tickets.prefix}) is matched first and
 * typed with the configured tool; the generic tracker patterns follow.
 * Tracker-style ids are upper-cased, GitHub references keep their
 * {@code #} form.
 */
@Service
@RequiredArgsConstructor
public class TicketExtractor {

    static final String GITHUB = "github";
    private static final String NO_TOOL = "none";

    private static final Map<String, Pattern> TICKET_PATTERNS = new LinkedHashMap<>();

    static {
        TICKET_PATTERNS.put("jira", Pattern.compile("([A-Z]{2,10}-\\d+)", Pattern.CASE_INSENSITIVE));
        TICKET_PATTERNS.put("linear", Pattern.compile("([A-Z]{2,5}-\\d+)", Pattern.CASE_INSENSITIVE));
        TICKET_PATTERNS.put(GITHUB, Pattern.compile("#(\\d+)"));
        TICKET_PATTERNS.put("notion", Pattern.compile("([a-f0-9]{32})", Pattern.CASE_INSENSITIVE));
    }

    private final WorklogProperties properties;

    public List<TicketReference> extract(String text) {
        return extractAll(text == null ? List.of() : List.of(text));
    }

    /**
     * Extract ids from several texts, keeping first-seen order and dropping
     * duplicates across texts.
     */
    public List<TicketReference> extractAll(Collection<String> texts) {
        Map<String, TicketReference> found = new LinkedHashMap<>();
        Pattern prefixPattern = buildPrefixPattern();
        String prefixType = resolvePrefixType();

        for (String text : texts) {
            if (text == null || text.isBlank()) {
                continue;
            }
            if (prefixPattern != null) {
                Matcher matcher = prefixPattern.matcher(text);
                while (matcher.find()) {
                    String id = matcher.group(1).toUpperCase(Locale.ROOT);
                    found.putIfAbsent(id, new TicketReference(id, prefixType));
                }
            }
            for (Map.Entry<String, Pattern> entry : TICKET_PATTERNS.entrySet()) {
                Matcher matcher = entry.getValue().matcher(text);
                while (matcher.find()) {
                    String id = GITHUB.equals(entry.getKey())
                            ? "#" + matcher.group(1)
                            : matcher.group(1).toUpperCase(Locale.ROOT);
                    found.putIfAbsent(id, new TicketReference(id, entry.getKey()));
                }
            }
        }
        return new ArrayList<>(found.values());
    }

    private Pattern buildPrefixPattern() {
        String prefix = properties.getTickets().getPrefix();
        if (prefix == null || prefix.isBlank()) {
            return null;
        }
        return Pattern.compile("(" + Pattern.quote(prefix.trim()) + "-\\d+)", Pattern.CASE_INSENSITIVE);
    }

    private String resolvePrefixType() {
        String tool = properties.getTickets().getTool();
        if (tool == null || tool.isBlank() || NO_TOOL.equalsIgnoreCase(tool)) {
            return "unknown";
        }
        return tool.trim().toLowerCase(Locale.ROOT);
    }
}
