package me.golemcore.worklog.adapter.outbound.github;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.worklog.domain.model.PullRequestSnapshot;
import me.golemcore.worklog.domain.model.PullRequestState;
import me.golemcore.worklog.domain.model.TicketSnapshot;
import me.golemcore.worklog.infrastructure.config.WorklogProperties;
import me.golemcore.worklog.infrastructure.process.ProcessRunner;
import me.golemcore.worklog.port.outbound.RemoteWorkException;
import me.golemcore.worklog.port.outbound.RemoteWorkPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Pull requests and GitHub issues read through the {@code gh} command line.
 *
 * <p>
 * Disabled by {@code worklog.github.enabled=false}. Availability is checked
 * once with {@code gh auth status} and cached. Only {@code #N} ticket ids can
 * be resolved; other trackers yield an empty result.
 */
@Component
@Slf4j
public class GhCliRemoteWorkAdapter implements RemoteWorkPort {

    private static final String PR_FIELDS = "number,title,state,url,baseRefName,headRefName,labels";
    private static final Pattern ISSUE_ID_PATTERN = Pattern.compile("^#(\\d+)$");

    private final ProcessRunner processRunner;
    private final ObjectMapper objectMapper;
    private final WorklogProperties properties;

    private volatile Boolean available;

    public GhCliRemoteWorkAdapter(ProcessRunner processRunner, ObjectMapper objectMapper,
            WorklogProperties properties) {
        this.processRunner = processRunner;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public boolean isAvailable() {
        if (!properties.getGithub().isEnabled()) {
            return false;
        }
        Boolean cached = available;
        if (cached != null) {
            return cached;
        }
        boolean authenticated;
        try {
            authenticated = execute(List.of("auth", "status")).isSuccess();
        } catch (RemoteWorkException e) {
            authenticated = false;
        }
        log.debug("[GitHub] gh CLI available: {}", authenticated);
        available = authenticated;
        return authenticated;
    }

    @Override
    public List<PullRequestSnapshot> listMyOpenPullRequests() {
        String output = gh("pr", "list", "--author", "@me", "--state", "open",
                "--json", PR_FIELDS,
                "--limit", String.valueOf(properties.getGithub().getOpenLimit()));
        return parsePullRequests(output, null);
    }

    @Override
    public List<PullRequestSnapshot> listMyMergedPullRequestsSince(Instant since) {
        String output = gh("pr", "list", "--author", "@me", "--state", "merged",
                "--json", PR_FIELDS + ",mergedAt",
                "--limit", String.valueOf(properties.getGithub().getMergedLimit()));
        return parsePullRequests(output, since);
    }

    @Override
    public Optional<TicketSnapshot> findTicket(String id) {
        if (id == null || !ISSUE_ID_PATTERN.matcher(id).matches()) {
            return Optional.empty();
        }
        String output = gh("issue", "view", id.substring(1), "--json", "number,title,state,url,labels");
        return Optional.ofNullable(parseIssue(id, output));
    }

    // ==================== PARSING ====================

    /**
     * Parse {@code gh pr list} JSON. When {@code mergedSince} is set, pull
     * requests merged before it are dropped.
     */
    List<PullRequestSnapshot> parsePullRequests(String json, Instant mergedSince) {
        List<PullRequestSnapshot> pullRequests = new ArrayList<>();
        JsonNode root = readTree(json);
        if (!root.isArray()) {
            return pullRequests;
        }
        for (JsonNode node : root) {
            if (mergedSince != null && !mergedOnOrAfter(node.path("mergedAt").asText(""), mergedSince)) {
                continue;
            }
            pullRequests.add(PullRequestSnapshot.builder()
                    .number(node.path("number").asInt())
                    .title(node.path("title").asText(""))
                    .state(PullRequestState.fromValue(node.path("state").asText(null)))
                    .url(node.path("url").asText(""))
                    .baseBranch(node.path("baseRefName").asText(""))
                    .headBranch(node.path("headRefName").asText(""))
                    .labels(labels(node))
                    .build());
        }
        return pullRequests;
    }

    TicketSnapshot parseIssue(String id, String json) {
        JsonNode node = readTree(json);
        if (!node.isObject()) {
            return null;
        }
        return TicketSnapshot.builder()
                .id(id)
                .title(node.path("title").asText(""))
                .status(node.path("state").asText(TicketSnapshot.UNKNOWN).toLowerCase(Locale.ROOT))
                .type("github")
                .url(node.path("url").asText(null))
                .build();
    }

    private static boolean mergedOnOrAfter(String mergedAt, Instant since) {
        if (mergedAt.isEmpty()) {
            return false;
        }
        try {
            return !Instant.parse(mergedAt).isBefore(since);
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static List<String> labels(JsonNode node) {
        List<String> labels = new ArrayList<>();
        for (JsonNode label : node.path("labels")) {
            String name = label.path("name").asText("");
            if (!name.isEmpty()) {
                labels.add(name);
            }
        }
        return labels;
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json == null || json.isBlank() ? "[]" : json);
        } catch (IOException e) {
            throw new RemoteWorkException("Unexpected gh output: " + e.getMessage(), e);
        }
    }

    // ==================== EXECUTION ====================

    private String gh(String... args) {
        ProcessRunner.ProcessResult result = execute(List.of(args));
        if (result.timedOut()) {
            throw new RemoteWorkException("gh " + args[0] + " " + result.stderr());
        }
        if (result.exitCode() != 0) {
            throw new RemoteWorkException("gh " + args[0] + " failed (exit " + result.exitCode() + "): "
                    + result.stderr().trim());
        }
        return result.stdout();
    }

    private ProcessRunner.ProcessResult execute(List<String> args) {
        List<String> command = new ArrayList<>();
        command.add(properties.getGithub().getExecutable());
        command.addAll(args);
        try {
            return processRunner.run(command, workingDirectory(), properties.getGithub().getTimeoutSeconds());
        } catch (IOException e) {
            throw new RemoteWorkException("Failed to run gh " + args.get(0) + ": " + e.getMessage(), e);
        }
    }

    private Path workingDirectory() {
        return Paths.get(properties.getGit().getWorkingDirectory()).toAbsolutePath().normalize();
    }
}
