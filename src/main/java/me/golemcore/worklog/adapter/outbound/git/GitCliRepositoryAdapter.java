package me.golemcore.worklog.adapter.outbound.git;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.worklog.domain.model.DiffStats;
import me.golemcore.worklog.domain.model.RepositoryBranch;
import me.golemcore.worklog.domain.model.RepositoryCommit;
import me.golemcore.worklog.infrastructure.config.WorklogProperties;
import me.golemcore.worklog.infrastructure.process.ProcessRunner;
import me.golemcore.worklog.port.outbound.RepositoryAccessException;
import me.golemcore.worklog.port.outbound.RepositoryFactsPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Repository facts read through the {@code git} command line.
 *
 * <p>
 * Commands run in {@code worklog.git.working-directory} without a shell and
 * under {@code worklog.git.timeout-seconds}. Output formats use explicit
 * separators so commit subjects and bodies can contain any text. Parsing is
 * kept in static methods so it can be tested without a repository.
 */
@Component
@Slf4j
public class GitCliRepositoryAdapter implements RepositoryFactsPort {

    static final String RECORD_SEPARATOR = "<<<WL_RECORD>>>";
    static final String FIELD_SEPARATOR = "<<<WL_FIELD>>>";
    static final String BRANCH_SEPARATOR = "|||";

    private static final String LOG_FORMAT = RECORD_SEPARATOR + "%H" + FIELD_SEPARATOR + "%s" + FIELD_SEPARATOR
            + "%an" + FIELD_SEPARATOR + "%ae" + FIELD_SEPARATOR + "%aI" + FIELD_SEPARATOR + "%b";
    private static final String BRANCH_FORMAT = "%(refname:short)" + BRANCH_SEPARATOR + "%(objectname:short)"
            + BRANCH_SEPARATOR + "%(subject)" + BRANCH_SEPARATOR + "%(committerdate:iso-strict)";

    private static final Pattern FILES_PATTERN = Pattern.compile("(\\d+) files? changed");
    private static final Pattern INSERTIONS_PATTERN = Pattern.compile("(\\d+) insertions?\\(\\+\\)");
    private static final Pattern DELETIONS_PATTERN = Pattern.compile("(\\d+) deletions?\\(-\\)");

    private final ProcessRunner processRunner;
    private final WorklogProperties properties;

    public GitCliRepositoryAdapter(ProcessRunner processRunner, WorklogProperties properties) {
        this.processRunner = processRunner;
        this.properties = properties;
    }

    @Override
    public boolean isRepository() {
        try {
            ProcessRunner.ProcessResult result = execute(List.of("rev-parse", "--is-inside-work-tree"));
            return result.isSuccess() && "true".equals(result.stdout().trim());
        } catch (RepositoryAccessException e) {
            log.debug("[Git] Repository check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Path repositoryRoot() {
        return Paths.get(git("rev-parse", "--show-toplevel").trim());
    }

    @Override
    public String remoteUrl() {
        ProcessRunner.ProcessResult result = execute(List.of("remote", "get-url", "origin"));
        if (!result.isSuccess()) {
            return null;
        }
        String url = result.stdout().trim();
        return url.isEmpty() ? null : url;
    }

    @Override
    public String currentBranch() {
        return git("rev-parse", "--abbrev-ref", "HEAD").trim();
    }

    @Override
    public List<RepositoryCommit> commitsInRange(Instant since, Instant until) {
        String output = git("log",
                "--since=" + DateTimeFormatter.ISO_INSTANT.format(since),
                "--until=" + DateTimeFormatter.ISO_INSTANT.format(until),
                "--format=" + LOG_FORMAT);
        return parseLog(output);
    }

    @Override
    public List<String> commitFiles(String hash) {
        return parseLines(git("diff-tree", "--no-commit-id", "--name-only", "-r", "--root", hash));
    }

    @Override
    public List<String> changedFiles(String base, String head) {
        return parseLines(git("diff", "--name-only", base + "..." + head));
    }

    @Override
    public DiffStats diffStats(String base, String head) {
        return parseShortStat(git("diff", "--shortstat", base + "..." + head));
    }

    @Override
    public List<RepositoryBranch> branchList() {
        return parseBranches(git("branch", "--format=" + BRANCH_FORMAT, "--sort=-committerdate"));
    }

    @Override
    public int aheadCount(String base, String branch) {
        String output = git("rev-list", "--count", base + ".." + branch).trim();
        try {
            return Integer.parseInt(output);
        } catch (NumberFormatException e) {
            throw new RepositoryAccessException("Unexpected rev-list output: " + output, e);
        }
    }

    @Override
    public List<String> uncommittedFiles() {
        return parseStatus(git("status", "--porcelain"));
    }

    @Override
    public Path hooksDirectory() {
        Path hooks = Paths.get(git("rev-parse", "--git-path", "hooks").trim());
        return hooks.isAbsolute() ? hooks : workingDirectory().resolve(hooks).normalize();
    }

    // ==================== PARSING ====================

    static List<RepositoryCommit> parseLog(String output) {
        List<RepositoryCommit> commits = new ArrayList<>();
        if (output == null || output.isBlank()) {
            return commits;
        }
        for (String record : output.split(Pattern.quote(RECORD_SEPARATOR))) {
            if (record.isBlank()) {
                continue;
            }
            String[] fields = record.split(Pattern.quote(FIELD_SEPARATOR), -1);
            if (fields.length < 5) {
                log.trace("[Git] Skipping malformed log record: {}", record);
                continue;
            }
            commits.add(new RepositoryCommit(
                    fields[0].trim(),
                    fields[1].trim(),
                    fields[2].trim(),
                    parseInstant(fields[4].trim())));
        }
        return commits;
    }

    static List<RepositoryBranch> parseBranches(String output) {
        List<RepositoryBranch> branches = new ArrayList<>();
        for (String line : parseLines(output)) {
            String[] parts = line.split(Pattern.quote(BRANCH_SEPARATOR), -1);
            if (parts.length < 4) {
                continue;
            }
            branches.add(new RepositoryBranch(
                    parts[0].trim(),
                    parts[1].trim(),
                    parts[2].trim(),
                    parseInstant(parts[3].trim())));
        }
        return branches;
    }

    static DiffStats parseShortStat(String output) {
        String text = output != null ? output : "";
        return new DiffStats(
                firstNumber(FILES_PATTERN, text),
                firstNumber(INSERTIONS_PATTERN, text),
                firstNumber(DELETIONS_PATTERN, text));
    }

    static List<String> parseStatus(String output) {
        List<String> files = new ArrayList<>();
        if (output == null) {
            return files;
        }
        for (String line : output.split("\n")) {
            if (line.length() < 4) {
                continue;
            }
            String path = line.substring(3).trim();
            int rename = path.indexOf(" -> ");
            if (rename >= 0) {
                path = path.substring(rename + 4);
            }
            files.add(unquote(path));
        }
        return files;
    }

    static List<String> parseLines(String output) {
        List<String> lines = new ArrayList<>();
        if (output == null) {
            return lines;
        }
        for (String line : output.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return lines;
    }

    private static Instant parseInstant(String value) {
        if (value.isEmpty()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.trace("[Git] Unparseable date '{}'", value);
            return null;
        }
    }

    private static int firstNumber(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : 0;
    }

    private static String unquote(String path) {
        if (path.length() >= 2 && path.startsWith("\"") && path.endsWith("\"")) {
            return path.substring(1, path.length() - 1);
        }
        return path;
    }

    // ==================== EXECUTION ====================

    private String git(String... args) {
        ProcessRunner.ProcessResult result = execute(List.of(args));
        if (result.timedOut()) {
            throw new RepositoryAccessException("git " + args[0] + " " + result.stderr());
        }
        if (result.exitCode() != 0) {
            throw new RepositoryAccessException("git " + args[0] + " failed (exit " + result.exitCode() + "): "
                    + result.stderr().trim());
        }
        return result.stdout();
    }

    private ProcessRunner.ProcessResult execute(List<String> args) {
        List<String> command = new ArrayList<>();
        command.add(properties.getGit().getExecutable());
        command.addAll(args);
        try {
            return processRunner.run(command, workingDirectory(), properties.getGit().getTimeoutSeconds());
        } catch (IOException e) {
            throw new RepositoryAccessException("Failed to run git " + args.get(0) + ": " + e.getMessage(), e);
        }
    }

    private Path workingDirectory() {
        return Paths.get(properties.getGit().getWorkingDirectory()).toAbsolutePath().normalize();
    }
}
