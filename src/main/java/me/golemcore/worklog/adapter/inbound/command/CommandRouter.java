package me.golemcore.worklog.adapter.inbound.command;

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
import me.golemcore.worklog.domain.model.AutoSnapshotResult;
import me.golemcore.worklog.domain.model.CrossProjectSummary;
import me.golemcore.worklog.domain.model.HookInstallResult;
import me.golemcore.worklog.domain.model.JournalQueryResult;
import me.golemcore.worklog.domain.model.PruneResult;
import me.golemcore.worklog.domain.model.RecallQuery;
import me.golemcore.worklog.domain.model.RecallResponse;
import me.golemcore.worklog.domain.model.SnapshotOptions;
import me.golemcore.worklog.domain.model.SnapshotResult;
import me.golemcore.worklog.domain.model.SnapshotSource;
import me.golemcore.worklog.domain.model.WorkSnapshot;
import me.golemcore.worklog.domain.service.AutoSnapshotService;
import me.golemcore.worklog.domain.service.GitHookService;
import me.golemcore.worklog.domain.service.JournalDateSupport;
import me.golemcore.worklog.domain.service.JournalService;
import me.golemcore.worklog.domain.service.RecallService;
import me.golemcore.worklog.domain.service.SnapshotAssemblyService;
import me.golemcore.worklog.infrastructure.config.WorklogProperties;
import me.golemcore.worklog.port.inbound.CommandPort;
import me.golemcore.worklog.port.outbound.RepositoryUnavailableException;
import me.golemcore.worklog.port.outbound.StorageLockException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Routes journal commands to the domain services.
 *
 * <p>
 * Commands:
 *
 * <ul>
 * <li>snapshot - Capture the current repository state into the journal
 * <li>journal list|show|projects|stats|prune|note|tag - Browse and maintain
 * the journal
 * <li>recall - Search the journal or show a file's history
 * <li>week - Cross-project activity for a week
 * <li>hooks - Install git hooks for automatic snapshots
 * <li>help - Show available commands
 * </ul>
 *
 * <p>
 * Invalid input, a missing repository and lock conflicts become failed
 * results carrying the error message. Read commands (recall, week, journal
 * list and show) trigger a background light snapshot when auto-snapshot is
 * enabled.
 *
 * @see me.golemcore.worklog.port.inbound.CommandPort
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String CMD_SNAPSHOT = "snapshot";
    private static final String CMD_JOURNAL = "journal";
    private static final String CMD_RECALL = "recall";
    private static final String CMD_WEEK = "week";
    private static final String CMD_HOOKS = "hooks";
    private static final String CMD_HELP = "help";
    private static final List<String> KNOWN_COMMANDS = List.of(
            CMD_SNAPSHOT, CMD_JOURNAL, CMD_RECALL, CMD_WEEK, CMD_HOOKS, CMD_HELP);

    private static final String OPT_DATE = "date";
    private static final String OPT_PROJECT = "project";
    private static final String OPT_NOTE = "note";
    private static final String OPT_TAG = "tag";
    private static final String OPT_FROM = "from";
    private static final String OPT_TO = "to";
    private static final String OPT_DAYS = "days";
    private static final String OPT_LIMIT = "limit";
    private static final String OPT_FILE = "file";
    private static final String OPT_OLDER_THAN = "older-than";
    private static final String FLAG_LIGHT = "light";
    private static final String FLAG_NO_PRS = "no-prs";
    private static final String FLAG_NO_TICKETS = "no-tickets";
    private static final String FLAG_FORCE = "force";
    private static final String FLAG_LAST = "last";

    private static final int DEFAULT_LIST_DAYS = 7;
    private static final String JOURNAL_USAGE = "journal list|show|projects|stats|prune|note|tag";

    private final JournalService journalService;
    private final SnapshotAssemblyService assemblyService;
    private final RecallService recallService;
    private final AutoSnapshotService autoSnapshotService;
    private final GitHookService gitHookService;
    private final JournalOutputFormatter formatter;
    private final WorklogProperties properties;
    private final Clock clock;

    public CommandRouter(
            JournalService journalService,
            SnapshotAssemblyService assemblyService,
            RecallService recallService,
            AutoSnapshotService autoSnapshotService,
            GitHookService gitHookService,
            JournalOutputFormatter formatter,
            WorklogProperties properties,
            Clock clock) {
        this.journalService = journalService;
        this.assemblyService = assemblyService;
        this.recallService = recallService;
        this.autoSnapshotService = autoSnapshotService;
        this.gitHookService = gitHookService;
        this.formatter = formatter;
        this.properties = properties;
        this.clock = clock;
        log.debug("CommandRouter initialized with commands: {}", KNOWN_COMMANDS);
    }

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args) {
        return CompletableFuture.supplyAsync(() -> {
            log.debug("Executing command: {} {}", command, args);
            if (!hasCommand(command)) {
                return CommandResult.failure("Unknown command: " + command + ". Try 'help'.");
            }
            try {
                return switch (command) {
                case CMD_SNAPSHOT -> handleSnapshot(args);
                case CMD_JOURNAL -> handleJournal(args);
                case CMD_RECALL -> handleRecall(args);
                case CMD_WEEK -> handleWeek(args);
                case CMD_HOOKS -> handleHooks(args);
                case CMD_HELP -> handleHelp();
                default -> CommandResult.failure("Unknown command: " + command);
                };
            } catch (IllegalArgumentException | RepositoryUnavailableException | StorageLockException e) {
                return CommandResult.failure(e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Command {} failed", command, e);
                return CommandResult.failure("Command failed: " + e.getMessage());
            }
        });
    }

    @Override
    public boolean hasCommand(String command) {
        return KNOWN_COMMANDS.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return List.of(
                new CommandDefinition(CMD_SNAPSHOT, "Capture the current repository state",
                        "snapshot [--light] [--date D] [--project P] [--note N] [--tag T]... [--days N]"
                                + " [--no-prs] [--no-tickets]"),
                new CommandDefinition(CMD_JOURNAL, "Browse and maintain the journal",
                        "journal list [--project P] [--from D] [--to D] [--days N] | show [--date D] [--project P]"
                                + " | projects | stats | prune --older-than N | note <text> | tag <tag>..."),
                new CommandDefinition(CMD_RECALL, "Search past work or a file's history",
                        "recall [text] [--tag T]... [--file F] [--project P] [--from D] [--to D] [--days N]"
                                + " [--limit N]"),
                new CommandDefinition(CMD_WEEK, "Activity across projects for a week",
                        "week [--last] [--from D --to D]"),
                new CommandDefinition(CMD_HOOKS, "Install git hooks for automatic snapshots", "hooks [--force]"),
                new CommandDefinition(CMD_HELP, "Show available commands", "help"));
    }

    // ==================== SNAPSHOT ====================

    private CommandResult handleSnapshot(List<String> args) {
        CommandArguments parsed = CommandArguments.parse(args,
                Set.of(FLAG_LIGHT, FLAG_NO_PRS, FLAG_NO_TICKETS),
                Set.of(OPT_DATE, OPT_PROJECT, OPT_NOTE, OPT_TAG, OPT_DAYS));

        SnapshotResult result = assemblyService.assembleAndSave(SnapshotOptions.builder()
                .date(parsed.value(OPT_DATE))
                .projectId(parsed.value(OPT_PROJECT))
                .recentDays(parsed.intValue(OPT_DAYS))
                .light(parsed.flag(FLAG_LIGHT))
                .skipPullRequests(parsed.flag(FLAG_NO_PRS))
                .skipTickets(parsed.flag(FLAG_NO_TICKETS))
                .note(parsed.value(OPT_NOTE))
                .tags(new ArrayList<>(parsed.values(OPT_TAG)))
                .build());
        return CommandResult.success(formatter.snapshotResult(result), result.warnings());
    }

    // ==================== JOURNAL ====================

    private CommandResult handleJournal(List<String> args) {
        if (args == null || args.isEmpty()) {
            return CommandResult.failure("Usage: " + JOURNAL_USAGE);
        }
        List<String> rest = args.subList(1, args.size());
        return switch (args.get(0)) {
        case "list" -> handleJournalList(rest);
        case "show" -> handleJournalShow(rest);
        case "projects" -> CommandResult.success(formatter.projects(journalService.listProjects()));
        case "stats" -> CommandResult.success(formatter.stats(journalService.stats()));
        case "prune" -> handleJournalPrune(rest);
        case "note" -> handleJournalNote(rest);
        case "tag" -> handleJournalTag(rest);
        default -> CommandResult.failure("Unknown journal subcommand: " + args.get(0) + ". Usage: "
                + JOURNAL_USAGE);
        };
    }

    private CommandResult handleJournalList(List<String> args) {
        CommandArguments parsed = CommandArguments.parse(args, Set.of(),
                Set.of(OPT_PROJECT, OPT_FROM, OPT_TO, OPT_DAYS));
        LocalDate to = JournalDateSupport.parseDateOrDefault(parsed.value(OPT_TO), OPT_TO, today());
        Integer days = parsed.intValue(OPT_DAYS);
        int lookback = days != null ? JournalDateSupport.requirePositive(days, OPT_DAYS) : DEFAULT_LIST_DAYS;
        LocalDate from = JournalDateSupport.parseDateOrDefault(parsed.value(OPT_FROM), OPT_FROM,
                to.minusDays(lookback));

        JournalQueryResult result = journalService.readRange(parsed.value(OPT_PROJECT), from, to);
        return withAutoSnapshot(SnapshotSource.JOURNAL, formatter.snapshotList(result.snapshots()),
                result.warnings());
    }

    private CommandResult handleJournalShow(List<String> args) {
        CommandArguments parsed = CommandArguments.parse(args, Set.of(), Set.of(OPT_DATE, OPT_PROJECT));
        String dateValue = parsed.value(OPT_DATE) != null ? parsed.value(OPT_DATE) : parsed.positionalText();
        LocalDate date = JournalDateSupport.parseDateOrDefault(dateValue, OPT_DATE, today());
        String projectId = parsed.value(OPT_PROJECT);

        JournalQueryResult result = projectId == null
                ? journalService.readRange(null, date, date)
                : journalService.lookup(date, projectId);
        List<WorkSnapshot> snapshots = result.snapshots();
        String output;
        if (!snapshots.isEmpty()) {
            output = String.join("\n\n", snapshots.stream().map(formatter::snapshotDetail).toList());
        } else if (projectId == null) {
            output = "No snapshots for " + date + ".";
        } else {
            output = "No snapshot for " + projectId + " on " + date + ".";
        }
        return withAutoSnapshot(SnapshotSource.JOURNAL, output, result.warnings());
    }

    private CommandResult handleJournalPrune(List<String> args) {
        CommandArguments parsed = CommandArguments.parse(args, Set.of(), Set.of(OPT_OLDER_THAN));
        Integer days = parsed.intValue(OPT_OLDER_THAN);
        if (days == null && !parsed.positional().isEmpty()) {
            days = parseInt(parsed.positional().get(0), OPT_OLDER_THAN);
        }
        if (days == null) {
            return CommandResult.failure("Usage: journal prune --older-than <days>");
        }
        PruneResult result = journalService.prune(days);
        return CommandResult.success(formatter.prune(result, days));
    }

    private CommandResult handleJournalNote(List<String> args) {
        CommandArguments parsed = CommandArguments.parse(args, Set.of(), Set.of(OPT_PROJECT, OPT_DATE));
        String note = parsed.positionalText();
        if (note == null || note.isBlank()) {
            return CommandResult.failure("Usage: journal note <text> [--project P] [--date D]");
        }
        LocalDate date = JournalDateSupport.parseDateOrDefault(parsed.value(OPT_DATE), OPT_DATE, today());
        String projectId = resolveProject(parsed.value(OPT_PROJECT));

        WorkSnapshot saved = journalService.addNote(projectId, note, date);
        return CommandResult.success("Note added to " + saved.getDate() + " / " + saved.getProjectId() + ".");
    }

    private CommandResult handleJournalTag(List<String> args) {
        CommandArguments parsed = CommandArguments.parse(args, Set.of(), Set.of(OPT_PROJECT, OPT_DATE));
        if (parsed.positional().isEmpty()) {
            return CommandResult.failure("Usage: journal tag <tag>... [--project P] [--date D]");
        }
        LocalDate date = JournalDateSupport.parseDateOrDefault(parsed.value(OPT_DATE), OPT_DATE, today());
        String projectId = resolveProject(parsed.value(OPT_PROJECT));

        if (!journalService.addTags(projectId, parsed.positional(), date)) {
            return CommandResult.failure("No snapshot for " + projectId + " on " + date + ". Take one first.");
        }
        return CommandResult.success("Tagged " + date + " / " + projectId + ".");
    }

    // ==================== RECALL / WEEK ====================

    private CommandResult handleRecall(List<String> args) {
        CommandArguments parsed = CommandArguments.parse(args, Set.of(),
                Set.of(OPT_TAG, OPT_FILE, OPT_PROJECT, OPT_FROM, OPT_TO, OPT_DAYS, OPT_LIMIT));

        RecallResponse response = recallService.recall(RecallQuery.builder()
                .text(parsed.positionalText())
                .tags(new ArrayList<>(parsed.values(OPT_TAG)))
                .filePath(parsed.value(OPT_FILE))
                .projectId(parsed.value(OPT_PROJECT))
                .from(parsed.value(OPT_FROM))
                .to(parsed.value(OPT_TO))
                .lookbackDays(parsed.intValue(OPT_DAYS))
                .limit(parsed.intValue(OPT_LIMIT))
                .build());
        return withAutoSnapshot(SnapshotSource.RECALL, formatter.recall(response), response.warnings());
    }

    private CommandResult handleWeek(List<String> args) {
        CommandArguments parsed = CommandArguments.parse(args, Set.of(FLAG_LAST), Set.of(OPT_FROM, OPT_TO));
        LocalDate weekStart = today().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        if (parsed.flag(FLAG_LAST)) {
            weekStart = weekStart.minusWeeks(1);
        }
        LocalDate defaultEnd = parsed.flag(FLAG_LAST) ? weekStart.plusDays(6) : today();
        LocalDate from = JournalDateSupport.parseDateOrDefault(parsed.value(OPT_FROM), OPT_FROM, weekStart);
        LocalDate to = JournalDateSupport.parseDateOrDefault(parsed.value(OPT_TO), OPT_TO, defaultEnd);
        JournalDateSupport.requireOrderedRange(from, to);

        CrossProjectSummary summary = journalService.crossProjectSummary(from, to);
        return withAutoSnapshot(SnapshotSource.WEEK, formatter.crossProject(summary), summary.warnings());
    }

    // ==================== HOOKS / HELP ====================

    private CommandResult handleHooks(List<String> args) {
        CommandArguments parsed = CommandArguments.parse(args, Set.of(FLAG_FORCE), Set.of());
        HookInstallResult result = gitHookService.installHooks(parsed.flag(FLAG_FORCE));
        return CommandResult.success(formatter.hooks(result), result.warnings());
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder("Available commands:\n");
        for (CommandDefinition command : listCommands()) {
            sb.append("  ").append(command.usage()).append("\n      ").append(command.description()).append("\n");
        }
        return CommandResult.success(sb.toString().trim());
    }

    // ==================== HELPERS ====================

    private CommandResult withAutoSnapshot(SnapshotSource source, String output, List<String> warnings) {
        CompletableFuture<AutoSnapshotResult> pending = autoSnapshotService.fireAndForget(source, null);
        if (properties.getJournal().isQuiet()) {
            return CommandResult.success(output, warnings);
        }
        AutoSnapshotResult result = pending.join();
        String status = result.taken()
                ? "Auto-snapshot saved for " + result.result().snapshot().getProjectId() + "."
                : "Auto-snapshot skipped: " + result.skipReason() + ".";
        return CommandResult.success(output + "\n\n" + status, warnings);
    }

    private String resolveProject(String explicit) {
        if (explicit != null) {
            return explicit;
        }
        try {
            return assemblyService.currentProjectId();
        } catch (RepositoryUnavailableException e) {
            throw new IllegalArgumentException("Not inside a git repository; pass --project", e);
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private static int parseInt(String value, String field) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " expects a number, got '" + value + "'", e);
        }
    }
}
