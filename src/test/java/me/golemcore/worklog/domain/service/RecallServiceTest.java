package me.golemcore.worklog.domain.service;

import me.golemcore.worklog.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.worklog.domain.model.BranchStatus;
import me.golemcore.worklog.domain.model.ChangedFile;
import me.golemcore.worklog.domain.model.FileHistoryEntry;
import me.golemcore.worklog.domain.model.JournalCommit;
import me.golemcore.worklog.domain.model.PullRequestSnapshot;
import me.golemcore.worklog.domain.model.PullRequestState;
import me.golemcore.worklog.domain.model.RecallQuery;
import me.golemcore.worklog.domain.model.RecallResponse;
import me.golemcore.worklog.domain.model.RecallResult;
import me.golemcore.worklog.domain.model.TicketSnapshot;
import me.golemcore.worklog.domain.model.WorkSnapshot;
import me.golemcore.worklog.infrastructure.config.AutoConfiguration;
import me.golemcore.worklog.infrastructure.config.WorklogProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecallServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-20T12:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 2, 20);
    private static final String ACME = "acme";

    @TempDir
    Path tempDir;

    private JournalService journalService;
    private RecallService recallService;

    @BeforeEach
    void setUp() {
        WorklogProperties properties = new WorklogProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();

        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        journalService = new JournalService(storage, AutoConfiguration.objectMapper(),
                new SnapshotTaggingService(), properties, clock);
        recallService = new RecallService(journalService, properties, clock);
    }

    @Test
    void shouldReturnHelpWhenNothingRequested() {
        journalService.save(snapshot(TODAY, ACME).build());

        RecallResponse response = recallService.recall(new RecallQuery());

        assertEquals(RecallResponse.Mode.HELP, response.mode());
        assertEquals(RecallService.USAGE, response.usage());
        assertEquals(1, response.stats().totalSnapshots());
        assertTrue(response.results().isEmpty());
    }

    @Test
    void shouldRankCurrentBranchAboveCommitMessage() {
        journalService.save(snapshot(LocalDate.of(2026, 2, 18), ACME)
                .currentBranch("feature/payments")
                .build());
        journalService.save(snapshot(LocalDate.of(2026, 2, 19), "beta")
                .todayCommits(commits(commit("c1", "touch payments module", "README.md")))
                .build());

        List<RecallResult> results = recallService.search(RecallQuery.builder().text("Payments").build());

        assertEquals(2, results.size());
        assertEquals(ACME, results.get(0).snapshot().getProjectId());
        assertEquals(RecallService.WEIGHT_CURRENT_BRANCH, results.get(0).score());
        assertEquals(RecallService.WEIGHT_TODAY_COMMIT, results.get(1).score());
        assertTrue(results.get(0).matchReasons().contains("branch: feature/payments"));
    }

    @Test
    void shouldAccumulateScoresAcrossFields() {
        journalService.save(snapshot(TODAY, ACME)
                .currentBranch("fix/login")
                .activeBranches(new ArrayList<>(List.of(BranchStatus.builder().name("fix/login").build())))
                .todayCommits(commits(commit("c1", "login redirect", "src/login.ts")))
                .recentCommits(commits(commit("c0", "login prep", "src/other.ts")))
                .pullRequests(new ArrayList<>(List.of(PullRequestSnapshot.builder()
                        .number(5).title("Login fixes").state(PullRequestState.OPEN).build())))
                .tickets(new ArrayList<>(List.of(TicketSnapshot.builder().id("PROJ-1").title("Login broken").build())))
                .notes("login took all day")
                .aiSummary("Fixed login")
                .tags(new ArrayList<>(List.of("login")))
                .topChangedFiles(new ArrayList<>(List.of(new ChangedFile("src/login.ts", 1))))
                .build());

        RecallResult result = recallService.search(RecallQuery.builder().text("login").build()).get(0);

        int expected = RecallService.WEIGHT_CURRENT_BRANCH + RecallService.WEIGHT_ACTIVE_BRANCH
                + RecallService.WEIGHT_TODAY_COMMIT + RecallService.WEIGHT_COMMIT_FILE
                + RecallService.WEIGHT_RECENT_COMMIT + RecallService.WEIGHT_PULL_REQUEST
                + RecallService.WEIGHT_TICKET + RecallService.WEIGHT_NOTES + RecallService.WEIGHT_AI_SUMMARY
                + RecallService.WEIGHT_TAG_TEXT + RecallService.WEIGHT_TOP_FILE;
        assertEquals(expected, result.score());
    }

    @Test
    void shouldRankThreeWeakSignalsAboveOneStrongSignal() {
        journalService.save(snapshot(LocalDate.of(2026, 2, 18), "one")
                .currentBranch("feature/auth")
                .build());
        journalService.save(snapshot(LocalDate.of(2026, 2, 18), "three")
                .recentCommits(commits(commit("c0", "auth tweak", "src/other.ts")))
                .tags(new ArrayList<>(List.of("auth")))
                .topChangedFiles(new ArrayList<>(List.of(new ChangedFile("src/auth.ts", 1))))
                .build());

        List<RecallResult> results = recallService.search(RecallQuery.builder().text("auth").build());

        assertEquals(List.of("three", "one"), results.stream().map(r -> r.snapshot().getProjectId()).toList());
        assertEquals(RecallService.WEIGHT_RECENT_COMMIT + RecallService.WEIGHT_TAG_TEXT
                + RecallService.WEIGHT_TOP_FILE, results.get(0).score());
        assertEquals(RecallService.WEIGHT_CURRENT_BRANCH, results.get(1).score());
    }

    @Test
    void shouldKeepEveryTextWeightAboveAThirdOfTheLargest() {
        List<Integer> weights = List.of(RecallService.WEIGHT_CURRENT_BRANCH, RecallService.WEIGHT_ACTIVE_BRANCH,
                RecallService.WEIGHT_TODAY_COMMIT, RecallService.WEIGHT_COMMIT_FILE,
                RecallService.WEIGHT_RECENT_COMMIT, RecallService.WEIGHT_PULL_REQUEST, RecallService.WEIGHT_TICKET,
                RecallService.WEIGHT_NOTES, RecallService.WEIGHT_AI_SUMMARY, RecallService.WEIGHT_TAG_TEXT,
                RecallService.WEIGHT_TOP_FILE, RecallService.WEIGHT_PROJECT, RecallService.WEIGHT_REQUESTED_TAG,
                RecallService.WEIGHT_REQUESTED_FILE);
        int min = weights.stream().mapToInt(Integer::intValue).min().orElseThrow();
        int max = weights.stream().mapToInt(Integer::intValue).max().orElseThrow();

        assertTrue(3 * min > max);
    }

    @Test
    void shouldCarryCorruptRecordWarningsIntoResponse() throws Exception {
        journalService.save(snapshot(TODAY, ACME).notes("deploy").build());
        Path corrupt = tempDir.resolve("journal/2026-02-19/acme.json");
        Files.createDirectories(corrupt.getParent());
        Files.writeString(corrupt, "{broken");

        RecallResponse search = recallService.recall(RecallQuery.builder().text("deploy").build());
        RecallResponse history = recallService.recall(RecallQuery.builder().filePath("auth.ts").build());

        assertEquals(1, search.results().size());
        assertEquals(List.of("Skipped unreadable record 2026-02-19/acme.json"), search.warnings());
        assertEquals(List.of("Skipped unreadable record 2026-02-19/acme.json"), history.warnings());
    }

    @Test
    void shouldSearchRecordWithExplicitNullLists() throws Exception {
        Path record = tempDir.resolve("journal/2026-02-19/acme.json");
        Files.createDirectories(record.getParent());
        Files.writeString(record, "{\"date\":\"2026-02-19\",\"projectId\":\"acme\",\"notes\":\"deploy\","
                + "\"todayCommits\":null,\"activeBranches\":null,\"tags\":null,\"topChangedFiles\":null}");

        List<RecallResult> results = recallService.search(RecallQuery.builder().text("deploy").build());

        assertEquals(1, results.size());
        assertEquals(RecallService.WEIGHT_NOTES, results.get(0).score());
        assertTrue(recallService.findFileHistory("auth.ts", ACME, 30).isEmpty());
    }

    @Test
    void shouldBreakScoreTiesByMostRecentDateThenProject() {
        journalService.save(snapshot(LocalDate.of(2026, 2, 10), "zeta").notes("deploy").build());
        journalService.save(snapshot(LocalDate.of(2026, 2, 12), "zeta").notes("deploy").build());
        journalService.save(snapshot(LocalDate.of(2026, 2, 12), "alpha").notes("deploy").build());

        List<RecallResult> results = recallService.search(RecallQuery.builder().text("deploy").build());

        assertEquals(List.of("2026-02-12/alpha", "2026-02-12/zeta", "2026-02-10/zeta"), results.stream()
                .map(r -> r.snapshot().getDate() + "/" + r.snapshot().getProjectId())
                .toList());
    }

    @Test
    void shouldTruncateAfterRanking() {
        journalService.save(snapshot(LocalDate.of(2026, 2, 18), ACME).notes("deploy").build());
        journalService.save(snapshot(LocalDate.of(2026, 2, 10), ACME).currentBranch("deploy-fix").build());

        List<RecallResult> results = recallService.search(RecallQuery.builder().text("deploy").limit(1).build());

        assertEquals(1, results.size());
        assertEquals(LocalDate.of(2026, 2, 10), results.get(0).snapshot().getDate());
    }

    @Test
    void shouldScoreRequestedTagsAndFiles() {
        journalService.save(snapshot(TODAY, ACME)
                .tags(new ArrayList<>(List.of("release")))
                .todayCommits(commits(commit("c1", "bump", "src/auth.ts")))
                .build());
        journalService.save(snapshot(TODAY, "beta").tags(new ArrayList<>(List.of("wip"))).build());

        List<RecallResult> byTag = recallService.search(RecallQuery.builder()
                .tags(List.of("Release")).build());
        List<RecallResult> byFile = recallService.search(RecallQuery.builder()
                .text("bump").filePath("auth.ts").build());

        assertEquals(1, byTag.size());
        assertEquals(RecallService.WEIGHT_REQUESTED_TAG, byTag.get(0).score());
        assertEquals(1, byFile.size());
        assertEquals(RecallService.WEIGHT_TODAY_COMMIT + RecallService.WEIGHT_REQUESTED_FILE, byFile.get(0).score());
    }

    @Test
    void shouldReturnNothingForUnmatchedText() {
        journalService.save(snapshot(TODAY, ACME).notes("quiet day").build());

        assertTrue(recallService.search(RecallQuery.builder().text("kubernetes").build()).isEmpty());
    }

    @Test
    void shouldSearchExplicitRangeInclusively() {
        journalService.save(snapshot(LocalDate.of(2026, 2, 10), ACME).notes("auth").build());
        journalService.save(snapshot(LocalDate.of(2026, 2, 11), ACME).notes("auth").build());
        journalService.save(snapshot(LocalDate.of(2026, 2, 12), ACME).notes("auth").build());

        List<RecallResult> results = recallService.search(RecallQuery.builder()
                .text("auth").from("2026-02-10").to("2026-02-11").build());

        assertEquals(2, results.size());
    }

    @Test
    void shouldMatchEveryRecordInRangeWhenOnlyDatesGiven() {
        journalService.save(snapshot(LocalDate.of(2026, 2, 10), ACME).build());

        List<RecallResult> results = recallService.search(RecallQuery.builder()
                .from("2026-02-01").to("2026-02-28").build());

        assertEquals(1, results.size());
        assertEquals(List.of("date match"), results.get(0).matchReasons());
    }

    @Test
    void shouldRejectInvalidQueries() {
        journalService.save(snapshot(TODAY, ACME).build());

        assertThrows(IllegalArgumentException.class, () -> recallService.search(RecallQuery.builder()
                .text("x").from("2026-02-12").to("2026-02-10").build()));
        assertThrows(IllegalArgumentException.class, () -> recallService.search(RecallQuery.builder()
                .text("x").from("Feb 10").build()));
        assertThrows(IllegalArgumentException.class, () -> recallService.search(RecallQuery.builder()
                .text("x").limit(0).build()));
        assertThrows(IllegalArgumentException.class, () -> recallService.search(RecallQuery.builder()
                .text("x").projectId("unknown-project").build()));
        assertThrows(IllegalArgumentException.class, () -> recallService.recall(RecallQuery.builder()
                .filePath("  ").build()));
    }

    @Test
    void shouldReturnFileHistoryMostRecentFirst() {
        journalService.save(snapshot(LocalDate.of(2026, 2, 10), ACME)
                .todayCommits(commits(commit("c1", "add auth", "src/auth.ts")))
                .build());
        journalService.save(snapshot(LocalDate.of(2026, 2, 14), ACME)
                .todayCommits(commits(
                        commit("c2", "refactor auth", "src/auth.ts", "src/session.ts"),
                        commit("c3", "unrelated", "README.md")))
                .build());
        journalService.save(snapshot(LocalDate.of(2026, 2, 15), ACME)
                .todayCommits(commits(commit("c4", "docs", "docs/index.md")))
                .build());

        List<FileHistoryEntry> history = recallService.findFileHistory("auth.ts", ACME, 90);

        assertEquals(List.of(LocalDate.of(2026, 2, 14), LocalDate.of(2026, 2, 10)),
                history.stream().map(FileHistoryEntry::date).toList());
        assertEquals(1, history.get(0).commits().size());
        assertEquals("c2", history.get(0).commits().get(0).getHash());
    }

    @Test
    void shouldDispatchPathOnlyRecallToFileHistory() {
        journalService.save(snapshot(LocalDate.of(2026, 2, 10), ACME)
                .todayCommits(commits(commit("c1", "add auth", "src/Auth.ts")))
                .build());

        RecallResponse response = recallService.recall(RecallQuery.builder().filePath("auth.ts").build());

        assertEquals(RecallResponse.Mode.FILE_HISTORY, response.mode());
        assertEquals(1, response.fileHistory().size());
    }

    @Test
    void shouldLimitFileHistoryToLookbackWindow() {
        journalService.save(snapshot(TODAY.minusDays(40), ACME)
                .todayCommits(commits(commit("c1", "old", "src/auth.ts")))
                .build());

        assertTrue(recallService.findFileHistory("auth.ts", null, 30).isEmpty());
        assertEquals(1, recallService.findFileHistory("auth.ts", null, 40).size());
        assertThrows(IllegalArgumentException.class, () -> recallService.findFileHistory("auth.ts", null, 0));
        assertThrows(IllegalArgumentException.class, () -> recallService.findFileHistory("auth.ts", "nope", 30));
    }

    private static WorkSnapshot.WorkSnapshotBuilder snapshot(LocalDate date, String projectId) {
        return WorkSnapshot.builder()
                .date(date)
                .takenAt(NOW)
                .projectId(projectId)
                .currentBranch("main");
    }

    private static List<JournalCommit> commits(JournalCommit... commits) {
        return new ArrayList<>(List.of(commits));
    }

    private static JournalCommit commit(String hash, String message, String... files) {
        return JournalCommit.builder()
                .hash(hash)
                .message(message)
                .author("dev")
                .date(NOW)
                .filesChanged(new ArrayList<>(List.of(files)))
                .build();
    }
}
