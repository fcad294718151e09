package me.golemcore.worklog.adapter.outbound.git;

import me.golemcore.worklog.domain.model.DiffStats;
import me.golemcore.worklog.domain.model.RepositoryBranch;
import me.golemcore.worklog.domain.model.RepositoryCommit;
import me.golemcore.worklog.infrastructure.config.WorklogProperties;
import me.golemcore.worklog.infrastructure.process.ProcessRunner;
import me.golemcore.worklog.port.outbound.RepositoryAccessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static me.golemcore.worklog.adapter.outbound.git.GitCliRepositoryAdapter.FIELD_SEPARATOR;
import static me.golemcore.worklog.adapter.outbound.git.GitCliRepositoryAdapter.RECORD_SEPARATOR;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GitCliRepositoryAdapterTest {

    private ProcessRunner processRunner;
    private WorklogProperties properties;
    private GitCliRepositoryAdapter adapter;

    @BeforeEach
    void setUp() {
        processRunner = mock(ProcessRunner.class);
        properties = new WorklogProperties();
        properties.getGit().setWorkingDirectory("/work/acme");
        adapter = new GitCliRepositoryAdapter(processRunner, properties);
    }

    @Test
    void shouldParseLogRecordsWithMultilineBodies() {
        String output = RECORD_SEPARATOR + "abc123" + FIELD_SEPARATOR + "feat: login" + FIELD_SEPARATOR + "Dev One"
                + FIELD_SEPARATOR + "dev@example.com" + FIELD_SEPARATOR + "2026-02-10T15:00:00+01:00"
                + FIELD_SEPARATOR + "body line 1\nbody line 2\n\n"
                + RECORD_SEPARATOR + "def456" + FIELD_SEPARATOR + "fix | pipe" + FIELD_SEPARATOR + "Dev Two"
                + FIELD_SEPARATOR + "two@example.com" + FIELD_SEPARATOR + "2026-02-10T09:00:00Z"
                + FIELD_SEPARATOR + "\n";

        List<RepositoryCommit> commits = GitCliRepositoryAdapter.parseLog(output);

        assertEquals(2, commits.size());
        assertEquals(new RepositoryCommit("abc123", "feat: login", "Dev One", Instant.parse("2026-02-10T14:00:00Z")),
                commits.get(0));
        assertEquals("fix | pipe", commits.get(1).message());
    }

    @Test
    void shouldSkipMalformedLogRecords() {
        assertTrue(GitCliRepositoryAdapter.parseLog("").isEmpty());
        assertTrue(GitCliRepositoryAdapter.parseLog(RECORD_SEPARATOR + "only" + FIELD_SEPARATOR + "two").isEmpty());
    }

    @Test
    void shouldParseBranches() {
        String output = "feature/login|||abc1234|||Add form|||2026-02-10T15:00:00+00:00\n"
                + "main|||def5678|||Release|||2026-02-08T10:00:00+00:00\n"
                + "broken line\n";

        List<RepositoryBranch> branches = GitCliRepositoryAdapter.parseBranches(output);

        assertEquals(2, branches.size());
        assertEquals("feature/login", branches.get(0).name());
        assertEquals(Instant.parse("2026-02-10T15:00:00Z"), branches.get(0).lastCommitDate());
    }

    @Test
    void shouldParseShortStat() {
        assertEquals(new DiffStats(3, 42, 7),
                GitCliRepositoryAdapter.parseShortStat(" 3 files changed, 42 insertions(+), 7 deletions(-)\n"));
        assertEquals(new DiffStats(1, 1, 0),
                GitCliRepositoryAdapter.parseShortStat(" 1 file changed, 1 insertion(+)\n"));
        assertEquals(new DiffStats(0, 0, 0), GitCliRepositoryAdapter.parseShortStat(""));
    }

    @Test
    void shouldParsePorcelainStatus() {
        String output = " M src/app.ts\n?? notes.txt\nR  old.ts -> new.ts\n A \"with space.ts\"\n";

        assertEquals(List.of("src/app.ts", "notes.txt", "new.ts", "with space.ts"),
                GitCliRepositoryAdapter.parseStatus(output));
    }

    @Test
    void shouldDetectRepository() throws IOException {
        when(processRunner.run(any(), any(), anyInt()))
                .thenReturn(new ProcessRunner.ProcessResult(0, "true\n", "", false));

        assertTrue(adapter.isRepository());
        verify(processRunner).run(eq(List.of("git", "rev-parse", "--is-inside-work-tree")),
                eq(Path.of("/work/acme")), eq(15));
    }

    @Test
    void shouldTreatStartFailureAsNoRepository() throws IOException {
        when(processRunner.run(any(), any(), anyInt())).thenThrow(new IOException("git not found"));

        assertFalse(adapter.isRepository());
    }

    @Test
    void shouldReturnNullRemoteWhenOriginMissing() throws IOException {
        when(processRunner.run(any(), any(), anyInt()))
                .thenReturn(new ProcessRunner.ProcessResult(2, "", "error: No such remote 'origin'", false));

        assertNull(adapter.remoteUrl());
    }

    @Test
    void shouldFailOnNonZeroExit() throws IOException {
        when(processRunner.run(any(), any(), anyInt()))
                .thenReturn(new ProcessRunner.ProcessResult(128, "", "fatal: bad revision\n", false));

        RepositoryAccessException thrown = assertThrows(RepositoryAccessException.class,
                () -> adapter.changedFiles("main", "HEAD"));
        assertEquals("git diff failed (exit 128): fatal: bad revision", thrown.getMessage());
    }

    @Test
    void shouldFailOnTimeout() throws IOException {
        when(processRunner.run(any(), any(), anyInt()))
                .thenReturn(new ProcessRunner.ProcessResult(-1, "", "timed out after 15 seconds", true));

        assertThrows(RepositoryAccessException.class, () -> adapter.currentBranch());
    }

    @Test
    void shouldQueryCommitsInRange() throws IOException {
        when(processRunner.run(any(), any(), anyInt()))
                .thenReturn(new ProcessRunner.ProcessResult(0, "", "", false));

        adapter.commitsInRange(Instant.parse("2026-02-10T00:00:00Z"), Instant.parse("2026-02-10T23:59:59Z"));

        verify(processRunner).run(argThat(command -> command.contains("--since=2026-02-10T00:00:00Z")
                && command.contains("--until=2026-02-10T23:59:59Z")), any(), anyInt());
    }

    @Test
    void shouldCountAheadCommits() throws IOException {
        when(processRunner.run(any(), any(), anyInt()))
                .thenReturn(new ProcessRunner.ProcessResult(0, "4\n", "", false));

        assertEquals(4, adapter.aheadCount("main", "feature/login"));
    }

    @Test
    void shouldResolveRelativeHooksDirectory() throws IOException {
        when(processRunner.run(any(), any(), anyInt()))
                .thenReturn(new ProcessRunner.ProcessResult(0, ".git/hooks\n", "", false));

        assertEquals(Path.of("/work/acme/.git/hooks"), adapter.hooksDirectory());
    }
}
