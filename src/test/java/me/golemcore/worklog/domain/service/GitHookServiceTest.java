package me.golemcore.worklog.domain.service;

import me.golemcore.worklog.domain.model.HookInstallResult;
import me.golemcore.worklog.port.outbound.RepositoryAccessException;
import me.golemcore.worklog.port.outbound.RepositoryFactsPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GitHookServiceTest {

    @TempDir
    Path tempDir;

    private Path hooksDirectory;
    private RepositoryFactsPort repositoryFactsPort;
    private GitHookService service;

    @BeforeEach
    void setUp() {
        hooksDirectory = tempDir.resolve(".git/hooks");
        repositoryFactsPort = mock(RepositoryFactsPort.class);
        when(repositoryFactsPort.isRepository()).thenReturn(true);
        when(repositoryFactsPort.hooksDirectory()).thenReturn(hooksDirectory);
        service = new GitHookService(repositoryFactsPort);
    }

    @Test
    void shouldInstallBothHooks() throws IOException {
        HookInstallResult result = service.installHooks(false);

        assertEquals(List.of("post-commit", "post-checkout"), result.installed());
        assertTrue(result.warnings().isEmpty());
        Path postCommit = hooksDirectory.resolve("post-commit");
        String content = Files.readString(postCommit);
        assertTrue(content.startsWith("#!/bin/sh\n"));
        assertTrue(content.contains(GitHookService.MARKER));
        assertTrue(content.contains("worklog snapshot --light --tag auto:post-commit"));
        assertTrue(Files.isExecutable(postCommit));
    }

    @Test
    void shouldRunPostCheckoutOnlyForBranchSwitches() {
        String hook = GitHookService.postCheckoutHook();

        assertTrue(hook.contains("[ \"$3\" != \"1\" ]"));
        assertTrue(hook.contains("--tag auto:post-checkout --note \"Switched branch\""));
        assertTrue(hook.contains("&)"));
    }

    @Test
    void shouldSkipAlreadyInstalledHooks() {
        service.installHooks(false);

        HookInstallResult second = service.installHooks(false);

        assertTrue(second.installed().isEmpty());
        assertEquals(2, second.skipped().size());
    }

    @Test
    void shouldOverwriteMarkedHookWhenForced() throws IOException {
        Files.createDirectories(hooksDirectory);
        Files.writeString(hooksDirectory.resolve("post-commit"), "#!/bin/sh\n" + GitHookService.MARKER + "\nold\n");

        HookInstallResult result = service.installHooks(true);

        assertTrue(result.installed().contains("post-commit (overwritten)"));
        assertEquals(GitHookService.postCommitHook(), Files.readString(hooksDirectory.resolve("post-commit")));
    }

    @Test
    void shouldAppendToForeignHook() throws IOException {
        Files.createDirectories(hooksDirectory);
        Path hook = hooksDirectory.resolve("post-commit");
        Files.writeString(hook, "#!/bin/sh\necho lint\n");

        HookInstallResult result = service.installHooks(false);

        String content = Files.readString(hook);
        assertTrue(content.startsWith("#!/bin/sh\necho lint\n"));
        assertTrue(content.contains(GitHookService.MARKER));
        assertTrue(result.installed().contains("post-commit (appended to existing hook)"));
        assertEquals(1, result.warnings().size());
    }

    @Test
    void shouldWarnOutsideRepository() {
        when(repositoryFactsPort.isRepository()).thenReturn(false);

        HookInstallResult result = service.installHooks(false);

        assertTrue(result.installed().isEmpty());
        assertEquals(List.of("Not a git repository, cannot install hooks"), result.warnings());
        assertFalse(Files.exists(hooksDirectory));
    }

    @Test
    void shouldWarnWhenHooksDirectoryUnknown() {
        when(repositoryFactsPort.hooksDirectory()).thenThrow(new RepositoryAccessException("git failed"));

        HookInstallResult result = service.installHooks(false);

        assertEquals(List.of("Could not locate hooks directory: git failed"), result.warnings());
    }
}
