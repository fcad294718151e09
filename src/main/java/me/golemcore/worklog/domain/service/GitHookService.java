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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.worklog.domain.model.HookInstallResult;
import me.golemcore.worklog.domain.model.SnapshotSource;
import me.golemcore.worklog.port.outbound.RepositoryFactsPort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Installs git hooks that capture a light snapshot after commits and branch
 * switches. The snapshot runs in the background so git is never slowed down
 * or failed by it.
 *
 * <p>
 * Hooks written by this service carry {@link #MARKER}. A foreign hook is
 * extended with a marked snippet rather than replaced; a marked hook is left
 * alone unless {@code force} is set.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GitHookService {

    static final String MARKER = "# golemcore-worklog auto-snapshot";
    static final String POST_COMMIT = "post-commit";
    static final String POST_CHECKOUT = "post-checkout";
    static final String COMMAND = "worklog";

    private final RepositoryFactsPort repositoryFactsPort;

    public HookInstallResult installHooks(boolean force) {
        List<String> installed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Path hooksDirectory;
        try {
            if (!repositoryFactsPort.isRepository()) {
                warnings.add("Not a git repository, cannot install hooks");
                return new HookInstallResult(installed, skipped, warnings);
            }
            hooksDirectory = repositoryFactsPort.hooksDirectory();
            Files.createDirectories(hooksDirectory);
        } catch (IOException | RuntimeException e) {
            warnings.add("Could not locate hooks directory: " + e.getMessage());
            return new HookInstallResult(installed, skipped, warnings);
        }

        installHook(hooksDirectory, POST_COMMIT, postCommitHook(), postCommitSnippet(), force,
                installed, skipped, warnings);
        installHook(hooksDirectory, POST_CHECKOUT, postCheckoutHook(), postCheckoutSnippet(), force,
                installed, skipped, warnings);
        return new HookInstallResult(installed, skipped, warnings);
    }

    private void installHook(Path hooksDirectory, String name, String content, String snippet, boolean force,
            List<String> installed, List<String> skipped, List<String> warnings) {
        Path hookPath = hooksDirectory.resolve(name);
        try {
            if (Files.exists(hookPath)) {
                String existing = Files.readString(hookPath, StandardCharsets.UTF_8);
                if (existing.contains(MARKER)) {
                    if (!force) {
                        skipped.add(name + " (already installed)");
                        return;
                    }
                    writeHook(hookPath, content, warnings);
                    installed.add(name + " (overwritten)");
                    return;
                }
                if (!force) {
                    writeHook(hookPath, existing + snippet, warnings);
                    installed.add(name + " (appended to existing hook)");
                    warnings.add(name + ": existing hook found, appended snapshot call. Review " + hookPath);
                    return;
                }
            }
            writeHook(hookPath, content, warnings);
            installed.add(name);
            log.info("[Git] Installed {} hook at {}", name, hookPath);
        } catch (IOException e) {
            warnings.add(name + ": " + e.getMessage());
        }
    }

    private static void writeHook(Path hookPath, String content, List<String> warnings) throws IOException {
        Files.writeString(hookPath, content, StandardCharsets.UTF_8);
        if (!hookPath.toFile().setExecutable(true, false)) {
            warnings.add(hookPath.getFileName() + ": could not mark hook executable");
        }
    }

    static String postCommitHook() {
        return "#!/bin/sh\n"
                + MARKER + "\n"
                + "# Installed by: " + COMMAND + " hooks\n"
                + "# Remove this file to disable post-commit snapshots\n"
                + "\n"
                + "if ! command -v " + COMMAND + " >/dev/null 2>&1; then\n"
                + "  exit 0\n"
                + "fi\n"
                + "\n"
                + "(" + snapshotCommand(SnapshotSource.POST_COMMIT, null) + " >/dev/null 2>&1 &)\n"
                + "\n"
                + "exit 0\n";
    }

    static String postCheckoutHook() {
        return "#!/bin/sh\n"
                + MARKER + "\n"
                + "# Installed by: " + COMMAND + " hooks\n"
                + "# Remove this file to disable post-checkout snapshots\n"
                + "#\n"
                + "# $1 previous HEAD, $2 new HEAD, $3 1 for branch checkouts\n"
                + "\n"
                + "if [ \"$3\" != \"1\" ] || [ \"$1\" = \"$2\" ]; then\n"
                + "  exit 0\n"
                + "fi\n"
                + "\n"
                + "if ! command -v " + COMMAND + " >/dev/null 2>&1; then\n"
                + "  exit 0\n"
                + "fi\n"
                + "\n"
                + "(" + snapshotCommand(SnapshotSource.POST_CHECKOUT, "Switched branch") + " >/dev/null 2>&1 &)\n"
                + "\n"
                + "exit 0\n";
    }

    private static String postCommitSnippet() {
        return "\n\n" + MARKER + "\n"
                + "if command -v " + COMMAND + " >/dev/null 2>&1; then\n"
                + "  (" + snapshotCommand(SnapshotSource.POST_COMMIT, null) + " >/dev/null 2>&1 &)\n"
                + "fi\n";
    }

    private static String postCheckoutSnippet() {
        return "\n\n" + MARKER + "\n"
                + "if [ \"$3\" = \"1\" ] && command -v " + COMMAND + " >/dev/null 2>&1; then\n"
                + "  (" + snapshotCommand(SnapshotSource.POST_CHECKOUT, "Switched branch") + " >/dev/null 2>&1 &)\n"
                + "fi\n";
    }

    private static String snapshotCommand(SnapshotSource source, String note) {
        String command = COMMAND + " snapshot --light --tag " + source.tag();
        return note != null ? command + " --note \"" + note + "\"" : command;
    }
}
