package me.golemcore.worklog.infrastructure.process;

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
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs external commands (git, gh) without a shell, with a timeout and bounded
 * output capture. Standard output and standard error are captured separately
 * so that parsers only see standard output.
 */
@Component
@Slf4j
public class ProcessRunner {

    private static final int MAX_OUTPUT_LENGTH = 2_000_000;

    private final ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "worklog-process-io");
        thread.setDaemon(true);
        return thread;
    });

    /**
     * Result of a finished process.
     */
    public record ProcessResult(int exitCode, String stdout, String stderr, boolean timedOut) {

        public boolean isSuccess() {
            return !timedOut && exitCode == 0;
        }
    }

    /**
     * Runs {@code command} in {@code workDir}. Never throws for a non-zero exit
     * or a timeout; those are reported in the result.
     *
     * @throws IOException
     *             when the process cannot be started
     */
    public ProcessResult run(List<String> command, Path workDir, int timeoutSeconds) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }

        long startTime = System.currentTimeMillis();
        Process process = pb.start();
        process.getOutputStream().close();

        Future<String> stdoutFuture = executor.submit(() -> readStream(process.getInputStream()));
        Future<String> stderrFuture = executor.submit(() -> readStream(process.getErrorStream()));

        try {
            boolean completed = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!completed) {
                process.destroyForcibly();
                log.debug("[Process] {} timed out after {}s", command.get(0), timeoutSeconds);
                return new ProcessResult(-1, "", "timed out after " + timeoutSeconds + " seconds", true);
            }

            String stdout = awaitOutput(stdoutFuture);
            String stderr = awaitOutput(stderrFuture);
            log.trace("[Process] {} finished with exit code {} in {}ms", command, process.exitValue(),
                    System.currentTimeMillis() - startTime);
            return new ProcessResult(process.exitValue(), stdout, stderr, false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while running " + command.get(0), e);
        }
    }

    private String awaitOutput(Future<String> future) throws InterruptedException {
        try {
            return future.get(1, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return "";
        } catch (ExecutionException e) {
            log.debug("[Process] Failed to read process output: {}", e.getMessage());
            return "";
        }
    }

    private static String readStream(InputStream stream) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                if (output.length() < MAX_OUTPUT_LENGTH) {
                    output.append(line).append('\n');
                }
                line = reader.readLine();
            }
        }
        return output.toString();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
