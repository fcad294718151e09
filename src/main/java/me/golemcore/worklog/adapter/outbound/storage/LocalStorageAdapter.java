package me.golemcore.worklog.adapter.outbound.storage;

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

import me.golemcore.worklog.infrastructure.config.WorklogProperties;
import me.golemcore.worklog.port.outbound.StorageLockException;
import me.golemcore.worklog.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Stores all data in a local workspace directory with subdirectories for
 * different data types:
 * <ul>
 * <li>journal/ - one directory per day, one JSON file per project
 * </ul>
 *
 * <p>
 * Locked updates combine a per-file {@link ReentrantLock} (threads of this
 * process) with an OS file lock on a {@code .lock} sibling (other processes,
 * e.g. a git hook snapshot racing an interactive command). Lock acquisition
 * is retried with exponential backoff.
 *
 * <p>
 * Base path configured via {@code worklog.storage.local.base-path}, defaults
 * to {@code ${user.home}/.golemcore/worklog}.
 *
 * @see me.golemcore.worklog.port.outbound.StoragePort
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    static final String LOCK_SUFFIX = ".lock";

    private final WorklogProperties properties;

    // Entries live only while some thread holds or waits for the key.
    private final Map<Path, KeyLock> localLocks = new ConcurrentHashMap<>();

    private Path basePath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath);
            Files.createDirectories(basePath.resolve(properties.getJournal().getDirectory()));
            log.debug("[Storage] Local storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("[Storage] Failed to create storage directory", e);
        }
    }

    @Override
    public CompletableFuture<Void> putText(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            try {
                Path filePath = resolvePath(directory, path);
                createParent(filePath);
                Files.writeString(filePath, content, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            } catch (IOException e) {
                throw new RuntimeException("Failed to write file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path filePath = resolvePath(directory, path);
                if (!Files.exists(filePath)) {
                    return null;
                }
                return Files.readString(filePath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new RuntimeException("Failed to read file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> Files.exists(resolvePath(directory, path)));
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.deleteIfExists(resolvePath(directory, path));
            } catch (IOException e) {
                throw new RuntimeException("Failed to delete file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> deleteDirectory(String directory, String path) {
        return CompletableFuture.runAsync(() -> {
            Path dirPath = resolvePath(directory, path);
            if (!Files.exists(dirPath)) {
                return;
            }
            try (Stream<Path> paths = Files.walk(dirPath)) {
                List<Path> ordered = paths.sorted(Comparator.reverseOrder()).toList();
                for (Path p : ordered) {
                    Files.deleteIfExists(p);
                }
            } catch (IOException e) {
                throw new RuntimeException("Failed to delete directory: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path dirPath = resolveDirectory(directory);
                if (!Files.exists(dirPath)) {
                    return Collections.emptyList();
                }

                Path prefixPath = prefix != null && !prefix.isEmpty()
                        ? resolvePath(directory, prefix)
                        : dirPath;

                if (!Files.exists(prefixPath)) {
                    return Collections.emptyList();
                }

                try (Stream<Path> paths = Files.walk(prefixPath)) {
                    return paths
                            .filter(Files::isRegularFile)
                            .map(p -> dirPath.relativize(p).toString().replace('\\', '/'))
                            .sorted()
                            .toList();
                }
            } catch (IOException e) {
                throw new RuntimeException("Failed to list files: " + directory + "/" + prefix, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listDirectories(String directory) {
        return CompletableFuture.supplyAsync(() -> {
            Path dirPath = resolveDirectory(directory);
            if (!Files.isDirectory(dirPath)) {
                return Collections.emptyList();
            }
            try (Stream<Path> children = Files.list(dirPath)) {
                return children
                        .filter(Files::isDirectory)
                        .map(p -> p.getFileName().toString())
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new RuntimeException("Failed to list directories: " + directory, e);
            }
        });
    }

    @Override
    public CompletableFuture<Long> sizeOf(String directory) {
        return CompletableFuture.supplyAsync(() -> {
            Path dirPath = resolveDirectory(directory);
            if (!Files.exists(dirPath)) {
                return 0L;
            }
            try (Stream<Path> paths = Files.walk(dirPath)) {
                long total = 0;
                for (Path p : paths.filter(Files::isRegularFile).toList()) {
                    total += Files.size(p);
                }
                return total;
            } catch (IOException e) {
                throw new RuntimeException("Failed to measure directory: " + directory, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> ensureDirectory(String directory) {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.createDirectories(resolveDirectory(directory));
            } catch (IOException e) {
                throw new RuntimeException("Failed to create directory: " + directory, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            try {
                writeAtomic(resolvePath(directory, path), content, backup);
                log.debug("[Storage] Atomic write completed: {}/{}", directory, path);
            } catch (IOException e) {
                throw new RuntimeException("Atomic write failed: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<String> updateTextLocked(String directory, String path, UnaryOperator<String> updater) {
        return CompletableFuture.supplyAsync(() -> {
            Path targetPath = resolvePath(directory, path);
            Path lockPath = targetPath.resolveSibling(targetPath.getFileName() + LOCK_SUFFIX);
            KeyLock localLock = acquireLocalLock(targetPath);
            try {
                createParent(targetPath);
                try (FileChannel channel = FileChannel.open(lockPath,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                        FileLock fileLock = acquireFileLock(channel, lockPath)) {
                    String current = Files.exists(targetPath)
                            ? Files.readString(targetPath, StandardCharsets.UTF_8)
                            : null;
                    String updated = updater.apply(current);
                    writeAtomic(targetPath, updated, false);
                    log.trace("[Storage] Locked update completed: {}/{} (lock valid: {})",
                            directory, path, fileLock.isValid());
                    return updated;
                }
            } catch (IOException e) {
                throw new RuntimeException("Locked update failed: " + directory + "/" + path, e);
            } finally {
                releaseLocalLock(targetPath, localLock);
            }
        });
    }

    private KeyLock acquireLocalLock(Path targetPath) {
        KeyLock keyLock = localLocks.compute(targetPath, (key, existing) -> {
            KeyLock lock = existing != null ? existing : new KeyLock();
            lock.users++;
            return lock;
        });
        keyLock.lock.lock();
        return keyLock;
    }

    private void releaseLocalLock(Path targetPath, KeyLock keyLock) {
        keyLock.lock.unlock();
        localLocks.computeIfPresent(targetPath, (key, existing) -> --existing.users == 0 ? null : existing);
    }

    int localLockCount() {
        return localLocks.size();
    }

    private FileLock acquireFileLock(FileChannel channel, Path lockPath) throws IOException {
        int maxAttempts = Math.max(1, properties.getStorage().getLock().getMaxAttempts());
        long backoff = Math.max(1, properties.getStorage().getLock().getInitialBackoffMs());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            FileLock lock;
            try {
                lock = channel.tryLock();
            } catch (OverlappingFileLockException e) {
                lock = null;
            }
            if (lock != null) {
                return lock;
            }
            if (attempt == maxAttempts) {
                break;
            }
            log.debug("[Storage] Lock busy on {} (attempt {}/{}), retrying in {}ms",
                    lockPath, attempt, maxAttempts, backoff);
            try {
                Thread.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StorageLockException("Interrupted while waiting for lock: " + lockPath, e);
            }
            backoff *= 2;
        }
        throw new StorageLockException("Could not acquire lock after " + maxAttempts + " attempts: " + lockPath);
    }

    private void writeAtomic(Path targetPath, String content, boolean backup) throws IOException {
        Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
        Path backupPath = targetPath.resolveSibling(targetPath.getFileName() + ".bak");

        try {
            createParent(targetPath);

            // 1. Write to temp file with fsync
            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }

            // 2. Verify written content is readable
            if (Files.size(tempPath) != bytes.length) {
                throw new IOException("Verification failed: size mismatch");
            }

            // 3. Backup existing file if requested
            if (backup && Files.exists(targetPath)) {
                Files.copy(targetPath, backupPath, StandardCopyOption.REPLACE_EXISTING);
                log.debug("[Storage] Created backup: {}", backupPath);
            }

            // 4. Atomic rename
            try {
                Files.move(tempPath, targetPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Storage] Atomic move not supported, using regular move");
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
            }
            throw e;
        }
    }

    private static void createParent(Path filePath) throws IOException {
        Path parent = filePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private Path resolveDirectory(String directory) {
        Path resolved = basePath.resolve(directory).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory);
        }
        return resolved;
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }

    // users is only read and written inside ConcurrentHashMap.compute for the key.
    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
