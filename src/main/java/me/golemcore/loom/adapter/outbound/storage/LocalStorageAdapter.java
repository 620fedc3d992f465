package me.golemcore.loom.adapter.outbound.storage;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.loom.domain.exception.StoreBusyException;
import me.golemcore.loom.domain.exception.StoreIOException;
import me.golemcore.loom.infrastructure.config.LoomProperties;
import me.golemcore.loom.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
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
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Stores all records in one data directory with subdirectories per record
 * type:
 * <ul>
 * <li>roots/ - conversation roots
 * <li>nodes/ - message nodes
 * <li>journal/ - in-flight multi-record transaction
 * <li>session/ - pointers owned by the front end
 * </ul>
 *
 * <p>
 * On startup the adapter takes an exclusive lock on {@code .lock} in the data
 * directory; a second instance pointed at the same directory, in this or
 * another process, fails with {@link StoreBusyException}.
 *
 * <p>
 * Base path configured via {@code loom.storage.local.base-path}, defaults to
 * {@code ${user.home}/.loom/data}.
 *
 * @see me.golemcore.loom.port.outbound.StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort, AutoCloseable {

    static final String LOCK_FILE = ".lock";
    private static final List<String> KNOWN_DIRECTORIES = List.of("roots", "nodes", "journal", "session");

    // Closing any channel on a locked file drops the process's OS lock, so
    // in-process contention is detected here before a channel is opened.
    private static final Set<Path> HELD_DIRECTORIES = ConcurrentHashMap.newKeySet();

    private final LoomProperties properties;

    private Path basePath;
    private FileChannel lockChannel;
    private FileLock lock;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath);
            for (String dir : KNOWN_DIRECTORIES) {
                Files.createDirectories(basePath.resolve(dir));
            }
        } catch (IOException e) {
            throw new StoreIOException("Failed to create data directory: " + basePath, e);
        }

        acquireLock();
        log.info("[Storage] Local storage opened at: {}", basePath);
    }

    @PreDestroy
    @Override
    public void close() {
        if (lock == null && lockChannel == null) {
            return;
        }
        try {
            if (lock != null && lock.isValid()) {
                lock.release();
            }
            if (lockChannel != null && lockChannel.isOpen()) {
                lockChannel.close();
            }
            log.debug("[Storage] Released lock on {}", basePath);
        } catch (IOException e) {
            log.warn("[Storage] Failed to release lock on {}: {}", basePath, e.getMessage());
        } finally {
            lock = null;
            lockChannel = null;
            HELD_DIRECTORIES.remove(basePath);
        }
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
                throw new StoreIOException("Failed to read file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return CompletableFuture.runAsync(() -> {
            try {
                Path filePath = resolvePath(directory, path);
                Files.deleteIfExists(filePath);
            } catch (IOException e) {
                throw new StoreIOException("Failed to delete file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path dirPath = basePath.resolve(directory);
                if (!Files.exists(dirPath)) {
                    return Collections.emptyList();
                }

                Path prefixPath = prefix != null && !prefix.isEmpty()
                        ? dirPath.resolve(prefix)
                        : dirPath;

                if (!Files.exists(prefixPath)) {
                    return Collections.emptyList();
                }

                try (Stream<Path> paths = Files.walk(prefixPath)) {
                    return paths
                            .filter(Files::isRegularFile)
                            .filter(p -> !p.getFileName().toString().endsWith(".tmp"))
                            .map(p -> dirPath.relativize(p).toString())
                            .sorted()
                            .toList();
                }
            } catch (IOException e) {
                throw new StoreIOException("Failed to list files: " + directory + "/" + prefix, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            Path targetPath = resolvePath(directory, path);
            Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");

            try {
                Path parent = targetPath.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }

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
                byte[] verification = Files.readAllBytes(tempPath);
                if (verification.length != bytes.length) {
                    throw new IOException("Verification failed: size mismatch");
                }

                // 3. Atomic rename
                try {
                    Files.move(tempPath, targetPath,
                            StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    log.warn("[Storage] Atomic move not supported, using regular move");
                    Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
                }

                log.debug("[Storage] Atomic write completed: {}/{}", directory, path);

            } catch (IOException e) {
                try {
                    Files.deleteIfExists(tempPath);
                } catch (IOException cleanupEx) {
                    log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
                }
                throw new StoreIOException("Atomic write failed: " + directory + "/" + path, e);
            }
        });
    }

    private void acquireLock() {
        if (!HELD_DIRECTORIES.add(basePath)) {
            throw new StoreBusyException("Data directory is already open in this process: " + basePath);
        }
        Path lockPath = basePath.resolve(LOCK_FILE);
        FileChannel channel = null;
        try {
            channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock acquired = channel.tryLock();
            if (acquired == null) {
                throw new StoreBusyException("Data directory is locked by another process: " + basePath);
            }
            channel.truncate(0);
            channel.write(ByteBuffer.wrap(
                    Long.toString(ProcessHandle.current().pid()).getBytes(StandardCharsets.UTF_8)));
            channel.force(true);
            this.lockChannel = channel;
            this.lock = acquired;
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            HELD_DIRECTORIES.remove(basePath);
            throw new StoreBusyException("Data directory is already open in this process: " + basePath, e);
        } catch (StoreBusyException e) {
            closeQuietly(channel);
            HELD_DIRECTORIES.remove(basePath);
            throw e;
        } catch (IOException e) {
            closeQuietly(channel);
            HELD_DIRECTORIES.remove(basePath);
            throw new StoreIOException("Failed to lock data directory: " + basePath, e);
        }
    }

    private void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("[Storage] Failed to close lock channel: {}", e.getMessage());
        }
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }
}
