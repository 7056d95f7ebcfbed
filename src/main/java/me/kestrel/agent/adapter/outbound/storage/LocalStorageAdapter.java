package me.kestrel.agent.adapter.outbound.storage;

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

import me.kestrel.agent.infrastructure.config.BotProperties;
import me.kestrel.agent.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Local filesystem implementation of {@link StoragePort}.
 *
 * <p>
 * Everything lives under the workspace directory
 * ({@code bot.storage.local.base-path}, default
 * {@code ${user.home}/.kestrel/workspace}):
 * <ul>
 * <li>{@code sessions/} - one JSON file per conversation
 * <li>{@code memory/} - MEMORY.md and HISTORY.md
 * <li>bootstrap prompt files such as AGENTS.md at the root
 * </ul>
 * Paths that normalize to a location outside the workspace are rejected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private final BotProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        this.basePath = properties.getStorage().getLocal().resolveBasePath();
        BotProperties.DirectoriesProperties directories = properties.getStorage().getDirectories();

        try {
            Files.createDirectories(basePath);
            for (String dir : List.of(directories.getSessions(), directories.getMemory())) {
                Files.createDirectories(basePath.resolve(dir));
            }
            log.info("Local storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("Failed to create storage directory {}", basePath, e);
        }
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolvePath(directory, path);
            if (!Files.isRegularFile(file)) {
                return null;
            }
            return io("read", directory, path, () -> Files.readString(file, StandardCharsets.UTF_8));
        });
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> Files.exists(resolvePath(directory, path)));
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            Path file = resolvePath(directory, path);
            io("append", directory, path, () -> {
                createParent(file);
                return Files.writeString(file, content, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            });
        });
    }

    /**
     * Writes to a uniquely named temp file next to the target, forces it to
     * disk and moves it over the target, so readers see either the old or
     * the new content and concurrent writers never share a temp file.
     */
    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            Path target = resolvePath(directory, path);
            io("write", directory, path, () -> {
                createParent(target);
                Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
                try {
                    try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                            StandardOpenOption.TRUNCATE_EXISTING)) {
                        ByteBuffer buffer = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
                        while (buffer.hasRemaining()) {
                            channel.write(buffer);
                        }
                        channel.force(true);
                    }
                    return moveIntoPlace(temp, target);
                } catch (IOException e) {
                    deleteTemp(temp, e);
                    throw e;
                }
            });
            log.debug("[Storage] Wrote {}/{} ({} chars)", directory, path, content.length());
        });
    }

    Path getBasePath() {
        return basePath;
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static Path moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            return Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic move not supported for {}, replacing non-atomically", target);
            return Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemp(Path temp, IOException cause) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    private static <T> T io(String verb, String directory, String path, IoAction<T> action) {
        try {
            return action.run();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to " + verb + " " + directory + "/" + path, e);
        }
    }

    @FunctionalInterface
    private interface IoAction<T> {
        T run() throws IOException;
    }
}
