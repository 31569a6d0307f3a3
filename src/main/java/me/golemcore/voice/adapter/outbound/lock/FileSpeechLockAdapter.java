package me.golemcore.voice.adapter.outbound.lock;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.voice.domain.model.LockState;
import me.golemcore.voice.infrastructure.config.VoiceProperties;
import me.golemcore.voice.port.outbound.SpeechLockPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * File-based implementation of {@link SpeechLockPort} shared by every process on
 * the machine that speaks through the same audio device.
 *
 * <p>
 * Two files live in the lock directory:
 * <ul>
 * <li>{@code tts_mutex.lock} - guard file, locked with an exclusive OS lock only
 * while the state file is read and rewritten</li>
 * <li>{@code tts_state.json} - who holds the speech lock and since when</li>
 * </ul>
 * A holder that has not released within the TTL is considered dead and its lock
 * is reclaimed by the next acquirer.
 *
 * <p>
 * OS file locks are held per process, so adapters inside one JVM are
 * additionally serialized on a per-path {@link ReentrantLock}.
 *
 * <p>
 * Directory configured via {@code voice.lock.directory} (environment variable
 * {@code VOICE_MUTEX_DIR}), defaults to {@code ${java.io.tmpdir}/golemcore-voice}.
 *
 * @see me.golemcore.voice.port.outbound.SpeechLockPort
 */
@Component
@Slf4j
public class FileSpeechLockAdapter implements SpeechLockPort {

    static final String GUARD_FILE = "tts_mutex.lock";
    static final String STATE_FILE = "tts_state.json";

    private static final Map<Path, ReentrantLock> JVM_GUARDS = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final VoiceProperties.LockProperties config;
    private final Path directory;
    private final Path guardFile;
    private final Path stateFile;
    private final String owner;

    public FileSpeechLockAdapter(VoiceProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.config = properties.getLock();
        this.directory = Paths.get(config.getDirectory()
                .replace("${java.io.tmpdir}", System.getProperty("java.io.tmpdir")))
                .toAbsolutePath().normalize();
        this.guardFile = directory.resolve(GUARD_FILE);
        this.stateFile = directory.resolve(STATE_FILE);
        this.owner = config.getCaller() + ":" + ProcessHandle.current().pid() + ":" + UUID.randomUUID();
    }

    /**
     * Acquire with the configured default timeout.
     */
    public boolean acquire() {
        return acquire(config.getAcquireTimeout());
    }

    @Override
    public boolean acquire(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            try {
                if (tryAcquire()) {
                    return true;
                }
            } catch (IOException e) {
                log.warn("[SpeechLock] Failed to access lock files in {}: {}", directory, e.getMessage());
                return false;
            }
            if (System.nanoTime() >= deadline) {
                log.debug("[SpeechLock] Timed out after {}ms", timeout.toMillis());
                return false;
            }
            try {
                Thread.sleep(config.getRetryInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    @Override
    public void release() {
        try {
            withGuard(() -> {
                LockState state = readState();
                if (state != null && state.isAcquired() && owner.equals(state.getOwner())) {
                    writeState(LockState.released(config.getCaller(), owner, clock.instant()));
                    log.debug("[SpeechLock] Released");
                }
                return null;
            });
        } catch (IOException e) {
            log.warn("[SpeechLock] Failed to release lock in {}: {}", directory, e.getMessage());
        }
    }

    @Override
    public boolean isLocked() {
        return currentHolder().isPresent();
    }

    @Override
    public Optional<String> whoHolds() {
        return currentHolder().map(state -> state.getCaller() != null ? state.getCaller() : "unknown");
    }

    @Override
    public String getOwner() {
        return owner;
    }

    @PreDestroy
    public void shutdown() {
        release();
    }

    Path getDirectory() {
        return directory;
    }

    private boolean tryAcquire() throws IOException {
        return withGuard(() -> {
            Instant now = clock.instant();
            LockState state = readState();
            if (state != null && state.isAcquired() && !owner.equals(state.getOwner())) {
                if (!state.isStale(now, config.getTtl())) {
                    return false;
                }
                log.info("[SpeechLock] Reclaiming stale lock held by {} since {}",
                        state.getCaller(), state.getAcquiredAt());
            }
            writeState(LockState.acquired(config.getCaller(), owner, now));
            return true;
        });
    }

    private Optional<LockState> currentHolder() {
        try {
            return withGuard(() -> {
                LockState state = readState();
                if (state != null && state.isHeld(clock.instant(), config.getTtl())) {
                    return Optional.of(state);
                }
                return Optional.<LockState>empty();
            });
        } catch (IOException e) {
            log.warn("[SpeechLock] Failed to read lock state in {}: {}", directory, e.getMessage());
            return Optional.empty();
        }
    }

    private <T> T withGuard(GuardedAction<T> action) throws IOException {
        ReentrantLock jvmGuard = JVM_GUARDS.computeIfAbsent(guardFile, path -> new ReentrantLock());
        jvmGuard.lock();
        try {
            Files.createDirectories(directory);
            try (FileChannel channel = FileChannel.open(guardFile, StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE);
                    FileLock fileLock = channel.lock()) {
                return action.run();
            }
        } finally {
            jvmGuard.unlock();
        }
    }

    private LockState readState() throws IOException {
        if (!Files.exists(stateFile)) {
            return null;
        }
        byte[] content = Files.readAllBytes(stateFile);
        if (content.length == 0) {
            return null;
        }
        try {
            return objectMapper.readValue(content, LockState.class);
        } catch (JsonProcessingException e) {
            log.debug("[SpeechLock] Unreadable state file, treating lock as free: {}", e.getOriginalMessage());
            return null;
        }
    }

    private void writeState(LockState state) throws IOException {
        Path tempFile = directory.resolve(STATE_FILE + ".tmp");
        Files.write(tempFile, objectMapper.writeValueAsBytes(state));
        try {
            Files.move(tempFile, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempFile, stateFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @FunctionalInterface
    private interface GuardedAction<T> {
        T run() throws IOException;
    }
}
