package com.orchestrator.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orchestrator.exception.SessionNotFoundException;
import com.orchestrator.exception.SessionStorageException;
import com.orchestrator.model.session.ExecutionSession;
import com.orchestrator.model.session.ExecutionStats;
import com.orchestrator.model.session.SessionQuery;
import com.orchestrator.service.api.SessionStorage;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * A file-based {@link SessionStorage} that keeps one JSON document per session under
 * {@code <dataDir>/execution-sessions/<sessionId>.json}.
 * <p>
 * Every write goes to a uniquely named temporary file in the same directory which is then
 * atomically renamed over the target, so a crash mid-write leaves the previous version intact.
 * Writes and read-modify-write cycles for one id are serialised on one of a fixed set of lock
 * stripes chosen by the id's hash. An id maps to the same stripe across delete and re-create.
 * <p>
 * A file that cannot be parsed is backed up with a {@code .corrupted.<millis>} suffix and treated
 * as absent, so that a single damaged session never prevents the others from loading.
 */
@Slf4j
public class FileSessionStorage implements SessionStorage {

    static final String SESSIONS_DIRECTORY = "execution-sessions";
    private static final String EXTENSION = ".json";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-][A-Za-z0-9_.-]*");
    static final int LOCK_STRIPES = 64;

    private final ObjectMapper objectMapper;
    private final Path sessionsDirectory;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public FileSessionStorage(ObjectMapper objectMapper, Path dataDirectory) {
        this.objectMapper = objectMapper;
        this.sessionsDirectory = dataDirectory.resolve(SESSIONS_DIRECTORY);
        Arrays.setAll(locks, i -> new Object());
        try {
            Files.createDirectories(sessionsDirectory);
        } catch (IOException e) {
            throw new SessionStorageException("Failed to create session directory at: " + sessionsDirectory, e);
        }
        log.info("Storing execution sessions in {}", sessionsDirectory);
    }

    public Path getSessionsDirectory() {
        return sessionsDirectory;
    }

    @Override
    public void saveSession(ExecutionSession session) {
        requireSafeId(session.getId());
        synchronized (lockFor(session.getId())) {
            write(session);
        }
    }

    @Override
    public Optional<ExecutionSession> loadSession(String sessionId) {
        if (sessionId == null || !SAFE_ID.matcher(sessionId).matches()) {
            return Optional.empty();
        }
        synchronized (lockFor(sessionId)) {
            return read(fileFor(sessionId));
        }
    }

    @Override
    public ExecutionSession updateSession(String sessionId, Consumer<ExecutionSession> mutator) {
        requireSafeId(sessionId);
        synchronized (lockFor(sessionId)) {
            ExecutionSession session = read(fileFor(sessionId))
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            mutator.accept(session);
            session.setUpdatedAt(Instant.now());
            write(session);
            return session;
        }
    }

    @Override
    public boolean deleteSession(String sessionId) {
        if (sessionId == null || !SAFE_ID.matcher(sessionId).matches()) {
            return false;
        }
        synchronized (lockFor(sessionId)) {
            try {
                boolean deleted = Files.deleteIfExists(fileFor(sessionId));
                if (deleted) {
                    log.info("Deleted session {}", sessionId);
                }
                return deleted;
            } catch (IOException e) {
                throw new SessionStorageException("Failed to delete session " + sessionId, e);
            }
        }
    }

    @Override
    public List<ExecutionSession> listSessions(SessionQuery query) {
        return query.apply(readAll());
    }

    @Override
    public ExecutionStats getExecutionStats(String planId) {
        return ExecutionStats.of(planId, readAll());
    }

    private List<ExecutionSession> readAll() {
        List<Path> files;
        try (Stream<Path> entries = Files.list(sessionsDirectory)) {
            files = entries.filter(path -> path.getFileName().toString().endsWith(EXTENSION)).toList();
        } catch (IOException e) {
            throw new SessionStorageException("Failed to list sessions in " + sessionsDirectory, e);
        }
        List<ExecutionSession> sessions = new ArrayList<>();
        for (Path file : files) {
            String id = file.getFileName().toString();
            id = id.substring(0, id.length() - EXTENSION.length());
            synchronized (lockFor(id)) {
                read(file).ifPresent(sessions::add);
            }
        }
        return sessions;
    }

    private Optional<ExecutionSession> read(Path file) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), ExecutionSession.class));
        } catch (IOException e) {
            log.warn("Could not load or parse session file at {}. A backup will be created and the session skipped. Error: {}",
                    file, e.getMessage());
            backupCorruptedFile(file);
            return Optional.empty();
        }
    }

    private void write(ExecutionSession session) {
        Path target = fileFor(session.getId());
        Path temp = null;
        try {
            temp = Files.createTempFile(sessionsDirectory, session.getId() + ".", ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), session);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved session {} ({})", session.getId(), session.getStatus());
        } catch (IOException e) {
            log.error("CRITICAL: Failed to save session {} to {}", session.getId(), target, e);
            deleteQuietly(temp);
            throw new SessionStorageException("Failed to save session " + session.getId(), e);
        }
    }

    private void backupCorruptedFile(Path file) {
        Path backup = file.resolveSibling(file.getFileName() + ".corrupted." + System.currentTimeMillis());
        try {
            Files.move(file, backup, StandardCopyOption.REPLACE_EXISTING);
            log.info("Backed up corrupted session file to {}", backup);
        } catch (IOException e) {
            log.error("CRITICAL: Failed to back up corrupted session file from {} to {}", file, backup, e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }

    private Path fileFor(String sessionId) {
        return sessionsDirectory.resolve(sessionId + EXTENSION);
    }

    Object lockFor(String sessionId) {
        return locks[Math.floorMod(sessionId.hashCode(), LOCK_STRIPES)];
    }

    private static void requireSafeId(String sessionId) {
        if (sessionId == null || !SAFE_ID.matcher(sessionId).matches()) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
    }
}
