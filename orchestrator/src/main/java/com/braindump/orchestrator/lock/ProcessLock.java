package com.braindump.orchestrator.lock;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * Advisory lock file announcing that an orchestrator process is running.
 *
 * Several processes (the server, CLI tools) may share one database and repository.
 * The lock does not prevent that; a live foreign holder only produces a warning.
 * A holder whose process is gone is considered stale and the lock is taken over.
 */
@Component
public class ProcessLock {

    private static final Logger log = LoggerFactory.getLogger(ProcessLock.class);

    public enum Outcome { ACQUIRED, RECLAIMED_STALE, HELD_BY_OTHER, UNAVAILABLE }

    private final ObjectMapper json;
    private final Path         lockFile;
    private final String       type;
    private final long         ownPid = ProcessHandle.current().pid();

    private volatile boolean owned;

    public ProcessLock(ObjectMapper objectMapper,
                       @Value("${braindump.lock.file}") String lockFile,
                       @Value("${braindump.lock.kind:server}") String type) {
        this.json     = objectMapper;
        this.lockFile = Path.of(lockFile);
        this.type     = type;
    }

    /**
     * Takes the lock unless a live process other than this one holds it.
     * A lock file that cannot be written gives {@link Outcome#UNAVAILABLE}; the caller
     * keeps running without the lock.
     */
    public synchronized Outcome acquire() {
        Optional<LockInfo> current = read();
        if (current.isPresent()) {
            LockInfo holder = current.get();
            if (holder.pid() != ownPid && isAlive(holder.pid())) {
                log.warn("Another {} process (pid {}, since {}) holds {}; continuing without the lock",
                        holder.type(), holder.pid(), holder.startedAt(), lockFile);
                return Outcome.HELD_BY_OTHER;
            }
            if (!write()) {
                return Outcome.UNAVAILABLE;
            }
            if (holder.pid() == ownPid) {
                return Outcome.ACQUIRED;
            }
            log.info("Reclaimed stale lock {} from pid {}", lockFile, holder.pid());
            return Outcome.RECLAIMED_STALE;
        }
        if (!write()) {
            return Outcome.UNAVAILABLE;
        }
        log.info("Acquired lock {} (pid {})", lockFile, ownPid);
        return Outcome.ACQUIRED;
    }

    /** Deletes the lock file if this process holds it. */
    public synchronized boolean release() {
        if (!owned) {
            return false;
        }
        Optional<LockInfo> current = read();
        if (current.isPresent() && current.get().pid() != ownPid) {
            log.warn("Lock {} was taken over by pid {}; leaving it", lockFile, current.get().pid());
            owned = false;
            return false;
        }
        try {
            Files.deleteIfExists(lockFile);
            owned = false;
            log.info("Released lock {}", lockFile);
            return true;
        } catch (IOException e) {
            log.warn("Could not delete lock file {}: {}", lockFile, e.getMessage());
            return false;
        }
    }

    /** Current holder, if the file exists and can be read. */
    public Optional<LockInfo> read() {
        if (!Files.exists(lockFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(json.readValue(lockFile.toFile(), LockInfo.class));
        } catch (IOException e) {
            // An unreadable lock cannot name a live holder.
            log.warn("Lock file {} is unreadable, treating as stale: {}", lockFile, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean isOwned() { return owned; }

    static boolean isAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    private boolean write() {
        try {
            Path parent = lockFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            json.writeValue(lockFile.toFile(), new LockInfo(ownPid, Instant.now(), type));
            owned = true;
            return true;
        } catch (IOException e) {
            log.warn("Could not write lock file {}; continuing without the lock: {}", lockFile, e.getMessage());
            return false;
        }
    }
}
