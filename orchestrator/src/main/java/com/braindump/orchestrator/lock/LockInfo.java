package com.braindump.orchestrator.lock;

import java.time.Instant;

/** Contents of the lock file: who holds it, since when, and what kind of process it is. */
public record LockInfo(long pid, Instant startedAt, String type) {}
