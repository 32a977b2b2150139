package in.hostsnap.domain.inventory;

import java.time.Instant;

/**
 * One operating system process.
 *
 * Fields the platform does not expose for a process (often the case for processes owned by
 * other users) are null.
 */
public record ProcessRecord(
    long pid,
    Long parentPid,
    String command,
    String user,
    Instant startedAt
) {}
