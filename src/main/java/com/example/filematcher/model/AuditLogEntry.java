package com.example.filematcher.model;

import java.time.Instant;

/**
 * One completed operation as written to the audit log.
 */
public record AuditLogEntry(
        Instant timestamp,
        String actionKind,
        String duplicatePath,
        String masterPath,
        long size,
        String hashPrefix,
        String result
) {
}
