package com.example.filematcher;

import com.example.filematcher.model.AuditLogEntry;
import com.example.filematcher.model.DuplicateGroup;

/**
 * Receives a record of each operation after it has completed.
 */
public interface AuditTrail {
    void logOperation(AuditLogEntry entry);

    void logDeclined(DuplicateGroup group);

    static AuditTrail noop() {
        return new AuditTrail() {
            @Override
            public void logOperation(AuditLogEntry entry) {
            }

            @Override
            public void logDeclined(DuplicateGroup group) {
            }
        };
    }
}
