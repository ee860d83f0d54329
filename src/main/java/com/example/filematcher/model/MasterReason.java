package com.example.filematcher.model;

/**
 * Rule that picked the master file of a duplicate group.
 */
public enum MasterReason {
    IN_MASTER_DIRECTORY("in master directory"),
    OLDEST_FALLBACK("no master-directory candidate, oldest chosen");

    private final String description;

    MasterReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
