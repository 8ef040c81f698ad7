package com.hellblazer.geodiversity.resource;

/**
 * Enumeration of the run-scoped artifacts a geodiversity run may create
 */
public enum ResourceType {
    TEMPORARY_WORKSPACE("Temporary Workspace", "Scratch directory for intermediate datasets"),
    STAGING_TABLE("Staging Table", "Computed results awaiting commit"),
    TABLE_LOCK("Table Lock", "Exclusive lock on a target attribute table"),
    MEMORY_TABLE("Memory Table", "In-memory intermediate table"),
    OTHER("Other", "Caller-defined artifact");

    private final String displayName;
    private final String description;

    ResourceType(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Locks must be released before anything else so a failed cleanup never leaves the target workspace locked
     */
    public boolean isLock() {
        return this == TABLE_LOCK;
    }
}
