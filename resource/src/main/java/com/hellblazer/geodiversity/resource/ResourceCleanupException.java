package com.hellblazer.geodiversity.resource;

/**
 * An intermediate artifact could not be released. Never fails the primary result of a run; collected by the
 * ResourceManager so the caller can intervene.
 */
public class ResourceCleanupException extends RuntimeException {

    private final String       resourceId;
    private final ResourceType resourceType;

    public ResourceCleanupException(ScopedResource resource, Throwable cause) {
        super("Failed to release " + resource.getType().getDisplayName() + " '" + resource.getDescription() + "'",
              cause);
        this.resourceId = resource.getId();
        this.resourceType = resource.getType();
    }

    public String getResourceId() {
        return resourceId;
    }

    public ResourceType getResourceType() {
        return resourceType;
    }
}
