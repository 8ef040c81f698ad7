package com.hellblazer.geodiversity.resource;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base implementation of ScopedResource wrapping a single underlying artifact. Release happens at most once; a
 * release that throws leaves the handle unreleased so the manager can report it.
 *
 * @param <T> the wrapped artifact
 */
public abstract class ResourceHandle<T> implements ScopedResource, AutoCloseable {

    private final String        id          = UUID.randomUUID().toString();
    private final AtomicBoolean released    = new AtomicBoolean(false);
    private final long          createdTime = System.currentTimeMillis();
    private final ResourceType  type;
    private final String        description;
    private final T             resource;

    protected ResourceHandle(T resource, ResourceType type, String description) {
        if (resource == null) {
            throw new IllegalArgumentException("Resource cannot be null");
        }
        this.resource = resource;
        this.type = type;
        this.description = description;
    }

    /**
     * Get the wrapped artifact
     *
     * @throws IllegalStateException if the handle has been released
     */
    public T get() {
        if (released.get()) {
            throw new IllegalStateException("Resource already released: " + description);
        }
        return resource;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public ResourceType getType() {
        return type;
    }

    @Override
    public String getDescription() {
        return description;
    }

    public long getAgeMillis() {
        return System.currentTimeMillis() - createdTime;
    }

    @Override
    public boolean isReleased() {
        return released.get();
    }

    @Override
    public synchronized void release() throws Exception {
        if (released.get()) {
            return;
        }
        doRelease(resource);
        released.set(true);
    }

    @Override
    public void close() throws Exception {
        release();
    }

    /**
     * Perform the actual release of the artifact
     */
    protected abstract void doRelease(T resource) throws Exception;

    @Override
    public String toString() {
        return String.format("%s[id=%s, type=%s, description=%s, age=%d ms]", getClass().getSimpleName(), id, type,
                             description, getAgeMillis());
    }
}
