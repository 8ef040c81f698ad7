package com.hellblazer.geodiversity.resource;

/**
 * An artifact whose lifetime is bounded by a single run and which must be released on every exit path
 */
public interface ScopedResource {

    String getId();

    ResourceType getType();

    String getDescription();

    /**
     * Release the artifact. Implementations must tolerate repeated calls.
     *
     * @throws Exception if the artifact could not be removed or unlocked
     */
    void release() throws Exception;

    boolean isReleased();
}
