package com.hellblazer.geodiversity.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Owns every intermediate artifact created during one run and guarantees its release on normal completion, on
 * failure, and on external interruption. Closing the manager releases table locks first, then everything else in
 * reverse order of acquisition. Release failures are logged and collected, never thrown, so cleanup cannot mask the
 * run's primary result.
 * <p>
 * A JVM shutdown hook is installed by default so that a run killed from outside still releases its workspace and
 * locks.
 */
public class ResourceManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResourceManager.class);

    private final String                          name;
    private final Deque<ScopedResource>           acquisitionOrder = new ConcurrentLinkedDeque<>();
    private final Map<String, ScopedResource>     resources        = new ConcurrentHashMap<>();
    private final Map<ResourceType, AtomicLong>   acquiredPerType  = new EnumMap<>(ResourceType.class);
    private final List<ResourceCleanupException>  cleanupFailures  = new CopyOnWriteArrayList<>();
    private final Thread                          shutdownHook;
    private volatile boolean                      closed           = false;

    /**
     * Create a resource manager that also releases its resources on JVM shutdown
     */
    public ResourceManager(String name) {
        this(name, true);
    }

    public ResourceManager(String name, boolean releaseOnShutdown) {
        this.name = name;
        for (ResourceType type : ResourceType.values()) {
            acquiredPerType.put(type, new AtomicLong(0));
        }
        if (releaseOnShutdown) {
            shutdownHook = new Thread(this::close, "release-" + name);
            Runtime.getRuntime().addShutdownHook(shutdownHook);
        } else {
            shutdownHook = null;
        }
        log.debug("Resource manager {} opened", name);
    }

    /**
     * Register an artifact acquired elsewhere
     */
    public <R extends ScopedResource> R register(R resource) {
        ensureNotClosed();
        if (resources.putIfAbsent(resource.getId(), resource) == null) {
            acquisitionOrder.push(resource);
            acquiredPerType.get(resource.getType()).incrementAndGet();
            log.debug("Registered {}: {}", resource.getType().getDisplayName(), resource.getDescription());
        }
        return resource;
    }

    /**
     * Wrap an arbitrary artifact and register it
     *
     * @param artifact    the artifact
     * @param type        its type
     * @param description human readable description used in diagnostics
     * @param releaser    how to release it
     */
    public <T> ResourceHandle<T> manage(T artifact, ResourceType type, String description, Releaser<T> releaser) {
        return register(new ResourceHandle<>(artifact, type, description) {
            @Override
            protected void doRelease(T resource) throws Exception {
                releaser.release(resource);
            }
        });
    }

    /**
     * Allocate and register a scratch directory
     */
    public TemporaryWorkspace allocateWorkspace(Path root, String prefix) throws IOException {
        ensureNotClosed();
        return register(TemporaryWorkspace.allocate(root, prefix));
    }

    /**
     * Release a single resource before the manager closes
     *
     * @return true if the resource was released, false if releasing it failed
     */
    public boolean release(ScopedResource resource) {
        if (resources.remove(resource.getId()) == null) {
            return resource.isReleased();
        }
        acquisitionOrder.remove(resource);
        return doRelease(resource);
    }

    /**
     * Get the resources not yet released, most recently acquired first
     */
    public List<ScopedResource> getActiveResources() {
        return new ArrayList<>(acquisitionOrder);
    }

    public int getActiveResourceCount() {
        return resources.size();
    }

    /**
     * Get the number of resources of a type acquired over the manager's lifetime
     */
    public long getAcquiredCount(ResourceType type) {
        return acquiredPerType.get(type).get();
    }

    /**
     * Get the failures recorded while releasing resources
     */
    public List<ResourceCleanupException> getCleanupFailures() {
        return Collections.unmodifiableList(cleanupFailures);
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isShutdownHookInstalled() {
        return shutdownHook != null && !closed;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }

        var remaining = new ArrayList<>(acquisitionOrder);
        acquisitionOrder.clear();
        // locks first, then reverse acquisition order
        var ordered = remaining.stream()
                               .sorted(Comparator.comparing((ScopedResource r) -> !r.getType().isLock()))
                               .collect(Collectors.toList());
        int released = 0;
        for (ScopedResource resource : ordered) {
            resources.remove(resource.getId());
            if (doRelease(resource)) {
                released++;
            }
        }
        removeShutdownHook();

        if (cleanupFailures.isEmpty()) {
            log.info("Resource manager {} closed, released {} resources", name, released);
        } else {
            log.warn("Resource manager {} closed, released {} resources, {} could not be released", name, released,
                     cleanupFailures.size());
        }
    }

    private boolean doRelease(ScopedResource resource) {
        try {
            resource.release();
            log.debug("Released {}: {}", resource.getType().getDisplayName(), resource.getDescription());
            return true;
        } catch (Exception e) {
            var failure = new ResourceCleanupException(resource, e);
            cleanupFailures.add(failure);
            log.warn(failure.getMessage(), e);
            return false;
        }
    }

    private void removeShutdownHook() {
        if (shutdownHook == null || Thread.currentThread() == shutdownHook) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM shutting down, hook for {} left in place", name);
        }
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("Resource manager is closed: " + name);
        }
    }

    @Override
    public String toString() {
        return String.format("ResourceManager[name=%s, active=%d, failures=%d, closed=%s]", name, resources.size(),
                             cleanupFailures.size(), closed);
    }

    /**
     * Release strategy for a managed artifact
     */
    @FunctionalInterface
    public interface Releaser<T> {
        void release(T artifact) throws Exception;
    }
}
