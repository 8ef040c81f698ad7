package com.hellblazer.geodiversity.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Scratch directory owned by a single run. Everything written beneath it is removed when the workspace is
 * released.
 */
public class TemporaryWorkspace extends ResourceHandle<Path> {
    private static final Logger log = LoggerFactory.getLogger(TemporaryWorkspace.class);

    private TemporaryWorkspace(Path directory, String description) {
        super(directory, ResourceType.TEMPORARY_WORKSPACE, description);
    }

    /**
     * Allocate a new scratch directory
     *
     * @param root   parent directory, or null for the platform temporary directory
     * @param prefix directory name prefix
     */
    public static TemporaryWorkspace allocate(Path root, String prefix) throws IOException {
        Path directory;
        if (root == null) {
            directory = Files.createTempDirectory(prefix);
        } else {
            Files.createDirectories(root);
            directory = Files.createTempDirectory(root, prefix);
        }
        log.debug("Allocated temporary workspace {}", directory);
        return new TemporaryWorkspace(directory, directory.toString());
    }

    public Path getDirectory() {
        return get();
    }

    /**
     * Resolve the path of an intermediate dataset inside this workspace
     */
    public Path resolve(String name) {
        return get().resolve(name);
    }

    @Override
    protected void doRelease(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            var paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (var path : paths) {
                Files.delete(path);
            }
        }
        log.debug("Removed temporary workspace {}", directory);
    }
}
