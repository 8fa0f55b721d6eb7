package com.purchasingpower.codegraph.service.discovery;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Enumerates the analyzable source files under a repository root.
 */
public interface FileDiscoveryService {

    /**
     * Walks the repository and returns the paths of supported source files.
     *
     * @param repositoryRoot absolute repository root
     * @return sorted paths relative to the root, '/' separated
     * @throws IOException if the tree cannot be walked
     */
    List<String> discover(Path repositoryRoot) throws IOException;
}
