package com.gitagent.server.git;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Lists the files of a working tree.
 */
@FunctionalInterface
public interface FileEnumerator {

    /**
     * @param root        tree to walk
     * @param ignoredDirs directory names whose subtrees are skipped wherever they occur
     * @return root-relative, '/'-separated, sorted paths; empty if the walk failed
     */
    Optional<List<String>> listFiles(Path root, Set<String> ignoredDirs);
}
