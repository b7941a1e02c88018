package com.gitagent.server.poll;

import java.util.List;

/**
 * Latest result of the working-tree enumeration.
 *
 * @param paths root-relative paths, '/'-separated and sorted
 * @param hash  content hash of {@code paths}
 */
public record FileListSnapshot(List<String> paths, int hash) {

    public static FileListSnapshot of(List<String> paths) {
        List<String> copy = List.copyOf(paths);
        return new FileListSnapshot(copy, copy.hashCode());
    }
}
