package com.gitagent.server.git;

import java.util.Optional;

/**
 * Produces the porcelain status listing of a working tree.
 */
@FunctionalInterface
public interface StatusScanner {

    /** @return the listing (possibly "") or empty if the scan could not run */
    Optional<String> scan();
}
