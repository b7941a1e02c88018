package com.gitagent.server.poll;

/**
 * Latest output of the status scan.
 *
 * @param text porcelain status listing with trailing whitespace removed; "" when clean
 * @param hash content hash of {@code text}
 */
public record StatusSnapshot(String text, int hash) {

    /** Stands in for "no scan has succeeded yet"; never stored in the cache. */
    public static final StatusSnapshot EMPTY = of("");

    public static StatusSnapshot of(String rawText) {
        String text = rawText == null ? "" : rawText.stripTrailing();
        return new StatusSnapshot(text, text.hashCode());
    }
}
