package com.gitagent.server.poll;

/**
 * Outcome of one poll.
 *
 * @param hasChanged   the watcher fired, the poll was forced, or the status differs from
 *                     what the previous poll returned
 * @param filesChanged the file list differs from what the previous poll returned
 * @param statusText   current porcelain status ("" when the tree is clean)
 * @param analyze      whether the change summary / suggestion should be generated
 */
public record PollResult(boolean hasChanged, boolean filesChanged, String statusText, boolean analyze) {}
