package com.gitagent.server.session;

/**
 * Thrown when a request needs a working tree but none has been selected yet.
 */
public class NoActiveSessionException extends RuntimeException {

    public NoActiveSessionException() {
        super("Repository not set");
    }
}
