package com.warmlead.crm.common.error;

/**
 * Failure tagged with its {@link ErrorKind} where it is raised.
 * 
 * Classifiers trust the tag over any pattern matching on the message, so code that
 * knows why it failed (an HTTP 429, a missing credential, a deadline) should throw
 * this instead of a bare RuntimeException. The message still keeps the recognizable
 * wording ("rate limit", "timeout", "unauthorized") for callers that only see text.
 */
public class SyncException extends RuntimeException {

    private final ErrorKind kind;

    public SyncException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SyncException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
