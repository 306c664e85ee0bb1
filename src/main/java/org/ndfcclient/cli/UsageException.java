package org.ndfcclient.cli;

/**
 * Thrown when a command is invoked with missing or malformed arguments.
 */
public class UsageException extends RuntimeException {

    public UsageException(String message) {
        super(message);
    }

    public UsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
