package org.ndfcclient.rest;

/**
 * Raised when the controller cannot be reached or rejects an operation.
 */
public class NdfcException extends RuntimeException {

    /** Controller return code, or 0 when no reply was received */
    private final int returnCode;

    public NdfcException(String message) {
        this(message, 0);
    }

    public NdfcException(String message, int returnCode) {
        super(message);
        this.returnCode = returnCode;
    }

    public NdfcException(String message, Throwable cause) {
        super(message, cause);
        this.returnCode = 0;
    }

    public int returnCode() {
        return returnCode;
    }
}
