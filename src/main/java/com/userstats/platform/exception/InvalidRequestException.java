package com.userstats.platform.exception;

/**
 * Bad client input. Not a store failure, so it does not extend {@link StoreException}.
 */
public class InvalidRequestException extends RuntimeException {
    private final String errorCode;

    public InvalidRequestException(String message) {
        super(message);
        this.errorCode = "INVALID_REQUEST";
    }

    public String getErrorCode() {
        return errorCode;
    }
}
