package com.userstats.platform.exception;

public class StoreException extends RuntimeException {
    private final String errorCode;

    public StoreException(String message) {
        super(message);
        this.errorCode = "STORE_ERROR";
    }

    public StoreException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "STORE_ERROR";
    }

    public StoreException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
