package com.userstats.platform.exception;

public class StoreUnavailableException extends StoreException {
    public StoreUnavailableException(String message) {
        super(message, "STORE_UNAVAILABLE");
    }
}
