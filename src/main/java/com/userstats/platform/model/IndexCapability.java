package com.userstats.platform.model;

public enum IndexCapability {
    AVAILABLE,
    UNAVAILABLE;

    public boolean isAvailable() {
        return this == AVAILABLE;
    }
}
