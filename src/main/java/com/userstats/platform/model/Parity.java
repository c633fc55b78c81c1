package com.userstats.platform.model;

import java.util.Locale;

/**
 * Parity of an id's leading character, decided lexically rather than numerically.
 */
public enum Parity {
    ODD("13579"),
    EVEN("02468");

    private final String digits;

    Parity(String digits) {
        this.digits = digits;
    }

    public boolean matches(String id) {
        if (id == null || id.isEmpty()) {
            return false;
        }
        return digits.indexOf(id.charAt(0)) >= 0;
    }

    public static Parity fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Parity cannot be null");
        }
        return Parity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
