package com.userstats.platform.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * One page of a cursor scan. A cursor of {@link #START_CURSOR} after a fetch means the pass
 * is complete.
 */
@Data
@AllArgsConstructor
public class ScanPage {
    public static final String START_CURSOR = "0";

    private String cursor;
    private List<String> keys;

    public boolean isLast() {
        return START_CURSOR.equals(cursor);
    }
}
