package com.userstats.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of loading one input file. {@code written} is zero when the batch commit failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionReport {
    private String source;
    private int read;
    private int written;
}
