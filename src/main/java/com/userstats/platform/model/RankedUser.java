package com.userstats.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A leaderboard member with its 1-based rank by descending score.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankedUser {
    private String userId;
    private Integer rank;
    private Double score;
}
