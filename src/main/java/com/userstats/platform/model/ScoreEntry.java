package com.userstats.platform.model;

import com.userstats.platform.repository.WriteBatch;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreEntry implements StoreRecord {

    public static final String BOARD_KEY_PREFIX = "board:";

    private String leaderboard;
    private String userId;
    private double score;

    public static String boardKeyFor(String leaderboard) {
        return BOARD_KEY_PREFIX + leaderboard;
    }

    public String boardKey() {
        return boardKeyFor(leaderboard);
    }

    @Override
    public void queueInto(WriteBatch batch) {
        batch.addOrUpdate(boardKey(), userId, score);
    }
}
