package com.userstats.platform.parser;

import com.userstats.platform.model.ScoreEntry;
import org.apache.commons.csv.CSVRecord;

import java.util.Optional;

/**
 * Maps rows of the score CSV ({@code leaderboard,score,user:id}) to score entries.
 */
public final class ScoreRecordMapper {

    public static final String LEADERBOARD_COLUMN = "leaderboard";
    public static final String SCORE_COLUMN = "score";
    public static final String USER_ID_COLUMN = "user:id";

    private ScoreRecordMapper() {
    }

    public static Optional<ScoreEntry> map(CSVRecord record) {
        String leaderboard = column(record, LEADERBOARD_COLUMN);
        String score = column(record, SCORE_COLUMN);
        String userId = column(record, USER_ID_COLUMN);
        if (leaderboard == null || score == null || userId == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(ScoreEntry.builder()
                .leaderboard(leaderboard)
                .userId(userId)
                .score(Double.parseDouble(score))
                .build());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String column(CSVRecord record, String name) {
        if (!record.isMapped(name) || !record.isSet(name)) {
            return null;
        }
        String value = record.get(name).trim();
        return value.isEmpty() ? null : value;
    }
}
