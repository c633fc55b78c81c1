package com.userstats.platform.parser;

import com.userstats.platform.model.UserProfile;

import java.util.List;
import java.util.Optional;

/**
 * Maps tokenized user lines to profiles. The source format alternates field labels and field
 * values after the id, so only the even offsets are read.
 */
public final class UserRecordMapper {

    public static final int MIN_TOKENS = 22;

    private static final int ID = 0;
    private static final int FIRST_NAME = 2;
    private static final int LAST_NAME = 4;
    private static final int EMAIL = 6;
    private static final int GENDER = 8;
    private static final int IP_ADDRESS = 10;
    private static final int COUNTRY = 12;
    private static final int COUNTRY_CODE = 14;
    private static final int CITY = 16;
    private static final int LONGITUDE = 18;
    private static final int LATITUDE = 20;
    private static final int LAST_LOGIN = 22;
    // Lines one token short carry last_login at 21; the input has both widths.
    private static final int LAST_LOGIN_SHORT = 21;

    private UserRecordMapper() {
    }

    public static Optional<UserProfile> map(List<String> tokens) {
        if (tokens == null || tokens.size() < MIN_TOKENS) {
            return Optional.empty();
        }

        return Optional.of(UserProfile.builder()
            .id(tokens.get(ID))
            .firstName(tokens.get(FIRST_NAME))
            .lastName(tokens.get(LAST_NAME))
            .email(tokens.get(EMAIL))
            .gender(tokens.get(GENDER))
            .ipAddress(tokens.get(IP_ADDRESS))
            .country(tokens.get(COUNTRY))
            .countryCode(tokens.get(COUNTRY_CODE))
            .city(tokens.get(CITY))
            .longitude(tokens.get(LONGITUDE))
            .latitude(tokens.get(LATITUDE))
            .lastLogin(tokens.size() > LAST_LOGIN ? tokens.get(LAST_LOGIN) : tokens.get(LAST_LOGIN_SHORT))
            .build());
    }

    public static Optional<UserProfile> mapLine(String line) {
        return map(LineTokenizer.tokenize(line));
    }
}
