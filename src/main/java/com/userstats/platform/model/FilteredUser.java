package com.userstats.platform.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Result row of the compound demographic filter. Identical shape whether it came from the
 * search index or from a keyspace scan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilteredUser {
    private String id;

    @JsonProperty("first_name")
    private String firstName;

    @JsonProperty("last_name")
    private String lastName;

    private String country;
    private String latitude;
    private String email;

    public static FilteredUser fromFields(String key, Map<String, String> fields) {
        return FilteredUser.builder()
            .id(key)
            .firstName(fields.getOrDefault(UserProfile.FIRST_NAME, ""))
            .lastName(fields.getOrDefault(UserProfile.LAST_NAME, ""))
            .country(fields.getOrDefault(UserProfile.COUNTRY, ""))
            .latitude(fields.getOrDefault(UserProfile.LATITUDE, ""))
            .email(fields.getOrDefault(UserProfile.EMAIL, ""))
            .build();
    }
}
