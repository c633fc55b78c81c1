package com.userstats.platform.model;

import com.userstats.platform.repository.WriteBatch;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfile implements StoreRecord {

    public static final String KEY_PREFIX = "user:";
    public static final String KEY_PATTERN = KEY_PREFIX + "*";

    public static final String FIRST_NAME = "first_name";
    public static final String LAST_NAME = "last_name";
    public static final String EMAIL = "email";
    public static final String GENDER = "gender";
    public static final String IP_ADDRESS = "ip_address";
    public static final String COUNTRY = "country";
    public static final String COUNTRY_CODE = "country_code";
    public static final String CITY = "city";
    public static final String LONGITUDE = "longitude";
    public static final String LATITUDE = "latitude";
    public static final String LAST_LOGIN = "last_login";

    private String id;
    private String firstName;
    private String lastName;
    private String email;
    private String gender;
    private String ipAddress;
    private String country;
    private String countryCode;
    private String city;
    private String longitude;
    private String latitude;
    private String lastLogin;

    public static String keyFor(String id) {
        return KEY_PREFIX + id;
    }

    public String key() {
        return keyFor(id);
    }

    /**
     * Hash fields in storage order. Null attributes are written as empty strings.
     */
    public Map<String, String> toFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FIRST_NAME, nullToEmpty(firstName));
        fields.put(LAST_NAME, nullToEmpty(lastName));
        fields.put(EMAIL, nullToEmpty(email));
        fields.put(GENDER, nullToEmpty(gender));
        fields.put(IP_ADDRESS, nullToEmpty(ipAddress));
        fields.put(COUNTRY, nullToEmpty(country));
        fields.put(COUNTRY_CODE, nullToEmpty(countryCode));
        fields.put(CITY, nullToEmpty(city));
        fields.put(LONGITUDE, nullToEmpty(longitude));
        fields.put(LATITUDE, nullToEmpty(latitude));
        fields.put(LAST_LOGIN, nullToEmpty(lastLogin));
        return fields;
    }

    @Override
    public void queueInto(WriteBatch batch) {
        batch.setFields(key(), toFields());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
