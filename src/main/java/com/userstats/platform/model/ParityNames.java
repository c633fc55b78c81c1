package com.userstats.platform.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Parallel lists: {@code lastNames.get(i)} belongs to {@code keys.get(i)}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ParityNames {
    private List<String> keys = new ArrayList<>();
    private List<String> lastNames = new ArrayList<>();

    public void add(String key, String lastName) {
        keys.add(key);
        lastNames.add(lastName);
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    public static ParityNames empty() {
        return new ParityNames();
    }
}
