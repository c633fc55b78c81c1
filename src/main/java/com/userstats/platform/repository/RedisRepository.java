package com.userstats.platform.repository;

import com.userstats.platform.model.RankedUser;
import com.userstats.platform.model.ScanPage;

import java.util.List;
import java.util.Map;

/**
 * Store operations used by ingestion and queries. Read methods throw
 * {@link com.userstats.platform.exception.StoreException} on failure; callers decide how to
 * degrade.
 */
public interface RedisRepository {
    boolean isAvailable();
    Map<String, String> getAllFields(String key);
    List<String> getFields(String key, String... fields);
    String getField(String key, String field);
    ScanPage scan(String cursor, String pattern, int count);
    List<RankedUser> getTopN(String sortedSetKey, int limit);
    WriteBatch newBatch();
}
