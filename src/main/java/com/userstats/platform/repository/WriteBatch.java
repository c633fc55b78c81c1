package com.userstats.platform.repository;

import java.util.Map;

/**
 * Writes queued client-side and submitted together by a single {@link #commit()}.
 */
public interface WriteBatch {
    void setFields(String key, Map<String, String> fields);
    void addOrUpdate(String sortedSetKey, String member, double score);
    int size();

    /**
     * Submits every queued write in one round trip.
     *
     * @throws com.userstats.platform.exception.StoreException if the store rejects or never
     *         acknowledges the batch; some writes may still have been applied
     */
    void commit();
}
