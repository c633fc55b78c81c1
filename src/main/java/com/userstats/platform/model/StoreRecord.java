package com.userstats.platform.model;

import com.userstats.platform.repository.WriteBatch;

/**
 * A record that knows how to queue its own write into a {@link WriteBatch}.
 */
public interface StoreRecord {
    void queueInto(WriteBatch batch);
}
