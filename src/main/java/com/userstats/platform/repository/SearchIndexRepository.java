package com.userstats.platform.repository;

import com.userstats.platform.model.FieldPredicate;
import com.userstats.platform.model.IndexCapability;
import com.userstats.platform.model.IndexedRecord;

import java.util.List;

/**
 * Optional secondary index over user profile hashes.
 */
public interface SearchIndexRepository {

    /**
     * Probes the store once. Never throws; any failure means {@link IndexCapability#UNAVAILABLE}.
     */
    IndexCapability detectCapability();

    /**
     * Creates the index if missing. Calling it again on an existing index is a no-op.
     */
    void build();

    List<IndexedRecord> search(FieldPredicate predicate);

    String getIndexName();
}
