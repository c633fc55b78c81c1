package com.userstats.platform.service;

import com.userstats.platform.model.ScanPage;
import com.userstats.platform.repository.RedisRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazily walks the keyspace with SCAN. Each pass fetches one page at a time and stops when the
 * store hands back cursor {@code "0"}. SCAN is not a snapshot: under concurrent writes a key may
 * be returned twice or not at all.
 */
@Service
public class KeyScanner {

    private final RedisRepository redisRepository;
    private final int pageSize;

    @Autowired
    public KeyScanner(RedisRepository redisRepository, @Value("${userstats.scan.page-size:50}") int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Scan page size must be greater than 0");
        }
        this.redisRepository = redisRepository;
        this.pageSize = pageSize;
    }

    public Iterable<String> keys(String pattern) {
        return keys(pattern, ScanPage.START_CURSOR);
    }

    /**
     * Keys matching {@code pattern}, starting from {@code cursor}. Every call to
     * {@code iterator()} restarts from that cursor.
     */
    public Iterable<String> keys(String pattern, String cursor) {
        return () -> new ScanIterator(pattern, cursor);
    }

    public int getPageSize() {
        return pageSize;
    }

    public final class ScanIterator implements Iterator<String> {
        private final String pattern;
        private String cursor;
        private Iterator<String> page = Collections.emptyIterator();
        private boolean exhausted = false;

        private ScanIterator(String pattern, String cursor) {
            this.pattern = pattern;
            this.cursor = cursor;
        }

        @Override
        public boolean hasNext() {
            // Pages may come back empty while the cursor is still live
            while (!page.hasNext() && !exhausted) {
                ScanPage next = redisRepository.scan(cursor, pattern, pageSize);
                cursor = next.getCursor();
                List<String> keys = next.getKeys();
                page = keys == null ? Collections.emptyIterator() : keys.iterator();
                exhausted = next.isLast();
            }
            return page.hasNext();
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Scan of " + pattern + " is complete");
            }
            return page.next();
        }

        /**
         * Cursor of the next page to request, {@code "0"} once the pass is complete.
         */
        public String getCursor() {
            return cursor;
        }

        public boolean isExhausted() {
            return exhausted && !page.hasNext();
        }
    }
}
