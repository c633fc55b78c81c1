package com.userstats.platform.repository.impl;

import com.userstats.platform.exception.StoreException;
import com.userstats.platform.repository.WriteBatch;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.exceptions.JedisException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Buffers writes in memory and sends them as one MULTI/EXEC block. Nothing touches the
 * connection until {@link #commit()}.
 */
class JedisWriteBatch implements WriteBatch {

    private final JedisPool jedisPool;
    private final List<Consumer<Transaction>> operations = new ArrayList<>();

    JedisWriteBatch(JedisPool jedisPool) {
        this.jedisPool = jedisPool;
    }

    @Override
    public void setFields(String key, Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Cannot write an empty hash to " + key);
        }
        Map<String, String> copy = new LinkedHashMap<>(fields);
        operations.add(tx -> tx.hset(key, copy));
    }

    @Override
    public void addOrUpdate(String sortedSetKey, String member, double score) {
        if (member == null || member.isEmpty()) {
            throw new IllegalArgumentException("Sorted set member cannot be null or empty");
        }
        operations.add(tx -> tx.zadd(sortedSetKey, score, member));
    }

    @Override
    public int size() {
        return operations.size();
    }

    @Override
    public void commit() {
        if (operations.isEmpty()) {
            return;
        }

        try (Jedis jedis = jedisPool.getResource();
             Transaction transaction = jedis.multi()) {
            for (Consumer<Transaction> operation : operations) {
                operation.accept(transaction);
            }
            List<Object> results = transaction.exec();
            if (results == null) {
                throw new StoreException("Batch of " + operations.size() + " writes was aborted", "BATCH_ABORTED");
            }
        } catch (JedisException e) {
            throw new StoreException("Failed to commit batch of " + operations.size() + " writes", "BATCH_FAILED", e);
        }
    }
}
