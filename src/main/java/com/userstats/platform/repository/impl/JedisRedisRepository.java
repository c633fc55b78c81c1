package com.userstats.platform.repository.impl;

import com.userstats.platform.config.RedisClientSettings;
import com.userstats.platform.exception.StoreException;
import com.userstats.platform.model.RankedUser;
import com.userstats.platform.model.ScanPage;
import com.userstats.platform.repository.RedisRepository;
import com.userstats.platform.repository.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;
import redis.clients.jedis.resps.Tuple;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Repository
public class JedisRedisRepository implements RedisRepository {

    private static final Logger logger = LoggerFactory.getLogger(JedisRedisRepository.class);

    private final RedisClientSettings settings;
    private JedisPool jedisPool;

    @Autowired
    public JedisRedisRepository(RedisClientSettings settings) {
        this.settings = settings;
    }

    JedisRedisRepository(JedisPool jedisPool) {
        this.settings = null;
        this.jedisPool = jedisPool;
    }

    @PostConstruct
    public void init() {
        try {
            JedisPoolConfig poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(16);
            poolConfig.setMaxIdle(8);
            poolConfig.setMinIdle(1);
            poolConfig.setTestOnBorrow(true);

            jedisPool = new JedisPool(poolConfig, settings.hostAndPort(), settings.clientConfig());

            // Test connection
            try (Jedis jedis = jedisPool.getResource()) {
                jedis.ping();
                logger.info("Successfully connected to Redis at {}", settings.describe());
            }
        } catch (Exception e) {
            logger.error("Failed to initialize Redis connection to {}: {}", settings.describe(), e.getMessage());
        }
    }

    @PreDestroy
    public void destroy() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
        }
    }

    @Override
    public boolean isAvailable() {
        if (jedisPool == null) {
            return false;
        }

        try (Jedis jedis = jedisPool.getResource()) {
            jedis.ping();
            return true;
        } catch (JedisException e) {
            logger.warn("Redis health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Map<String, String> getAllFields(String key) {
        try (Jedis jedis = jedisPool.getResource()) {
            return jedis.hgetAll(key);
        } catch (JedisException e) {
            throw new StoreException("Failed to read hash " + key, e);
        }
    }

    @Override
    public List<String> getFields(String key, String... fields) {
        try (Jedis jedis = jedisPool.getResource()) {
            return jedis.hmget(key, fields);
        } catch (JedisException e) {
            throw new StoreException("Failed to read fields of hash " + key, e);
        }
    }

    @Override
    public String getField(String key, String field) {
        try (Jedis jedis = jedisPool.getResource()) {
            return jedis.hget(key, field);
        } catch (JedisException e) {
            throw new StoreException("Failed to read field " + field + " of hash " + key, e);
        }
    }

    @Override
    public ScanPage scan(String cursor, String pattern, int count) {
        ScanParams params = new ScanParams().match(pattern).count(count);
        try (Jedis jedis = jedisPool.getResource()) {
            ScanResult<String> result = jedis.scan(cursor, params);
            return new ScanPage(result.getCursor(), result.getResult());
        } catch (JedisException e) {
            throw new StoreException("Failed to scan keys matching " + pattern + " from cursor " + cursor, e);
        }
    }

    @Override
    public List<RankedUser> getTopN(String sortedSetKey, int limit) {
        if (limit <= 0) {
            return new ArrayList<>();
        }

        try (Jedis jedis = jedisPool.getResource()) {
            // Highest score first; equal scores follow Redis' reverse lexicographic member order
            List<Tuple> tuples = jedis.zrevrangeWithScores(sortedSetKey, 0, limit - 1);

            List<RankedUser> rankedUsers = new ArrayList<>();
            int rank = 1;
            for (Tuple tuple : tuples) {
                rankedUsers.add(RankedUser.builder()
                    .userId(tuple.getElement())
                    .rank(rank++)
                    .score(tuple.getScore())
                    .build());
            }
            return rankedUsers;
        } catch (JedisException e) {
            throw new StoreException("Failed to get top " + limit + " of " + sortedSetKey, e);
        }
    }

    @Override
    public WriteBatch newBatch() {
        return new JedisWriteBatch(jedisPool);
    }
}
