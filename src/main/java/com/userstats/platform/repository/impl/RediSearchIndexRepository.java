package com.userstats.platform.repository.impl;

import com.userstats.platform.config.RedisClientSettings;
import com.userstats.platform.exception.StoreException;
import com.userstats.platform.model.FieldPredicate;
import com.userstats.platform.model.IndexCapability;
import com.userstats.platform.model.IndexedRecord;
import com.userstats.platform.model.UserProfile;
import com.userstats.platform.repository.SearchIndexRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.search.Document;
import redis.clients.jedis.search.FTCreateParams;
import redis.clients.jedis.search.IndexDataType;
import redis.clients.jedis.search.Query;
import redis.clients.jedis.search.SearchResult;
import redis.clients.jedis.search.schemafields.NumericField;
import redis.clients.jedis.search.schemafields.SchemaField;
import redis.clients.jedis.search.schemafields.TagField;
import redis.clients.jedis.search.schemafields.TextField;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * RediSearch-backed index over {@code user:*} hashes.
 */
@Repository
public class RediSearchIndexRepository implements SearchIndexRepository {

    private static final Logger logger = LoggerFactory.getLogger(RediSearchIndexRepository.class);

    static final int SEARCH_PAGE_SIZE = 500;
    private static final long INDEXING_POLL_MILLIS = 100L;
    private static final String ALREADY_EXISTS = "Index already exists";

    /**
     * A hash whose NUMERIC field does not parse is left out of the index entirely, so only fields
     * that range predicates need are declared NUMERIC.
     */
    public static final Set<String> NUMERIC_FIELDS = Set.of(UserProfile.LATITUDE);

    static final List<String> TEXT_FIELDS = List.of(
        UserProfile.FIRST_NAME, UserProfile.LAST_NAME, UserProfile.EMAIL, UserProfile.CITY);

    static final List<String> TAG_FIELDS = List.of(
        UserProfile.GENDER, UserProfile.COUNTRY, UserProfile.COUNTRY_CODE, UserProfile.IP_ADDRESS,
        UserProfile.LONGITUDE, UserProfile.LAST_LOGIN);

    // ASCII unit separator, not expected inside any profile value
    static final char TAG_SEPARATOR = '\u001F';

    private final RedisClientSettings settings;
    private final String indexName;
    private final long buildTimeoutMillis;
    private UnifiedJedis client;

    @Autowired
    public RediSearchIndexRepository(
            RedisClientSettings settings,
            @Value("${userstats.index.name:idx:users}") String indexName,
            @Value("${userstats.index.build-timeout:10000}") long buildTimeoutMillis) {
        this.settings = settings;
        this.indexName = indexName;
        this.buildTimeoutMillis = buildTimeoutMillis;
    }

    RediSearchIndexRepository(UnifiedJedis client, String indexName, long buildTimeoutMillis) {
        this.settings = null;
        this.client = client;
        this.indexName = indexName;
        this.buildTimeoutMillis = buildTimeoutMillis;
    }

    @PostConstruct
    public void init() {
        if (client == null) {
            client = new JedisPooled(settings.hostAndPort(), settings.clientConfig());
        }
    }

    @PreDestroy
    public void destroy() {
        if (client != null) {
            client.close();
        }
    }

    @Override
    public IndexCapability detectCapability() {
        try {
            client.ftList();
            logger.info("Search module detected, index {} can be used", indexName);
            return IndexCapability.AVAILABLE;
        } catch (JedisException e) {
            logger.info("Search module not available ({}), compound filters will scan", e.getMessage());
            return IndexCapability.UNAVAILABLE;
        }
    }

    @Override
    public void build() {
        FTCreateParams params = FTCreateParams.createParams()
            .on(IndexDataType.HASH)
            .prefix(UserProfile.KEY_PREFIX);

        try {
            client.ftCreate(indexName, params, schema());
            logger.info("Created search index {} over {} hashes", indexName, UserProfile.KEY_PATTERN);
        } catch (JedisDataException e) {
            if (e.getMessage() != null && e.getMessage().contains(ALREADY_EXISTS)) {
                logger.debug("Search index {} already exists, nothing to build", indexName);
                return;
            }
            throw new StoreException("Failed to create search index " + indexName, "INDEX_BUILD_FAILED", e);
        } catch (JedisException e) {
            throw new StoreException("Failed to create search index " + indexName, "INDEX_BUILD_FAILED", e);
        }

        awaitIndexing();
    }

    static List<SchemaField> schema() {
        List<SchemaField> fields = new ArrayList<>();
        for (String name : TEXT_FIELDS) {
            fields.add(TextField.of(name));
        }
        // Case-sensitive and never split, so a tag match is the exact comparison done when scanning
        for (String name : TAG_FIELDS) {
            fields.add(TagField.of(name).caseSensitive().separator(TAG_SEPARATOR));
        }
        for (String name : NUMERIC_FIELDS) {
            fields.add(NumericField.of(name));
        }
        return fields;
    }

    /**
     * Existing hashes are indexed in the background after FT.CREATE; wait for that to finish so
     * the first search sees every profile.
     */
    private void awaitIndexing() {
        long deadline = System.currentTimeMillis() + buildTimeoutMillis;
        while (System.currentTimeMillis() < deadline) {
            try {
                Map<String, Object> info = client.ftInfo(indexName);
                Object indexing = info.get("indexing");
                if (indexing == null || "0".equals(String.valueOf(indexing))) {
                    return;
                }
                Thread.sleep(INDEXING_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (JedisException e) {
                logger.warn("Could not read indexing progress of {}: {}", indexName, e.getMessage());
                return;
            }
        }
        logger.warn("Search index {} still indexing after {} ms", indexName, buildTimeoutMillis);
    }

    @Override
    public List<IndexedRecord> search(FieldPredicate predicate) {
        String queryString = predicate.toQuery();
        List<IndexedRecord> records = new ArrayList<>();
        int offset = 0;
        long total;

        try {
            do {
                Query query = new Query(queryString).limit(offset, SEARCH_PAGE_SIZE);
                SearchResult result = client.ftSearch(indexName, query);
                total = result.getTotalResults();
                List<Document> documents = result.getDocuments();
                for (Document document : documents) {
                    records.add(new IndexedRecord(document.getId(), fieldsOf(document)));
                }
                if (documents.isEmpty()) {
                    break;
                }
                offset += SEARCH_PAGE_SIZE;
            } while (offset < total);
        } catch (JedisException e) {
            throw new StoreException("Search on " + indexName + " failed for " + queryString, e);
        }

        logger.debug("Index {} returned {} records for {}", indexName, records.size(), queryString);
        return records;
    }

    private static Map<String, String> fieldsOf(Document document) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (Map.Entry<String, Object> property : document.getProperties()) {
            Object value = property.getValue();
            if (value instanceof byte[]) {
                fields.put(property.getKey(), new String((byte[]) value, StandardCharsets.UTF_8));
            } else if (value != null) {
                fields.put(property.getKey(), String.valueOf(value));
            }
        }
        return fields;
    }

    @Override
    public String getIndexName() {
        return indexName;
    }
}
