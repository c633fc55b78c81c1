package com.userstats.platform.service;

import com.userstats.platform.model.FieldPredicate;
import com.userstats.platform.model.FilteredUser;
import com.userstats.platform.model.GeoLocation;
import com.userstats.platform.model.IndexCapability;
import com.userstats.platform.model.IndexedRecord;
import com.userstats.platform.model.ParityNames;
import com.userstats.platform.model.Parity;
import com.userstats.platform.model.QueryOutcome;
import com.userstats.platform.model.RankedUser;
import com.userstats.platform.model.ScoreEntry;
import com.userstats.platform.model.UserProfile;
import com.userstats.platform.repository.RedisRepository;
import com.userstats.platform.repository.SearchIndexRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The report queries. None of them throws on a store failure: the operation's empty value is
 * returned inside a {@link QueryOutcome} marked {@code FAILED}.
 */
@Service
public class QueryService {

    private static final Logger logger = LoggerFactory.getLogger(QueryService.class);

    public static final FieldPredicate DEMOGRAPHIC_GEO_FILTER = FieldPredicate.and(
        FieldPredicate.tagEquals(UserProfile.GENDER, "female"),
        FieldPredicate.tagIn(UserProfile.COUNTRY, "China", "Russia"),
        FieldPredicate.numericRange(UserProfile.LATITUDE, 40, 46));

    public static final String DEFAULT_LEADERBOARD = "2";
    public static final int DEFAULT_TOP_LIMIT = 10;

    public enum FilterPath {
        INDEX,
        SCAN
    }

    private final RedisRepository redisRepository;
    private final SearchIndexRepository searchIndexRepository;
    private final IndexCapability indexCapability;
    private final KeyScanner keyScanner;

    @Autowired
    public QueryService(
            RedisRepository redisRepository,
            SearchIndexRepository searchIndexRepository,
            IndexCapability indexCapability,
            KeyScanner keyScanner) {
        this.redisRepository = redisRepository;
        this.searchIndexRepository = searchIndexRepository;
        this.indexCapability = indexCapability;
        this.keyScanner = keyScanner;
    }

    public QueryOutcome<Map<String, String>> profileById(String id) {
        String key = UserProfile.keyFor(id);
        try {
            Map<String, String> fields = redisRepository.getAllFields(key);
            if (fields == null) {
                return QueryOutcome.of(Collections.emptyMap(), true);
            }
            return QueryOutcome.of(fields, fields.isEmpty());
        } catch (RuntimeException e) {
            logger.warn("Profile lookup for {} failed: {}", key, e.getMessage());
            return QueryOutcome.failed(Collections.emptyMap(), e);
        }
    }

    /**
     * Both coordinates or nothing; a profile holding only one of them yields an empty result.
     */
    public QueryOutcome<Optional<GeoLocation>> locationById(String id) {
        String key = UserProfile.keyFor(id);
        try {
            List<String> values = redisRepository.getFields(key, UserProfile.LONGITUDE, UserProfile.LATITUDE);
            if (values == null || values.size() < 2 || isNullOrEmpty(values.get(0)) || isNullOrEmpty(values.get(1))) {
                return QueryOutcome.of(Optional.empty(), true);
            }
            return QueryOutcome.of(Optional.of(new GeoLocation(values.get(0), values.get(1))), false);
        } catch (RuntimeException e) {
            logger.warn("Location lookup for {} failed: {}", key, e.getMessage());
            return QueryOutcome.failed(Optional.empty(), e);
        }
    }

    /**
     * Keys whose id starts with a character of the given parity and whose last name is set,
     * in the order the scan discovers them.
     */
    public QueryOutcome<ParityNames> parityFilteredNames(Parity parity) {
        ParityNames result = new ParityNames();
        Set<String> visited = new HashSet<>();
        try {
            for (String key : keyScanner.keys(UserProfile.KEY_PATTERN)) {
                if (!visited.add(key)) {
                    continue;
                }
                if (!parity.matches(idOf(key))) {
                    continue;
                }
                String lastName = redisRepository.getField(key, UserProfile.LAST_NAME);
                if (!isNullOrEmpty(lastName)) {
                    result.add(key, lastName);
                }
            }
            return QueryOutcome.of(result, result.isEmpty());
        } catch (RuntimeException e) {
            logger.warn("{} parity scan failed: {}", parity, e.getMessage());
            return QueryOutcome.failed(ParityNames.empty(), e);
        }
    }

    public QueryOutcome<List<FilteredUser>> compoundFilter() {
        return compoundFilter(DEMOGRAPHIC_GEO_FILTER);
    }

    /**
     * Runs the predicate on the search index when the capability was detected at startup,
     * otherwise scans every profile. Both paths return the same set of users; order may differ.
     * A failing index query is retried as a scan, so a missing index never changes the result.
     */
    public QueryOutcome<List<FilteredUser>> compoundFilter(FieldPredicate predicate) {
        FilterPath path = filterPath();
        try {
            List<FilteredUser> users;
            if (path == FilterPath.INDEX) {
                users = filterWithIndexOrScan(predicate);
            } else {
                users = filterWithScan(predicate);
            }
            logger.debug("Compound filter {} matched {} users via {}", predicate, users.size(), path);
            return QueryOutcome.of(users, users.isEmpty());
        } catch (RuntimeException e) {
            logger.warn("Compound filter {} via {} failed: {}", predicate, path, e.getMessage());
            return QueryOutcome.failed(Collections.emptyList(), e);
        }
    }

    public FilterPath filterPath() {
        return indexCapability.isAvailable() ? FilterPath.INDEX : FilterPath.SCAN;
    }

    private List<FilteredUser> filterWithIndexOrScan(FieldPredicate predicate) {
        try {
            return filterWithIndex(predicate);
        } catch (RuntimeException e) {
            logger.warn("Search index {} failed for {} ({}), falling back to a keyspace scan",
                searchIndexRepository.getIndexName(), predicate, e.getMessage());
            return filterWithScan(predicate);
        }
    }

    private List<FilteredUser> filterWithIndex(FieldPredicate predicate) {
        List<FilteredUser> users = new ArrayList<>();
        for (IndexedRecord record : searchIndexRepository.search(predicate)) {
            users.add(FilteredUser.fromFields(record.getKey(), record.getFields()));
        }
        return users;
    }

    private List<FilteredUser> filterWithScan(FieldPredicate predicate) {
        List<FilteredUser> users = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String key : keyScanner.keys(UserProfile.KEY_PATTERN)) {
            if (!visited.add(key)) {
                continue;
            }
            Map<String, String> fields = redisRepository.getAllFields(key);
            if (fields != null && predicate.test(fields)) {
                users.add(FilteredUser.fromFields(key, fields));
            }
        }
        return users;
    }

    /**
     * Emails of the top members of a leaderboard, highest score first. Members without a
     * profile email are left out; the others keep their relative rank order.
     */
    public QueryOutcome<List<String>> leaderboardEmails(String leaderboardId, int limit) {
        String boardKey = ScoreEntry.boardKeyFor(leaderboardId);
        try {
            List<String> emails = new ArrayList<>();
            for (RankedUser member : redisRepository.getTopN(boardKey, limit)) {
                String email = redisRepository.getField(UserProfile.keyFor(member.getUserId()), UserProfile.EMAIL);
                if (isNullOrEmpty(email)) {
                    logger.debug("No email for ranked member {} of {}", member.getUserId(), boardKey);
                    continue;
                }
                emails.add(email);
            }
            return QueryOutcome.of(emails, emails.isEmpty());
        } catch (RuntimeException e) {
            logger.warn("Leaderboard email lookup for {} failed: {}", boardKey, e.getMessage());
            return QueryOutcome.failed(Collections.emptyList(), e);
        }
    }

    public QueryOutcome<List<String>> leaderboardEmails() {
        return leaderboardEmails(DEFAULT_LEADERBOARD, DEFAULT_TOP_LIMIT);
    }

    static String idOf(String key) {
        int separator = key.indexOf(':');
        return separator < 0 ? key : key.substring(separator + 1);
    }

    private static boolean isNullOrEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
