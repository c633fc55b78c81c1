package com.userstats.platform.service;

import com.userstats.platform.exception.StoreException;
import com.userstats.platform.exception.StoreUnavailableException;
import com.userstats.platform.model.IndexCapability;
import com.userstats.platform.model.IngestionReport;
import com.userstats.platform.model.Parity;
import com.userstats.platform.model.QueryOutcome;
import com.userstats.platform.repository.RedisRepository;
import com.userstats.platform.repository.SearchIndexRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;

/**
 * Startup pipeline: health check, load both files, build the index when the store supports
 * it, then log the five report queries.
 */
@Component
@ConditionalOnProperty(name = "userstats.report.run-on-startup", havingValue = "true", matchIfMissing = true)
public class ReportRunner implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(ReportRunner.class);

    private final RedisRepository redisRepository;
    private final IngestionService ingestionService;
    private final SearchIndexRepository searchIndexRepository;
    private final IndexCapability indexCapability;
    private final QueryService queryService;

    @Value("${userstats.ingest.users-file:users.txt}")
    private String usersFile = "users.txt";

    @Value("${userstats.ingest.scores-file:userscores.csv}")
    private String scoresFile = "userscores.csv";

    @Value("${userstats.report.profile-id:3}")
    private String profileId = "3";

    @Value("${userstats.report.leaderboard-id:2}")
    private String leaderboardId = QueryService.DEFAULT_LEADERBOARD;

    @Value("${userstats.report.top-limit:10}")
    private int topLimit = QueryService.DEFAULT_TOP_LIMIT;

    @Autowired
    public ReportRunner(
            RedisRepository redisRepository,
            IngestionService ingestionService,
            SearchIndexRepository searchIndexRepository,
            IndexCapability indexCapability,
            QueryService queryService) {
        this.redisRepository = redisRepository;
        this.ingestionService = ingestionService;
        this.searchIndexRepository = searchIndexRepository;
        this.indexCapability = indexCapability;
        this.queryService = queryService;
    }

    @Override
    public void run(String... args) {
        if (!redisRepository.isAvailable()) {
            logger.error("Redis connection failed, skipping ingestion and report");
            throw new StoreUnavailableException("Redis connection failed");
        }

        IngestionReport users = ingestionService.ingestUsers(Paths.get(usersFile));
        IngestionReport scores = ingestionService.ingestScores(Paths.get(scoresFile));
        logger.info("Ingestion finished - users: {}/{}, scores: {}/{}",
            users.getWritten(), users.getRead(), scores.getWritten(), scores.getRead());

        buildIndexIfAvailable();

        report("Profile " + profileId, queryService.profileById(profileId));
        report("Location " + profileId, queryService.locationById(profileId));
        report("Even-id last names", queryService.parityFilteredNames(Parity.EVEN));
        report("Odd-id last names", queryService.parityFilteredNames(Parity.ODD));
        report("Demographic filter (" + queryService.filterPath() + ")", queryService.compoundFilter());
        report("Top " + topLimit + " emails of leaderboard " + leaderboardId,
            queryService.leaderboardEmails(leaderboardId, topLimit));
    }

    private void buildIndexIfAvailable() {
        if (!indexCapability.isAvailable()) {
            return;
        }
        try {
            searchIndexRepository.build();
        } catch (StoreException e) {
            logger.warn("Could not build search index {}: {}", searchIndexRepository.getIndexName(), e.getMessage());
        }
    }

    private void report(String name, QueryOutcome<?> outcome) {
        if (outcome.isFailed()) {
            logger.warn("{}: query failed, reporting empty result", name);
        }
        logger.info("{}: {}", name, outcome.getValue());
    }
}
