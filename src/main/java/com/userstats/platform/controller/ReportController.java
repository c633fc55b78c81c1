package com.userstats.platform.controller;

import com.userstats.platform.dto.DemographicFilterResponse;
import com.userstats.platform.dto.LeaderboardEmailsResponse;
import com.userstats.platform.exception.InvalidRequestException;
import com.userstats.platform.model.FilteredUser;
import com.userstats.platform.model.GeoLocation;
import com.userstats.platform.model.ParityNames;
import com.userstats.platform.model.Parity;
import com.userstats.platform.model.QueryOutcome;
import com.userstats.platform.service.QueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to the report queries. Store failures are not errors here: they come back
 * as the same empty bodies as a query without matches.
 */
@RestController
@RequestMapping("/api/v1")
public class ReportController {

    private static final Logger logger = LoggerFactory.getLogger(ReportController.class);

    private static final int MAX_TOP_LIMIT = 1000;

    private final QueryService queryService;

    @Autowired
    public ReportController(QueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * GET /api/v1/users/{id}
     */
    @GetMapping("/users/{id}")
    public ResponseEntity<Map<String, String>> getProfile(@PathVariable String id) {
        logger.info("Received GET request for profile - id: {}", id);
        return ResponseEntity.ok(queryService.profileById(id).getValue());
    }

    /**
     * GET /api/v1/users/{id}/location, 204 unless both coordinates are stored.
     */
    @GetMapping("/users/{id}/location")
    public ResponseEntity<GeoLocation> getLocation(@PathVariable String id) {
        logger.info("Received GET request for location - id: {}", id);
        Optional<GeoLocation> location = queryService.locationById(id).getValue();
        return location.map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * GET /api/v1/reports/parity/{parity}
     */
    @GetMapping("/reports/parity/{parity}")
    public ResponseEntity<ParityNames> getParityNames(@PathVariable String parity) {
        Parity selected;
        try {
            selected = Parity.fromString(parity);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Parity must be 'odd' or 'even', got: " + parity);
        }

        logger.info("Received GET request for {} parity names", selected);
        return ResponseEntity.ok(queryService.parityFilteredNames(selected).getValue());
    }

    /**
     * GET /api/v1/reports/demographic-filter
     */
    @GetMapping("/reports/demographic-filter")
    public ResponseEntity<DemographicFilterResponse> getDemographicFilter() {
        logger.info("Received GET request for demographic filter");
        QueryOutcome<List<FilteredUser>> outcome = queryService.compoundFilter();

        DemographicFilterResponse response = DemographicFilterResponse.builder()
            .users(outcome.getValue())
            .path(queryService.filterPath())
            .retrievedAt(Instant.now())
            .build();

        logger.info("Demographic filter returned {} users via {}", response.getUsers().size(), response.getPath());
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/v1/leaderboards/{leaderboardId}/emails?limit=N
     */
    @GetMapping("/leaderboards/{leaderboardId}/emails")
    public ResponseEntity<LeaderboardEmailsResponse> getLeaderboardEmails(
            @PathVariable String leaderboardId,
            @RequestParam(defaultValue = "10") int limit) {
        if (limit <= 0 || limit > MAX_TOP_LIMIT) {
            throw new InvalidRequestException("Limit must be between 1 and " + MAX_TOP_LIMIT);
        }

        logger.info("Received GET request for top {} emails - leaderboardId: {}", limit, leaderboardId);
        List<String> emails = queryService.leaderboardEmails(leaderboardId, limit).getValue();

        LeaderboardEmailsResponse response = LeaderboardEmailsResponse.builder()
            .leaderboardId(leaderboardId)
            .emails(emails)
            .retrievedAt(Instant.now())
            .build();
        return ResponseEntity.ok(response);
    }
}
