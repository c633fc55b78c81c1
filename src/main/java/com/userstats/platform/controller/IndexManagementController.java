package com.userstats.platform.controller;

import com.userstats.platform.dto.IndexStatusResponse;
import com.userstats.platform.model.IndexCapability;
import com.userstats.platform.repository.SearchIndexRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for the optional search index.
 */
@RestController
@RequestMapping("/api/v1/admin/index")
public class IndexManagementController {

    private static final Logger logger = LoggerFactory.getLogger(IndexManagementController.class);

    private final SearchIndexRepository searchIndexRepository;
    private final IndexCapability indexCapability;

    @Autowired
    public IndexManagementController(SearchIndexRepository searchIndexRepository, IndexCapability indexCapability) {
        this.searchIndexRepository = searchIndexRepository;
        this.indexCapability = indexCapability;
    }

    @GetMapping
    public ResponseEntity<IndexStatusResponse> getStatus() {
        return ResponseEntity.ok(status(false));
    }

    /**
     * POST /api/v1/admin/index, safe to repeat. Without the search capability nothing is built.
     */
    @PostMapping
    public ResponseEntity<IndexStatusResponse> build() {
        if (!indexCapability.isAvailable()) {
            logger.info("Index build requested but search capability is unavailable");
            return ResponseEntity.ok(status(false));
        }

        logger.info("Building search index {}", searchIndexRepository.getIndexName());
        searchIndexRepository.build();
        return ResponseEntity.ok(status(true));
    }

    private IndexStatusResponse status(boolean buildTriggered) {
        return IndexStatusResponse.builder()
            .indexName(searchIndexRepository.getIndexName())
            .capability(indexCapability)
            .buildTriggered(buildTriggered)
            .build();
    }
}
