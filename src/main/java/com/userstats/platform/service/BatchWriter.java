package com.userstats.platform.service;

import com.userstats.platform.exception.StoreException;
import com.userstats.platform.model.StoreRecord;
import com.userstats.platform.repository.RedisRepository;
import com.userstats.platform.repository.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Function;

@Service
public class BatchWriter {

    private static final Logger logger = LoggerFactory.getLogger(BatchWriter.class);

    private final RedisRepository redisRepository;

    @Autowired
    public BatchWriter(RedisRepository redisRepository) {
        this.redisRepository = redisRepository;
    }

    /**
     * Maps every source, queues the records that mapped, and commits them in one round trip.
     * A source that fails to map is skipped without affecting the rest of the batch.
     *
     * @return number of records queued, or 0 if the commit failed. A positive count means the
     *         batch was submitted, not that every write is durable.
     */
    public <S> int write(Iterable<S> sources, Function<S, Optional<? extends StoreRecord>> mapper) {
        WriteBatch batch = redisRepository.newBatch();
        int skipped = 0;

        for (S source : sources) {
            if (queue(batch, source, mapper)) {
                continue;
            }
            skipped++;
        }

        int queued = batch.size();
        if (queued == 0) {
            logger.info("Nothing to commit ({} records skipped)", skipped);
            return 0;
        }

        try {
            batch.commit();
        } catch (StoreException e) {
            // Redis may still have applied part of the block; readers can observe it
            logger.error("Batch commit of {} records failed", queued, e);
            return 0;
        }

        logger.info("Committed batch of {} records ({} skipped)", queued, skipped);
        return queued;
    }

    private <S> boolean queue(WriteBatch batch, S source, Function<S, Optional<? extends StoreRecord>> mapper) {
        try {
            Optional<? extends StoreRecord> record = mapper.apply(source);
            if (record.isEmpty()) {
                logger.debug("Skipping malformed record: {}", source);
                return false;
            }
            record.get().queueInto(batch);
            return true;
        } catch (RuntimeException e) {
            logger.debug("Skipping record that failed to map: {} ({})", source, e.getMessage());
            return false;
        }
    }
}
