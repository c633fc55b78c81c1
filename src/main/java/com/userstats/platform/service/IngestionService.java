package com.userstats.platform.service;

import com.userstats.platform.model.IngestionReport;
import com.userstats.platform.parser.ScoreRecordMapper;
import com.userstats.platform.parser.UserRecordMapper;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads the user and score files. Each file is committed as one batch; unreadable files are
 * logged and reported as nothing written.
 */
@Service
public class IngestionService {

    private static final Logger logger = LoggerFactory.getLogger(IngestionService.class);

    private static final CSVFormat SCORE_FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreEmptyLines(true)
        .setTrim(true)
        .build();

    private final BatchWriter batchWriter;

    @Autowired
    public IngestionService(BatchWriter batchWriter) {
        this.batchWriter = batchWriter;
    }

    public IngestionReport ingestUsers(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException | UncheckedIOException e) {
            logger.error("Failed to read user file {}", file, e);
            return IngestionReport.builder().source(file.toString()).build();
        }

        int written = batchWriter.write(lines, UserRecordMapper::mapLine);
        logger.info("Loaded {} of {} user lines from {}", written, lines.size(), file);
        return IngestionReport.builder()
            .source(file.toString())
            .read(lines.size())
            .written(written)
            .build();
    }

    public IngestionReport ingestScores(Path file) {
        List<CSVRecord> records;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, SCORE_FORMAT)) {
            records = parser.getRecords();
        } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
            logger.error("Failed to read score file {}", file, e);
            return IngestionReport.builder().source(file.toString()).build();
        }

        int written = batchWriter.write(records, ScoreRecordMapper::map);
        logger.info("Loaded {} of {} score rows from {}", written, records.size(), file);
        return IngestionReport.builder()
            .source(file.toString())
            .read(records.size())
            .written(written)
            .build();
    }
}
