package edu.harvard.hms.dbmi.avillach.inventory.ingest.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for ingestion.
 *
 * Uses Spring Boot property binding with fail-fast validation. All properties use the "ingest.*" prefix.
 */
@ConfigurationProperties(prefix = "ingest")
@Validated
public class IngestConfig {
    private static final Logger log = LoggerFactory.getLogger(IngestConfig.class);

    private String participantIdColumn = "participant_id";
    private List<String> participantIdAliases = new ArrayList<>(List.of("SubjID"));
    private List<String> nullSentinels = new ArrayList<>(); // empty = NullSentinelDetector defaults
    private int lockRetries = 3;
    private long lockBackoffMs = 50;

    // Optional directories
    private String schemaDir; // null = no schema bootstrap from datasets.yaml/variables.csv
    private String bulkImportDir; // null = no bulk import at startup
    private String bulkImportSource = "bulk-import";

    @PostConstruct
    public void validateAndLog() {
        log.info("=== VALIDATING INGEST CONFIGURATION ===");

        List<String> errors = new ArrayList<>();
        if (participantIdColumn == null || participantIdColumn.isBlank()) {
            errors.add("ingest.participant-id-column is required");
        }
        if (lockRetries < 0) {
            errors.add("ingest.lock-retries must not be negative: " + lockRetries);
        }
        if (lockBackoffMs < 0) {
            errors.add("ingest.lock-backoff-ms must not be negative: " + lockBackoffMs);
        }
        if (schemaDir != null && !schemaDir.isBlank() && !Files.isDirectory(Path.of(schemaDir))) {
            errors.add("Schema directory not found: " + schemaDir);
        }
        if (bulkImportDir != null && !bulkImportDir.isBlank()) {
            if (!Files.isDirectory(Path.of(bulkImportDir))) {
                errors.add("Bulk import directory not found: " + bulkImportDir);
            }
            if (bulkImportSource == null || bulkImportSource.isBlank()) {
                errors.add("ingest.bulk-import-source is required when ingest.bulk-import-dir is set");
            }
        }

        if (!errors.isEmpty()) {
            String errorMsg = "Ingest configuration validation failed:\n  - " + String.join("\n  - ", errors);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        log.info("=== EFFECTIVE INGEST CONFIGURATION ===");
        log.info("Participant id column: {} (aliases {})", participantIdColumn, participantIdAliases);
        log.info("Null sentinels: {}", nullSentinels.isEmpty() ? "(defaults)" : nullSentinels);
        log.info("Lock retries: {} (backoff {}ms)", lockRetries, lockBackoffMs);
        log.info("Schema dir: {}", schemaDir != null ? schemaDir : "(none - schema is published through the API)");
        log.info("Bulk import dir: {}", bulkImportDir != null ? bulkImportDir + " as source " + bulkImportSource : "(none)");
        log.info("======================================");
    }

    public String getParticipantIdColumn() {
        return participantIdColumn;
    }

    public void setParticipantIdColumn(String participantIdColumn) {
        this.participantIdColumn = participantIdColumn;
    }

    public List<String> getParticipantIdAliases() {
        return participantIdAliases;
    }

    public void setParticipantIdAliases(List<String> participantIdAliases) {
        this.participantIdAliases = participantIdAliases;
    }

    public List<String> getNullSentinels() {
        return nullSentinels;
    }

    public void setNullSentinels(List<String> nullSentinels) {
        this.nullSentinels = nullSentinels;
    }

    public int getLockRetries() {
        return lockRetries;
    }

    public void setLockRetries(int lockRetries) {
        this.lockRetries = lockRetries;
    }

    public long getLockBackoffMs() {
        return lockBackoffMs;
    }

    public void setLockBackoffMs(long lockBackoffMs) {
        this.lockBackoffMs = lockBackoffMs;
    }

    public String getSchemaDir() {
        return schemaDir;
    }

    public void setSchemaDir(String schemaDir) {
        this.schemaDir = schemaDir;
    }

    public String getBulkImportDir() {
        return bulkImportDir;
    }

    public void setBulkImportDir(String bulkImportDir) {
        this.bulkImportDir = bulkImportDir;
    }

    public String getBulkImportSource() {
        return bulkImportSource;
    }

    public void setBulkImportSource(String bulkImportSource) {
        this.bulkImportSource = bulkImportSource;
    }
}
