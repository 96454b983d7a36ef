package edu.harvard.hms.dbmi.avillach.inventory.ingest.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class IngestConfigTest {

    @TempDir
    Path directory;

    @Test
    public void validateAndLog_defaultsAreValid() {
        IngestConfig config = new IngestConfig();
        assertDoesNotThrow(config::validateAndLog);
        assertEquals("participant_id", config.getParticipantIdColumn());
        assertEquals(3, config.getLockRetries());
    }

    @Test
    public void validateAndLog_existingDirectories_areAccepted() {
        IngestConfig config = new IngestConfig();
        config.setSchemaDir(directory.toString());
        config.setBulkImportDir(directory.toString());
        assertDoesNotThrow(config::validateAndLog);
    }

    @Test
    public void validateAndLog_invalidValues_failFast() {
        IngestConfig config = new IngestConfig();
        config.setParticipantIdColumn(" ");
        config.setLockRetries(-1);
        config.setBulkImportDir(directory.resolve("absent").toString());

        IllegalStateException exception = assertThrows(IllegalStateException.class, config::validateAndLog);
        assertTrue(exception.getMessage().contains("ingest.participant-id-column"));
        assertTrue(exception.getMessage().contains("ingest.lock-retries"));
        assertTrue(exception.getMessage().contains("Bulk import directory not found"));
    }
}
