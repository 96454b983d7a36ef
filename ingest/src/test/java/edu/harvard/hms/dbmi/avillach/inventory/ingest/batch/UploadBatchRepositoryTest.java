package edu.harvard.hms.dbmi.avillach.inventory.ingest.batch;

import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UploadBatchRepositoryTest {

    @TempDir
    Path directory;

    private static UploadBatch batch(String id, String hash, Instant at, boolean cancelled, String batchError) {
        ValidationReport report = batchError != null ? ValidationReport.batchFailure(batchError)
            : new ValidationReport(List.of(RowResult.accepted(1, "P1", 1, 2)), null);
        return new UploadBatch(id, "clinic", "alice", at, 1, null, UploadFormat.CSV, hash, BatchOutcome.ACCEPTED, cancelled, report);
    }

    @Test
    public void save_survivesRestart() throws Exception {
        Path journal = directory.resolve("batches.jsonl");
        try (UploadBatchRepository repository = new UploadBatchRepository(journal)) {
            repository.save(batch("b-2", "h2", Instant.parse("2024-01-02T00:00:00Z"), false, null));
            repository.save(batch("b-1", "h1", Instant.parse("2024-01-01T00:00:00Z"), false, null));
        }
        try (UploadBatchRepository reopened = new UploadBatchRepository(journal)) {
            assertEquals(List.of("b-1", "b-2"), reopened.findAll().stream().map(UploadBatch::batchId).toList());
            UploadBatch restored = reopened.find("b-1").orElseThrow();
            assertEquals(2, restored.report().rows().get(0).valuesMerged());
            assertEquals("b-2", reopened.findByContentHash("h2").orElseThrow().batchId());
        }
    }

    @Test
    public void findByContentHash_ignoresCancelledAndBatchLevelRejections() throws Exception {
        try (UploadBatchRepository repository = new UploadBatchRepository(directory.resolve("batches.jsonl"))) {
            repository.save(batch("cancelled", "h1", Instant.now(), true, null));
            repository.save(batch("rejected", "h2", Instant.now(), false, "UnknownVersion: schema version 9 does not exist"));

            assertTrue(repository.findByContentHash("h1").isEmpty());
            assertTrue(repository.findByContentHash("h2").isEmpty());
            assertTrue(repository.find("cancelled").isPresent());
        }
    }
}
