package edu.harvard.hms.dbmi.avillach.inventory.ingest.pipeline;

import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.BatchOutcome;
import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.UploadBatch;
import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.UploadFormat;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableConstraints;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableType;
import edu.harvard.hms.dbmi.avillach.inventory.exception.LockTimeoutException;
import edu.harvard.hms.dbmi.avillach.inventory.ingest.batch.UploadBatchRepository;
import edu.harvard.hms.dbmi.avillach.inventory.ingest.config.IngestConfig;
import edu.harvard.hms.dbmi.avillach.inventory.ingest.parse.CsvBatchParser;
import edu.harvard.hms.dbmi.avillach.inventory.processing.identity.IdentityResolver;
import edu.harvard.hms.dbmi.avillach.inventory.processing.identity.MatchingConfig;
import edu.harvard.hms.dbmi.avillach.inventory.processing.schema.SchemaRegistry;
import edu.harvard.hms.dbmi.avillach.inventory.processing.store.VariableStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestionPipelineLockRetryTest {

    @TempDir
    Path directory;

    @Mock
    private VariableStore variableStore;

    private IdentityResolver identityResolver;
    private UploadBatchRepository uploadBatchRepository;
    private IngestionPipeline pipeline;

    private final RawBatch upload = RawBatch.of(UploadFormat.CSV, "participant_id,age\nP1,34\n".getBytes(StandardCharsets.UTF_8));

    @BeforeEach
    public void setup() {
        SchemaRegistry schemaRegistry = new SchemaRegistry(directory.resolve("schema"), Clock.systemUTC());
        schemaRegistry.publish(List.of(VariableDefinition.of("age", "visit", VariableType.NUMERIC, VariableConstraints.range(0.0, 120.0, true))));
        identityResolver = new IdentityResolver(directory.resolve("identity-log.jsonl"), MatchingConfig.DEFAULT, Clock.systemUTC());
        uploadBatchRepository = new UploadBatchRepository(directory.resolve("batches.jsonl"));
        IngestConfig config = new IngestConfig();
        config.setLockRetries(2);
        config.setLockBackoffMs(1);
        pipeline = new IngestionPipeline(
            schemaRegistry, identityResolver, variableStore, uploadBatchRepository, List.of(new CsvBatchParser()), config, Clock.systemUTC()
        );
    }

    @AfterEach
    public void teardown() throws Exception {
        identityResolver.close();
        uploadBatchRepository.close();
    }

    @Test
    public void ingest_transientLockTimeout_isRetried() {
        when(variableStore.merge(anyInt(), eq(1), anyMap(), anyString()))
            .thenThrow(new LockTimeoutException(1, 10))
            .thenReturn(List.of());

        UploadBatch batch = pipeline.ingest(upload, null, "clinic", "alice");

        assertEquals(BatchOutcome.ACCEPTED, batch.outcome());
        verify(variableStore, times(2)).merge(anyInt(), eq(1), anyMap(), anyString());
    }

    @Test
    public void ingest_persistentLockTimeout_recordsBatchAndRethrows() {
        when(variableStore.merge(anyInt(), eq(1), anyMap(), anyString())).thenThrow(new LockTimeoutException(1, 10));

        assertThrows(LockTimeoutException.class, () -> pipeline.ingest(upload, null, "clinic", "alice"));

        verify(variableStore, times(3)).merge(anyInt(), eq(1), anyMap(), anyString());
        UploadBatch recorded = uploadBatchRepository.findAll().get(0);
        assertTrue(recorded.report().batchError().startsWith("LockTimeout"));
        assertTrue(uploadBatchRepository.findByContentHash(recorded.contentHash()).isEmpty(), "a timed out batch can be submitted again");
    }
}
