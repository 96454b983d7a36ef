package edu.harvard.hms.dbmi.avillach.inventory.ingest.pipeline;

import com.google.common.util.concurrent.Striped;
import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.*;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.DatasetDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.SchemaVersion;
import edu.harvard.hms.dbmi.avillach.inventory.exception.LockTimeoutException;
import edu.harvard.hms.dbmi.avillach.inventory.exception.UnknownVersionException;
import edu.harvard.hms.dbmi.avillach.inventory.ingest.batch.UploadBatchRepository;
import edu.harvard.hms.dbmi.avillach.inventory.ingest.config.IngestConfig;
import edu.harvard.hms.dbmi.avillach.inventory.ingest.parse.BatchParser;
import edu.harvard.hms.dbmi.avillach.inventory.ingest.parse.ParsedBatch;
import edu.harvard.hms.dbmi.avillach.inventory.ingest.parse.ParsedRow;
import edu.harvard.hms.dbmi.avillach.inventory.processing.identity.IdentityResolver;
import edu.harvard.hms.dbmi.avillach.inventory.processing.identity.Resolution;
import edu.harvard.hms.dbmi.avillach.inventory.processing.schema.SchemaRegistry;
import edu.harvard.hms.dbmi.avillach.inventory.processing.store.VariableStore;
import edu.harvard.hms.dbmi.avillach.inventory.util.NullSentinelDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.locks.Lock;
import java.util.function.BooleanSupplier;

/**
 * Validates uploaded batches against a schema version and merges the rows that pass into the variable store.
 *
 * Rows are independent: a failing row is recorded in the batch's report and never prevents the other rows from being merged. Each
 * accepted row is merged (and journaled) before the next one is examined, so a crash or cancellation leaves every earlier row durable.
 * Re-submitting the same bytes from the same source returns the batch recorded the first time.
 */
@Component
public class IngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private static final int CONTENT_LOCK_STRIPES = 64;

    private final SchemaRegistry schemaRegistry;
    private final IdentityResolver identityResolver;
    private final VariableStore variableStore;
    private final UploadBatchRepository uploadBatchRepository;
    private final Map<UploadFormat, BatchParser> parsers = new EnumMap<>(UploadFormat.class);
    private final IngestConfig config;
    private final RowValidator rowValidator;
    private final Clock clock;

    // uploads of the same content hash share a stripe, so concurrent duplicates are detected
    private final Striped<Lock> contentLocks = Striped.lock(CONTENT_LOCK_STRIPES);

    @Autowired
    public IngestionPipeline(
        SchemaRegistry schemaRegistry, IdentityResolver identityResolver, VariableStore variableStore,
        UploadBatchRepository uploadBatchRepository, List<BatchParser> parsers, IngestConfig config
    ) {
        this(schemaRegistry, identityResolver, variableStore, uploadBatchRepository, parsers, config, Clock.systemUTC());
    }

    public IngestionPipeline(
        SchemaRegistry schemaRegistry, IdentityResolver identityResolver, VariableStore variableStore,
        UploadBatchRepository uploadBatchRepository, List<BatchParser> parsers, IngestConfig config, Clock clock
    ) {
        this.schemaRegistry = schemaRegistry;
        this.identityResolver = identityResolver;
        this.variableStore = variableStore;
        this.uploadBatchRepository = uploadBatchRepository;
        parsers.forEach(parser -> this.parsers.put(parser.format(), parser));
        this.config = config;
        this.rowValidator = new RowValidator(new NullSentinelDetector(new HashSet<>(config.getNullSentinels())));
        this.clock = clock;
    }

    public UploadBatch ingest(RawBatch rawBatch, Integer schemaVersion, String sourceSystem, String submitter) {
        return ingest(rawBatch, schemaVersion, sourceSystem, submitter, () -> false);
    }

    /**
     * @param schemaVersion version to validate against, null for the current version
     * @param cancelled polled between rows; once true the batch is closed with the rows processed so far
     * @throws LockTimeoutException if a participant's lock could not be acquired after the configured retries; the batch is recorded
     *                              with the rows merged so far before the exception is rethrown
     */
    public UploadBatch ingest(RawBatch rawBatch, Integer schemaVersion, String sourceSystem, String submitter, BooleanSupplier cancelled) {
        if (sourceSystem == null || sourceSystem.isBlank()) {
            throw new IllegalArgumentException("Source system is required");
        }
        String contentHash = contentHash(sourceSystem, rawBatch.content());
        Lock lock = contentLocks.get(contentHash);
        lock.lock();
        try {
            Optional<UploadBatch> previous = uploadBatchRepository.findByContentHash(contentHash);
            if (previous.isPresent()) {
                log.info("Batch from {} is identical to batch {}, returning it unchanged", sourceSystem, previous.get().batchId());
                return previous.get();
            }
            return process(new BatchContext(UUID.randomUUID().toString(), rawBatch, sourceSystem, submitter, contentHash), schemaVersion,
                cancelled);
        } finally {
            lock.unlock();
        }
    }

    private record BatchContext(String batchId, RawBatch rawBatch, String sourceSystem, String submitter, String contentHash) {
    }

    private UploadBatch process(BatchContext context, Integer requestedVersion, BooleanSupplier cancelled) {
        SchemaVersion schema;
        try {
            schema = requestedVersion == null ? schemaRegistry.current() : schemaRegistry.get(requestedVersion);
        } catch (UnknownVersionException e) {
            log.warn("Rejecting batch {} from {}: {}", context.batchId(), context.sourceSystem(), e.getMessage());
            return close(context, null, ValidationReport.batchFailure(e.getCode() + ": " + e.getMessage()), false);
        }

        String dataset = context.rawBatch().dataset();
        DatasetDefinition datasetDefinition = dataset == null ? null : schema.datasets().get(dataset);
        if (dataset != null && datasetDefinition == null) {
            String error = "dataset " + dataset + " is not declared in schema version " + schema.version();
            log.warn("Rejecting batch {} from {}: {}", context.batchId(), context.sourceSystem(), error);
            return close(context, schema.version(), ValidationReport.batchFailure(error), false);
        }

        BatchParser parser = parsers.get(context.rawBatch().format());
        if (parser == null) {
            throw new IllegalStateException("No parser registered for " + context.rawBatch().format());
        }
        String sheetName = context.rawBatch().sheetName() != null ? context.rawBatch().sheetName()
            : datasetDefinition == null ? null : datasetDefinition.sheetName();
        int headerRow = datasetDefinition == null ? 0 : datasetDefinition.headerRow();
        ParsedBatch parsed = parser.parse(context.rawBatch().content(), sheetName, headerRow);
        if (parsed.batchError() != null) {
            log.warn("Rejecting batch {} from {}: {}", context.batchId(), context.sourceSystem(), parsed.batchError());
            return close(context, schema.version(), ValidationReport.batchFailure(parsed.batchError()), false);
        }

        List<String> participantIdColumns = new ArrayList<>();
        participantIdColumns.add(config.getParticipantIdColumn());
        participantIdColumns.addAll(config.getParticipantIdAliases());
        ColumnPlan plan = ColumnPlan.of(
            parsed.header(), schema, dataset, participantIdColumns, identityResolver.getMatchingConfig().identityAttributes()
        );
        if (!plan.headerFailures().isEmpty()) {
            log.warn("Batch {} header problems affect every row: {}", context.batchId(), plan.headerFailures());
        }

        List<RowResult> results = new ArrayList<>();
        boolean wasCancelled = false;
        for (ParsedRow row : parsed.rows()) {
            if (cancelled.getAsBoolean()) {
                log.info("Batch {} cancelled after {} of {} rows", context.batchId(), results.size(), parsed.rows().size());
                wasCancelled = true;
                break;
            }
            try {
                results.add(processRow(context, schema, plan, row));
            } catch (LockTimeoutException e) {
                log.error("Batch {} stopped at row {}: {}", context.batchId(), row.rowNumber(), e.getMessage());
                close(context, schema.version(), new ValidationReport(results, e.getCode() + ": " + e.getMessage()), false);
                throw e;
            }
        }
        return close(context, schema.version(), new ValidationReport(results, null), wasCancelled);
    }

    private RowResult processRow(BatchContext context, SchemaVersion schema, ColumnPlan plan, ParsedRow row) {
        RowValidator.RowCheck check = rowValidator.validate(row, plan);
        if (!check.passed()) {
            log.debug("Batch {} row {} rejected: {}", context.batchId(), row.rowNumber(), check.failures());
            return RowResult.rejected(row.rowNumber(), check.participantKey(), check.failures());
        }

        long rowSequence = variableStore.openRow();
        try {
            Resolution resolution = identityResolver.resolve(
                context.sourceSystem(), check.participantKey(), check.identityAttributes(),
                created -> variableStore.introduce(created, rowSequence)
            );
            if (!resolution.resolved()) {
                return RowResult.rejected(
                    row.rowNumber(), check.participantKey(),
                    List.of(
                        RowFailure.of(
                            FailureReason.IDENTITY_AMBIGUOUS,
                            resolution.candidates().size() + " candidate participant(s) " + resolution.candidates() + ", best score "
                                + String.format(Locale.ROOT, "%.3f", resolution.score())
                        )
                    )
                );
            }

            int participantId = resolution.participant().participantId();
            int merged = mergeWithRetry(participantId, schema.version(), check.values(), context.batchId());
            return RowResult.accepted(row.rowNumber(), check.participantKey(), participantId, merged);
        } finally {
            variableStore.closeRow(rowSequence);
        }
    }

    private int mergeWithRetry(int participantId, int schemaVersion, Map<String, String> values, String batchId) {
        int attempt = 0;
        while (true) {
            try {
                return variableStore.merge(participantId, schemaVersion, values, batchId).size();
            } catch (LockTimeoutException e) {
                if (attempt >= config.getLockRetries()) {
                    throw e;
                }
                long backoff = config.getLockBackoffMs() << attempt;
                attempt++;
                log.warn("Lock timeout for participant {} (attempt {}/{}), retrying in {}ms", participantId, attempt, config.getLockRetries(),
                    backoff);
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    private UploadBatch close(BatchContext context, Integer schemaVersion, ValidationReport report, boolean wasCancelled) {
        BatchOutcome outcome = report.batchError() != null && report.rows().isEmpty() ? BatchOutcome.REJECTED
            : BatchOutcome.of(report.getAcceptedCount(), report.getRejectedCount());
        UploadBatch batch = new UploadBatch(
            context.batchId(), context.sourceSystem(), context.submitter(), clock.instant(), schemaVersion, context.rawBatch().dataset(),
            context.rawBatch().format(), context.contentHash(), outcome, wasCancelled, report
        );
        uploadBatchRepository.save(batch);
        log.info(
            "Batch {} from {} closed {}{}: {} accepted, {} rejected ({} ambiguous)", batch.batchId(), batch.sourceSystem(), outcome,
            wasCancelled ? " (cancelled)" : "", report.getAcceptedCount(), report.getRejectedCount(), report.getAmbiguousCount()
        );
        return batch;
    }

    /**
     * SHA-256 over the source system and the uploaded bytes, hex encoded.
     */
    static String contentHash(String sourceSystem, byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(sourceSystem.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(content);
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
