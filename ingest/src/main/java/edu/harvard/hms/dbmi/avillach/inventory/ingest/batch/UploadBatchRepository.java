package edu.harvard.hms.dbmi.avillach.inventory.ingest.batch;

import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.UploadBatch;
import edu.harvard.hms.dbmi.avillach.inventory.storage.JsonLinesJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Closed upload batches with their validation reports, journaled so that reports and duplicate detection survive restarts.
 *
 * Only batches that ran to completion are indexed by content hash: a cancelled batch or one rejected before any row was examined
 * has to be re-submittable.
 */
@Component
public class UploadBatchRepository implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UploadBatchRepository.class);

    private final JsonLinesJournal<UploadBatch> journal;
    private final Map<String, UploadBatch> batches = new ConcurrentHashMap<>();
    private final Map<String, UploadBatch> batchesByContentHash = new ConcurrentHashMap<>();

    @Autowired
    public UploadBatchRepository(@Value("${INVENTORY_DATA_DIRECTORY:/opt/local/inventory/}") String dataDirectory) {
        this(Path.of(dataDirectory, "batches.jsonl"));
    }

    public UploadBatchRepository(Path journalFile) {
        this.journal = new JsonLinesJournal<>(journalFile, UploadBatch.class);
        journal.replay().forEach(this::index);
        log.info("Loaded {} upload batch(es), {} indexed for duplicate detection", batches.size(), batchesByContentHash.size());
    }

    public void save(UploadBatch batch) {
        journal.append(batch);
        index(batch);
    }

    public Optional<UploadBatch> find(String batchId) {
        return Optional.ofNullable(batches.get(batchId));
    }

    public Optional<UploadBatch> findByContentHash(String contentHash) {
        return Optional.ofNullable(batchesByContentHash.get(contentHash));
    }

    public List<UploadBatch> findAll() {
        return batches.values().stream().sorted(Comparator.comparing(UploadBatch::submittedAt)).toList();
    }

    public static boolean isDeduplicable(UploadBatch batch) {
        return !batch.cancelled() && batch.report().batchError() == null;
    }

    private void index(UploadBatch batch) {
        batches.put(batch.batchId(), batch);
        if (isDeduplicable(batch)) {
            batchesByContentHash.putIfAbsent(batch.contentHash(), batch);
        }
    }

    @Override
    public void close() throws IOException {
        journal.close();
    }
}
