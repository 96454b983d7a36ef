package edu.harvard.hms.dbmi.avillach.inventory.ingest.pipeline;

import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.UploadBatch;
import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.UploadFormat;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.DatasetDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.SchemaVersion;
import edu.harvard.hms.dbmi.avillach.inventory.exception.InventoryException;
import edu.harvard.hms.dbmi.avillach.inventory.processing.schema.SchemaRegistry;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads every dataset file of a schema version from a directory, one batch per dataset. Datasets without a configured file name or
 * whose file is missing are skipped.
 */
@Component
public class BulkImporter {
    private static final Logger log = LoggerFactory.getLogger(BulkImporter.class);

    private final SchemaRegistry schemaRegistry;
    private final IngestionPipeline ingestionPipeline;

    @Autowired
    public BulkImporter(SchemaRegistry schemaRegistry, IngestionPipeline ingestionPipeline) {
        this.schemaRegistry = schemaRegistry;
        this.ingestionPipeline = ingestionPipeline;
    }

    public List<UploadBatch> importDirectory(Path directory, String sourceSystem) {
        return importDirectory(directory, schemaRegistry.current(), sourceSystem);
    }

    public List<UploadBatch> importDirectory(Path directory, SchemaVersion schema, String sourceSystem) {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Bulk import directory not found: " + directory);
        }
        log.info("Bulk import of {} against schema version {}", directory, schema.version());

        List<UploadBatch> batches = new ArrayList<>();
        for (DatasetDefinition dataset : schema.datasets().values()) {
            if (dataset.fileName() == null) {
                log.debug("Dataset {} has no file name, skipping", dataset.name());
                continue;
            }
            Path file = directory.resolve(dataset.fileName());
            if (!Files.isRegularFile(file)) {
                log.warn("File {} for dataset {} not found, skipping", file, dataset.name());
                continue;
            }
            try {
                UploadFormat format = dataset.kind() != null ? dataset.kind() : UploadFormat.fromName(dataset.fileName());
                byte[] content = FileUtils.readFileToByteArray(file.toFile());
                UploadBatch batch = ingestionPipeline.ingest(
                    new RawBatch(format, content, dataset.name(), dataset.sheetName()), schema.version(), sourceSystem, sourceSystem
                );
                log.info("Dataset {}: batch {} {}", dataset.name(), batch.batchId(), batch.outcome());
                batches.add(batch);
            } catch (IOException | IllegalArgumentException | InventoryException e) {
                log.error("Dataset {} from {} could not be imported, skipping", dataset.name(), file, e);
            }
        }
        log.info("Bulk import of {} finished: {} batch(es)", directory, batches.size());
        return batches;
    }
}
