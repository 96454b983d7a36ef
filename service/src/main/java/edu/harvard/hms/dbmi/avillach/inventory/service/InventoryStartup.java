package edu.harvard.hms.dbmi.avillach.inventory.service;

import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.UploadBatch;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.DatasetDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.SchemaVersion;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.exception.ValidationException;
import edu.harvard.hms.dbmi.avillach.inventory.ingest.config.IngestConfig;
import edu.harvard.hms.dbmi.avillach.inventory.ingest.pipeline.BulkImporter;
import edu.harvard.hms.dbmi.avillach.inventory.processing.schema.SchemaDefinitionLoader;
import edu.harvard.hms.dbmi.avillach.inventory.processing.schema.SchemaDefinitions;
import edu.harvard.hms.dbmi.avillach.inventory.processing.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Optional bootstrap on startup: publishes the schema described by {@code ingest.schema-dir} when it differs from the current version,
 * then loads the dataset files found in {@code ingest.bulk-import-dir}.
 */
@Component
public class InventoryStartup implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(InventoryStartup.class);

    private final IngestConfig config;
    private final SchemaDefinitionLoader schemaDefinitionLoader;
    private final SchemaRegistry schemaRegistry;
    private final BulkImporter bulkImporter;

    @Autowired
    public InventoryStartup(
        IngestConfig config, SchemaDefinitionLoader schemaDefinitionLoader, SchemaRegistry schemaRegistry, BulkImporter bulkImporter
    ) {
        this.config = config;
        this.schemaDefinitionLoader = schemaDefinitionLoader;
        this.schemaRegistry = schemaRegistry;
        this.bulkImporter = bulkImporter;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (config.getSchemaDir() != null && !config.getSchemaDir().isBlank()) {
            publishSchemaDirectory(Path.of(config.getSchemaDir()));
        }
        if (config.getBulkImportDir() != null && !config.getBulkImportDir().isBlank()) {
            List<UploadBatch> batches = bulkImporter.importDirectory(Path.of(config.getBulkImportDir()), config.getBulkImportSource());
            log.info("Startup bulk import produced {} batch(es)", batches.size());
        }
    }

    void publishSchemaDirectory(Path schemaDirectory) {
        SchemaDefinitions definitions;
        try {
            definitions = schemaDefinitionLoader.load(schemaDirectory);
        } catch (ValidationException e) {
            log.error("Schema directory {} is invalid: {}", schemaDirectory, e.getResult());
            throw new IllegalStateException(e.getMessage(), e);
        }

        String participantIdColumn = definitions.participantIdColumn();
        if (!participantIdColumn.equals(config.getParticipantIdColumn()) && !config.getParticipantIdAliases().contains(participantIdColumn)) {
            log.info("Accepting {} from {} as a participant id column", participantIdColumn, SchemaDefinitionLoader.DATASETS_FILE);
            List<String> aliases = new ArrayList<>(config.getParticipantIdAliases());
            aliases.add(participantIdColumn);
            config.setParticipantIdAliases(aliases);
        }

        Optional<SchemaVersion> latest = schemaRegistry.latest();
        if (latest.isPresent() && isPublished(latest.get(), definitions)) {
            log.info("Schema in {} is already published as version {}", schemaDirectory, latest.get().version());
            return;
        }
        SchemaVersion published = schemaRegistry.publish(definitions.variables(), definitions.datasets());
        log.info("Published schema version {} from {}", published.version(), schemaDirectory);
    }

    private static boolean isPublished(SchemaVersion version, SchemaDefinitions definitions) {
        for (VariableDefinition definition : definitions.variables()) {
            if (!definition.equals(version.variables().get(definition.name()))) {
                return false;
            }
        }
        for (DatasetDefinition dataset : definitions.datasets()) {
            if (!dataset.equals(version.datasets().get(dataset.name()))) {
                return false;
            }
        }
        return true;
    }
}
