package edu.harvard.hms.dbmi.avillach.inventory.processing.schema;

import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.UploadFormat;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.*;
import edu.harvard.hms.dbmi.avillach.inventory.exception.SchemaConflictException;
import edu.harvard.hms.dbmi.avillach.inventory.exception.UnknownVersionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

class SchemaRegistryTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path schemaDirectory;

    private SchemaRegistry schemaRegistry;

    private final VariableDefinition age = VariableDefinition.of("age", "visit", VariableType.NUMERIC, VariableConstraints.range(0.0, 120.0, true));
    private final VariableDefinition diagnosis =
        VariableDefinition.of("diagnosis", "visit", VariableType.CATEGORICAL, VariableConstraints.enumeration(List.of("A", "B")));

    @BeforeEach
    public void setup() {
        schemaRegistry = new SchemaRegistry(schemaDirectory, CLOCK);
    }

    @Test
    public void current_nothingPublished_throwsUnknownVersion() {
        assertThrows(UnknownVersionException.class, () -> schemaRegistry.current());
        assertTrue(schemaRegistry.latest().isEmpty());
    }

    @Test
    public void publish_firstDraft_createsVersionOne() {
        SchemaVersion version = schemaRegistry.publish(List.of(age, diagnosis));

        assertEquals(1, version.version());
        assertEquals(CLOCK.instant(), version.publishedAt());
        assertEquals(List.of("age", "diagnosis"), List.copyOf(version.variables().keySet()));
        assertTrue(version.datasets().containsKey("visit"));
        assertSame(version, schemaRegistry.current());
    }

    @Test
    public void publish_amendment_overlaysCurrentVersion() {
        schemaRegistry.publish(List.of(age));
        VariableDefinition bmi = VariableDefinition.of("bmi", "visit", VariableType.NUMERIC, null);

        SchemaVersion second = schemaRegistry.publish(List.of(bmi));

        assertEquals(2, second.version());
        assertTrue(second.definition("age").isPresent());
        assertTrue(second.definition("bmi").isPresent());
        assertFalse(schemaRegistry.get(1).definition("bmi").isPresent());
        assertEquals(List.of(1, 2), schemaRegistry.versions());
    }

    @Test
    public void publish_typeChangeOfExistingVariable_throwsSchemaConflict() {
        schemaRegistry.publish(List.of(age));
        VariableDefinition ageAsText = VariableDefinition.of("age", "visit", VariableType.TEXT, null);

        SchemaConflictException exception = assertThrows(SchemaConflictException.class, () -> schemaRegistry.publish(List.of(ageAsText)));

        assertEquals(1, exception.getConflicts().size());
        assertTrue(exception.getConflicts().get(0).contains("cannot be redefined as TEXT"));
        assertEquals(1, schemaRegistry.current().version());
    }

    @Test
    public void publish_sameNameTwiceWithDifferentTypes_throwsSchemaConflict() {
        VariableDefinition ageAsDate = VariableDefinition.of("age", "visit", VariableType.DATE, null);

        assertThrows(SchemaConflictException.class, () -> schemaRegistry.publish(List.of(age, ageAsDate)));
        assertTrue(schemaRegistry.latest().isEmpty());
    }

    @Test
    public void publish_constraintsForWrongType_throwsSchemaConflict() {
        VariableDefinition sex = VariableDefinition.of("sex", "visit", VariableType.CATEGORICAL, VariableConstraints.range(0.0, 1.0, false));

        SchemaConflictException exception = assertThrows(SchemaConflictException.class, () -> schemaRegistry.publish(List.of(sex)));
        assertTrue(exception.getConflicts().get(0).startsWith("variable sex"));
    }

    @Test
    public void get_unknownVersion_throwsUnknownVersion() {
        schemaRegistry.publish(List.of(age));

        UnknownVersionException exception = assertThrows(UnknownVersionException.class, () -> schemaRegistry.get(7));
        assertEquals("UnknownVersion", exception.getCode());
    }

    @Test
    public void retire_publishesNewVersionWithMarker() {
        schemaRegistry.publish(List.of(age, diagnosis));

        SchemaVersion second = schemaRegistry.retire("diagnosis");

        assertEquals(2, second.version());
        assertTrue(second.definition("diagnosis").orElseThrow().retired());
        assertFalse(schemaRegistry.get(1).definition("diagnosis").orElseThrow().retired());
        assertEquals(1, second.getActiveDefinitions().size());
        assertSame(second, schemaRegistry.retire("diagnosis"));
    }

    @Test
    public void retire_unknownVariable_throwsSchemaConflict() {
        schemaRegistry.publish(List.of(age));

        assertThrows(SchemaConflictException.class, () -> schemaRegistry.retire("weight"));
    }

    @Test
    public void constructor_existingDirectory_reloadsPublishedVersions() {
        schemaRegistry.publish(List.of(age), List.of(new DatasetDefinition("visit", "Clinic visits", UploadFormat.CSV, "visit.csv", null, 0)));
        schemaRegistry.publish(List.of(diagnosis));

        SchemaRegistry reloaded = new SchemaRegistry(schemaDirectory, CLOCK);

        assertEquals(List.of(1, 2), reloaded.versions());
        assertEquals(schemaRegistry.get(2), reloaded.current());
        assertEquals("visit.csv", reloaded.current().datasets().get("visit").fileName());
    }

    @Test
    public void publish_concurrentDrafts_assignsDistinctVersions() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<SchemaVersion>> futures = new CopyOnWriteArrayList<>();
            for (int i = 0; i < 8; i++) {
                VariableDefinition definition = VariableDefinition.of("var" + i, "visit", VariableType.TEXT, null);
                futures.add(executor.submit(() -> schemaRegistry.publish(List.of(definition))));
            }
            for (Future<SchemaVersion> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(8, schemaRegistry.current().version());
        assertEquals(8, schemaRegistry.current().variables().size());
    }
}
