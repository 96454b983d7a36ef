package edu.harvard.hms.dbmi.avillach.inventory.ingest.pipeline;

import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.FailureReason;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.SchemaVersion;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableConstraints;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableType;
import edu.harvard.hms.dbmi.avillach.inventory.ingest.parse.ParsedRow;
import edu.harvard.hms.dbmi.avillach.inventory.util.NullSentinelDetector;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RowValidatorTest {

    private static final List<String> PARTICIPANT_ID_COLUMNS = List.of("participant_id", "SubjID");
    private static final List<String> IDENTITY_ATTRIBUTES = List.of("date_of_birth", "name");

    private final VariableDefinition age = VariableDefinition.of("age", "visit", VariableType.NUMERIC, VariableConstraints.range(0.0, 120.0, true));
    private final VariableDefinition sex =
        VariableDefinition.of("sex", "visit", VariableType.CATEGORICAL, VariableConstraints.enumeration(List.of("F", "M"))).asRequired();
    private final VariableDefinition visitDate = new VariableDefinition(
        "visit_date", "visit", VariableType.DATE, false, false, null, "Visit Date", false, null
    );
    private final VariableDefinition oldCode = VariableDefinition.of("old_code", "visit", VariableType.TEXT, null).asRetired();

    private final SchemaVersion schema = new SchemaVersion(
        3, Instant.EPOCH, Map.of("age", age, "sex", sex, "visit_date", visitDate, "old_code", oldCode), Map.of()
    );

    private final RowValidator rowValidator = new RowValidator(new NullSentinelDetector());

    private ColumnPlan plan(String... header) {
        return ColumnPlan.of(List.of(header), schema, null, PARTICIPANT_ID_COLUMNS, IDENTITY_ATTRIBUTES);
    }

    @Test
    public void columnPlan_mapsParticipantIdentityAndSourceColumns() {
        ColumnPlan plan = plan("SubjID", "Name", "age", "sex", "Visit Date");

        assertEquals(0, plan.participantIdIndex());
        assertEquals(Map.of(1, "name"), plan.identityColumns());
        assertEquals(List.of("age", "sex", "visit_date"), plan.variableColumns().values().stream().map(VariableDefinition::name).toList());
        assertTrue(plan.headerFailures().isEmpty());
    }

    @Test
    public void columnPlan_reportsHeaderProblems() {
        ColumnPlan plan = plan("age", "old_code", "weight", "");

        List<FailureReason> reasons = plan.headerFailures().stream().map(failure -> failure.reason()).toList();
        assertTrue(reasons.contains(FailureReason.MALFORMED_ROW), "blank header");
        assertEquals(2, reasons.stream().filter(reason -> reason == FailureReason.UNKNOWN_VARIABLE).count(), "retired and unknown columns");
        assertTrue(plan.headerFailures().stream().anyMatch(failure -> failure.detail().startsWith("no participant id column")));
        assertTrue(plan.headerFailures().stream().anyMatch(failure -> "sex".equals(failure.variable())), "required sex has no column");
    }

    @Test
    public void validate_canonicalizesValuesAndCollectsIdentityAttributes() {
        ColumnPlan plan = plan("participant_id", "name", "age", "sex", "Visit Date");

        RowValidator.RowCheck check = rowValidator.validate(ParsedRow.of(1, List.of(" P1 ", "Ana Silva", "034", "F", "2024-03-01")), plan);

        assertTrue(check.passed());
        assertEquals("P1", check.participantKey());
        assertEquals(Map.of("name", "Ana Silva"), check.identityAttributes());
        assertEquals("34", check.values().get("age"));
        assertEquals("F", check.values().get("sex"));
        assertEquals("2024-03-01", check.values().get("visit_date"));
    }

    @Test
    public void validate_collectsEveryFailureOfTheRow() {
        ColumnPlan plan = plan("participant_id", "age", "sex", "Visit Date");

        RowValidator.RowCheck check = rowValidator.validate(ParsedRow.of(4, List.of("P1", "121", "", "n/a")), plan);

        assertFalse(check.passed());
        assertEquals(3, check.failures().size());
        assertEquals(FailureReason.CONSTRAINT_VIOLATION, check.failures().get(0).reason());
        assertEquals("sex is required", check.failures().get(1).detail());
        assertEquals("visit_date must not be empty", check.failures().get(2).detail());
    }

    @Test
    public void validate_sentinelParticipantIdIsMissing() {
        RowValidator.RowCheck check = rowValidator.validate(ParsedRow.of(1, List.of("NULL", "40", "M")), plan("participant_id", "age", "sex"));

        assertNull(check.participantKey());
        assertEquals(FailureReason.MISSING_REQUIRED, check.failures().get(0).reason());
    }

    @Test
    public void validate_customSentinelsReplaceDefaults() {
        RowValidator custom = new RowValidator(new NullSentinelDetector(Set.of("-999")));
        ColumnPlan plan = plan("participant_id", "age", "sex");

        assertTrue(custom.validate(ParsedRow.of(1, List.of("P1", "-999", "M")), plan).passed());
        assertEquals(
            FailureReason.TYPE_MISMATCH, custom.validate(ParsedRow.of(2, List.of("P2", "NA", "M")), plan).failures().get(0).reason()
        );
    }

    @Test
    public void validate_structuralErrorOnly() {
        RowValidator.RowCheck check = rowValidator.validate(ParsedRow.malformed(7, "expected 3 fields, found 2"), plan("participant_id", "age"));

        assertEquals(1, check.failures().size());
        assertEquals(FailureReason.MALFORMED_ROW, check.failures().get(0).reason());
    }
}
