package edu.harvard.hms.dbmi.avillach.inventory.ingest.pipeline;

import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.FailureReason;
import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.RowFailure;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.ingest.parse.ParsedRow;
import edu.harvard.hms.dbmi.avillach.inventory.util.NullSentinelDetector;

import java.util.*;

/**
 * Structural and schema validation of one row. Every problem of the row is reported, not only the first.
 */
public class RowValidator {

    private final NullSentinelDetector nullSentinelDetector;

    public RowValidator(NullSentinelDetector nullSentinelDetector) {
        this.nullSentinelDetector = nullSentinelDetector;
    }

    /**
     * @param values canonical values of the row by variable name; null cells are absent
     * @param identityAttributes identity attribute values of the row, blank cells absent
     */
    public record RowCheck(String participantKey, Map<String, String> values, Map<String, String> identityAttributes, List<RowFailure> failures) {

        public boolean passed() {
            return failures.isEmpty();
        }
    }

    public RowCheck validate(ParsedRow row, ColumnPlan plan) {
        if (row.structuralError() != null) {
            return new RowCheck(null, Map.of(), Map.of(), List.of(RowFailure.of(FailureReason.MALFORMED_ROW, row.structuralError())));
        }
        List<RowFailure> failures = new ArrayList<>(plan.headerFailures());

        String participantKey = null;
        if (plan.participantIdIndex() >= 0) {
            String raw = row.cell(plan.participantIdIndex());
            if (isNull(raw)) {
                failures.add(RowFailure.of(FailureReason.MISSING_REQUIRED, "participant id is empty"));
            } else {
                participantKey = raw.trim();
            }
        }

        Map<String, String> identityAttributes = new LinkedHashMap<>();
        plan.identityColumns().forEach((index, attribute) -> {
            String raw = row.cell(index);
            if (!isNull(raw)) {
                identityAttributes.put(attribute, raw.trim());
            }
        });

        Map<String, String> values = new LinkedHashMap<>();
        plan.variableColumns().forEach((index, definition) -> {
            String raw = row.cell(index);
            if (isNull(raw)) {
                if (definition.required()) {
                    failures.add(new RowFailure(FailureReason.MISSING_REQUIRED, definition.name(), definition.name() + " is required"));
                } else if (!definition.nullable()) {
                    failures.add(new RowFailure(FailureReason.MISSING_REQUIRED, definition.name(), definition.name() + " must not be empty"));
                }
                return;
            }
            VariableDefinition.ValueCheck check = definition.check(raw);
            if (check.isValid()) {
                values.put(definition.name(), check.canonicalValue());
            } else {
                failures.add(new RowFailure(check.failureReason(), definition.name(), check.detail()));
            }
        });
        return new RowCheck(participantKey, values, identityAttributes, failures);
    }

    private boolean isNull(String raw) {
        return raw == null || raw.isBlank() || nullSentinelDetector.isNullSentinel(raw);
    }
}
