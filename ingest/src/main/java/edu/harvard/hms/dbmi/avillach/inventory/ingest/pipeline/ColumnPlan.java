package edu.harvard.hms.dbmi.avillach.inventory.ingest.pipeline;

import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.FailureReason;
import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.RowFailure;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.SchemaVersion;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableDefinition;

import java.util.*;

/**
 * How the columns of one upload map onto the schema version it is validated against. Header problems apply to every row of the
 * batch and are kept as {@link #headerFailures()}.
 *
 * @param participantIdIndex column holding the source-local participant key, -1 when the header has none
 * @param variableColumns column index to the active variable read from it
 * @param identityColumns column index to the identity attribute read from it
 */
public record ColumnPlan(
    int participantIdIndex, SortedMap<Integer, VariableDefinition> variableColumns, SortedMap<Integer, String> identityColumns,
    List<RowFailure> headerFailures
) {

    public ColumnPlan {
        headerFailures = List.copyOf(headerFailures);
    }

    /**
     * @param participantIdColumns canonical participant id column name followed by its aliases
     * @param identityAttributes names of the columns that carry identity attributes rather than variables
     * @param dataset the dataset the upload belongs to, null to match columns against every dataset
     */
    public static ColumnPlan of(
        List<String> header, SchemaVersion schema, String dataset, List<String> participantIdColumns, List<String> identityAttributes
    ) {
        int participantIdIndex = -1;
        SortedMap<Integer, VariableDefinition> variableColumns = new TreeMap<>();
        SortedMap<Integer, String> identityColumns = new TreeMap<>();
        List<RowFailure> failures = new ArrayList<>();
        Map<String, String> columnOfVariable = new HashMap<>();

        for (int i = 0; i < header.size(); i++) {
            String column = header.get(i) == null ? "" : header.get(i).trim();
            if (column.isEmpty()) {
                failures.add(RowFailure.of(FailureReason.MALFORMED_ROW, "column " + (i + 1) + " has no header"));
                continue;
            }
            if (participantIdColumns.contains(column)) {
                if (participantIdIndex >= 0) {
                    failures.add(
                        new RowFailure(
                            FailureReason.MALFORMED_ROW, column,
                            "duplicate participant id column: '" + header.get(participantIdIndex).trim() + "' and '" + column + "'"
                        )
                    );
                } else {
                    participantIdIndex = i;
                }
                continue;
            }
            String identityAttribute = identityAttributes.stream().filter(column::equalsIgnoreCase).findFirst().orElse(null);
            if (identityAttribute != null) {
                if (identityColumns.containsValue(identityAttribute)) {
                    failures.add(new RowFailure(FailureReason.MALFORMED_ROW, column, "duplicate identity column '" + column + "'"));
                } else {
                    identityColumns.put(i, identityAttribute);
                }
                continue;
            }

            Optional<VariableDefinition> definition = schema.findByColumn(column, dataset);
            if (definition.isEmpty()) {
                failures.add(
                    new RowFailure(
                        FailureReason.UNKNOWN_VARIABLE, column,
                        "column '" + column + "' is not a variable of schema version " + schema.version()
                            + (dataset == null ? "" : " for dataset " + dataset)
                    )
                );
            } else if (definition.get().retired()) {
                failures.add(
                    new RowFailure(
                        FailureReason.UNKNOWN_VARIABLE, column,
                        "column '" + column + "' maps to retired variable " + definition.get().name()
                    )
                );
            } else {
                String previous = columnOfVariable.putIfAbsent(definition.get().name(), column);
                if (previous != null) {
                    failures.add(
                        new RowFailure(
                            FailureReason.MALFORMED_ROW, definition.get().name(),
                            "columns '" + previous + "' and '" + column + "' both map to variable " + definition.get().name()
                        )
                    );
                } else {
                    variableColumns.put(i, definition.get());
                }
            }
        }

        if (participantIdIndex < 0) {
            failures.add(
                RowFailure.of(FailureReason.MISSING_REQUIRED, "no participant id column (expected one of " + participantIdColumns + ")")
            );
        }

        Set<String> datasets = new TreeSet<>();
        if (dataset != null) {
            datasets.add(dataset);
        } else {
            variableColumns.values().forEach(definition -> datasets.add(definition.dataset()));
        }
        for (String covered : datasets) {
            for (VariableDefinition definition : schema.variablesOf(covered)) {
                if (!definition.required() || definition.retired()) {
                    continue;
                }
                if (!columnOfVariable.containsKey(definition.name())) {
                    failures.add(
                        new RowFailure(
                            FailureReason.MISSING_REQUIRED, definition.name(), "required variable " + definition.name() + " has no column"
                        )
                    );
                }
            }
        }
        return new ColumnPlan(participantIdIndex, variableColumns, identityColumns, failures);
    }
}
