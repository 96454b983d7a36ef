package edu.harvard.hms.dbmi.avillach.inventory.data.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.collect.ImmutableSortedMap;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;

/**
 * An immutable, published version of the schema contract.
 */
public record SchemaVersion(
    int version, Instant publishedAt, SortedMap<String, VariableDefinition> variables, SortedMap<String, DatasetDefinition> datasets
) {

    public SchemaVersion {
        variables = variables == null ? ImmutableSortedMap.of() : ImmutableSortedMap.copyOfSorted(variables);
        datasets = datasets == null ? ImmutableSortedMap.of() : ImmutableSortedMap.copyOfSorted(datasets);
    }

    public SchemaVersion(int version, Instant publishedAt, Map<String, VariableDefinition> variables,
        Map<String, DatasetDefinition> datasets) {
        this(version, publishedAt, ImmutableSortedMap.copyOf(variables), ImmutableSortedMap.copyOf(datasets));
    }

    public Optional<VariableDefinition> definition(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    @JsonIgnore
    public List<VariableDefinition> getActiveDefinitions() {
        return variables.values().stream().filter(definition -> !definition.retired()).toList();
    }

    public List<VariableDefinition> variablesOf(String dataset) {
        return variables.values().stream().filter(definition -> definition.dataset().equals(dataset)).toList();
    }

    /**
     * Finds the variable an uploaded column refers to, by declared source column first and variable name second. When a dataset is
     * given only its variables are considered.
     */
    public Optional<VariableDefinition> findByColumn(String column, String dataset) {
        List<VariableDefinition> candidates = dataset == null ? List.copyOf(variables.values()) : variablesOf(dataset);
        return candidates.stream().filter(definition -> column.equals(definition.sourceColumn())).findFirst()
            .or(() -> candidates.stream().filter(definition -> column.equals(definition.name())).findFirst());
    }
}
