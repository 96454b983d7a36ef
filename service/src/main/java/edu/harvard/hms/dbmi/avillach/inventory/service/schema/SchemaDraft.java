package edu.harvard.hms.dbmi.avillach.inventory.service.schema;

import edu.harvard.hms.dbmi.avillach.inventory.data.schema.DatasetDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableDefinition;

import java.util.List;

/**
 * Body of a publish request: variable definitions and, optionally, dataset descriptions.
 */
public record SchemaDraft(List<VariableDefinition> definitions, List<DatasetDefinition> datasets) {

    public SchemaDraft {
        definitions = definitions == null ? List.of() : definitions;
        datasets = datasets == null ? List.of() : datasets;
    }
}
