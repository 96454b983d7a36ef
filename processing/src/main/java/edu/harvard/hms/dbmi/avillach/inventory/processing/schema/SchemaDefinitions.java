package edu.harvard.hms.dbmi.avillach.inventory.processing.schema;

import edu.harvard.hms.dbmi.avillach.inventory.data.schema.DatasetDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableDefinition;

import java.util.List;

/**
 * Datasets and variables read from declarative schema files, ready to be published.
 *
 * @param participantIdColumn canonical participant id column declared by the files; never a variable
 */
public record SchemaDefinitions(List<DatasetDefinition> datasets, List<VariableDefinition> variables, String participantIdColumn) {

    public SchemaDefinitions {
        datasets = List.copyOf(datasets);
        variables = List.copyOf(variables);
    }
}
