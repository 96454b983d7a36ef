package edu.harvard.hms.dbmi.avillach.inventory.processing.query;

import edu.harvard.hms.dbmi.avillach.inventory.data.query.CohortQuery;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.SchemaVersion;

/**
 * A cohort query that passed validation against {@code schema}. Always carries an id.
 *
 * @param schema the version the predicates were validated against, null for a query without a clause
 */
public record CompiledQuery(CohortQuery query, SchemaVersion schema) {
}
