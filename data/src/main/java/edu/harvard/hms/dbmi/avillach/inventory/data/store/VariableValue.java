package edu.harvard.hms.dbmi.avillach.inventory.data.store;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One entry of the entity-attribute-value store. Values are never updated; a newer value for the same participant and variable names
 * its predecessor in {@code supersedes}.
 *
 * @param valueId store-wide, strictly increasing id
 * @param schemaVersion version of the schema whose definition of {@code variable} the value was validated against
 * @param value canonical text form of the value
 * @param supersedes id of the value this one replaced, null for the first value of a chain
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VariableValue(
    long valueId, int participantId, String variable, int schemaVersion, String value, String batchId, Instant recordedAt, Long supersedes
) {
}
