package edu.harvard.hms.dbmi.avillach.inventory.data.participant;

/**
 * A participant key as known to one contributing source system.
 */
public record SourceIdentifier(String sourceSystem, String sourceLocalKey) {

    @Override
    public String toString() {
        return sourceSystem + ":" + sourceLocalKey;
    }
}
