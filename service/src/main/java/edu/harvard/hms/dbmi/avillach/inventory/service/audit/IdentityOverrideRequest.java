package edu.harvard.hms.dbmi.avillach.inventory.service.audit;

/**
 * @param participantId participant to attach the identifier to, null to create a new participant
 */
public record IdentityOverrideRequest(String sourceSystem, String sourceLocalKey, Integer participantId) {
}
