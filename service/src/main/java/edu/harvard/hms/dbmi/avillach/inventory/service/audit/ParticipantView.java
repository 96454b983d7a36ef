package edu.harvard.hms.dbmi.avillach.inventory.service.audit;

import edu.harvard.hms.dbmi.avillach.inventory.data.participant.Participant;
import edu.harvard.hms.dbmi.avillach.inventory.data.store.VariableValue;

import java.util.Map;

/**
 * A participant with its current values and the {@code has_<dataset>} availability flags.
 */
public record ParticipantView(Participant participant, Map<String, VariableValue> currentValues, Map<String, Boolean> datasets) {
}
