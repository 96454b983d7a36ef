package edu.harvard.hms.dbmi.avillach.inventory.data.query;

import java.util.List;

public record ParticipantExplanation(int participantId, List<PredicateMatch> matches) {
}
