package edu.harvard.hms.dbmi.avillach.inventory.processing.identity;

import edu.harvard.hms.dbmi.avillach.inventory.data.participant.Participant;

import java.util.List;

/**
 * Outcome of {@link IdentityResolver#resolve}. {@code participant} is null only for {@link ResolutionMethod#AMBIGUOUS}.
 *
 * @param candidates ids of the participants that were scored, best first
 */
public record Resolution(ResolutionMethod method, Participant participant, double score, List<Integer> candidates) {

    public Resolution {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static Resolution ambiguous(double bestScore, List<Integer> candidates) {
        return new Resolution(ResolutionMethod.AMBIGUOUS, null, bestScore, candidates);
    }

    public boolean resolved() {
        return participant != null;
    }
}
