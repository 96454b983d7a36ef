package edu.harvard.hms.dbmi.avillach.inventory.processing.identity;

import edu.harvard.hms.dbmi.avillach.inventory.data.participant.Participant;
import edu.harvard.hms.dbmi.avillach.inventory.data.participant.SourceIdentifier;
import org.apache.commons.text.similarity.JaroWinklerSimilarity;

import java.text.Normalizer;
import java.util.*;

/**
 * Deterministic candidate matching: blocking on exact normalized keys, then a mean Jaro-Winkler score over the similarity attributes.
 * Holds no state besides its configuration; the same inputs always produce the same outcome.
 */
public class CandidateMatcher {

    private static final JaroWinklerSimilarity SIMILARITY = new JaroWinklerSimilarity();

    private final MatchingConfig config;

    public CandidateMatcher(MatchingConfig config) {
        this.config = config;
    }

    public MatchingConfig getConfig() {
        return config;
    }

    public record ScoredCandidate(int participantId, double score) {
    }

    /**
     * @param candidates every blocked candidate, best score first (ties by participant id)
     */
    public record MatchOutcome(List<ScoredCandidate> candidates, double threshold) {

        public List<ScoredCandidate> aboveThreshold() {
            return candidates.stream().filter(candidate -> candidate.score() >= threshold).toList();
        }

        public double bestScore() {
            return candidates.isEmpty() ? 0.0 : candidates.get(0).score();
        }

        public List<Integer> candidateIds() {
            return candidates.stream().map(ScoredCandidate::participantId).toList();
        }
    }

    /**
     * Scores {@code participants} against an incoming record. Participants that already carry an identifier from the incoming source
     * system are never candidates, since a source knows each person under one key.
     *
     * @param attributes the incoming record's attributes, already {@link #normalize normalized}
     */
    public MatchOutcome match(SourceIdentifier incoming, Map<String, String> attributes, Collection<Participant> participants) {
        if (config.blockingKeys().isEmpty() || !config.blockingKeys().stream().allMatch(attributes::containsKey)) {
            return new MatchOutcome(List.of(), config.threshold());
        }
        List<ScoredCandidate> candidates = new ArrayList<>();
        for (Participant participant : participants) {
            boolean sameSource = participant.sourceIdentifiers().stream()
                .anyMatch(identifier -> identifier.sourceSystem().equals(incoming.sourceSystem()));
            if (sameSource || !blocks(attributes, participant.attributes())) {
                continue;
            }
            candidates.add(new ScoredCandidate(participant.participantId(), score(attributes, participant.attributes())));
        }
        candidates.sort(
            Comparator.comparingDouble(ScoredCandidate::score).reversed().thenComparingInt(ScoredCandidate::participantId)
        );
        return new MatchOutcome(candidates, config.threshold());
    }

    private boolean blocks(Map<String, String> incoming, Map<String, String> existing) {
        return config.blockingKeys().stream().allMatch(key -> incoming.get(key).equals(existing.get(key)));
    }

    double score(Map<String, String> incoming, Map<String, String> existing) {
        double total = 0;
        int compared = 0;
        for (String attribute : config.similarityAttributes()) {
            String left = incoming.get(attribute);
            String right = existing.get(attribute);
            if (left != null && right != null) {
                total += SIMILARITY.apply(left, right);
                compared++;
            }
        }
        return compared == 0 ? 0.0 : total / compared;
    }

    /**
     * Lower-cases names and values, strips accents, collapses whitespace and drops blank values.
     */
    public static Map<String, String> normalize(Map<String, String> attributes) {
        Map<String, String> normalized = new TreeMap<>();
        if (attributes == null) {
            return normalized;
        }
        attributes.forEach((name, value) -> {
            if (name == null || value == null || value.isBlank()) {
                return;
            }
            normalized.put(name.trim().toLowerCase(Locale.ENGLISH), normalizeValue(value));
        });
        return normalized;
    }

    private static String normalizeValue(String value) {
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        return decomposed.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ENGLISH);
    }
}
