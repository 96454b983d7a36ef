package edu.harvard.hms.dbmi.avillach.inventory.processing.identity;

import edu.harvard.hms.dbmi.avillach.inventory.data.participant.Participant;
import edu.harvard.hms.dbmi.avillach.inventory.data.participant.SourceIdentifier;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CandidateMatcherTest {

    private final CandidateMatcher matcher = new CandidateMatcher(MatchingConfig.DEFAULT);

    private final SourceIdentifier incoming = new SourceIdentifier("registry", "R-17");

    @Test
    public void normalize_stripsAccentsCaseAndWhitespace() {
        Map<String, String> normalized = CandidateMatcher.normalize(Map.of("Name", "  José   GARCÍA ", "date_of_birth", "1980-02-01", "note", " "));

        assertEquals(Map.of("name", "jose garcia", "date_of_birth", "1980-02-01"), normalized);
    }

    @Test
    public void match_missingBlockingKey_returnsNoCandidates() {
        CandidateMatcher.MatchOutcome outcome =
            matcher.match(incoming, CandidateMatcher.normalize(Map.of("name", "Ana Silva")), List.of(participant(1, "clinic", "ana silva")));

        assertTrue(outcome.candidates().isEmpty());
    }

    @Test
    public void match_blocksOnDateOfBirthAndScoresName() {
        List<Participant> participants = List.of(
            participant(1, "clinic", "ana silva"),
            participant(2, "clinic", "ana silvia"),
            new Participant(3, List.of(new SourceIdentifier("clinic", "C-3")), Map.of("name", "ana silva", "date_of_birth", "1991-01-01"), Instant.EPOCH)
        );

        CandidateMatcher.MatchOutcome outcome =
            matcher.match(incoming, CandidateMatcher.normalize(Map.of("name", "Ana Silva", "date_of_birth", "1980-02-01")), participants);

        assertEquals(List.of(1, 2), outcome.candidateIds());
        assertEquals(1.0, outcome.bestScore());
        assertEquals(2, outcome.aboveThreshold().size());
    }

    @Test
    public void match_participantAlreadyKnownToSameSource_isNotACandidate() {
        Participant sameSource = participant(1, "registry", "ana silva");

        CandidateMatcher.MatchOutcome outcome =
            matcher.match(incoming, CandidateMatcher.normalize(Map.of("name", "Ana Silva", "date_of_birth", "1980-02-01")), List.of(sameSource));

        assertTrue(outcome.candidates().isEmpty());
    }

    @Test
    public void match_isDeterministicRegardlessOfInputOrder() {
        List<Participant> participants = List.of(participant(5, "clinic", "maria lopez"), participant(2, "clinic", "maria lopez"));
        Map<String, String> attributes = CandidateMatcher.normalize(Map.of("name", "Maria Lopez", "date_of_birth", "1980-02-01"));

        assertEquals(List.of(2, 5), matcher.match(incoming, attributes, participants).candidateIds());
        assertEquals(List.of(2, 5), matcher.match(incoming, attributes, List.of(participants.get(1), participants.get(0))).candidateIds());
    }

    @Test
    public void score_noComparableAttributes_isZero() {
        assertEquals(0.0, matcher.score(Map.of("date_of_birth", "1980-02-01"), Map.of("name", "ana")));
    }

    private static Participant participant(int participantId, String sourceSystem, String name) {
        return new Participant(
            participantId, List.of(new SourceIdentifier(sourceSystem, "K-" + participantId)), Map.of("name", name, "date_of_birth", "1980-02-01"),
            Instant.EPOCH
        );
    }
}
