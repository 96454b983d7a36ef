package edu.harvard.hms.dbmi.avillach.inventory.processing.identity;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import edu.harvard.hms.dbmi.avillach.inventory.data.participant.Participant;
import edu.harvard.hms.dbmi.avillach.inventory.data.participant.SourceIdentifier;
import edu.harvard.hms.dbmi.avillach.inventory.storage.JsonLinesJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntConsumer;

/**
 * Owns the mapping from source identifiers to canonical participants.
 *
 * Resolution is serialized: a decision to create or attach must see every earlier decision, otherwise two rows for the same person
 * arriving from different sources at once could both create a participant. Every decision is journaled before it takes effect and the
 * journal is replayed at startup.
 */
@Component
public class IdentityResolver implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final CandidateMatcher matcher;
    private final Clock clock;
    private final JsonLinesJournal<ResolutionLogEntry> journal;

    private final Map<SourceIdentifier, Integer> participantIdBySource = new ConcurrentHashMap<>();
    private final Map<Integer, Participant> participants = new ConcurrentHashMap<>();
    private final Map<SourceIdentifier, PendingResolution> pending = new ConcurrentHashMap<>();
    private final List<ResolutionLogEntry> auditLog = Collections.synchronizedList(new ArrayList<>());
    private int lastParticipantId = 0;

    @Autowired
    public IdentityResolver(
        @Value("${INVENTORY_DATA_DIRECTORY:/opt/local/inventory/}") String dataDirectory,
        @Value("${identity.blocking-keys:date_of_birth}") String[] blockingKeys,
        @Value("${identity.similarity-attributes:name}") String[] similarityAttributes,
        @Value("${identity.threshold:0.92}") double threshold
    ) {
        this(
            Path.of(dataDirectory, "identity-log.jsonl"), new MatchingConfig(List.of(blockingKeys), List.of(similarityAttributes), threshold),
            Clock.systemUTC()
        );
    }

    public IdentityResolver(Path journalFile, MatchingConfig config, Clock clock) {
        this.matcher = new CandidateMatcher(config);
        this.clock = clock;
        this.journal = new JsonLinesJournal<>(journalFile, ResolutionLogEntry.class);
        journal.replay().forEach(this::apply);
        log.info(
            "Identity resolver ready: {} participants, {} source identifiers, {} pending (blocking on {}, similarity over {}, threshold {})",
            participants.size(), participantIdBySource.size(), pending.size(), config.blockingKeys(), config.similarityAttributes(),
            config.threshold()
        );
    }

    /**
     * Resolves a source identifier to a canonical participant: an already mapped identifier wins; otherwise the single candidate at or
     * above the threshold is attached; with no candidate a participant is created; anything else is ambiguous and nothing changes.
     */
    public Resolution resolve(String sourceSystem, String sourceLocalKey, Map<String, String> candidateAttributes) {
        return resolve(sourceSystem, sourceLocalKey, candidateAttributes, participantId -> {
        });
    }

    /**
     * @param onCreate called with the id of a participant this resolution creates, before the participant is visible
     */
    public synchronized Resolution resolve(
        String sourceSystem, String sourceLocalKey, Map<String, String> candidateAttributes, IntConsumer onCreate
    ) {
        if (sourceSystem == null || sourceSystem.isBlank() || sourceLocalKey == null || sourceLocalKey.isBlank()) {
            throw new IllegalArgumentException("Source system and source-local key are required to resolve a participant");
        }
        SourceIdentifier identifier = new SourceIdentifier(sourceSystem, sourceLocalKey);
        Map<String, String> attributes = CandidateMatcher.normalize(candidateAttributes);

        Integer known = participantIdBySource.get(identifier);
        if (known != null) {
            record(identifier, ResolutionMethod.EXACT, known, 1.0, List.of(known), attributes);
            return new Resolution(ResolutionMethod.EXACT, participants.get(known), 1.0, List.of(known));
        }

        CandidateMatcher.MatchOutcome outcome = matcher.match(identifier, attributes, participants.values());
        List<CandidateMatcher.ScoredCandidate> aboveThreshold = outcome.aboveThreshold();
        if (aboveThreshold.size() == 1) {
            int participantId = aboveThreshold.get(0).participantId();
            record(identifier, ResolutionMethod.MATCHED, participantId, outcome.bestScore(), outcome.candidateIds(), attributes);
            log.info("Matched {} to participant {} (score {})", identifier, participantId, outcome.bestScore());
            return new Resolution(ResolutionMethod.MATCHED, participants.get(participantId), outcome.bestScore(), outcome.candidateIds());
        }
        if (!outcome.candidates().isEmpty()) {
            record(identifier, ResolutionMethod.AMBIGUOUS, null, outcome.bestScore(), outcome.candidateIds(), attributes);
            log.warn(
                "Ambiguous identity for {}: {} candidate(s) {}, {} at or above threshold {}", identifier, outcome.candidates().size(),
                outcome.candidateIds(), aboveThreshold.size(), outcome.threshold()
            );
            return Resolution.ambiguous(outcome.bestScore(), outcome.candidateIds());
        }

        int participantId = lastParticipantId + 1;
        onCreate.accept(participantId);
        record(identifier, ResolutionMethod.CREATED, participantId, 0.0, List.of(), attributes);
        log.debug("Created participant {} for {}", participantId, identifier);
        return new Resolution(ResolutionMethod.CREATED, participants.get(participantId), 0.0, List.of());
    }

    /**
     * Operator decision for a source identifier that is not mapped yet: attach it to {@code participantId}, or create a new participant
     * when {@code participantId} is null. Attributes recorded with a pending resolution are carried over to a created participant.
     *
     * @throws IllegalStateException if the identifier is already mapped
     * @throws NoSuchElementException if {@code participantId} does not exist
     */
    public synchronized Participant override(String sourceSystem, String sourceLocalKey, Integer participantId) {
        SourceIdentifier identifier = new SourceIdentifier(sourceSystem, sourceLocalKey);
        Integer known = participantIdBySource.get(identifier);
        if (known != null) {
            throw new IllegalStateException(identifier + " is already mapped to participant " + known);
        }
        if (participantId != null && !participants.containsKey(participantId)) {
            throw new NoSuchElementException("Participant " + participantId + " does not exist");
        }
        PendingResolution pendingResolution = pending.get(identifier);
        Map<String, String> attributes = pendingResolution == null ? Map.of() : pendingResolution.attributes();
        int target = participantId == null ? lastParticipantId + 1 : participantId;
        record(identifier, ResolutionMethod.OVERRIDE, target, 1.0, List.of(), attributes);
        log.info("Override: {} {} participant {}", identifier, participantId == null ? "created" : "attached to", target);
        return participants.get(target);
    }

    public Optional<Participant> participant(int participantId) {
        return Optional.ofNullable(participants.get(participantId));
    }

    public Optional<Participant> findBySourceIdentifier(String sourceSystem, String sourceLocalKey) {
        return Optional.ofNullable(participantIdBySource.get(new SourceIdentifier(sourceSystem, sourceLocalKey))).map(participants::get);
    }

    public SortedSet<Integer> participantIds() {
        return ImmutableSortedSet.copyOf(participants.keySet());
    }

    public List<PendingResolution> pending() {
        return pending.values().stream().sorted(Comparator.comparing(PendingResolution::flaggedAt)).toList();
    }

    public List<ResolutionLogEntry> auditLog() {
        synchronized (auditLog) {
            return ImmutableList.copyOf(auditLog);
        }
    }

    public MatchingConfig getMatchingConfig() {
        return matcher.getConfig();
    }

    private void record(
        SourceIdentifier identifier, ResolutionMethod method, Integer participantId, double score, List<Integer> candidates,
        Map<String, String> attributes
    ) {
        ResolutionLogEntry entry = new ResolutionLogEntry(
            clock.instant(), identifier.sourceSystem(), identifier.sourceLocalKey(), method, participantId, score, candidates, attributes
        );
        journal.append(entry);
        apply(entry);
    }

    private void apply(ResolutionLogEntry entry) {
        SourceIdentifier identifier = new SourceIdentifier(entry.sourceSystem(), entry.sourceLocalKey());
        auditLog.add(entry);
        if (entry.method() == ResolutionMethod.AMBIGUOUS) {
            pending.put(identifier, new PendingResolution(identifier, entry.attributes(), entry.candidates(), entry.at()));
            return;
        }
        if (entry.method() == ResolutionMethod.EXACT) {
            return;
        }
        int participantId = entry.participantId();
        Instant createdAt = entry.at();
        participants.compute(participantId, (id, existing) -> existing == null
            ? new Participant(id, List.of(identifier), entry.attributes(), createdAt)
            : existing.withSourceIdentifier(identifier));
        participantIdBySource.put(identifier, participantId);
        pending.remove(identifier);
        lastParticipantId = Math.max(lastParticipantId, participantId);
    }

    @Override
    public void close() throws IOException {
        journal.close();
    }
}
