package edu.harvard.hms.dbmi.avillach.inventory.processing.store;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.data.store.VariableValue;
import edu.harvard.hms.dbmi.avillach.inventory.exception.LockTimeoutException;
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
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entity-attribute-value store of participant variables with full history.
 *
 * Each (participant, variable) pair owns an append-only chain of values ordered by recorded-at; the last entry is current and is also
 * kept in a per-variable index for constant-time lookup. Writes for one participant are serialized by a per-participant lock with a
 * bounded wait. Value ids are allocated in one increasing sequence, which lets readers take a {@link #snapshot() snapshot}: every value
 * at or below the snapshot belongs to a row that was merged completely.
 */
@Component
public class VariableStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(VariableStore.class);

    private record ValueKey(int participantId, String variable) {
    }

    private final Map<ValueKey, List<VariableValue>> history = new ConcurrentHashMap<>();
    private final Map<String, Map<Integer, VariableValue>> currentIndex = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, ReentrantLock> participantLocks = new ConcurrentHashMap<>();

    // guards nextValueId and inFlight
    private final Object sequenceLock = new Object();
    private long nextValueId = 1;
    private final TreeSet<Long> inFlight = new TreeSet<>();
    // sequence of the row that introduced a participant, for participants created since startup
    private final Map<Integer, Long> introducedAt = new ConcurrentHashMap<>();

    private final JsonLinesJournal<VariableValue> journal;
    private final long lockTimeoutMillis;
    private final Clock clock;

    @Autowired
    public VariableStore(
        @Value("${INVENTORY_DATA_DIRECTORY:/opt/local/inventory/}") String dataDirectory,
        @Value("${store.lock-timeout-ms:5000}") long lockTimeoutMillis
    ) {
        this(Path.of(dataDirectory, "values.jsonl"), lockTimeoutMillis, Clock.systemUTC());
    }

    public VariableStore(Path journalFile, long lockTimeoutMillis, Clock clock) {
        this.journal = new JsonLinesJournal<>(journalFile, VariableValue.class);
        this.lockTimeoutMillis = lockTimeoutMillis;
        this.clock = clock;
        restore();
    }

    public VariableValue append(int participantId, VariableDefinition definition, int schemaVersion, String value, String batchId) {
        return merge(participantId, schemaVersion, Map.of(definition.name(), value), batchId).get(0);
    }

    /**
     * Appends one row's values for a participant under a single acquisition of its lock. Each value supersedes the current value of
     * its variable. The values are journaled before they become visible.
     *
     * @param values variable name to canonical value; null values are not stored
     * @throws LockTimeoutException if the participant's lock is not acquired within the configured wait
     */
    public List<VariableValue> merge(int participantId, int schemaVersion, Map<String, String> values, String batchId) {
        Map<String, String> present = new LinkedHashMap<>();
        values.forEach((variable, value) -> {
            if (value != null) {
                present.put(variable, value);
            }
        });
        if (present.isEmpty()) {
            return List.of();
        }

        ReentrantLock lock = participantLock(participantId);
        acquire(lock, participantId);
        try {
            long firstValueId = reserve(present.size());
            try {
                Instant now = clock.instant();
                List<VariableValue> appended = new ArrayList<>(present.size());
                long valueId = firstValueId;
                for (Map.Entry<String, String> entry : present.entrySet()) {
                    VariableValue previous = latest(participantId, entry.getKey());
                    Instant recordedAt = previous != null && now.isBefore(previous.recordedAt()) ? previous.recordedAt() : now;
                    appended.add(
                        new VariableValue(
                            valueId++, participantId, entry.getKey(), schemaVersion, entry.getValue(), batchId, recordedAt,
                            previous == null ? null : previous.valueId()
                        )
                    );
                }
                journal.appendAll(appended);
                appended.forEach(this::index);
                return appended;
            } finally {
                synchronized (sequenceLock) {
                    inFlight.remove(firstValueId);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public Optional<VariableValue> current(int participantId, String variable) {
        return Optional.ofNullable(currentIndex.getOrDefault(variable, Map.of()).get(participantId));
    }

    /**
     * Current value as of a snapshot: the latest value with an id at or below {@code snapshot}.
     */
    public Optional<VariableValue> current(int participantId, String variable, long snapshot) {
        VariableValue current = currentIndex.getOrDefault(variable, Map.of()).get(participantId);
        if (current == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(asOf(current, snapshot));
    }

    /**
     * Every value ever recorded for the pair, most recent first.
     */
    public List<VariableValue> history(int participantId, String variable) {
        List<VariableValue> chain = history.get(new ValueKey(participantId, variable));
        return chain == null ? List.of() : Lists.reverse(List.copyOf(chain));
    }

    /**
     * Number of participants with a current value for the variable.
     */
    public int coverage(String variable) {
        return currentIndex.getOrDefault(variable, Map.of()).size();
    }

    /**
     * Current values of a variable by participant as of a snapshot.
     */
    public Map<Integer, VariableValue> currentValues(String variable, long snapshot) {
        Map<Integer, VariableValue> values = new HashMap<>();
        currentIndex.getOrDefault(variable, Map.of()).forEach((participantId, current) -> {
            VariableValue value = asOf(current, snapshot);
            if (value != null) {
                values.put(participantId, value);
            }
        });
        return values;
    }

    /**
     * Current values of every variable of one participant.
     */
    public Map<String, VariableValue> currentValues(int participantId) {
        Map<String, VariableValue> values = new TreeMap<>();
        currentIndex.forEach((variable, byParticipant) -> {
            VariableValue value = byParticipant.get(participantId);
            if (value != null) {
                values.put(variable, value);
            }
        });
        return ImmutableMap.copyOf(values);
    }

    /**
     * Watermark for consistent reads: the highest value id below which no row is still being merged.
     */
    public long snapshot() {
        synchronized (sequenceLock) {
            return inFlight.isEmpty() ? nextValueId - 1 : inFlight.first() - 1;
        }
    }

    /**
     * Reserves a position in the value sequence for a row whose participant may not exist yet. Until {@link #closeRow(long)} the
     * snapshot stays below the returned sequence, so participants {@link #introduce introduced} by the row stay hidden with its values.
     */
    public long openRow() {
        return reserve(1);
    }

    public void closeRow(long rowSequence) {
        synchronized (sequenceLock) {
            inFlight.remove(rowSequence);
        }
    }

    /**
     * Records that a participant was created by the row holding {@code rowSequence}. Must be called before the participant becomes
     * visible to readers.
     */
    public void introduce(int participantId, long rowSequence) {
        introducedAt.put(participantId, rowSequence);
    }

    /**
     * The participants that exist as of a snapshot: those introduced by a row above the snapshot are left out.
     */
    public SortedSet<Integer> visibleParticipants(Set<Integer> participantIds, long snapshot) {
        SortedSet<Integer> visible = new TreeSet<>();
        for (Integer participantId : participantIds) {
            Long introduced = introducedAt.get(participantId);
            if (introduced == null || introduced <= snapshot) {
                visible.add(participantId);
            }
        }
        return visible;
    }

    public Set<String> variables() {
        return Set.copyOf(currentIndex.keySet());
    }

    ReentrantLock participantLock(int participantId) {
        return participantLocks.computeIfAbsent(participantId, id -> new ReentrantLock());
    }

    private void acquire(ReentrantLock lock, int participantId) {
        try {
            if (!lock.tryLock(lockTimeoutMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Lock wait for participant {} exceeded {}ms", participantId, lockTimeoutMillis);
                throw new LockTimeoutException(participantId, lockTimeoutMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(participantId, lockTimeoutMillis);
        }
    }

    private long reserve(int count) {
        synchronized (sequenceLock) {
            long first = nextValueId;
            nextValueId += count;
            inFlight.add(first);
            return first;
        }
    }

    private VariableValue latest(int participantId, String variable) {
        List<VariableValue> chain = history.get(new ValueKey(participantId, variable));
        return chain == null || chain.isEmpty() ? null : chain.get(chain.size() - 1);
    }

    private VariableValue asOf(VariableValue current, long snapshot) {
        if (current.valueId() <= snapshot) {
            return current;
        }
        List<VariableValue> chain = history.get(new ValueKey(current.participantId(), current.variable()));
        for (VariableValue value : Lists.reverse(List.copyOf(chain))) {
            if (value.valueId() <= snapshot) {
                return value;
            }
        }
        return null;
    }

    private void index(VariableValue value) {
        history.computeIfAbsent(new ValueKey(value.participantId(), value.variable()), key -> new CopyOnWriteArrayList<>()).add(value);
        currentIndex.computeIfAbsent(value.variable(), key -> new ConcurrentHashMap<>()).put(value.participantId(), value);
    }

    private void restore() {
        List<VariableValue> values = new ArrayList<>(journal.replay());
        values.sort(Comparator.comparingLong(VariableValue::valueId));
        values.forEach(this::index);
        nextValueId = values.isEmpty() ? 1 : values.get(values.size() - 1).valueId() + 1;
        log.info("Variable store restored: {} values, {} variables", values.size(), currentIndex.size());
    }

    @Override
    public void close() throws IOException {
        journal.close();
    }
}
