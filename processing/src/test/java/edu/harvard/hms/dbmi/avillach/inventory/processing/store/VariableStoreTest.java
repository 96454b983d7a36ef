package edu.harvard.hms.dbmi.avillach.inventory.processing.store;

import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableType;
import edu.harvard.hms.dbmi.avillach.inventory.data.store.VariableValue;
import edu.harvard.hms.dbmi.avillach.inventory.exception.LockTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;

class VariableStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path directory;

    private VariableStore variableStore;

    private final VariableDefinition age = VariableDefinition.of("age", "visit", VariableType.NUMERIC, null);

    @BeforeEach
    public void setup() {
        variableStore = new VariableStore(directory.resolve("values.jsonl"), 200, CLOCK);
    }

    @AfterEach
    public void teardown() throws Exception {
        variableStore.close();
    }

    @Test
    public void append_firstValue_isCurrentWithoutPredecessor() {
        VariableValue value = variableStore.append(1, age, 1, "34", "batch-1");

        assertEquals(1L, value.valueId());
        assertNull(value.supersedes());
        assertEquals(Optional.of(value), variableStore.current(1, "age"));
        assertEquals(1, variableStore.coverage("age"));
    }

    @Test
    public void append_newValue_supersedesAndKeepsHistory() {
        VariableValue first = variableStore.append(1, age, 1, "34", "batch-1");
        VariableValue second = variableStore.append(1, age, 1, "35", "batch-2");

        assertEquals(first.valueId(), second.supersedes());
        assertEquals("35", variableStore.current(1, "age").orElseThrow().value());
        assertEquals(List.of(second, first), variableStore.history(1, "age"));
        assertEquals(1, variableStore.coverage("age"));
    }

    @Test
    public void history_isRestartableAndUnmodifiable() {
        variableStore.append(1, age, 1, "34", "batch-1");
        List<VariableValue> history = variableStore.history(1, "age");

        assertEquals(history, variableStore.history(1, "age"));
        assertThrows(UnsupportedOperationException.class, () -> history.add(history.get(0)));
        assertTrue(variableStore.history(2, "age").isEmpty());
    }

    @Test
    public void merge_rowSkipsNullsAndAllocatesConsecutiveIds() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("age", "34");
        row.put("diagnosis", null);
        row.put("site", "north");

        List<VariableValue> merged = variableStore.merge(7, 1, row, "batch-1");

        assertEquals(2, merged.size());
        assertEquals(List.of(1L, 2L), merged.stream().map(VariableValue::valueId).toList());
        assertTrue(variableStore.current(7, "diagnosis").isEmpty());
        assertEquals(2L, variableStore.snapshot());
        assertEquals(Set.of("age", "site"), variableStore.currentValues(7).keySet());
    }

    @Test
    public void merge_clockGoingBackwards_keepsRecordedAtMonotonic() throws Exception {
        variableStore.append(1, age, 1, "34", "batch-1");
        variableStore.close();
        Clock earlier = Clock.fixed(CLOCK.instant().minusSeconds(3600), ZoneId.of("UTC"));
        variableStore = new VariableStore(directory.resolve("values.jsonl"), 200, earlier);

        VariableValue second = variableStore.append(1, age, 1, "35", "batch-2");

        assertEquals(CLOCK.instant(), second.recordedAt());
    }

    @Test
    public void currentValues_asOfSnapshot_ignoresLaterValues() {
        variableStore.append(1, age, 1, "34", "batch-1");
        variableStore.append(2, age, 1, "50", "batch-1");
        long snapshot = variableStore.snapshot();
        variableStore.append(1, age, 1, "35", "batch-2");
        variableStore.append(3, age, 1, "61", "batch-2");

        Map<Integer, VariableValue> values = variableStore.currentValues("age", snapshot);

        assertEquals(Set.of(1, 2), values.keySet());
        assertEquals("34", values.get(1).value());
        assertEquals("34", variableStore.current(1, "age", snapshot).orElseThrow().value());
        assertTrue(variableStore.current(3, "age", snapshot).isEmpty());
        assertEquals(3, variableStore.currentValues("age", variableStore.snapshot()).size());
    }

    @Test
    public void openRow_holdsSnapshotAndHidesIntroducedParticipant() {
        variableStore.append(1, age, 1, "34", "batch-1");
        long before = variableStore.snapshot();

        long row = variableStore.openRow();
        variableStore.introduce(2, row);
        variableStore.append(2, age, 1, "50", "batch-2");

        assertEquals(before, variableStore.snapshot());
        assertEquals(Set.of(1), variableStore.visibleParticipants(Set.of(1, 2), variableStore.snapshot()));

        variableStore.closeRow(row);

        long after = variableStore.snapshot();
        assertTrue(after > row);
        assertEquals(Set.of(1, 2), variableStore.visibleParticipants(Set.of(1, 2), after));
        assertEquals("50", variableStore.current(2, "age", after).orElseThrow().value());
    }

    @Test
    public void merge_lockHeldElsewhere_throwsLockTimeout() throws Exception {
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            ReentrantLock lock = variableStore.participantLock(1);
            Future<?> holder = executor.submit(() -> {
                lock.lock();
                locked.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    lock.unlock();
                }
            });
            assertTrue(locked.await(5, TimeUnit.SECONDS));

            LockTimeoutException exception = assertThrows(LockTimeoutException.class, () -> variableStore.append(1, age, 1, "34", "batch-1"));
            assertEquals(1, exception.getParticipantId());
            assertTrue(variableStore.current(1, "age").isEmpty());

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
            assertEquals("34", variableStore.append(1, age, 1, "34", "batch-1").value());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void merge_concurrentRowsForOneParticipant_produceSingleChain() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                String value = String.valueOf(i);
                futures.add(executor.submit(() -> variableStore.merge(1, 1, Map.of("age", value, "site", value), "batch-" + value)));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        List<VariableValue> history = variableStore.history(1, "age");
        assertEquals(100, history.size());
        for (int i = 0; i < history.size() - 1; i++) {
            assertEquals(history.get(i + 1).valueId(), history.get(i).supersedes());
        }
        assertNull(history.get(history.size() - 1).supersedes());
        assertEquals(200L, variableStore.snapshot());
        assertEquals(history.get(0), variableStore.current(1, "age").orElseThrow());
    }

    @Test
    public void constructor_replaysJournal() throws Exception {
        variableStore.append(1, age, 1, "34", "batch-1");
        VariableValue latest = variableStore.append(1, age, 2, "35", "batch-2");
        variableStore.close();

        variableStore = new VariableStore(directory.resolve("values.jsonl"), 200, CLOCK);

        assertEquals(Optional.of(latest), variableStore.current(1, "age"));
        assertEquals(2, variableStore.history(1, "age").size());
        assertEquals(3L, variableStore.append(2, age, 2, "40", "batch-3").valueId());
    }
}
