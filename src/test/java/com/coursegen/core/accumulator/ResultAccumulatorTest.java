package com.coursegen.core.accumulator;

import com.coursegen.core.metrics.GenerationMetrics;
import com.coursegen.core.model.CompletionStatus;
import com.coursegen.core.model.ContentEntry;
import com.coursegen.core.model.ContentKind;
import com.coursegen.core.model.GenerationContext;
import com.coursegen.core.model.ImageBinding;
import com.coursegen.core.model.RunState;
import com.coursegen.core.model.UnitResult;
import com.coursegen.core.model.WorkUnit;
import com.coursegen.core.model.WorkUnitKind;
import com.coursegen.core.persistence.InMemoryRunStateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ResultAccumulatorTest {

    private static final GenerationContext GEN = new GenerationContext("o", "f", "openai", Map.of());

    private InMemoryRunStateStore store;
    private ResultAccumulator accumulator;

    @BeforeEach
    void setUp() {
        store = new InMemoryRunStateStore();
        accumulator = new ResultAccumulator(store);
    }

    private static ContentEntry lesson(String ref, String text, Integer... imageIds) {
        return new ContentEntry(ref, ContentKind.LESSON, ref, "f/" + ref + ".md", text, List.of(imageIds));
    }

    private static UnitResult finished(String unitId, List<ContentEntry> entries, Map<Integer, ImageBinding> images) {
        return new UnitResult(unitId, unitId, entries, images, true);
    }

    @Nested
    @DisplayName("merge")
    class Merge {

        @Test
        @DisplayName("Adds new entries and their image bindings")
        void addsEntries() {
            var state = RunState.start("R-1", 2, GEN);
            var result = finished("u1", List.of(lesson("01-01", "a", 10101)),
                    Map.of(10101, new ImageBinding("f/images/10101.png", "d")));

            var outcome = accumulator.merge(state, result);

            assertEquals(List.of("01-01"), outcome.acceptedRefs());
            assertEquals(List.of("u1"), outcome.state().completedUnitIds());
            assertEquals("f/images/10101.png", outcome.state().imageBindings().get(10101).storageKey());
            assertEquals(CompletionStatus.PARTIAL, outcome.state().completionStatus());
            assertFalse(outcome.readyForAssembly());
        }

        @Test
        @DisplayName("Merging the same result twice changes nothing")
        void idempotent() {
            var result = finished("u1", List.of(lesson("01-01", "a", 10101)),
                    Map.of(10101, new ImageBinding("k", "d")));
            var once = accumulator.merge(RunState.start("R-1", 2, GEN), result).state();

            var twice = accumulator.merge(once, result);

            assertEquals(once, twice.state());
            assertEquals(List.of("01-01"), twice.skippedRefs());
            assertTrue(twice.acceptedRefs().isEmpty());
        }

        @Test
        @DisplayName("An existing entry is never overwritten outside a replacement")
        void firstWriteWins() {
            var state = accumulator.merge(RunState.start("R-1", 3, GEN),
                    finished("u1", List.of(lesson("01-01", "first")), Map.of())).state();

            var outcome = accumulator.merge(state, finished("u2", List.of(lesson("01-01", "second")), Map.of()));

            assertEquals("first", outcome.state().accumulatedContent().get("01-01").text());
            assertEquals(List.of("u1", "u2"), outcome.state().completedUnitIds());
        }

        @Test
        @DisplayName("Completion becomes COMPLETE exactly once and only that merge is ready")
        void readyOnce() {
            var state = RunState.start("R-1", 2, GEN);
            var first = accumulator.merge(state, finished("u1", List.of(lesson("01-01", "a")), Map.of()));
            var second = accumulator.merge(first.state(), finished("u2", List.of(lesson("01-02", "b")), Map.of()));
            var again = accumulator.merge(second.state(), finished("u2", List.of(lesson("01-02", "b")), Map.of()));

            assertFalse(first.readyForAssembly());
            assertTrue(second.readyForAssembly());
            assertTrue(second.state().isComplete());
            assertFalse(again.readyForAssembly());
            assertTrue(again.state().isComplete());
        }

        @Test
        @DisplayName("A partial result commits entries without completing its unit")
        void partialDoesNotComplete() {
            var partial = new UnitResult("u1", "u1", List.of(lesson("01-01", "a")), Map.of(), false);

            var outcome = accumulator.merge(RunState.start("R-1", 1, GEN), partial);

            assertEquals(List.of("01-01"), outcome.acceptedRefs());
            assertTrue(outcome.state().completedUnitIds().isEmpty());
            assertFalse(outcome.state().isComplete());
        }

        @Test
        @DisplayName("A continuation completes its origin unit")
        void continuationCompletesOrigin() {
            var continuation = new UnitResult("u1~2", "u1", List.of(lesson("01-03", "c")), Map.of(), true);

            var outcome = accumulator.merge(RunState.start("R-1", 1, GEN), continuation);

            assertEquals(List.of("u1"), outcome.state().completedUnitIds());
            assertTrue(outcome.readyForAssembly());
        }

        @Test
        @DisplayName("Binding an image id to a different value is a conflict")
        void imageConflict() {
            var state = accumulator.merge(RunState.start("R-1", 3, GEN), finished("u1",
                    List.of(lesson("01-01", "a", 10101)), Map.of(10101, new ImageBinding("k1", "d")))).state();
            var conflicting = finished("u2", List.of(lesson("01-02", "b", 10101)),
                    Map.of(10101, new ImageBinding("k2", "d")));

            var e = assertThrows(MergeConflictException.class, () -> accumulator.merge(state, conflicting));

            assertEquals(10101, e.imageId());
            assertEquals("k1", e.existing().storageKey());
            assertEquals("k2", e.incoming().storageKey());
        }

        @Test
        @DisplayName("Skipped entries do not merge their images")
        void skippedImagesIgnored() {
            var state = accumulator.merge(RunState.start("R-1", 3, GEN), finished("u1",
                    List.of(lesson("01-01", "a", 10101)), Map.of(10101, new ImageBinding("k1", "d")))).state();

            var outcome = accumulator.merge(state, finished("u2",
                    List.of(lesson("01-01", "again", 10101)), Map.of(10101, new ImageBinding("k2", "d"))));

            assertEquals("k1", outcome.state().imageBindings().get(10101).storageKey());
        }

        @Test
        @DisplayName("Records skipped refs as a metric")
        void skippedMetric() {
            var registry = new SimpleMeterRegistry();
            var metered = new ResultAccumulator(store, new GenerationMetrics(registry));
            var result = finished("u1", List.of(lesson("01-01", "a")), Map.of());
            var once = metered.merge(RunState.start("R-1", 2, GEN), result).state();

            metered.merge(once, result);

            assertEquals(1.0, registry.counter("coursegen.merge.skipped").count());
        }
    }

    @Nested
    @DisplayName("Replacement")
    class Replacement {

        private RunState completed() {
            var state = RunState.start("R-1", 1, GEN);
            return accumulator.merge(state, finished("u1",
                    List.of(lesson("01-01", "one", 10101), lesson("01-02", "two", 10201)),
                    Map.of(10101, new ImageBinding("f/images/10101.png", "d"),
                           10201, new ImageBinding("f/images/10201.png", "d")))).state();
        }

        @Test
        @DisplayName("Replaces only the target and swaps its images")
        void replacesTarget() {
            var reopened = completed().reopenForReplacement(List.of("01-02"));

            var outcome = accumulator.merge(reopened, finished("regen-01-02",
                    List.of(lesson("01-02", "two v2", 10201)),
                    Map.of(10201, new ImageBinding("f/images/rev-1/10201.png", "d"))));

            var content = outcome.state().accumulatedContent();
            assertEquals("one", content.get("01-01").text());
            assertEquals("two v2", content.get("01-02").text());
            assertEquals("f/images/10101.png", outcome.state().imageBindings().get(10101).storageKey());
            assertEquals("f/images/rev-1/10201.png", outcome.state().imageBindings().get(10201).storageKey());
            assertTrue(outcome.state().replacementTargets().isEmpty());
            assertTrue(outcome.readyForAssembly());
        }

        @Test
        @DisplayName("Non-target refs in a replacement pass are skipped")
        void nonTargetSkipped() {
            var reopened = completed().reopenForReplacement(List.of("01-02"));

            var outcome = accumulator.merge(reopened, finished("regen-01-02",
                    List.of(lesson("01-01", "sneaky"), lesson("01-02", "two v2")), Map.of()));

            assertEquals("one", outcome.state().accumulatedContent().get("01-01").text());
            assertEquals(List.of("01-01"), outcome.skippedRefs());
        }

        @Test
        @DisplayName("A target is replaced once, then closed")
        void replacedOnce() {
            var reopened = completed().reopenForReplacement(List.of("01-02"));
            var first = accumulator.merge(reopened, new UnitResult("regen-01-02", "regen-01-02",
                    List.of(lesson("01-02", "v2")), Map.of(), false)).state();

            var second = accumulator.merge(first, finished("regen-01-02", List.of(lesson("01-02", "v3")), Map.of()));

            assertEquals("v2", second.state().accumulatedContent().get("01-02").text());
        }

        @Test
        @DisplayName("Completed units never drop across repeated regeneration of the same lesson")
        void completedCountAcrossPasses() {
            var full = completed();
            assertEquals(1, full.unitsCompleted());

            var firstPass = full.reopenForReplacement(List.of("01-02"));
            assertEquals(1, firstPass.unitsCompleted());
            var firstDone = accumulator.merge(firstPass, finished("regen-01-02", List.of(lesson("01-02", "v2")), Map.of()));
            assertTrue(firstDone.readyForAssembly());
            assertEquals(2, firstDone.state().unitsCompleted());

            var secondPass = firstDone.state().reopenForReplacement(List.of("01-02"));
            assertEquals(2, secondPass.unitsCompleted());
            var secondDone = accumulator.merge(secondPass, finished("regen-01-02", List.of(lesson("01-02", "v3")), Map.of()));

            assertTrue(secondDone.readyForAssembly());
            assertEquals(3, secondDone.state().unitsCompleted());
            assertEquals(3, secondDone.state().unitsTotal());
            assertEquals("v3", secondDone.state().accumulatedContent().get("01-02").text());
        }
    }

    @Nested
    @DisplayName("RunLedger")
    class Ledger {

        @Test
        @DisplayName("Persists the initial state and every commit")
        void persistsCommits() {
            var ledger = accumulator.open(RunState.start("R-1", 2, GEN));
            ledger.commit(finished("u1", List.of(lesson("01-01", "a")), Map.of()));

            assertEquals(2, store.saveCount());
            assertEquals(ledger.current(), store.find("R-1").orElseThrow());
        }

        @Test
        @DisplayName("Records pending units")
        void recordsPending() {
            var ledger = accumulator.open(RunState.start("R-1", 2, GEN));
            var pending = new WorkUnit("u2", WorkUnitKind.LESSON_BATCH, List.of("01-02"), GEN);

            var state = ledger.recordPending(List.of(pending));

            assertEquals(List.of(pending), state.pendingUnits());
            assertEquals(List.of(pending), store.find("R-1").orElseThrow().pendingUnits());
        }

        @Test
        @DisplayName("Concurrent commits lose nothing and exactly one is ready")
        void concurrentCommits() throws Exception {
            int units = 16;
            var ledger = accumulator.open(RunState.start("R-1", units, GEN));
            ExecutorService pool = Executors.newFixedThreadPool(8);
            var start = new CountDownLatch(1);
            try {
                var futures = new ArrayList<CompletableFuture<MergeOutcome>>();
                for (int i = 1; i <= units; i++) {
                    String ref = String.format("01-%02d", i);
                    String unitId = "u" + i;
                    futures.add(CompletableFuture.supplyAsync(() -> {
                        try {
                            start.await();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw new IllegalStateException(e);
                        }
                        return ledger.commit(finished(unitId, List.of(lesson(ref, ref)), Map.of()));
                    }, pool));
                }
                start.countDown();
                long ready = 0;
                for (var f : futures) {
                    if (f.get(10, TimeUnit.SECONDS).readyForAssembly()) {
                        ready++;
                    }
                }

                assertEquals(1, ready);
                assertEquals(units, ledger.current().accumulatedContent().size());
                assertEquals(units, ledger.current().unitsCompleted());
                assertTrue(ledger.current().isComplete());
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
