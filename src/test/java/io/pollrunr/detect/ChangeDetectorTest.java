package io.pollrunr.detect;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ChangeDetectorTest {

    private static final StreamKey<String> SKILL = StreamKey.of("skill", String.class);
    private static final StreamKey<String> SERVER = StreamKey.of("server", String.class);
    private static final StreamKey<String> TITLE = StreamKey.of("title", String.class);

    private ChangeDetector detector;

    @BeforeEach
    void setUp() {
        detector = new ChangeDetector();
    }

    @Test
    void shouldCaptureBaselineThenSuppressThenReportChange() {
        var first = detector.observe(SKILL, "A1");
        var repeat = detector.observe(SKILL, "A1");
        var changed = detector.observe(SKILL, "B2");

        assertEquals(Observation.Kind.BASELINE, first.kind());
        assertNull(first.previous());
        assertEquals(Observation.Kind.SUPPRESSED, repeat.kind());
        assertEquals(Observation.Kind.CHANGED, changed.kind());
        assertEquals("A1", changed.previous());
        assertEquals("B2", changed.current());
        assertTrue(changed.isChanged());
        assertEquals(Optional.of("B2"), detector.current(SKILL));
    }

    @Test
    void streamsShouldBeIndependent() {
        detector.observe(SKILL, "A1");

        assertEquals(Observation.Kind.BASELINE, detector.observe(SERVER, "A1").kind());
        assertEquals(Set.of("skill", "server"), detector.trackedKeys());
    }

    @Test
    void shouldUseStructuralEqualityForRecords() {
        record Status(long time, int status) {}

        var status = StreamKey.of("server", Status.class);
        detector.observe(status, new Status(100, 0));

        assertEquals(Observation.Kind.SUPPRESSED, detector.observe(status, new Status(100, 0)).kind());
        assertEquals(Observation.Kind.CHANGED, detector.observe(status, new Status(200, 1)).kind());
    }

    @Test
    void shouldHonourCustomEquivalence() {
        detector.observe(TITLE, "Patch Notes", String::equalsIgnoreCase);

        var same = detector.observe(TITLE, "PATCH NOTES", String::equalsIgnoreCase);

        assertEquals(Observation.Kind.SUPPRESSED, same.kind());
        assertEquals(Optional.of("Patch Notes"), detector.current(TITLE));
    }

    @Test
    void recordShouldStoreSilentlyAndResetShouldForget() {
        detector.record(SERVER, "closed");

        assertEquals(Observation.Kind.CHANGED, detector.observe(SERVER, "open").kind());
        assertTrue(detector.reset(SERVER));
        assertFalse(detector.reset(SERVER));
        assertEquals(Observation.Kind.BASELINE, detector.observe(SERVER, "open").kind());
    }

    @Test
    void shouldRejectNullValues() {
        assertThrows(NullPointerException.class, () -> detector.observe(SKILL, null));
        assertThrows(NullPointerException.class, () -> detector.observe(null, "A1"));
    }

    @Test
    void shouldRejectValueOfAnotherTypeOnTheSameStream() {
        detector.observe(SKILL, "A1");
        var mistyped = StreamKey.of("skill", Integer.class);

        assertThrows(ClassCastException.class, () -> detector.observe(mistyped, 7));
        assertThrows(ClassCastException.class, () -> detector.current(mistyped));
        assertEquals(Optional.of("A1"), detector.current(SKILL));
    }

    @Test
    void currentShouldBeEmptyForUnknownStream() {
        assertEquals(Optional.empty(), detector.current(SKILL));
        assertTrue(detector.trackedKeys().isEmpty());
    }

    @Test
    void concurrentFirstObservationsShouldYieldExactlyOneBaseline() throws Exception {
        List<Observation<String>> results = runConcurrently(32, i -> detector.observe(SKILL, "A1"));

        long baselines = results.stream().filter(o -> o.kind() == Observation.Kind.BASELINE).count();
        assertEquals(1, baselines);
        assertEquals(31, results.stream().filter(o -> o.kind() == Observation.Kind.SUPPRESSED).count());
    }

    @Test
    void concurrentChangesShouldNeverTransitionFromTheSamePreviousValue() throws Exception {
        detector.observe(SKILL, "base");

        List<Observation<String>> results = runConcurrently(32, i -> detector.observe(SKILL, "v" + i));

        Set<String> previousValues = new HashSet<>();
        for (Observation<String> result : results) {
            assertEquals(Observation.Kind.CHANGED, result.kind());
            assertTrue(previousValues.add(result.previous()), "double transition from " + result.previous());
        }
        assertTrue(previousValues.contains("base"));
    }

    private interface Observer {
        Observation<String> observe(int index);
    }

    private static List<Observation<String>> runConcurrently(int threads, Observer observer) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Observation<String>>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                int index = i;
                Callable<Observation<String>> call = () -> {
                    start.await();
                    return observer.observe(index);
                };
                futures.add(pool.submit(call));
            }
            start.countDown();
            List<Observation<String>> results = new ArrayList<>();
            for (Future<Observation<String>> future : futures) {
                results.add(future.get(5, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }
}
