package com.ryuqq.workpool.testkit.contract;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ConcurrencyProbe}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ConcurrencyProbeTest {

    @Test
    void testSequentialEntries_PeakIsOne() {
        // Given
        ConcurrencyProbe probe = new ConcurrencyProbe();

        // When
        for (int i = 0; i < 5; i++) {
            probe.enter();
            probe.exit();
        }

        // Then
        assertEquals(1, probe.maxObserved());
        assertEquals(5, probe.entries());
        assertEquals(0, probe.current());
    }

    @Test
    void testOverlappingEntries_PeakMatchesOverlap() throws Exception {
        // Given
        ConcurrencyProbe probe = new ConcurrencyProbe();
        CountDownLatch allInside = new CountDownLatch(3);
        CountDownLatch leave = new CountDownLatch(1);
        ExecutorService executorService = Executors.newFixedThreadPool(3);

        // When
        for (int i = 0; i < 3; i++) {
            executorService.submit(() -> {
                probe.enter();
                try {
                    allInside.countDown();
                    leave.await();
                } finally {
                    probe.exit();
                }
                return null;
            });
        }
        assertTrue(allInside.await(5, TimeUnit.SECONDS));
        int inside = probe.current();
        leave.countDown();
        executorService.shutdown();
        assertTrue(executorService.awaitTermination(5, TimeUnit.SECONDS));

        // Then
        assertEquals(3, inside);
        assertEquals(3, probe.maxObserved());
        assertEquals(0, probe.current());
    }

    @Test
    void testExitWithoutEnter_ThrowsException() {
        // Given
        ConcurrencyProbe probe = new ConcurrencyProbe();

        // When & Then
        assertThrows(IllegalStateException.class, probe::exit);
        assertEquals(0, probe.current());
    }
}
