package com.ryuqq.workpool.testkit.contract;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ThreadLeakDetector}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ThreadLeakDetectorTest {

    @Test
    void testNoNewThreads_Passes() {
        // Given
        ThreadLeakDetector detector = ThreadLeakDetector.snapshot();

        // When & Then
        assertDoesNotThrow(() -> detector.assertNoNewThreads(Duration.ofMillis(50)));
    }

    @Test
    void testLingeringThread_Fails() throws Exception {
        // Given
        ThreadLeakDetector detector = ThreadLeakDetector.snapshot();
        CountDownLatch stop = new CountDownLatch(1);
        Thread lingering = new Thread(() -> awaitQuietly(stop), "leaky-thread");
        lingering.setDaemon(true);
        lingering.start();

        try {
            // When
            AssertionError error = assertThrows(AssertionError.class,
                () -> detector.assertNoNewThreads(Duration.ofMillis(50)));

            // Then
            assertTrue(error.getMessage().contains("leaky-thread"));
            assertTrue(detector.newThreads().contains("leaky-thread"));
        } finally {
            stop.countDown();
            lingering.join(5000);
        }
    }

    @Test
    void testThreadExitingWithinGrace_Passes() {
        // Given
        ThreadLeakDetector detector = ThreadLeakDetector.snapshot();
        Thread shortLived = new Thread(() -> sleepQuietly(30), "short-lived");
        shortLived.start();

        // When & Then
        assertDoesNotThrow(() -> detector.assertNoNewThreads(Duration.ofSeconds(5)));
    }

    @Test
    void testIgnoredPrefix_NotReported() throws Exception {
        // Given
        ThreadLeakDetector detector = ThreadLeakDetector.snapshot().ignoring("tolerated-");
        CountDownLatch stop = new CountDownLatch(1);
        Thread tolerated = new Thread(() -> awaitQuietly(stop), "tolerated-1");
        tolerated.setDaemon(true);
        tolerated.start();

        try {
            // When & Then
            assertDoesNotThrow(() -> detector.assertNoNewThreads(Duration.ofMillis(50)));
        } finally {
            stop.countDown();
            tolerated.join(5000);
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
