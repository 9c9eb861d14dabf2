package com.ryuqq.workpool.testkit.contract;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Detects threads started after a snapshot that are still alive.
 *
 * <p>Take a snapshot before exercising a {@code Job}, then call
 * {@link #assertNoNewThreads(Duration)} once the job has completed. Threads get the whole
 * grace period to finish exiting before they count as leaked.</p>
 *
 * <p><strong>Ignored threads:</strong></p>
 * <ul>
 *   <li>{@code ForkJoinPool.commonPool-worker-*} (shared JVM pool)</li>
 *   <li>Any thread whose name starts with a prefix passed to {@link #ignoring(String...)}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ThreadLeakDetector {

    private static final String COMMON_POOL_PREFIX = "ForkJoinPool.commonPool-worker";
    private static final long POLL_INTERVAL_MS = 10;

    private final Set<Long> baseline;
    private final List<String> ignoredPrefixes;

    private ThreadLeakDetector(Set<Long> baseline, List<String> ignoredPrefixes) {
        this.baseline = baseline;
        this.ignoredPrefixes = ignoredPrefixes;
    }

    /**
     * Records the threads alive right now.
     *
     * @return detector holding the baseline
     */
    public static ThreadLeakDetector snapshot() {
        Set<Long> ids = Thread.getAllStackTraces().keySet().stream()
            .map(Thread::getId)
            .collect(Collectors.toUnmodifiableSet());
        return new ThreadLeakDetector(ids, List.of(COMMON_POOL_PREFIX));
    }

    /**
     * Returns a copy that also ignores threads with the given name prefixes.
     *
     * @param prefixes thread name prefixes to ignore
     * @return new detector with the same baseline
     */
    public ThreadLeakDetector ignoring(String... prefixes) {
        List<String> merged = new ArrayList<>(ignoredPrefixes);
        Collections.addAll(merged, prefixes);
        return new ThreadLeakDetector(baseline, List.copyOf(merged));
    }

    /**
     * Threads started since the snapshot that are still alive and not ignored.
     *
     * @return names of new threads
     */
    public List<String> newThreads() {
        return Thread.getAllStackTraces().keySet().stream()
            .filter(Thread::isAlive)
            .filter(thread -> !baseline.contains(thread.getId()))
            .map(Thread::getName)
            .filter(name -> ignoredPrefixes.stream().noneMatch(name::startsWith))
            .sorted()
            .collect(Collectors.toList());
    }

    /**
     * Waits up to {@code grace} for new threads to exit.
     *
     * @param grace maximum time to wait
     * @throws AssertionError if new threads are still alive after the grace period
     */
    public void assertNoNewThreads(Duration grace) {
        long deadline = System.nanoTime() + grace.toNanos();
        List<String> leaked = newThreads();
        while (!leaked.isEmpty() && System.nanoTime() < deadline) {
            sleep(POLL_INTERVAL_MS);
            leaked = newThreads();
        }
        if (!leaked.isEmpty()) {
            throw new AssertionError("Leaked threads after " + grace.toMillis() + "ms: " + leaked);
        }
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Sleep interrupted", e);
        }
    }
}
