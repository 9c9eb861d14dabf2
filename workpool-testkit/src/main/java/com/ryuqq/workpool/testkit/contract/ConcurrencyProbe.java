package com.ryuqq.workpool.testkit.contract;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Records how many callers are inside a section at once.
 *
 * <p>Worker functions call {@link #enter()} on entry and {@link #exit()} in a finally block;
 * assertions then read the peak via {@link #maxObserved()}.</p>
 *
 * <pre>
 * ConcurrencyProbe probe = new ConcurrencyProbe();
 * WorkerFunction worker = (id, work, progress) -&gt; {
 *     probe.enter();
 *     try {
 *         doWork(work);
 *     } finally {
 *         probe.exit();
 *     }
 * };
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConcurrencyProbe {

    private final AtomicInteger current = new AtomicInteger();
    private final AtomicInteger maxObserved = new AtomicInteger();
    private final AtomicLong entries = new AtomicLong();

    /**
     * Marks entry into the probed section.
     */
    public void enter() {
        int now = current.incrementAndGet();
        maxObserved.accumulateAndGet(now, Math::max);
        entries.incrementAndGet();
    }

    /**
     * Marks exit from the probed section.
     *
     * @throws IllegalStateException if called more often than {@link #enter()}
     */
    public void exit() {
        int previous = current.getAndUpdate(value -> value > 0 ? value - 1 : value);
        if (previous == 0) {
            throw new IllegalStateException("exit() called without a matching enter()");
        }
    }

    /**
     * Number of callers currently inside.
     *
     * @return current occupancy
     */
    public int current() {
        return current.get();
    }

    /**
     * Highest occupancy observed so far.
     *
     * @return peak occupancy
     */
    public int maxObserved() {
        return maxObserved.get();
    }

    /**
     * Total number of entries.
     *
     * @return entry count
     */
    public long entries() {
        return entries.get();
    }
}
