package com.ryuqq.workpool.adapter.inmemory.channel;

import com.ryuqq.workpool.core.channel.Channel;
import com.ryuqq.workpool.core.channel.ChannelClosedException;

import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of the {@link Channel} SPI.
 *
 * <p>A bounded FIFO buffer guarded by a single {@link ReentrantLock} with three
 * conditions, in the style of {@link java.util.concurrent.ArrayBlockingQueue},
 * extended with a close signal and an unbuffered hand-off mode.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Buffer:</strong> ArrayDeque&lt;T&gt; bounded by {@code capacity} (one slot when capacity is 0)</li>
 *   <li><strong>notEmpty:</strong> receivers wait here until an element arrives or the channel closes</li>
 *   <li><strong>notFull:</strong> senders wait here until space frees up or the channel closes</li>
 *   <li><strong>taken:</strong> with capacity 0, the sender waits here until a receiver has taken its element</li>
 * </ul>
 *
 * <p><strong>Capacity:</strong></p>
 * <ul>
 *   <li><strong>0 (default):</strong> rendezvous. {@code send} returns only once a receiver holds the element</li>
 *   <li><strong>N &gt; 0:</strong> {@code send} returns as soon as the element is buffered, blocking only while N elements wait</li>
 * </ul>
 *
 * <p><strong>Close Semantics:</strong></p>
 * <ul>
 *   <li>{@link #close()} is idempotent and wakes every blocked sender and receiver</li>
 *   <li>Senders blocked or arriving after close get {@link ChannelClosedException};
 *       a rendezvous sender whose element was not taken withdraws it</li>
 *   <li>Elements buffered before close remain receivable; receive returns empty once drained</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Channel&lt;Work&gt; intake = new InMemoryChannel&lt;&gt;();
 *
 * // producer: each send returns once a consumer has the element
 * intake.send(Work.of(Map.of("path", "/tmp/a")));
 * intake.close();
 *
 * // consumer
 * Optional&lt;Work&gt; next;
 * while ((next = intake.receive()).isPresent()) {
 *     process(next.get());
 * }
 * </pre>
 *
 * @param <T> element type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryChannel<T> implements Channel<T> {

    /**
     * Default capacity: 0, an unbuffered rendezvous hand-off.
     */
    public static final int DEFAULT_CAPACITY = 0;

    private final int capacity;
    private final int bufferLimit;
    private final ArrayDeque<T> buffer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final Condition taken = lock.newCondition();
    private long putCount;
    private long takeCount;
    private boolean closed;

    /**
     * Creates a new unbuffered InMemoryChannel.
     */
    public InMemoryChannel() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Creates a new InMemoryChannel with the given capacity.
     *
     * @param capacity maximum number of buffered elements, 0 for a rendezvous channel
     * @throws IllegalArgumentException if capacity is negative
     */
    public InMemoryChannel(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity cannot be negative, but was: " + capacity);
        }
        this.capacity = capacity;
        this.bufferLimit = Math.max(capacity, 1);
        this.buffer = new ArrayDeque<>(bufferLimit);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Waits on {@code notFull} while the buffer is full</li>
     *   <li>Re-checks the closed flag after every wake-up</li>
     *   <li>With capacity 0, additionally waits on {@code taken} until a receiver dequeues the element;
     *       on close or interrupt the untaken element is withdrawn</li>
     * </ul>
     */
    @Override
    public void send(T element) throws InterruptedException {
        if (element == null) {
            throw new IllegalArgumentException("element cannot be null");
        }

        lock.lockInterruptibly();
        try {
            while (!closed && buffer.size() >= bufferLimit) {
                notFull.await();
            }
            if (closed) {
                throw new ChannelClosedException("send on closed channel");
            }
            buffer.addLast(element);
            long ticket = ++putCount;
            notEmpty.signal();

            if (capacity == 0) {
                awaitTaken(ticket);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty() && !closed) {
                notEmpty.await();
            }
            return Optional.ofNullable(dequeue());
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>A non-positive timeout checks the buffer once without waiting</li>
     *   <li>Returns empty on timeout, or when the channel is closed and drained</li>
     * </ul>
     */
    @Override
    public Optional<T> poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }

        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty() && !closed) {
                if (nanos <= 0L) {
                    return Optional.empty();
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return Optional.ofNullable(dequeue());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
            taken.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of buffered elements. Used for test assertions.
     *
     * @return buffered element count
     */
    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the configured capacity.
     *
     * @return capacity, 0 for a rendezvous channel
     */
    public int capacity() {
        return capacity;
    }

    // must hold lock; the buffer holds at most the caller's element while it waits
    private void awaitTaken(long ticket) throws InterruptedException {
        try {
            while (takeCount < ticket) {
                if (closed) {
                    withdraw();
                    throw new ChannelClosedException("channel closed before the element was received");
                }
                taken.await();
            }
        } catch (InterruptedException e) {
            if (takeCount < ticket) {
                withdraw();
            }
            throw e;
        }
    }

    // must hold lock
    private void withdraw() {
        buffer.pollLast();
        putCount--;
        notFull.signal();
    }

    // must hold lock
    private T dequeue() {
        T element = buffer.pollFirst();
        if (element != null) {
            takeCount++;
            notFull.signal();
            taken.signalAll();
        }
        return element;
    }
}
