/**
 * In-memory Channel adapter used for the coordinator's work intake and progress streams.
 *
 * <p>This package contains the reference implementation of the
 * {@link com.ryuqq.workpool.core.channel.Channel} SPI. Many senders and many receivers
 * may share one channel; each element is delivered to exactly one receiver.</p>
 *
 * <h2>Element Lifecycle</h2>
 *
 * <pre>
 * send ──► [buffer, bounded by capacity] ──► receive / poll
 *                   │
 *                   └── close(): no more sends, buffered elements still drain,
 *                                then receive returns Optional.empty()
 * </pre>
 *
 * <h2>Limitations</h2>
 *
 * <ul>
 *   <li><strong>Single JVM:</strong> No cross-process delivery</li>
 *   <li><strong>No Persistence:</strong> Buffered elements are lost on process exit</li>
 * </ul>
 *
 * @see com.ryuqq.workpool.core.channel.Channel
 * @see com.ryuqq.workpool.adapter.inmemory.channel.InMemoryChannel
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.workpool.adapter.inmemory.channel;
