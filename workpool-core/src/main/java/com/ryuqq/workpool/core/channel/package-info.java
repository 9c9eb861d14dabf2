/**
 * Channel SPI.
 *
 * <p>Supervisor, Worker, Progress Sink 사이의 통신 경로를 정의합니다.</p>
 *
 * <h2>인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workpool.core.channel.SendChannel} - 쓰기 전용 view (Worker에게 전달)</li>
 *   <li>{@link com.ryuqq.workpool.core.channel.ReceiveChannel} - 읽기 전용 view (Sink, Worker intake)</li>
 *   <li>{@link com.ryuqq.workpool.core.channel.Channel} - 닫기를 포함한 전체 계약</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-inmemory (InMemoryChannel)
 *   ↓ implements
 * core/channel (Channel SPI)
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.workpool.core.channel;
