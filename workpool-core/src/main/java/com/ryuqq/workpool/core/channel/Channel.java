package com.ryuqq.workpool.core.channel;

/**
 * 닫을 수 있는 양방향 채널 SPI.
 *
 * <p>Supervisor의 작업 투입(intake) 채널과 Progress 출력 채널이 이 계약을 따릅니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>여러 생산자와 여러 소비자가 동시에 사용해도 안전해야 합니다.</li>
 *   <li>{@link #close()}는 멱등이며 블로킹 중인 모든 송신자/수신자를 깨웁니다.</li>
 *   <li>닫힌 뒤의 send는 {@link ChannelClosedException}을 던집니다.</li>
 *   <li>닫힌 뒤에도 버퍼에 남은 원소는 수신할 수 있습니다.</li>
 * </ul>
 *
 * <p>구현체는 adapter-inmemory 모듈의 {@code InMemoryChannel}에서 제공됩니다.</p>
 *
 * @param <T> 원소 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Channel<T> extends SendChannel<T>, ReceiveChannel<T> {

    /**
     * 채널 닫기.
     *
     * <p>더 이상 원소를 보내지 않겠다는 신호입니다. 이미 닫힌 채널에 호출해도 안전합니다.</p>
     */
    void close();

    @Override
    boolean isClosed();
}
