package com.ryuqq.workpool.core.channel;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 읽기 전용 채널 핸들.
 *
 * <p>닫힌 채널도 버퍼에 남은 원소는 모두 읽을 수 있습니다.
 * 버퍼가 비고 닫힌 뒤에야 수신 메서드가 빈 값을 반환합니다.</p>
 *
 * @param <T> 원소 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ReceiveChannel<T> {

    /**
     * 원소 수신 (블로킹).
     *
     * @return 수신한 원소, 채널이 닫히고 비었으면 Optional.empty()
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    Optional<T> receive() throws InterruptedException;

    /**
     * 원소 수신 (타임아웃 대기).
     *
     * @param timeout 최대 대기 시간
     * @param unit 시간 단위
     * @return 수신한 원소, 타임아웃이거나 채널이 닫히고 비었으면 Optional.empty()
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    Optional<T> poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * 채널이 닫혔는지 확인.
     *
     * @return 닫혔으면 true (버퍼에 원소가 남아 있을 수 있음)
     */
    boolean isClosed();
}
