package com.ryuqq.workpool.core.channel;

/**
 * 쓰기 전용 채널 핸들.
 *
 * <p>Worker에게는 Progress 채널의 이 view만 전달됩니다.</p>
 *
 * @param <T> 원소 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SendChannel<T> {

    /**
     * 원소 전송.
     *
     * <p>버퍼가 가득 차 있으면 읽는 쪽이 공간을 만들 때까지 블로킹합니다.</p>
     *
     * @param element 전송할 원소 (null 불가)
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     * @throws ChannelClosedException 채널이 이미 닫혔거나 대기 중 닫힌 경우
     * @throws IllegalArgumentException element가 null인 경우
     */
    void send(T element) throws InterruptedException;

    /**
     * 채널이 닫혔는지 확인.
     *
     * @return 닫혔으면 true
     */
    boolean isClosed();
}
