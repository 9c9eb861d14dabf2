package com.ryuqq.workpool.core.limiter;

/**
 * Worker 입장 제한기 SPI.
 *
 * <p>동시에 실행되는 Worker 수를 고정 용량의 슬롯으로 제한합니다.
 * Supervisor는 슬롯을 하나 얻을 때마다 Worker를 하나 띄우고,
 * Worker는 종료 시 정확히 하나의 슬롯을 반납합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * AdmissionLimiter limiter = new SemaphoreAdmissionLimiter(new AdmissionConfig(4));
 *
 * if (limiter.tryAcquire(10)) {
 *     try {
 *         // Worker 실행
 *     } finally {
 *         limiter.release();
 *     }
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AdmissionLimiter {

    /**
     * 슬롯 획득 시도 (비블로킹).
     *
     * @return true: 슬롯 획득, false: 모든 슬롯 사용 중
     */
    boolean tryAcquire();

    /**
     * 슬롯 획득 시도 (타임아웃 대기).
     *
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @return true: 슬롯 획득, false: 타임아웃
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    boolean tryAcquire(long timeoutMs) throws InterruptedException;

    /**
     * 슬롯 반납.
     *
     * <p>반드시 획득한 슬롯에 대해서만, try-finally 블록에서 한 번 호출되어야 합니다.</p>
     *
     * @throws IllegalStateException 획득된 슬롯이 없는데 반납하려는 경우
     */
    void release();

    /**
     * 현재 사용 중인 슬롯 수.
     *
     * @return 획득 후 아직 반납되지 않은 슬롯 수
     */
    int getCurrentConcurrency();

    /**
     * 설정 조회.
     *
     * @return 최대 동시 실행 수 등
     */
    AdmissionConfig getConfig();
}
