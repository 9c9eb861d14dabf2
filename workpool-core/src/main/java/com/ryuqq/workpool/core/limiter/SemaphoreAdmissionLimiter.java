package com.ryuqq.workpool.core.limiter;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Semaphore 기반 AdmissionLimiter.
 *
 * <p>{@link Semaphore}의 permit 수를 maxConcurrency로 고정하고,
 * 사용 중인 슬롯 수를 별도로 추적하여 과다 반납을 거부합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>0 ≤ getCurrentConcurrency() ≤ maxConcurrency</li>
 *   <li>획득하지 않은 슬롯의 release()는 {@link IllegalStateException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SemaphoreAdmissionLimiter implements AdmissionLimiter {

    private final AdmissionConfig config;
    private final Semaphore permits;
    private final AtomicInteger inUse = new AtomicInteger();

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public SemaphoreAdmissionLimiter(AdmissionConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.permits = new Semaphore(config.maxConcurrency());
    }

    @Override
    public boolean tryAcquire() {
        if (permits.tryAcquire()) {
            inUse.incrementAndGet();
            return true;
        }
        return false;
    }

    @Override
    public boolean tryAcquire(long timeoutMs) throws InterruptedException {
        if (permits.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
            inUse.incrementAndGet();
            return true;
        }
        return false;
    }

    @Override
    public void release() {
        int previous = inUse.getAndUpdate(current -> current > 0 ? current - 1 : current);
        if (previous == 0) {
            throw new IllegalStateException("release() called without an acquired slot");
        }
        permits.release();
    }

    @Override
    public int getCurrentConcurrency() {
        return inUse.get();
    }

    @Override
    public AdmissionConfig getConfig() {
        return config;
    }
}
