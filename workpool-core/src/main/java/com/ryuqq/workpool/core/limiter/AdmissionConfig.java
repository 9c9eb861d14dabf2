package com.ryuqq.workpool.core.limiter;

/**
 * AdmissionLimiter 설정.
 *
 * @param maxConcurrency 최대 동시 실행 Worker 수 (1 이상)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AdmissionConfig(int maxConcurrency) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if maxConcurrency is not positive
     */
    public AdmissionConfig {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive (current: " + maxConcurrency + ")");
        }
    }
}
