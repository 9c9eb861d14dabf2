/**
 * Admission Limiter 패키지.
 *
 * <p>Supervisor가 동시에 띄울 수 있는 Worker 수를 제한하는 counting semaphore 추상화입니다.</p>
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workpool.core.limiter.AdmissionLimiter} - acquire/release SPI</li>
 *   <li>{@link com.ryuqq.workpool.core.limiter.AdmissionConfig} - 최대 동시 실행 수</li>
 *   <li>{@link com.ryuqq.workpool.core.limiter.SemaphoreAdmissionLimiter} - {@link java.util.concurrent.Semaphore} 구현</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.workpool.core.limiter;
