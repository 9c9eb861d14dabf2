/**
 * 호출자 관점의 작업 API.
 *
 * <p>{@link com.ryuqq.workpool.application.job.Job}은 Worker 수 상한, Work 공급, 입장 중단,
 * 완료 대기를 하나의 계약으로 묶습니다. 구현은 {@code workpool-adapter-runner} 모듈에 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.workpool.application.job;
