/**
 * Job 실행 어댑터.
 *
 * <p>{@link com.ryuqq.workpool.application.job.Job} 계약을 스레드 풀과 세마포어 기반
 * 입장 제한으로 구현합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workpool.adapter.runner.SupervisedJob} - 입장 루프, Worker 실행, 완료 판정</li>
 *   <li>{@link com.ryuqq.workpool.adapter.runner.SupervisorConfig} - 폴링 간격, 완료 판정 횟수, 채널 크기 등 설정</li>
 * </ul>
 *
 * <h2>상태 흐름</h2>
 * <pre>
 * IDLE ──supervise()──► ADMITTING ──noMoreWork()──► DRAINING ──live worker 0 연속 관측──► QUIESCENT
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.workpool.adapter.runner;
