/**
 * Progress 소비 측 구성 요소.
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.workpool.application.progress.ProgressLogger} - 태그별 기록, 오류 콜백, UPDATE/ESTIMATE 전달</li>
 *   <li>{@link com.ryuqq.workpool.application.progress.ProgressTally} - 전달받은 UPDATE/ESTIMATE로 진행률 집계</li>
 * </ul>
 *
 * <pre>
 * Worker ──► progress ──► ProgressLogger ──► slf4j Logger
 *                              │
 *                              └── UPDATE / ESTIMATE ──► forwarding ──► ProgressTally
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.workpool.application.progress;
