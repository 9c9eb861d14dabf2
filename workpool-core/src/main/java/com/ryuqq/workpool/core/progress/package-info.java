/**
 * Progress Envelope 패키지.
 *
 * <p>Worker가 상태, 오류, 작업량 변화를 보고하는 태그 기반 메시지를 정의합니다.</p>
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workpool.core.progress.Progress} - 태그 + payload record</li>
 *   <li>{@link com.ryuqq.workpool.core.progress.ProgressType} - 열린 정수 태그 (알 수 없는 값 허용)</li>
 *   <li>{@link com.ryuqq.workpool.core.progress.ProgressFailure} - errorf가 만드는 구조화된 오류</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.workpool.core.progress;
