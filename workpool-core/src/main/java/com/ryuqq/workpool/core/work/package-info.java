/**
 * Work Item 패키지.
 *
 * <p>Worker에게 전달되는 파라미터 묶음과 그 값의 variant를 정의합니다.</p>
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workpool.core.work.Work} - 불변 파라미터 묶음</li>
 *   <li>{@link com.ryuqq.workpool.core.work.WorkValue} - Sealed interface (permits Absent, Text, Flag, Whole, Decimal, Opaque)</li>
 * </ul>
 *
 * <h2>변환 규칙</h2>
 * <ul>
 *   <li>문자열 view: 값의 텍스트 표현, 없으면 ""</li>
 *   <li>불리언 view: 숫자는 0이 아니면 true, 문자열은 true/yes/on 등, 그 외 false</li>
 *   <li>정수 view: 불리언은 1/0, 문자열은 파싱, 실수는 버림, 그 외 0</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.workpool.core.work;
