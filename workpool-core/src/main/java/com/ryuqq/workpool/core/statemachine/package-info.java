/**
 * Supervisor 상태 머신.
 *
 * <ul>
 *   <li>{@link com.ryuqq.workpool.core.statemachine.SupervisorState} - IDLE, ADMITTING, DRAINING, QUIESCENT</li>
 *   <li>{@link com.ryuqq.workpool.core.statemachine.StateTransition} - 전이 규칙 검증</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.workpool.core.statemachine;
