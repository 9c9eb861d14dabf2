package com.ryuqq.workpool.core.statemachine;

/**
 * Supervisor(Job 인스턴스)의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * IDLE
 *    │
 *    ▼ (supervise 호출)
 * ADMITTING
 *    │
 *    ▼ (stopAdmitting 호출)
 * DRAINING
 *    │
 *    ▼ (live Worker 0이 연속 폴링 동안 유지)
 * QUIESCENT
 *
 * 금지된 전이:
 * - 역방향 전이 전부 ❌
 * - 단계 건너뛰기 (IDLE → DRAINING 등) ❌
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SupervisorState {

    /**
     * 생성됨, 아직 supervise 전.
     */
    IDLE,

    /**
     * 입장 루프 동작 중 (슬롯이 나면 Worker를 띄움).
     */
    ADMITTING,

    /**
     * 더 이상 Worker를 띄우지 않음. 이미 실행 중인 Worker는 끝까지 실행.
     */
    DRAINING,

    /**
     * 모든 Worker 종료 확인, 완료 신호 발행됨.
     */
    QUIESCENT;

    /**
     * 종료 상태인지 확인.
     *
     * @return QUIESCENT인 경우 true
     */
    public boolean isTerminal() {
        return this == QUIESCENT;
    }

    /**
     * 새 Worker 입장이 허용되는 상태인지 확인.
     *
     * @return ADMITTING인 경우 true
     */
    public boolean isAdmitting() {
        return this == ADMITTING;
    }
}
