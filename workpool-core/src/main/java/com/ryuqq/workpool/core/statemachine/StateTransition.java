package com.ryuqq.workpool.core.statemachine;

/**
 * Supervisor 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>IDLE → ADMITTING</li>
 *   <li>ADMITTING → DRAINING</li>
 *   <li>DRAINING → QUIESCENT</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(SupervisorState from, SupervisorState to) {
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid supervisor state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 허용 여부.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(SupervisorState from, SupervisorState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return switch (from) {
            case IDLE -> to == SupervisorState.ADMITTING;
            case ADMITTING -> to == SupervisorState.DRAINING;
            case DRAINING -> to == SupervisorState.QUIESCENT;
            case QUIESCENT -> false;
        };
    }
}
