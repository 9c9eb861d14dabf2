package com.ryuqq.workpool.core.progress;

import java.util.Objects;

/**
 * Worker가 보고한 실패.
 *
 * <p>{@link Progress#errorf(String, Object...)}가 만드는 구조화된 오류입니다.
 * 같은 메시지로 만든 두 ProgressFailure는 같은 값으로 취급됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ProgressFailure extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public ProgressFailure(String message) {
        super(message);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public ProgressFailure(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(getMessage(), ((ProgressFailure) o).getMessage());
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(getMessage());
    }
}
