package com.ryuqq.workpool.application.job;

import com.ryuqq.workpool.core.channel.Channel;
import com.ryuqq.workpool.core.progress.Progress;

/**
 * {@link Job#supervise}가 반환하는 핸들.
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li><strong>progress:</strong> Worker들이 보내는 Progress 채널. 호출자가 소비하고, 다 쓰면 닫습니다.</li>
 *   <li><strong>stopAdmitting:</strong> 새 Worker 입장을 멈추는 신호. 여러 번 호출해도 안전합니다.</li>
 * </ul>
 *
 * @param progress Progress 채널
 * @param stopAdmitting 입장 중단 신호
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Supervision(Channel<Progress> progress, Runnable stopAdmitting) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException progress 또는 stopAdmitting이 null인 경우
     */
    public Supervision {
        if (progress == null) {
            throw new IllegalArgumentException("progress cannot be null");
        }
        if (stopAdmitting == null) {
            throw new IllegalArgumentException("stopAdmitting cannot be null");
        }
    }

    /**
     * 더 이상 공급할 Work가 없음을 알림.
     *
     * <p>이미 실행 중인 Worker는 끝까지 실행됩니다.</p>
     */
    public void noMoreWork() {
        stopAdmitting.run();
    }
}
