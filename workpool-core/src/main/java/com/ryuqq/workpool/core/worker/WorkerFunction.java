package com.ryuqq.workpool.core.worker;

import com.ryuqq.workpool.core.channel.SendChannel;
import com.ryuqq.workpool.core.progress.Progress;
import com.ryuqq.workpool.core.work.Work;

/**
 * Work 하나를 처리하는 호출자 로직.
 *
 * <p>Supervisor는 Worker 하나당 이 함수를 정확히 한 번 호출합니다.
 * 각 호출은 고유한 id와 자기만의 Work를 받으며, 진행 상황은 전달된 채널로 보냅니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>반환 이후 id와 Work를 보관하거나 재사용하지 않습니다.</li>
 *   <li>Progress는 0개 이상 보낼 수 있습니다.</li>
 *   <li>실패는 {@link Progress#errorf(String, Object...)} 또는 {@link Progress#error(Throwable)}로 보고합니다.</li>
 *   <li>던진 RuntimeException은 격리되지 않고 Worker 스레드로 전파됩니다.
 *       슬롯 반납과 Worker 수 감소는 그 경우에도 보장됩니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * WorkerFunction fetcher = (id, work, progress) -> {
 *     try {
 *         fetch(work.getString("url"));
 *         progress.send(Progress.update(1));
 *     } catch (IOException e) {
 *         progress.send(Progress.errorf("worker %s: %s", id, e.getMessage()));
 *     }
 * };
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface WorkerFunction {

    /**
     * Work 처리.
     *
     * @param id Worker 식별자 (호출자에게만 의미 있는 값, 예: 순번)
     * @param work 처리할 Work
     * @param progress Progress 출력 채널 (쓰기 전용)
     * @throws InterruptedException Progress 전송 등 블로킹 중 인터럽트 발생 시
     */
    void work(Object id, Work work, SendChannel<Progress> progress) throws InterruptedException;
}
