package com.ryuqq.workpool.application.job;

import com.ryuqq.workpool.core.channel.ReceiveChannel;
import com.ryuqq.workpool.core.statemachine.SupervisorState;
import com.ryuqq.workpool.core.work.Work;

import java.util.concurrent.CompletableFuture;

/**
 * 한정된 수의 Worker로 Work를 처리하는 작업 단위.
 *
 * <p>호출자는 intake 채널로 Work를 공급하고, {@link Supervision}을 통해 Progress를 받으며,
 * 더 이상 Work가 없으면 입장 중단을 알린 뒤 {@link #isDone()}으로 완료를 기다립니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <ol>
 *   <li>{@link #supervise(int, ReceiveChannel)} - 입장 루프 시작 (IDLE → ADMITTING)</li>
 *   <li>{@link Supervision#noMoreWork()} - 새 Worker 입장 중단 (ADMITTING → DRAINING)</li>
 *   <li>{@link #isDone()} 완료 - 모든 Worker 종료 확인 (DRAINING → QUIESCENT)</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Channel&lt;Work&gt; intake = new InMemoryChannel&lt;&gt;();
 * Supervision supervision = job.supervise(4, intake);
 * CompletableFuture&lt;Void&gt; sink = new ProgressLogger(log, true)
 *     .start(supervision.progress(), executor);
 *
 * for (Map&lt;String, Object&gt; params : inputs) {
 *     intake.send(Work.of(params));
 * }
 * supervision.noMoreWork();
 *
 * job.isDone().join();
 * supervision.progress().close();
 * sink.join();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Job {

    /**
     * 입장 루프를 시작하고 Supervision 핸들 반환.
     *
     * <p>동시에 실행되는 Worker 호출은 최대 maxWorkers개입니다.
     * 반환된 progress 채널은 호출자가 계속 소비해야 하며, 소비를 마친 뒤 닫는 것도 호출자의 몫입니다.</p>
     *
     * @param maxWorkers 최대 동시 Worker 수 (양수)
     * @param intake Work 공급 채널
     * @return Supervision (progress 채널 + 입장 중단 신호)
     * @throws IllegalArgumentException maxWorkers가 양수가 아니거나 intake가 null인 경우
     * @throws IllegalStateException 이미 supervise가 호출된 경우
     */
    Supervision supervise(int maxWorkers, ReceiveChannel<Work> intake);

    /**
     * Worker 호출 한 번을 현재 스레드에서 실행.
     *
     * <p>"Work 도착"과 "입장 중단" 중 먼저 일어난 쪽을 따릅니다. Work가 오면 WorkerFunction을
     * 정확히 한 번 실행하고, 중단이 먼저면 즉시 반환합니다. 보통은 입장 루프가 호출합니다.</p>
     *
     * @param id Worker 식별자 (WorkerFunction에 그대로 전달)
     * @throws IllegalStateException supervise 전에 호출한 경우
     */
    void newWorker(Object id);

    /**
     * 완료 신호.
     *
     * <p>입장 중단 이후 모든 Worker가 종료되면 정확히 한 번 완료됩니다.
     * 여러 호출자가 동시에 기다려도 모두 같은 완료를 관찰합니다.</p>
     *
     * @return 완료 시 complete되는 CompletableFuture
     */
    CompletableFuture<Void> isDone();

    /**
     * 현재 Supervisor 상태.
     *
     * @return SupervisorState
     */
    SupervisorState state();

    /**
     * 현재 살아 있는 Worker 수.
     *
     * @return live worker count (음수가 되지 않음)
     */
    long liveWorkers();
}
