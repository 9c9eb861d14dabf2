package com.ryuqq.workpool.application.progress;

import com.ryuqq.workpool.core.channel.ReceiveChannel;
import com.ryuqq.workpool.core.progress.Progress;
import com.ryuqq.workpool.core.progress.ProgressType;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * forwarding 채널을 읽어 진행률을 집계하는 소비자.
 *
 * <p>UPDATE의 증감량은 completed에 누적하고, ESTIMATE는 가장 최근 값만 유지합니다.
 * 그 외 태그는 무시합니다. 진행 표시줄 렌더링은 호출자가 {@link #fraction()}으로 구현합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ProgressTally {

    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong estimate = new AtomicLong();

    /**
     * source가 닫히고 비워질 때까지 현재 스레드에서 집계.
     *
     * @param source forwarding 채널
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     * @throws IllegalArgumentException source가 null인 경우
     */
    public void run(ReceiveChannel<Progress> source) throws InterruptedException {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }

        Optional<Progress> next;
        while ((next = source.receive()).isPresent()) {
            record(next.get());
        }
    }

    /**
     * executor에서 {@link #run(ReceiveChannel)}을 실행.
     *
     * @param source forwarding 채널
     * @param executor 집계 루프를 실행할 Executor
     * @return source가 닫히고 비워지면 complete되는 CompletableFuture
     */
    public CompletableFuture<Void> start(ReceiveChannel<Progress> source, Executor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }

        return CompletableFuture.runAsync(() -> {
            try {
                run(source);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Progress tally interrupted", e);
            }
        }, executor);
    }

    /**
     * Progress 한 건 반영.
     *
     * @param progress 반영할 Progress
     */
    public void record(Progress progress) {
        if (progress == null) {
            throw new IllegalArgumentException("progress cannot be null");
        }
        if (ProgressType.UPDATE.equals(progress.type())) {
            completed.addAndGet(progress.asCount().orElseThrow());
        } else if (ProgressType.ESTIMATE.equals(progress.type())) {
            estimate.set(progress.asCount().orElseThrow());
        }
    }

    /**
     * 누적 완료량.
     *
     * @return UPDATE 증감량의 합
     */
    public long completed() {
        return completed.get();
    }

    /**
     * 최근 전체 작업량 추정치.
     *
     * @return 마지막 ESTIMATE 값, 없으면 0
     */
    public long estimate() {
        return estimate.get();
    }

    /**
     * 진행률.
     *
     * @return completed / estimate (0.0 ~ 1.0), 추정치가 0 이하이면 0.0
     */
    public double fraction() {
        long total = estimate.get();
        if (total <= 0) {
            return 0.0;
        }
        double ratio = (double) completed.get() / total;
        return Math.max(0.0, Math.min(1.0, ratio));
    }

    @Override
    public String toString() {
        return "ProgressTally{completed=" + completed.get() + ", estimate=" + estimate.get() + "}";
    }
}
