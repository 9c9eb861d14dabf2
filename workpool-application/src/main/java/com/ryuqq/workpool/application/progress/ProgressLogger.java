package com.ryuqq.workpool.application.progress;

import com.ryuqq.workpool.core.channel.ChannelClosedException;
import com.ryuqq.workpool.core.channel.ReceiveChannel;
import com.ryuqq.workpool.core.channel.SendChannel;
import com.ryuqq.workpool.core.progress.Progress;
import com.ryuqq.workpool.core.progress.ProgressType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Progress 채널을 소비하며 태그별로 분류하는 Sink.
 *
 * <p><strong>태그별 처리:</strong></p>
 * <ul>
 *   <li><strong>ERROR:</strong> 항상 ERROR 레벨로 기록 ({@code [PROGRESS] ERROR: msg}), 이후 errorHandler 호출</li>
 *   <li><strong>MESSAGE:</strong> logMessages가 true일 때만 INFO 레벨로 기록</li>
 *   <li><strong>UPDATE / ESTIMATE:</strong> logMessages가 true면 INFO 기록,
 *       forwarding 채널이 있으면 logMessages와 무관하게 그대로 전달</li>
 *   <li><strong>그 외 (OTHER, 알 수 없는 태그):</strong> WARN 레벨로 기록 ({@code [PROGRESS] ??: ...}), 버리지 않음</li>
 * </ul>
 *
 * <p><strong>주의:</strong> forwarding 채널이 가득 차면 전달이 블로킹됩니다.
 * forwarding 채널을 설정했다면 반드시 읽는 쪽({@link ProgressTally} 등)을 함께 돌려야 합니다.
 * 읽는 쪽이 채널을 닫으면 한 번 경고를 남기고 이후 전달을 생략합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Channel&lt;Progress&gt; bar = new InMemoryChannel&lt;&gt;(16);
 * ProgressLogger sink = new ProgressLogger(LoggerFactory.getLogger("job"), true)
 *     .withErrorHandler(error -&gt; failures.add(error))
 *     .withForwarding(bar);
 *
 * CompletableFuture&lt;Void&gt; done = sink.start(supervision.progress(), executor);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ProgressLogger {

    private static final Logger log = LoggerFactory.getLogger(ProgressLogger.class);

    private final Logger out;
    private final boolean logMessages;
    private final Consumer<Throwable> errorHandler;
    private final SendChannel<Progress> forwarding;
    private final AtomicBoolean forwardingDropped = new AtomicBoolean(false);

    /**
     * errorHandler, forwarding 없이 생성.
     *
     * @param out 기록 대상 Logger
     * @param logMessages MESSAGE/UPDATE/ESTIMATE 기록 여부
     * @throws IllegalArgumentException out이 null인 경우
     */
    public ProgressLogger(Logger out, boolean logMessages) {
        this(out, logMessages, null, null);
    }

    /**
     * 생성자.
     *
     * @param out 기록 대상 Logger
     * @param logMessages MESSAGE/UPDATE/ESTIMATE 기록 여부
     * @param errorHandler ERROR 기록 후 호출할 콜백 (nullable)
     * @param forwarding UPDATE/ESTIMATE 전달 채널 (nullable)
     * @throws IllegalArgumentException out이 null인 경우
     */
    public ProgressLogger(Logger out, boolean logMessages,
                          Consumer<Throwable> errorHandler, SendChannel<Progress> forwarding) {
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        this.out = out;
        this.logMessages = logMessages;
        this.errorHandler = errorHandler;
        this.forwarding = forwarding;
    }

    /**
     * errorHandler를 지정한 복사본 생성.
     *
     * @param errorHandler ERROR 콜백
     * @return 새 ProgressLogger
     */
    public ProgressLogger withErrorHandler(Consumer<Throwable> errorHandler) {
        return new ProgressLogger(out, logMessages, errorHandler, forwarding);
    }

    /**
     * forwarding 채널을 지정한 복사본 생성.
     *
     * @param forwarding UPDATE/ESTIMATE 전달 채널
     * @return 새 ProgressLogger
     */
    public ProgressLogger withForwarding(SendChannel<Progress> forwarding) {
        return new ProgressLogger(out, logMessages, errorHandler, forwarding);
    }

    /**
     * source가 닫히고 비워질 때까지 현재 스레드에서 소비.
     *
     * @param source Progress 채널
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     * @throws IllegalArgumentException source가 null인 경우
     */
    public void run(ReceiveChannel<Progress> source) throws InterruptedException {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }

        Optional<Progress> next;
        while ((next = source.receive()).isPresent()) {
            accept(next.get());
        }
        log.debug("Progress source closed and drained");
    }

    /**
     * executor에서 {@link #run(ReceiveChannel)}을 실행.
     *
     * <p>source가 닫히고 비워지면 정상 완료되고, errorHandler나 기록 중 예외가 나면
     * 그 예외로 완료됩니다. 인터럽트되면 인터럽트 플래그를 복원하고 예외로 완료됩니다.</p>
     *
     * @param source Progress 채널
     * @param executor 소비 루프를 실행할 Executor
     * @return 소비 종료 시 complete되는 CompletableFuture
     * @throws IllegalArgumentException source 또는 executor가 null인 경우
     */
    public CompletableFuture<Void> start(ReceiveChannel<Progress> source, Executor executor) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }

        return CompletableFuture.runAsync(() -> {
            try {
                run(source);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Progress sink interrupted", e);
            }
        }, executor);
    }

    /**
     * Progress 한 건 처리.
     *
     * @param progress 처리할 Progress
     * @throws InterruptedException forwarding 채널 대기 중 인터럽트 발생 시
     * @throws IllegalArgumentException progress가 null인 경우
     */
    public void accept(Progress progress) throws InterruptedException {
        if (progress == null) {
            throw new IllegalArgumentException("progress cannot be null");
        }

        ProgressType type = progress.type();
        if (ProgressType.ERROR.equals(type)) {
            Throwable error = progress.asError().orElseThrow();
            out.error("[PROGRESS] ERROR: {}", error.getMessage());
            if (errorHandler != null) {
                errorHandler.accept(error);
            }
        } else if (ProgressType.MESSAGE.equals(type)) {
            if (logMessages) {
                out.info("[PROGRESS] {}", progress.asMessage().orElseThrow());
            }
        } else if (ProgressType.UPDATE.equals(type) || ProgressType.ESTIMATE.equals(type)) {
            if (logMessages) {
                out.info("[PROGRESS] {}: {}", type.displayName(), progress.asCount().orElseThrow());
            }
            forward(progress);
        } else {
            out.warn("[PROGRESS] ??: {}", progress.render());
        }
    }

    private void forward(Progress progress) throws InterruptedException {
        if (forwarding == null || forwardingDropped.get()) {
            return;
        }
        try {
            forwarding.send(progress);
        } catch (ChannelClosedException e) {
            if (forwardingDropped.compareAndSet(false, true)) {
                log.warn("Forwarding channel closed by its reader, further {} envelopes are not forwarded",
                    progress.type().displayName());
            }
        }
    }
}
