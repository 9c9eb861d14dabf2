package com.ryuqq.workpool.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SupervisedJob 전용 스레드 팩토리.
 *
 * <p>스레드 이름은 {@code <prefix>-<번호>} 형식이며 데몬 스레드로 생성합니다.
 * WorkerFunction이 던진 예외는 스레드의 UncaughtExceptionHandler가 ERROR 레벨로 기록합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class WorkerThreadFactory implements ThreadFactory {

    private static final Logger log = LoggerFactory.getLogger(WorkerThreadFactory.class);

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger();

    WorkerThreadFactory(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + "-" + sequence.incrementAndGet());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) ->
            log.error("Uncaught exception in {}", t.getName(), e));
        return thread;
    }
}
