package com.ryuqq.workpool.adapter.runner;

import com.ryuqq.workpool.adapter.inmemory.channel.InMemoryChannel;
import com.ryuqq.workpool.application.job.Job;
import com.ryuqq.workpool.application.job.Supervision;
import com.ryuqq.workpool.core.channel.Channel;
import com.ryuqq.workpool.core.channel.ReceiveChannel;
import com.ryuqq.workpool.core.limiter.AdmissionConfig;
import com.ryuqq.workpool.core.limiter.AdmissionLimiter;
import com.ryuqq.workpool.core.limiter.SemaphoreAdmissionLimiter;
import com.ryuqq.workpool.core.progress.Progress;
import com.ryuqq.workpool.core.statemachine.StateTransition;
import com.ryuqq.workpool.core.statemachine.SupervisorState;
import com.ryuqq.workpool.core.work.Work;
import com.ryuqq.workpool.core.worker.WorkerFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link Job} 기본 구현.
 *
 * <p>하나의 WorkerFunction을 최대 maxWorkers개의 Worker로 동시에 실행하며,
 * 입장 중단 이후 모든 Worker가 빠져나가면 완료를 알립니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>입장 루프: 슬롯 획득({@link AdmissionLimiter#tryAcquire(long)})과 입장 중단 중 먼저 일어난 쪽을 따름.
 *       슬롯을 얻으면 live worker 수를 증가시키고 Worker를 띄움</li>
 *   <li>Worker: intake에서 Work를 기다리다가 받으면 WorkerFunction을 한 번 실행,
 *       입장 중단이 먼저면 즉시 종료. 어느 경우든 live worker 수 감소 후 슬롯 반납</li>
 *   <li>완료 판정: 입장 중단을 기다린 뒤 pollingIntervalMs마다 live worker 수를 확인하고,
 *       quiescentPolls번 연속 0이면 Worker 스레드를 정리하고 완료</li>
 * </ol>
 *
 * <p><strong>보장 사항:</strong></p>
 * <ul>
 *   <li>동시에 실행되는 WorkerFunction 호출은 maxWorkers개 이하</li>
 *   <li>live worker 수는 원자적으로만 변경되며 음수가 되지 않음</li>
 *   <li>입장 중단 이후 새 Worker는 입장하지 않음</li>
 *   <li>완료 신호는 정확히 한 번 발생</li>
 * </ul>
 *
 * <p><strong>호출자 책임:</strong></p>
 * <ul>
 *   <li>Progress 채널을 계속 소비 (소비하지 않으면 Progress를 보내는 Worker가 블로킹됨)</li>
 *   <li>공급이 끝나면 {@link Supervision#noMoreWork()} 호출 (intake를 닫는 것만으로는 완료되지 않음)</li>
 *   <li>완료 후 Progress 소비를 마치면 Progress 채널 닫기</li>
 * </ul>
 *
 * <p><strong>스레드 구성:</strong></p>
 * <ul>
 *   <li>Worker 스레드: maxWorkers개 고정 풀 ({@code <threadNamePrefix>-N})</li>
 *   <li>제어 스레드: 입장 루프, 완료 판정 각 1개 ({@code <threadNamePrefix>-control-N})</li>
 *   <li>모든 스레드는 완료 시 종료됩니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SupervisedJob implements Job {

    private static final Logger log = LoggerFactory.getLogger(SupervisedJob.class);

    private final WorkerFunction workerFunction;
    private final SupervisorConfig config;
    private final AtomicReference<SupervisorState> state = new AtomicReference<>(SupervisorState.IDLE);
    private final AtomicLong liveWorkers = new AtomicLong();
    private final AtomicLong dispatched = new AtomicLong();
    private final AtomicLong workerSequence = new AtomicLong();
    private final CountDownLatch drainRequested = new CountDownLatch(1);
    private final CompletableFuture<Void> done = new CompletableFuture<>();

    private volatile ReceiveChannel<Work> intake;
    private volatile Channel<Progress> progress;
    private volatile AdmissionLimiter limiter;
    private volatile ExecutorService workerPool;
    private volatile ExecutorService controlPool;

    /**
     * 기본 설정으로 생성.
     *
     * @param workerFunction Work 한 건을 처리할 함수
     * @throws IllegalArgumentException workerFunction이 null인 경우
     */
    public SupervisedJob(WorkerFunction workerFunction) {
        this(workerFunction, new SupervisorConfig());
    }

    /**
     * 생성자.
     *
     * @param workerFunction Work 한 건을 처리할 함수
     * @param config 설정
     * @throws IllegalArgumentException workerFunction 또는 config가 null인 경우
     */
    public SupervisedJob(WorkerFunction workerFunction, SupervisorConfig config) {
        if (workerFunction == null) {
            throw new IllegalArgumentException("workerFunction cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.workerFunction = workerFunction;
        this.config = config;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>구현 세부:</strong></p>
     * <ul>
     *   <li>Progress 채널은 {@link SupervisorConfig#progressCapacity()} 크기의 {@link InMemoryChannel}</li>
     *   <li>입장 루프와 완료 판정은 제어 스레드에서 비동기로 시작</li>
     * </ul>
     */
    @Override
    public synchronized Supervision supervise(int maxWorkers, ReceiveChannel<Work> intake) {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive (current: " + maxWorkers + ")");
        }
        if (intake == null) {
            throw new IllegalArgumentException("intake cannot be null");
        }
        if (state.get() != SupervisorState.IDLE) {
            throw new IllegalStateException("supervise() already called (state: " + state.get() + ")");
        }

        this.intake = intake;
        this.progress = new InMemoryChannel<>(config.progressCapacity());
        this.limiter = new SemaphoreAdmissionLimiter(new AdmissionConfig(maxWorkers));
        this.workerPool = Executors.newFixedThreadPool(maxWorkers,
            new WorkerThreadFactory(config.threadNamePrefix()));
        this.controlPool = Executors.newFixedThreadPool(2,
            new WorkerThreadFactory(config.threadNamePrefix() + "-control"));

        transition(SupervisorState.IDLE, SupervisorState.ADMITTING);
        controlPool.execute(this::admit);
        controlPool.execute(this::awaitQuiescence);

        log.info("Supervising job with maxWorkers={}", maxWorkers);
        return new Supervision(progress, this::stopAdmitting);
    }

    /**
     * {@inheritDoc}
     *
     * <p>입장 루프를 거치지 않고 직접 호출하면 슬롯을 스스로 획득합니다.
     * 슬롯을 얻기 전에 입장이 중단되면 WorkerFunction을 실행하지 않고 반환합니다.
     * WorkerFunction이 던진 RuntimeException은 슬롯 반납 후 호출자에게 전파됩니다.</p>
     */
    @Override
    public void newWorker(Object id) {
        if (state.get() == SupervisorState.IDLE) {
            throw new IllegalStateException("newWorker() requires supervise() first");
        }

        try {
            if (!acquireSlot()) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker {} interrupted while waiting for a slot", id);
            return;
        }
        runWorker(id);
    }

    /**
     * {@inheritDoc}
     *
     * <p>반환되는 future는 호출마다 새 복사본이므로 한 호출자가 취소하거나 완료시켜도
     * 다른 호출자와 내부 완료 상태에 영향을 주지 않습니다.</p>
     */
    @Override
    public CompletableFuture<Void> isDone() {
        return done.copy();
    }

    @Override
    public SupervisorState state() {
        return state.get();
    }

    @Override
    public long liveWorkers() {
        return liveWorkers.get();
    }

    /**
     * Work를 받아 WorkerFunction을 실행한 횟수.
     *
     * @return dispatched count
     */
    public long dispatched() {
        return dispatched.get();
    }

    /**
     * 설정 조회.
     *
     * @return SupervisorConfig
     */
    public SupervisorConfig config() {
        return config;
    }

    private void stopAdmitting() {
        if (transition(SupervisorState.ADMITTING, SupervisorState.DRAINING)) {
            log.info("Admission stopped, draining {} live workers", liveWorkers.get());
            drainRequested.countDown();
        }
    }

    private void admit() {
        try {
            while (acquireSlot()) {
                long id = workerSequence.incrementAndGet();
                try {
                    workerPool.execute(() -> runWorker(id));
                } catch (RejectedExecutionException e) {
                    liveWorkers.decrementAndGet();
                    limiter.release();
                    throw e;
                }
            }
            log.debug("Admission loop stopped after {} workers", workerSequence.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Admission loop interrupted");
        }
    }

    /**
     * 슬롯 획득과 입장 중단 사이의 경합.
     *
     * <p>슬롯을 얻으면 live worker 수를 먼저 올린 뒤 중단 여부를 다시 확인합니다.</p>
     *
     * @return 슬롯을 얻었으면 true, 입장 중단이 먼저면 false
     */
    private boolean acquireSlot() throws InterruptedException {
        while (!isDraining()) {
            if (limiter.tryAcquire(config.pollingIntervalMs())) {
                liveWorkers.incrementAndGet();
                if (isDraining()) {
                    liveWorkers.decrementAndGet();
                    limiter.release();
                    return false;
                }
                return true;
            }
        }
        return false;
    }

    private void runWorker(Object id) {
        try {
            Optional<Work> work = awaitWork();
            if (work.isPresent()) {
                dispatched.incrementAndGet();
                workerFunction.work(id, work.get(), progress);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker {} interrupted", id);
        } finally {
            liveWorkers.decrementAndGet();
            limiter.release();
        }
    }

    /**
     * Work 도착과 입장 중단 사이의 경합.
     *
     * <p>intake가 닫히고 비었으면 더 올 Work가 없으므로 입장 중단만 기다립니다.</p>
     *
     * @return 받은 Work, 입장 중단이 먼저면 Optional.empty()
     */
    private Optional<Work> awaitWork() throws InterruptedException {
        while (!isDraining()) {
            Optional<Work> work = intake.poll(config.pollingIntervalMs(), TimeUnit.MILLISECONDS);
            if (work.isPresent()) {
                return work;
            }
            if (intake.isClosed()) {
                drainRequested.await();
            }
        }
        return Optional.empty();
    }

    private void awaitQuiescence() {
        try {
            drainRequested.await();

            int zeroStreak = 0;
            while (true) {
                if (liveWorkers.get() > 0) {
                    zeroStreak = 0;
                } else {
                    zeroStreak++;
                }
                if (zeroStreak >= config.quiescentPolls()) {
                    break;
                }
                Thread.sleep(config.pollingIntervalMs());
            }

            shutdownWorkerPool();
            transition(SupervisorState.DRAINING, SupervisorState.QUIESCENT);
            log.info("Job quiescent: {} work items dispatched", dispatched.get());
            done.complete(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Completion wait interrupted");
            done.completeExceptionally(e);
        } finally {
            controlPool.shutdown();
        }
    }

    private void shutdownWorkerPool() throws InterruptedException {
        workerPool.shutdown();
        if (!workerPool.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("Worker threads did not terminate within {}ms, forcing shutdown", config.shutdownTimeoutMs());
            workerPool.shutdownNow();
        }
    }

    private boolean isDraining() {
        return drainRequested.getCount() == 0;
    }

    private boolean transition(SupervisorState from, SupervisorState to) {
        StateTransition.validate(from, to);
        return state.compareAndSet(from, to);
    }
}
