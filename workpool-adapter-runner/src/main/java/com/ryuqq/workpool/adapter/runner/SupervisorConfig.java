package com.ryuqq.workpool.adapter.runner;

/**
 * SupervisedJob 설정 (불변 record).
 *
 * <p>이 record는 SupervisedJob의 입장 루프, 완료 판정, 종료 동작을 제어하는 설정값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollingIntervalMs: 슬롯 대기, Work 대기, live worker 수 폴링 간격 (기본 10ms)</li>
 *   <li>quiescentPolls: 완료로 판정하기 위한 연속 0 관측 횟수 (기본 5)</li>
 *   <li>progressCapacity: Progress 채널 버퍼 크기, 0이면 rendezvous (기본 0)</li>
 *   <li>shutdownTimeoutMs: 완료 후 Worker 스레드 종료 대기 시간 (기본 5000ms)</li>
 *   <li>threadNamePrefix: Worker 스레드 이름 접두사 (기본 "workpool-worker")</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>빠른 완료 감지: pollingIntervalMs 감소 (10 → 1), quiescentPolls 감소 (5 → 2)</li>
 *   <li>느린 Progress 소비자: progressCapacity 증가 (0 → 64)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param pollingIntervalMs 폴링 간격 (밀리초, 양수여야 함)
 * @param quiescentPolls 연속 0 관측 횟수 (1 이상이어야 함)
 * @param progressCapacity Progress 채널 버퍼 크기 (0 이상이어야 함)
 * @param shutdownTimeoutMs 스레드 종료 대기 시간 (밀리초, 양수여야 함)
 * @param threadNamePrefix 스레드 이름 접두사 (blank 불가)
 */
public record SupervisorConfig(
    long pollingIntervalMs,
    int quiescentPolls,
    int progressCapacity,
    long shutdownTimeoutMs,
    String threadNamePrefix
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollingIntervalMs=10ms, quiescentPolls=5, progressCapacity=0,
     * shutdownTimeoutMs=5000ms, threadNamePrefix="workpool-worker"</p>
     */
    public SupervisorConfig() {
        this(10, 5, 0, 5000, "workpool-worker");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SupervisorConfig {
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")"
            );
        }
        if (quiescentPolls <= 0) {
            throw new IllegalArgumentException(
                "quiescentPolls must be positive (current: " + quiescentPolls + ")"
            );
        }
        if (progressCapacity < 0) {
            throw new IllegalArgumentException(
                "progressCapacity cannot be negative (current: " + progressCapacity + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
    }

    /**
     * pollingIntervalMs만 변경한 새 인스턴스 생성.
     */
    public SupervisorConfig withPollingIntervalMs(long pollingIntervalMs) {
        return new SupervisorConfig(pollingIntervalMs, quiescentPolls, progressCapacity, shutdownTimeoutMs, threadNamePrefix);
    }

    /**
     * quiescentPolls만 변경한 새 인스턴스 생성.
     */
    public SupervisorConfig withQuiescentPolls(int quiescentPolls) {
        return new SupervisorConfig(pollingIntervalMs, quiescentPolls, progressCapacity, shutdownTimeoutMs, threadNamePrefix);
    }

    /**
     * progressCapacity만 변경한 새 인스턴스 생성.
     */
    public SupervisorConfig withProgressCapacity(int progressCapacity) {
        return new SupervisorConfig(pollingIntervalMs, quiescentPolls, progressCapacity, shutdownTimeoutMs, threadNamePrefix);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public SupervisorConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new SupervisorConfig(pollingIntervalMs, quiescentPolls, progressCapacity, shutdownTimeoutMs, threadNamePrefix);
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public SupervisorConfig withThreadNamePrefix(String threadNamePrefix) {
        return new SupervisorConfig(pollingIntervalMs, quiescentPolls, progressCapacity, shutdownTimeoutMs, threadNamePrefix);
    }
}
