package com.ryuqq.lifecycle.adapter.runner;

/**
 * CooperativeScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>tickIntervalMs: 백그라운드 pump 주기 (기본 50ms)</li>
 *   <li>awaitTerminationMs: shutdown 시 타이머 스레드 종료 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * <p>tickIntervalMs는 폴링 간격의 해상도입니다. Task의 실제 probe 간격은
 * {@link TaskRunnerConfig#pollIntervalMs()}이며, tick보다 짧게 잡아도 tick 단위로 반올림됩니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param tickIntervalMs pump 주기 (밀리초, 양수여야 함)
 * @param awaitTerminationMs 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record SchedulerConfig(
    long tickIntervalMs,
    long awaitTerminationMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: tickIntervalMs=50ms, awaitTerminationMs=60000ms</p>
     */
    public SchedulerConfig() {
        this(50, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SchedulerConfig {
        if (tickIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "tickIntervalMs must be positive (current: " + tickIntervalMs + ")"
            );
        }
        if (awaitTerminationMs <= 0) {
            throw new IllegalArgumentException(
                "awaitTerminationMs must be positive (current: " + awaitTerminationMs + ")"
            );
        }
    }

    /**
     * tickIntervalMs만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withTickIntervalMs(long tickIntervalMs) {
        return new SchedulerConfig(tickIntervalMs, awaitTerminationMs);
    }

    /**
     * awaitTerminationMs만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withAwaitTerminationMs(long awaitTerminationMs) {
        return new SchedulerConfig(tickIntervalMs, awaitTerminationMs);
    }
}
