package com.ryuqq.lifecycle.adapter.runner;

/**
 * TaskRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollIntervalMs: probe 사이 대기 시간 (기본 1000ms)</li>
 *   <li>probeRetryLimit: 연속된 probe 전송 오류를 허용하는 횟수 (기본 0 = 첫 오류에서 실패)</li>
 *   <li>maxProbeBackoffMs: probe 재시도 대기 시간 상한 (기본 30000ms)</li>
 * </ul>
 *
 * <p>백엔드 변경 호출(create, update, ...)은 이 설정과 무관하게 절대 재시도하지 않습니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param pollIntervalMs probe 간격 (밀리초, 양수여야 함)
 * @param probeRetryLimit probe 오류 허용 횟수 (0 이상이어야 함)
 * @param maxProbeBackoffMs probe 재시도 대기 상한 (밀리초, pollIntervalMs 이상이어야 함)
 */
public record TaskRunnerConfig(
    long pollIntervalMs,
    int probeRetryLimit,
    long maxProbeBackoffMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollIntervalMs=1000ms, probeRetryLimit=0, maxProbeBackoffMs=30000ms</p>
     */
    public TaskRunnerConfig() {
        this(1000, 0, 30000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TaskRunnerConfig {
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalMs must be positive (current: " + pollIntervalMs + ")"
            );
        }
        if (probeRetryLimit < 0) {
            throw new IllegalArgumentException(
                "probeRetryLimit must be non-negative (current: " + probeRetryLimit + ")"
            );
        }
        if (maxProbeBackoffMs < pollIntervalMs) {
            throw new IllegalArgumentException(
                "maxProbeBackoffMs must be >= pollIntervalMs (poll: " + pollIntervalMs + ", max: " + maxProbeBackoffMs + ")"
            );
        }
    }

    /**
     * pollIntervalMs만 변경한 새 인스턴스 생성.
     *
     * <p>maxProbeBackoffMs가 새 간격보다 작으면 간격과 같게 맞춥니다.</p>
     */
    public TaskRunnerConfig withPollIntervalMs(long pollIntervalMs) {
        return new TaskRunnerConfig(pollIntervalMs, probeRetryLimit, Math.max(maxProbeBackoffMs, pollIntervalMs));
    }

    /**
     * probeRetryLimit만 변경한 새 인스턴스 생성.
     */
    public TaskRunnerConfig withProbeRetryLimit(int probeRetryLimit) {
        return new TaskRunnerConfig(pollIntervalMs, probeRetryLimit, maxProbeBackoffMs);
    }

    /**
     * maxProbeBackoffMs만 변경한 새 인스턴스 생성.
     */
    public TaskRunnerConfig withMaxProbeBackoffMs(long maxProbeBackoffMs) {
        return new TaskRunnerConfig(pollIntervalMs, probeRetryLimit, maxProbeBackoffMs);
    }
}
