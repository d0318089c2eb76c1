package com.ryuqq.lifecycle.adapter.runner;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>probe 호출이 전송 오류로 실패했을 때 다음 probe까지의 대기 시간을 계산합니다.
 * 여러 리소스가 같은 백엔드 장애를 동시에 겪을 때 재시도가 한 시점에 몰리지 않도록 jitter를 더합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(failureCount-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>failureCount=1: 1000-1100ms</li>
 *   <li>failureCount=2: 2000-2200ms</li>
 *   <li>failureCount=3: 4000-4400ms</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final double DEFAULT_JITTER_FACTOR = 0.1;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * TaskRunnerConfig 기반 생성 (base=pollIntervalMs, max=maxProbeBackoffMs, jitter=0.1).
     *
     * @param config TaskRunner 설정
     */
    public BackoffCalculator(TaskRunnerConfig config) {
        this(config.pollIntervalMs(), config.maxProbeBackoffMs(), DEFAULT_JITTER_FACTOR);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param failureCount 연속 실패 횟수 (1부터 시작)
     * @return 다음 probe 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException failureCount가 양수가 아닌 경우
     */
    public long calculate(int failureCount) {
        if (failureCount <= 0) {
            throw new IllegalArgumentException(
                "failureCount must be positive (current: " + failureCount + ")"
            );
        }

        // shift overflow 방지: 62비트 이상은 어차피 maxDelay로 잘림
        int shift = Math.min(failureCount - 1, 62);
        long multiplier = 1L << shift;
        long exponential = baseDelayMs > maxDelayMs / multiplier
            ? maxDelayMs
            : Math.min(baseDelayMs * multiplier, maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * Math.random());

        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
