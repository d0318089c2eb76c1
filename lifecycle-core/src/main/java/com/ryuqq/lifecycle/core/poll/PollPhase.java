package com.ryuqq.lifecycle.core.poll;

/**
 * probe 결과를 현재 액션 기준으로 분류한 값.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum PollPhase {

    /**
     * {@code <ACTION>_IN_PROGRESS}: 다음 폴링까지 대기.
     */
    IN_PROGRESS,

    /**
     * {@code <ACTION>_COMPLETE}: 성공 종료.
     */
    COMPLETE,

    /**
     * {@code <ACTION>_FAILED}: 원격 측 실패 종료.
     */
    FAILED,

    /**
     * 현재 액션의 세 가지 상태 중 어느 것과도 일치하지 않음.
     */
    UNKNOWN;

    /**
     * 폴링을 계속해야 하는지 확인.
     *
     * @return IN_PROGRESS인 경우 true
     */
    public boolean isPending() {
        return this == IN_PROGRESS;
    }
}
