package com.ryuqq.lifecycle.core.task;

import com.ryuqq.lifecycle.core.poll.PollResult;

/**
 * Task가 소유하는 읽기 전용 상태 조회.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StatusProbe {

    /**
     * 원격 상태 조회.
     *
     * @return 원격 상태
     * @throws com.ryuqq.lifecycle.core.spi.TransportException 호출 실패 시
     * @throws com.ryuqq.lifecycle.core.spi.RemoteNotFoundException 원격 엔티티가 없는 경우
     */
    PollResult probe();
}
