package com.ryuqq.lifecycle.core.task;

/**
 * Task가 소유하는 백엔드 변경 호출 (create, update, delete, suspend, resume).
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RemoteCall {

    /**
     * 백엔드 호출 실행.
     *
     * @throws com.ryuqq.lifecycle.core.spi.TransportException 호출 실패 시
     * @throws com.ryuqq.lifecycle.core.spi.RemoteNotFoundException 원격 엔티티가 없는 경우
     */
    void execute();
}
