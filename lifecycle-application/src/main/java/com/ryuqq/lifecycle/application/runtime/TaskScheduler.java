package com.ryuqq.lifecycle.application.runtime;

import com.ryuqq.lifecycle.core.task.Task;

/**
 * Task 등록 창구.
 *
 * <p>등록된 Task는 {@link Runtime#pump()} 주기마다 한 단계씩 진행되며,
 * 결과는 돌려받은 {@link TaskHandle}로 전달됩니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface TaskScheduler {

    /**
     * Task 등록.
     *
     * @param task 실행할 Task
     * @param timeoutMs 전체 제한 시간 (밀리초)
     * @return 완료 대기 및 취소용 핸들
     * @throws IllegalArgumentException task가 null이거나 timeoutMs가 양수가 아닌 경우 (리소스는 (action, FAILED))
     * @throws IllegalStateException 같은 리소스의 Task가 이미 등록되어 있거나 (리소스 상태 유지)
     *         스케줄러가 종료된 경우 (리소스는 Cancelled 사유로 (action, FAILED))
     */
    TaskHandle submit(Task task, long timeoutMs);

    /**
     * 아직 종료되지 않은 Task 수.
     *
     * @return 등록된 Task 수
     */
    int inFlightCount();
}
