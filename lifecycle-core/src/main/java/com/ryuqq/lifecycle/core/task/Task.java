package com.ryuqq.lifecycle.core.task;

import com.ryuqq.lifecycle.core.poll.PollResult;
import com.ryuqq.lifecycle.core.resource.ResourceInstance;
import com.ryuqq.lifecycle.core.statemachine.ResourceAction;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 하나의 리소스에 대한 하나의 생명주기 액션.
 *
 * <p>Task는 대상 리소스, 요청된 액션, 백엔드 변경 호출 1개, 읽기 전용 probe를 소유합니다.
 * 실행 순서(변경 호출 → probe 반복 → 종료 처리)는 TaskRunner가 결정하며,
 * Task는 그 단계를 하나씩 제공합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>변경 호출은 최대 1회 ({@link #invoke()} 재호출 시 IllegalStateException)</li>
 *   <li>Task는 재사용되지 않음 (액션 요청마다 새로 생성)</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class Task {

    private static final Runnable NO_OP = () -> { };

    private final ResourceInstance resource;
    private final ResourceAction action;
    private final RemoteCall remoteCall;
    private final StatusProbe statusProbe;
    private final Runnable completionHook;
    private final AtomicBoolean invoked = new AtomicBoolean(false);
    private final AtomicInteger probeCount = new AtomicInteger();

    /**
     * 생성자.
     *
     * @param resource 대상 리소스
     * @param action 액션 (INIT 불가)
     * @param remoteCall 백엔드 변경 호출
     * @param statusProbe 원격 상태 조회
     * @param completionHook COMPLETE 직전에 실행할 후처리 (null이면 no-op)
     * @throws IllegalArgumentException 필수 인자가 null이거나 action이 INIT인 경우
     */
    public Task(ResourceInstance resource, ResourceAction action,
                RemoteCall remoteCall, StatusProbe statusProbe, Runnable completionHook) {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        if (action == null || action == ResourceAction.INIT) {
            throw new IllegalArgumentException("action must be a lifecycle action (current: " + action + ")");
        }
        if (remoteCall == null) {
            throw new IllegalArgumentException("remoteCall cannot be null");
        }
        if (statusProbe == null) {
            throw new IllegalArgumentException("statusProbe cannot be null");
        }
        this.resource = resource;
        this.action = action;
        this.remoteCall = remoteCall;
        this.statusProbe = statusProbe;
        this.completionHook = completionHook == null ? NO_OP : completionHook;
    }

    public Task(ResourceInstance resource, ResourceAction action, RemoteCall remoteCall, StatusProbe statusProbe) {
        this(resource, action, remoteCall, statusProbe, null);
    }

    /**
     * 백엔드 변경 호출 실행 (1회).
     *
     * @throws IllegalStateException 이미 호출된 경우
     */
    public void invoke() {
        if (!invoked.compareAndSet(false, true)) {
            throw new IllegalStateException("Remote call of " + this + " was already invoked");
        }
        remoteCall.execute();
    }

    /**
     * 원격 상태 조회 (횟수 기록).
     *
     * @return 원격 상태
     */
    public PollResult probe() {
        probeCount.incrementAndGet();
        return statusProbe.probe();
    }

    /**
     * COMPLETE 직전 후처리 실행 (예: UPDATE 후 속성 반영).
     */
    public void complete() {
        completionHook.run();
    }

    public ResourceInstance resource() {
        return resource;
    }

    public ResourceAction action() {
        return action;
    }

    public boolean isInvoked() {
        return invoked.get();
    }

    /**
     * 지금까지의 probe 호출 횟수.
     *
     * @return probe 횟수
     */
    public int probeCount() {
        return probeCount.get();
    }

    @Override
    public String toString() {
        return "Task{" + action + " " + resource.name() + '}';
    }
}
