package com.ryuqq.lifecycle.core.statemachine;

/**
 * (action, status) 쌍.
 *
 * <p>리소스의 생명주기를 외부에서 관찰할 수 있는 유일한 값입니다.</p>
 *
 * @param action 마지막으로 시작된 액션
 * @param status 그 액션의 진행 상태
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record ResourceState(
    ResourceAction action,
    ResourceStatus status
) {

    /**
     * 새로 만들어진 리소스의 상태 (INIT, COMPLETE).
     */
    public static final ResourceState INITIAL = new ResourceState(ResourceAction.INIT, ResourceStatus.COMPLETE);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException action 또는 status가 null인 경우
     */
    public ResourceState {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    public static ResourceState of(ResourceAction action, ResourceStatus status) {
        return new ResourceState(action, status);
    }

    /**
     * 진행 중인 액션이 있는지 확인.
     *
     * @return status가 IN_PROGRESS인 경우 true
     */
    public boolean isInFlight() {
        return status == ResourceStatus.IN_PROGRESS;
    }

    @Override
    public String toString() {
        return action + "_" + status;
    }
}
