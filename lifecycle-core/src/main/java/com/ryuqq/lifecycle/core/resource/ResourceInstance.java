package com.ryuqq.lifecycle.core.resource;

import com.ryuqq.lifecycle.core.model.Properties;
import com.ryuqq.lifecycle.core.model.ResourceId;
import com.ryuqq.lifecycle.core.model.ResourceName;
import com.ryuqq.lifecycle.core.model.ResourceType;
import com.ryuqq.lifecycle.core.statemachine.ResourceAction;
import com.ryuqq.lifecycle.core.statemachine.ResourceState;
import com.ryuqq.lifecycle.core.statemachine.ResourceStatus;
import com.ryuqq.lifecycle.core.statemachine.StateTransition;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 하나의 리소스 인스턴스.
 *
 * <p>식별자(ResourceId), (action, status) 상태, 실패 사유를 보관합니다.
 * 생성 직후 상태는 (INIT, COMPLETE)입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>ResourceId는 최대 한 번만 설정되며 이후 변경 불가</li>
 *   <li>failureReason은 status가 FAILED일 때만 존재</li>
 *   <li>IN_PROGRESS 상태에서는 새 액션을 시작할 수 없음 (in-flight 검사)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>상태 변경은 현재 Task를 실행 중인 단일 writer(TaskRunner)만 수행합니다.</li>
 *   <li>상태 쓰기(시작/종료)는 synchronized로 직렬화되고, 읽기는 잠금 없이 AtomicReference에서 합니다.</li>
 *   <li>속성 조회 등 reader는 잠금 없이 읽으며, 진행 중인 Task가 있으면 이전 값을 볼 수 있습니다.</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ResourceInstance {

    private final ResourceName name;
    private final ResourceType type;
    private final AtomicReference<ResourceId> resourceId = new AtomicReference<>();
    private final AtomicReference<ResourceState> state = new AtomicReference<>(ResourceState.INITIAL);
    private volatile Properties properties;
    private volatile String failureReason;

    private ResourceInstance(ResourceName name, ResourceType type, Properties properties) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        this.name = name;
        this.type = type;
        this.properties = properties;
    }

    /**
     * ResourceInstance 생성 (상태: INIT_COMPLETE, 식별자 없음).
     *
     * @param name 리소스 이름
     * @param type 리소스 유형
     * @param properties CREATE에 사용할 속성
     * @return ResourceInstance 인스턴스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static ResourceInstance of(ResourceName name, ResourceType type, Properties properties) {
        return new ResourceInstance(name, type, properties);
    }

    public ResourceName name() {
        return name;
    }

    public ResourceType type() {
        return type;
    }

    public Properties properties() {
        return properties;
    }

    /**
     * 백엔드 식별자 조회.
     *
     * @return CREATE 호출이 식별자를 돌려준 뒤부터 값이 존재
     */
    public Optional<ResourceId> resourceId() {
        return Optional.ofNullable(resourceId.get());
    }

    public boolean hasResourceId() {
        return resourceId.get() != null;
    }

    public ResourceState state() {
        return state.get();
    }

    public ResourceAction action() {
        return state.get().action();
    }

    public ResourceStatus status() {
        return state.get().status();
    }

    /**
     * 실패 사유 조회.
     *
     * @return status가 FAILED일 때만 값이 존재
     */
    public Optional<String> failureReason() {
        return Optional.ofNullable(failureReason);
    }

    /**
     * 논리적으로 삭제되었는지 확인.
     *
     * @return 상태가 (DELETE, COMPLETE)인 경우 true
     */
    public boolean isDeleted() {
        ResourceState current = state.get();
        return current.action() == ResourceAction.DELETE && current.status() == ResourceStatus.COMPLETE;
    }

    /**
     * 백엔드 식별자 설정 (최초 1회).
     *
     * @param id CREATE 호출이 돌려준 식별자
     * @throws IllegalArgumentException id가 null인 경우
     * @throws IllegalStateException 이미 식별자가 설정된 경우
     */
    public void assignResourceId(ResourceId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (!resourceId.compareAndSet(null, id)) {
            throw new IllegalStateException(
                String.format("ResourceId of %s is already set (current: %s, attempted: %s)",
                    name, resourceId.get(), id));
        }
    }

    /**
     * 액션 시작: (action, IN_PROGRESS)로 전이.
     *
     * <p>상태 변경은 모두 이 인스턴스의 모니터 안에서 수행되므로, 두 호출자가 동시에
     * 액션을 시작하면 하나만 성공하고 나머지는 IllegalStateException을 받습니다.</p>
     *
     * @param action 시작할 액션
     * @return 전이된 상태
     * @throws IllegalStateException 이미 진행 중인 액션이 있는 경우
     */
    public synchronized ResourceState beginAction(ResourceAction action) {
        ResourceState next = StateTransition.begin(state.get(), action);
        failureReason = null;
        state.set(next);
        return next;
    }

    /**
     * 진행 중인 액션을 성공으로 종료.
     *
     * @return 전이된 상태
     * @throws IllegalStateException 진행 중인 액션이 없는 경우
     */
    public ResourceState markComplete() {
        return finish(ResourceStatus.COMPLETE, null);
    }

    /**
     * 진행 중인 액션을 실패로 종료.
     *
     * @param reason 실패 사유
     * @return 전이된 상태
     * @throws IllegalArgumentException reason이 null이거나 빈 문자열인 경우
     * @throws IllegalStateException 진행 중인 액션이 없는 경우
     */
    public ResourceState markFailed(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        return finish(ResourceStatus.FAILED, reason);
    }

    /**
     * UPDATE 완료 후 속성 교체.
     *
     * @param updated 새 속성
     * @throws IllegalArgumentException updated가 null인 경우
     */
    public void replaceProperties(Properties updated) {
        if (updated == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        this.properties = updated;
    }

    private synchronized ResourceState finish(ResourceStatus terminal, String reason) {
        ResourceState next = StateTransition.finish(state.get(), terminal);
        // reason을 먼저 기록해야 FAILED를 읽은 reader가 사유도 볼 수 있음
        failureReason = reason;
        state.set(next);
        return next;
    }

    @Override
    public String toString() {
        return "ResourceInstance{" + name + ", " + type.getValue() + ", " + state.get() + '}';
    }
}
