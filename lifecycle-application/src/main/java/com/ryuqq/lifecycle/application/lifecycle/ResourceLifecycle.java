package com.ryuqq.lifecycle.application.lifecycle;

import com.ryuqq.lifecycle.core.model.PropertyDiff;
import com.ryuqq.lifecycle.core.resource.ResourceInstance;
import com.ryuqq.lifecycle.core.statemachine.ResourceAction;
import com.ryuqq.lifecycle.core.task.Task;

import java.util.Optional;

/**
 * 리소스 상태 머신.
 *
 * <p>외부 호출자(의존성 그래프 실행기)가 리소스에 액션을 요청하면,
 * 사전 조건을 검사하고 상태를 (action, IN_PROGRESS)로 바꾼 뒤 Task를 만들어 돌려줍니다.
 * Task의 실행과 종료 상태 확정은 TaskRunner 또는 TaskScheduler가 담당합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Task task = lifecycle.perform(ResourceAction.CREATE, resource);
 * lifecycle.run(task, 60_000);
 * // resource.state() == (CREATE, COMPLETE)
 *
 * try {
 *     lifecycle.perform(ResourceAction.SUSPEND, notCreated);
 * } catch (ResourceFailure e) {
 *     // e.kind() == NOT_FOUND, notCreated.state() == (SUSPEND, FAILED)
 * }
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface ResourceLifecycle {

    /**
     * 액션 요청.
     *
     * <p><strong>사전 조건:</strong></p>
     * <ul>
     *   <li>CREATE: 식별자가 없어야 함 (있으면 IllegalStateException)</li>
     *   <li>UPDATE/DELETE/SUSPEND/RESUME: 식별자가 있어야 함. 없으면 원격 호출 없이
     *       (action, FAILED)로 기록하고 NotFound 실패를 던짐</li>
     *   <li>진행 중인 액션이 없어야 함 (있으면 IllegalStateException)</li>
     * </ul>
     *
     * <p>UPDATE를 이 메서드로 요청하면 빈 diff로 {@link #update}를 호출한 것과 같습니다.</p>
     *
     * @param action 액션 (INIT 불가)
     * @param resource 대상 리소스
     * @return 실행 준비된 Task (상태는 이미 (action, IN_PROGRESS))
     * @throws com.ryuqq.lifecycle.core.failure.ResourceFailure 식별자가 없는 경우 (NotFound)
     * @throws IllegalArgumentException action이 INIT이거나 인자가 null, 또는 유형의 핸들러가 없는 경우
     * @throws IllegalStateException 사전 조건 위반
     */
    Task perform(ResourceAction action, ResourceInstance resource);

    /**
     * UPDATE 요청.
     *
     * <p>diff에 교체가 필요한 속성이 있으면 상태를 바꾸기 전에
     * {@link com.ryuqq.lifecycle.core.failure.ReplacementRequiredException}을 던집니다.</p>
     *
     * @param resource 대상 리소스
     * @param diff 변경된 속성
     * @return 실행 준비된 Task
     * @throws com.ryuqq.lifecycle.core.failure.ReplacementRequiredException 제자리 변경 불가
     * @throws com.ryuqq.lifecycle.core.failure.ResourceFailure 식별자가 없는 경우 (NotFound)
     */
    Task update(ResourceInstance resource, PropertyDiff diff);

    /**
     * Task를 종료 상태까지 실행 (호출 스레드에서 블로킹).
     *
     * @param task 실행할 Task
     * @param timeoutMs 전체 제한 시간 (밀리초)
     * @throws com.ryuqq.lifecycle.core.failure.ResourceFailure 실패 시 (리소스는 FAILED)
     */
    void run(Task task, long timeoutMs);

    /**
     * 속성 조회.
     *
     * <ul>
     *   <li>식별자가 없으면 empty</li>
     *   <li>"show"는 전체 속성 Map</li>
     *   <li>show 결과에 없는 이름은 InvalidAttribute 실패</li>
     * </ul>
     *
     * @param resource 대상 리소스
     * @param attributeName 속성 이름
     * @return 속성 값
     * @throws com.ryuqq.lifecycle.core.failure.ResourceFailure 존재하지 않는 속성 (InvalidAttribute)
     */
    Optional<Object> resolveAttribute(ResourceInstance resource, String attributeName);
}
