package com.ryuqq.lifecycle.core.failure;

import com.ryuqq.lifecycle.core.model.ResourceName;
import com.ryuqq.lifecycle.core.statemachine.ResourceAction;

import java.util.Set;

/**
 * 제자리 UPDATE가 불가능하다는 신호.
 *
 * <p>상태 전이가 아닙니다. 이 예외는 리소스 상태를 바꾸기 전, 원격 호출 전에 던져지며
 * 리소스는 이전 상태를 그대로 유지합니다. 호출자(의존성 그래프 실행기)는
 * 이 신호를 받아 새 리소스를 만들고 기존 리소스를 지우는 교체 절차를 진행합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ReplacementRequiredException extends ResourceFailure {

    private final Set<String> offendingProperties;

    /**
     * 생성자.
     *
     * @param resourceName 리소스 이름
     * @param offendingProperties 교체를 유발한 속성 이름
     */
    public ReplacementRequiredException(ResourceName resourceName, Set<String> offendingProperties) {
        super(FailureKind.REPLACEMENT_REQUIRED, resourceName, ResourceAction.UPDATE,
            String.format("Update of %s requires replacement (properties: %s)", resourceName, offendingProperties));
        this.offendingProperties = Set.copyOf(offendingProperties);
    }

    /**
     * 교체를 유발한 속성 이름.
     *
     * @return 수정 불가 Set
     */
    public Set<String> offendingProperties() {
        return offendingProperties;
    }
}
