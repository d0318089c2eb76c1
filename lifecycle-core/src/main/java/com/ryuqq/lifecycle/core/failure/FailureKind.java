package com.ryuqq.lifecycle.core.failure;

/**
 * 구조화된 실패의 종류.
 *
 * <p>{@link #label()}은 외부 도구가 패턴 매칭할 수 있도록
 * {@link ResourceFailure#toString()}의 접두사로 사용됩니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum FailureKind {

    /**
     * 리소스가 아직 생성되지 않았거나 원격에서 사라짐.
     */
    NOT_FOUND("NotFound"),

    /**
     * 변경 사항을 제자리(in-place)에 적용할 수 없어 교체가 필요함.
     */
    REPLACEMENT_REQUIRED("ReplacementRequired"),

    /**
     * 백엔드 호출 자체가 실패함 (연결, HTTP 오류 등).
     */
    TRANSPORT_ERROR("TransportError"),

    /**
     * 원격 측이 해당 액션의 FAILED 상태를 보고함.
     */
    RESOURCE_IN_ERROR("ResourceInError"),

    /**
     * 현재 액션의 규칙에 맞지 않는 상태 문자열.
     */
    RESOURCE_UNKNOWN_STATUS("ResourceUnknownStatus"),

    TIMEOUT("Timeout"),

    CANCELLED("Cancelled"),

    /**
     * show 결과에 없는 속성 이름 참조.
     */
    INVALID_ATTRIBUTE("InvalidAttribute");

    private final String label;

    FailureKind(String label) {
        this.label = label;
    }

    /**
     * 메시지 접두사.
     *
     * @return 예: "ResourceInError"
     */
    public String label() {
        return label;
    }
}
