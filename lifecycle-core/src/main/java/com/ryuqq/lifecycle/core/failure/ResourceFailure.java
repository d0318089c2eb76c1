package com.ryuqq.lifecycle.core.failure;

import com.ryuqq.lifecycle.core.model.ResourceName;
import com.ryuqq.lifecycle.core.statemachine.ResourceAction;

/**
 * 리소스 액션의 구조화된 실패.
 *
 * <p>실패 종류, 리소스 이름, 진행 중이던 액션을 함께 담아 호출자에게 전달합니다.</p>
 *
 * <p><strong>메시지 형식:</strong></p>
 * <ul>
 *   <li>{@link #getMessage()}: 실패 종류별 고정 패턴 (예: {@code Went to status CREATE_FAILED due to "..."})</li>
 *   <li>{@link #toString()}: {@code <Kind>: <message>} (예: {@code ResourceInError: Went to status ...})</li>
 * </ul>
 *
 * <p>리소스의 failureReason에는 {@link #toString()} 값이 기록됩니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class ResourceFailure extends RuntimeException {

    private final FailureKind kind;
    private final ResourceName resourceName;
    private final ResourceAction action;

    /**
     * 생성자.
     *
     * @param kind 실패 종류
     * @param resourceName 리소스 이름
     * @param action 진행 중이던 액션
     * @param message 고정 패턴 메시지
     * @param cause 원인 (null 가능)
     * @throws IllegalArgumentException kind, resourceName, action, message 중 하나가 null인 경우
     */
    public ResourceFailure(FailureKind kind, ResourceName resourceName, ResourceAction action,
                           String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (resourceName == null) {
            throw new IllegalArgumentException("resourceName cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        this.kind = kind;
        this.resourceName = resourceName;
        this.action = action;
    }

    public ResourceFailure(FailureKind kind, ResourceName resourceName, ResourceAction action, String message) {
        this(kind, resourceName, action, message, null);
    }

    /**
     * 생성 전 리소스에 대한 액션 (NotFound).
     *
     * @param resourceName 리소스 이름
     * @param action 요청된 액션
     * @return "Cannot suspend remote_stack, resource not found" 형식의 실패
     */
    public static ResourceFailure notFound(ResourceName resourceName, ResourceAction action) {
        return new ResourceFailure(FailureKind.NOT_FOUND, resourceName, action,
            String.format("Cannot %s %s, resource not found", action.verb(), resourceName));
    }

    /**
     * 원격 측 FAILED 보고 (ResourceInError).
     *
     * @param resourceName 리소스 이름
     * @param action 진행 중이던 액션
     * @param status 원격 상태 문자열 (예: SUSPEND_FAILED)
     * @param reason 원격 측 사유 (null이면 빈 문자열)
     * @return ResourceInError 실패
     */
    public static ResourceFailure inError(ResourceName resourceName, ResourceAction action,
                                          String status, String reason) {
        return new ResourceFailure(FailureKind.RESOURCE_IN_ERROR, resourceName, action,
            String.format("Went to status %s due to \"%s\"", status, reason == null ? "" : reason));
    }

    /**
     * 인식할 수 없는 원격 상태 (ResourceUnknownStatus).
     *
     * @param resourceName 리소스 이름
     * @param action 진행 중이던 액션
     * @param status 원격 상태 문자열
     * @return ResourceUnknownStatus 실패
     */
    public static ResourceFailure unknownStatus(ResourceName resourceName, ResourceAction action, String status) {
        return new ResourceFailure(FailureKind.RESOURCE_UNKNOWN_STATUS, resourceName, action,
            "Resource failed - Unknown status " + status);
    }

    public static ResourceFailure timeout(ResourceName resourceName, ResourceAction action, long timeoutMs) {
        return new ResourceFailure(FailureKind.TIMEOUT, resourceName, action,
            String.format("Resource %s timed out after %dms", action, timeoutMs));
    }

    public static ResourceFailure cancelled(ResourceName resourceName, ResourceAction action) {
        return new ResourceFailure(FailureKind.CANCELLED, resourceName, action,
            String.format("Resource %s cancelled", action));
    }

    /**
     * 백엔드 호출 실패 (TransportError).
     *
     * @param resourceName 리소스 이름
     * @param action 진행 중이던 액션
     * @param cause 원인 예외
     * @return TransportError 실패 (원인 메시지를 그대로 사용)
     */
    public static ResourceFailure transport(ResourceName resourceName, ResourceAction action, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.toString();
        return new ResourceFailure(FailureKind.TRANSPORT_ERROR, resourceName, action, message, cause);
    }

    /**
     * 존재하지 않는 속성 참조 (InvalidAttribute).
     *
     * @param resourceName 리소스 이름
     * @param action 리소스의 현재 액션
     * @param attributeName 참조된 속성 이름
     * @return InvalidAttribute 실패
     */
    public static ResourceFailure invalidAttribute(ResourceName resourceName, ResourceAction action,
                                                   String attributeName) {
        return new ResourceFailure(FailureKind.INVALID_ATTRIBUTE, resourceName, action,
            String.format("The Referenced Attribute (%s %s) is incorrect.", resourceName, attributeName));
    }

    public FailureKind kind() {
        return kind;
    }

    public ResourceName resourceName() {
        return resourceName;
    }

    public ResourceAction action() {
        return action;
    }

    @Override
    public String toString() {
        return kind.label() + ": " + getMessage();
    }
}
