package com.ryuqq.lifecycle.core.statemachine;

/**
 * 리소스 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>(any, 비진행 상태) → (action, IN_PROGRESS) : 액션 시작, action은 INIT 불가</li>
 *   <li>(action, IN_PROGRESS) → (action, COMPLETE)</li>
 *   <li>(action, IN_PROGRESS) → (action, FAILED)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>IN_PROGRESS 상태에서는 새 액션을 시작할 수 없음 (리소스당 단일 writer)</li>
 *   <li>종료는 IN_PROGRESS에서만 가능하며, 진행 중인 액션을 바꿀 수 없음</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 액션 시작 전이 검증 및 실행.
     *
     * @param current 현재 상태
     * @param action 시작할 액션
     * @return (action, IN_PROGRESS)
     * @throws IllegalArgumentException current 또는 action이 null이거나 action이 INIT인 경우
     * @throws IllegalStateException 이미 진행 중인 액션이 있는 경우
     */
    public static ResourceState begin(ResourceState current, ResourceAction action) {
        if (current == null || action == null) {
            throw new IllegalArgumentException(
                "State and action cannot be null (current: " + current + ", action: " + action + ")");
        }
        if (action == ResourceAction.INIT) {
            throw new IllegalArgumentException("INIT cannot be started as an action");
        }
        if (current.isInFlight()) {
            throw new IllegalStateException(
                String.format("Cannot start %s while %s is in flight", action, current));
        }
        return new ResourceState(action, ResourceStatus.IN_PROGRESS);
    }

    /**
     * 종료 전이 검증 및 실행.
     *
     * @param current 현재 상태
     * @param terminal 종료 상태 (COMPLETE 또는 FAILED)
     * @return (current.action, terminal)
     * @throws IllegalArgumentException current 또는 terminal이 null이거나 terminal이 종료 상태가 아닌 경우
     * @throws IllegalStateException current가 IN_PROGRESS가 아닌 경우
     */
    public static ResourceState finish(ResourceState current, ResourceStatus terminal) {
        if (current == null || terminal == null) {
            throw new IllegalArgumentException(
                "State and status cannot be null (current: " + current + ", terminal: " + terminal + ")");
        }
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Target status must be terminal (current: " + terminal + ")");
        }
        if (!current.isInFlight()) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s_%s", current, current.action(), terminal));
        }
        return new ResourceState(current.action(), terminal);
    }
}
