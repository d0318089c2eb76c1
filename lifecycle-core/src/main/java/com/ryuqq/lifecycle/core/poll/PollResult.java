package com.ryuqq.lifecycle.core.poll;

import com.ryuqq.lifecycle.core.statemachine.ResourceAction;

/**
 * 원격 상태 probe 한 번의 결과.
 *
 * <p>엔진은 백엔드별 상태 어휘를 해석하지 않습니다.
 * {@code <ACTION>_<PHASE>} 규칙만으로 분류하며, 규칙에 맞지 않는 문자열은 모두 UNKNOWN입니다.</p>
 *
 * <p><strong>분류 예시 (action = DELETE):</strong></p>
 * <ul>
 *   <li>DELETE_IN_PROGRESS → IN_PROGRESS</li>
 *   <li>DELETE_COMPLETE → COMPLETE</li>
 *   <li>DELETE_FAILED → FAILED</li>
 *   <li>UPDATE_COMPLETE → UNKNOWN (다른 액션의 상태)</li>
 *   <li>ACTIVE → UNKNOWN</li>
 * </ul>
 *
 * @param status 원격 상태 문자열 (예: CREATE_IN_PROGRESS)
 * @param reason 원격 측 사유 (null 가능)
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record PollResult(
    String status,
    String reason
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException status가 null이거나 빈 문자열인 경우
     */
    public PollResult {
        if (status == null || status.isBlank()) {
            throw new IllegalArgumentException("status cannot be null or blank");
        }
        // reason은 null 허용
    }

    /**
     * 사유 없는 PollResult 생성.
     *
     * @param status 원격 상태 문자열
     * @return PollResult 인스턴스
     */
    public static PollResult of(String status) {
        return new PollResult(status, null);
    }

    public static PollResult of(String status, String reason) {
        return new PollResult(status, reason);
    }

    /**
     * 액션과 단계로부터 PollResult 생성.
     *
     * @param action 액션
     * @param phase IN_PROGRESS, COMPLETE, FAILED 중 하나
     * @param reason 사유 (null 가능)
     * @return 예: {@code of(CREATE, COMPLETE, null)} → "CREATE_COMPLETE"
     * @throws IllegalArgumentException phase가 UNKNOWN인 경우
     */
    public static PollResult of(ResourceAction action, PollPhase phase, String reason) {
        if (phase == PollPhase.UNKNOWN) {
            throw new IllegalArgumentException("UNKNOWN has no status string");
        }
        return new PollResult(action.name() + "_" + phase.name(), reason);
    }

    /**
     * 현재 액션 기준으로 상태 분류.
     *
     * @param action 진행 중인 액션
     * @return 분류 결과
     * @throws IllegalArgumentException action이 null인 경우
     */
    public PollPhase classify(ResourceAction action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        String prefix = action.name() + "_";
        if (!status.startsWith(prefix)) {
            return PollPhase.UNKNOWN;
        }
        String phase = status.substring(prefix.length());
        for (PollPhase candidate : PollPhase.values()) {
            if (candidate != PollPhase.UNKNOWN && candidate.name().equals(phase)) {
                return candidate;
            }
        }
        return PollPhase.UNKNOWN;
    }
}
