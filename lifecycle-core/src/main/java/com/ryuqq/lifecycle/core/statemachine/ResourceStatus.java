package com.ryuqq.lifecycle.core.statemachine;

/**
 * 현재 액션의 진행 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * (INIT, COMPLETE)
 *    │
 *    ▼ (액션 시작)
 * (action, IN_PROGRESS)
 *    │
 *    ├─► (action, COMPLETE) (성공)
 *    │
 *    └─► (action, FAILED)   (실패)
 *
 * 종료 상태에서 새 액션을 시작하면 다시 IN_PROGRESS로 들어갑니다.
 *
 * 금지된 전이:
 * - IN_PROGRESS → IN_PROGRESS ❌ (동일 리소스에 액션 중복 실행)
 * - COMPLETE/FAILED → COMPLETE/FAILED ❌ (IN_PROGRESS를 거치지 않은 종료)
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum ResourceStatus {

    /**
     * 액션 실행 중 (원격 작업이 아직 끝나지 않음).
     */
    IN_PROGRESS,

    /**
     * 완료 (성공).
     */
    COMPLETE,

    /**
     * 실패.
     */
    FAILED,

    /**
     * 상태를 판단할 수 없음.
     *
     * <p>TaskRunner는 이 값을 기록하지 않습니다. 외부에서 복원된 리소스처럼
     * 마지막 상태를 알 수 없는 경우에만 사용됩니다.</p>
     */
    UNKNOWN;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETE 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
