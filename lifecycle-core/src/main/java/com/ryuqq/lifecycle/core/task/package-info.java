/**
 * Task: 하나의 리소스 액션을 구성하는 단계들.
 *
 * <pre>
 * Task
 *  ├─ RemoteCall   : 백엔드 변경 호출 (1회)
 *  ├─ StatusProbe  : 원격 상태 조회 (반복)
 *  └─ completion   : COMPLETE 직전 후처리
 * </pre>
 *
 * <p>실행 순서와 폴링, 타임아웃, 취소는 adapter-runner 모듈의 TaskRunner가 담당합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.core.task;
