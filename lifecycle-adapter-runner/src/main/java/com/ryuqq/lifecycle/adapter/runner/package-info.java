/**
 * Task 실행 어댑터.
 *
 * <p>{@link com.ryuqq.lifecycle.adapter.runner.TaskRunner}가 Task 하나를 폴링 루프로 진행시키고,
 * {@link com.ryuqq.lifecycle.adapter.runner.DefaultResourceLifecycle}가 핸들러 registry로 Task를 조립하며,
 * {@link com.ryuqq.lifecycle.adapter.runner.CooperativeScheduler}가 여러 Task를 한 스레드에서 번갈아 진행합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.adapter.runner;
