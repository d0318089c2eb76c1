package com.ryuqq.lifecycle.application.runtime;

import com.ryuqq.lifecycle.core.failure.ResourceFailure;
import com.ryuqq.lifecycle.core.statemachine.ResourceState;
import com.ryuqq.lifecycle.core.task.Task;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 스케줄러에 등록된 Task의 핸들.
 *
 * <p>Task가 종료되면 completion이 종료 상태로 완료되고,
 * 실패하면 {@link ResourceFailure}로 예외 완료됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TaskHandle handle = scheduler.submit(task, 60_000);
 *
 * handle.completion().whenComplete((state, error) -> ...);
 *
 * // 또는 블로킹 대기
 * ResourceState state = handle.await(70, TimeUnit.SECONDS);
 *
 * // 취소 (다음 폴링 시점에 반영)
 * handle.cancel();
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class TaskHandle {

    private final Task task;
    private final CompletableFuture<ResourceState> completion;
    private final Runnable canceller;

    /**
     * 생성자.
     *
     * @param task 등록된 Task
     * @param completion 완료 신호
     * @param canceller 취소 요청 동작
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public TaskHandle(Task task, CompletableFuture<ResourceState> completion, Runnable canceller) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (completion == null) {
            throw new IllegalArgumentException("completion cannot be null");
        }
        if (canceller == null) {
            throw new IllegalArgumentException("canceller cannot be null");
        }
        this.task = task;
        this.completion = completion;
        this.canceller = canceller;
    }

    public Task task() {
        return task;
    }

    /**
     * 완료 신호.
     *
     * <p>호출자가 직접 완료시키지 못하도록 복사본을 돌려줍니다.</p>
     *
     * @return 종료 상태로 완료되는 future
     */
    public CompletableFuture<ResourceState> completion() {
        return completion.copy();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * 취소 요청.
     *
     * <p>다음 폴링 시점에 마지막 probe를 한 번 수행한 뒤 Cancelled 실패로 종료됩니다.</p>
     */
    public void cancel() {
        canceller.run();
    }

    /**
     * 종료까지 대기.
     *
     * @param timeout 대기 시간
     * @param unit 시간 단위
     * @return 종료 상태
     * @throws ResourceFailure Task가 실패한 경우
     * @throws TimeoutException 대기 시간 안에 종료되지 않은 경우
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public ResourceState await(long timeout, TimeUnit unit) throws TimeoutException, InterruptedException {
        try {
            return completion.get(timeout, unit);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    /**
     * 종료까지 대기 (제한 없음).
     *
     * @return 종료 상태
     * @throws ResourceFailure Task가 실패한 경우
     */
    public ResourceState join() {
        try {
            return completion.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new IllegalStateException("Task failed with checked exception", cause);
    }

    @Override
    public String toString() {
        return "TaskHandle{" + task + ", done=" + completion.isDone() + '}';
    }
}
