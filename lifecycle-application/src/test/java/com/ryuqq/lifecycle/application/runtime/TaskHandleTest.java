package com.ryuqq.lifecycle.application.runtime;

import com.ryuqq.lifecycle.core.failure.ResourceFailure;
import com.ryuqq.lifecycle.core.model.Properties;
import com.ryuqq.lifecycle.core.model.ResourceName;
import com.ryuqq.lifecycle.core.model.ResourceType;
import com.ryuqq.lifecycle.core.poll.PollResult;
import com.ryuqq.lifecycle.core.resource.ResourceInstance;
import com.ryuqq.lifecycle.core.statemachine.ResourceAction;
import com.ryuqq.lifecycle.core.statemachine.ResourceState;
import com.ryuqq.lifecycle.core.statemachine.ResourceStatus;
import com.ryuqq.lifecycle.core.task.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TaskHandle 테스트.
 *
 * <ul>
 *   <li>join/await는 실패 원인(ResourceFailure)을 감싸지 않고 그대로 던짐</li>
 *   <li>cancel은 등록된 취소 동작에 위임</li>
 *   <li>completion()은 복사본이라 호출자가 완료시킬 수 없음</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class TaskHandleTest {

    private Task task;
    private CompletableFuture<ResourceState> completion;
    private AtomicInteger cancelRequests;
    private TaskHandle handle;

    @BeforeEach
    void setUp() {
        ResourceInstance resource = ResourceInstance.of(
            ResourceName.of("remote_stack"), ResourceType.of("OS::Heat::Stack"), Properties.empty());
        task = new Task(resource, ResourceAction.CREATE, () -> { }, () -> PollResult.of("CREATE_COMPLETE"));
        completion = new CompletableFuture<>();
        cancelRequests = new AtomicInteger();
        handle = new TaskHandle(task, completion, cancelRequests::incrementAndGet);
    }

    @Test
    void join_완료되면_종료_상태를_돌려준다() {
        // given
        ResourceState done = ResourceState.of(ResourceAction.CREATE, ResourceStatus.COMPLETE);

        // when
        completion.complete(done);

        // then
        assertThat(handle.isDone()).isTrue();
        assertThat(handle.join()).isEqualTo(done);
        assertThat(handle.task()).isSameAs(task);
    }

    @Test
    void join_실패하면_ResourceFailure를_그대로_던진다() {
        // given
        ResourceFailure failure = ResourceFailure.cancelled(ResourceName.of("remote_stack"), ResourceAction.CREATE);

        // when
        completion.completeExceptionally(failure);

        // then
        assertThatThrownBy(handle::join).isSameAs(failure);
        assertThatThrownBy(() -> handle.await(1, TimeUnit.SECONDS)).isSameAs(failure);
    }

    @Test
    void join_checked_예외는_IllegalStateException으로_감싼다() {
        // when
        completion.completeExceptionally(new IOException("disk"));

        // then
        assertThatThrownBy(handle::join)
            .isInstanceOf(IllegalStateException.class)
            .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void await_시간_안에_끝나지_않으면_TimeoutException() {
        assertThatThrownBy(() -> handle.await(10, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);
    }

    @Test
    void cancel_취소_동작에_위임한다() {
        // when
        handle.cancel();
        handle.cancel();

        // then
        assertThat(cancelRequests.get()).isEqualTo(2);
    }

    @Test
    void completion_복사본을_완료해도_원본은_영향이_없다() {
        // when
        handle.completion().complete(ResourceState.INITIAL);

        // then
        assertThat(handle.isDone()).isFalse();
    }

    @Test
    void 생성자_null_인자는_거부한다() {
        assertThatThrownBy(() -> new TaskHandle(null, completion, () -> { }))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TaskHandle(task, null, () -> { }))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TaskHandle(task, completion, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
