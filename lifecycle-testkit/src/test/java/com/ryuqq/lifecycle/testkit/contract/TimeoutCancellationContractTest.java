package com.ryuqq.lifecycle.testkit.contract;

import com.ryuqq.lifecycle.adapter.runner.CooperativeScheduler;
import com.ryuqq.lifecycle.adapter.runner.SchedulerConfig;
import com.ryuqq.lifecycle.application.runtime.TaskHandle;
import com.ryuqq.lifecycle.core.failure.FailureKind;
import com.ryuqq.lifecycle.core.failure.ResourceFailure;
import com.ryuqq.lifecycle.core.resource.ResourceInstance;
import com.ryuqq.lifecycle.core.statemachine.ResourceAction;
import com.ryuqq.lifecycle.core.statemachine.ResourceStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contract Test: 제한 시간과 취소.
 *
 * <p>두 경우 모두 리소스는 (action, FAILED)로 끝나야 하며 변경 호출은 1회뿐입니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class TimeoutCancellationContractTest extends AbstractLifecycleContractTest {

    private final AtomicLong clock = new AtomicLong();
    private CooperativeScheduler scheduler;

    @BeforeEach
    void setUpScheduler() {
        scheduler = new CooperativeScheduler(runnerConfig, new SchedulerConfig(), clock::get);
    }

    @Test
    void run_완료되지_않으면_제한_시간_후_Timeout() {
        // given
        handler.thenProbe("CREATE_IN_PROGRESS");
        ResourceInstance resource = newResource();

        // when
        ResourceFailure failure = catchThrowableOfType(
            () -> lifecycle.run(lifecycle.perform(ResourceAction.CREATE, resource), 30),
            ResourceFailure.class);

        // then
        assertThat(failure.kind()).isEqualTo(FailureKind.TIMEOUT);
        assertState(resource, ResourceAction.CREATE, ResourceStatus.FAILED);
        assertThat(handler.mutatingCallCount()).isEqualTo(1);
    }

    @Test
    void run_제한_시간이_양수가_아니면_리소스를_FAILED로_남기고_다음_액션을_허용한다() {
        // given
        ResourceInstance resource = createdResource();

        // when & then
        assertThatThrownBy(() -> lifecycle.run(lifecycle.perform(ResourceAction.SUSPEND, resource), 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(resource.state().isInFlight()).isFalse();
        assertState(resource, ResourceAction.SUSPEND, ResourceStatus.FAILED);
        assertThat(handler.mutatingCallCount()).isZero();

        // when
        handler.thenProbe("DELETE_COMPLETE");
        lifecycle.run(lifecycle.perform(ResourceAction.DELETE, resource), TIMEOUT_MS);

        // then
        assertState(resource, ResourceAction.DELETE, ResourceStatus.COMPLETE);
    }

    @Test
    void scheduler_제한_시간이_지나면_future가_Timeout으로_끝난다() {
        // given
        handler.thenProbe("CREATE_IN_PROGRESS");
        ResourceInstance resource = newResource();
        TaskHandle handle = scheduler.submit(lifecycle.perform(ResourceAction.CREATE, resource), 100);

        // when
        scheduler.pump();
        clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(101));
        scheduler.pump();

        // then
        assertThat(handle.isDone()).isTrue();
        ResourceFailure failure = catchThrowableOfType(handle::join, ResourceFailure.class);
        assertThat(failure.kind()).isEqualTo(FailureKind.TIMEOUT);
        assertState(resource, ResourceAction.CREATE, ResourceStatus.FAILED);
        assertThat(scheduler.inFlightCount()).isZero();
    }

    @Test
    void cancel_다음_pump에서_Cancelled로_끝나고_마지막_probe를_1회_한다() {
        // given
        handler.thenProbe("CREATE_IN_PROGRESS");
        ResourceInstance resource = newResource();
        TaskHandle handle = scheduler.submit(lifecycle.perform(ResourceAction.CREATE, resource), TIMEOUT_MS);
        scheduler.pump();

        // when
        handle.cancel();
        scheduler.pump();

        // then
        assertThatThrownBy(handle::join)
            .isInstanceOf(ResourceFailure.class)
            .hasMessageContaining("cancelled");
        assertState(resource, ResourceAction.CREATE, ResourceStatus.FAILED);
        assertThat(handler.calls()).containsExactly("create", "probe", "probe");
    }

    @Test
    void cancel_시작_전이면_변경_호출_없이_Cancelled() {
        // given
        ResourceInstance resource = createdResource();
        TaskHandle handle = scheduler.submit(lifecycle.perform(ResourceAction.DELETE, resource), TIMEOUT_MS);

        // when
        handle.cancel();
        scheduler.pump();

        // then
        assertThat(handle.completion()).isCompletedExceptionally();
        assertState(resource, ResourceAction.DELETE, ResourceStatus.FAILED);
        assertThat(handler.calls()).isEmpty();
    }

    @Test
    void cancel_완료된_Task에는_영향이_없다() {
        // given
        handler.thenProbe("CREATE_COMPLETE");
        ResourceInstance resource = newResource();
        TaskHandle handle = scheduler.submit(lifecycle.perform(ResourceAction.CREATE, resource), TIMEOUT_MS);
        scheduler.pump();

        // when
        handle.cancel();
        scheduler.pump();

        // then
        assertThat(handle.join()).isEqualTo(resource.state());
        assertState(resource, ResourceAction.CREATE, ResourceStatus.COMPLETE);
    }
}
