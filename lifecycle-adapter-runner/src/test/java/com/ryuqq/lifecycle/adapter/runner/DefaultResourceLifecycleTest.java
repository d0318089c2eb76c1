package com.ryuqq.lifecycle.adapter.runner;

import com.ryuqq.lifecycle.core.failure.FailureKind;
import com.ryuqq.lifecycle.core.failure.ReplacementRequiredException;
import com.ryuqq.lifecycle.core.failure.ResourceFailure;
import com.ryuqq.lifecycle.core.model.Properties;
import com.ryuqq.lifecycle.core.model.PropertyDiff;
import com.ryuqq.lifecycle.core.model.ResourceId;
import com.ryuqq.lifecycle.core.model.ResourceName;
import com.ryuqq.lifecycle.core.model.ResourceType;
import com.ryuqq.lifecycle.core.poll.PollResult;
import com.ryuqq.lifecycle.core.resource.ResourceInstance;
import com.ryuqq.lifecycle.core.spi.RemoteNotFoundException;
import com.ryuqq.lifecycle.core.spi.ResourceHandler;
import com.ryuqq.lifecycle.core.spi.ResourceHandlerRegistry;
import com.ryuqq.lifecycle.core.spi.TransportException;
import com.ryuqq.lifecycle.core.statemachine.ResourceAction;
import com.ryuqq.lifecycle.core.statemachine.ResourceState;
import com.ryuqq.lifecycle.core.statemachine.ResourceStatus;
import com.ryuqq.lifecycle.core.task.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * DefaultResourceLifecycle 유닛 테스트.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultResourceLifecycleTest {

    private static final ResourceType STACK = ResourceType.of("OS::Heat::Stack");
    private static final ResourceName NAME = ResourceName.of("remote_stack");
    private static final ResourceId STACK_ID = ResourceId.of("stack-1");

    @Mock
    private ResourceHandler handler;

    private DefaultResourceLifecycle lifecycle;
    private ResourceInstance resource;

    @BeforeEach
    void setUp() {
        ResourceHandlerRegistry registry = new ResourceHandlerRegistry().register(STACK, handler);
        lifecycle = new DefaultResourceLifecycle(registry, new TaskRunnerConfig(1, 0, 10));
        resource = ResourceInstance.of(NAME, STACK, Properties.of(Map.of("template", "t", "timeout", 10)));
    }

    // ============================================================
    // 1. perform 사전 조건
    // ============================================================

    @Test
    void perform_CREATE는_상태를_IN_PROGRESS로_바꾸고_Task를_돌려준다() {
        // when
        Task task = lifecycle.perform(ResourceAction.CREATE, resource);

        // then
        assertThat(task.action()).isEqualTo(ResourceAction.CREATE);
        assertThat(task.resource()).isSameAs(resource);
        assertThat(task.isInvoked()).isFalse();
        assertThat(resource.state()).isEqualTo(ResourceState.of(ResourceAction.CREATE, ResourceStatus.IN_PROGRESS));
        verifyNoInteractions(handler);
    }

    @Test
    void perform_진행_중인_리소스는_IllegalStateException() {
        // given
        lifecycle.perform(ResourceAction.CREATE, resource);

        // when & then
        assertThatThrownBy(() -> lifecycle.perform(ResourceAction.DELETE, resource))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void perform_INIT은_IllegalArgumentException() {
        assertThatThrownBy(() -> lifecycle.perform(ResourceAction.INIT, resource))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void perform_등록되지_않은_유형은_IllegalArgumentException() {
        ResourceInstance firewall = ResourceInstance.of(
            ResourceName.of("firewall"), ResourceType.of("OS::Neutron::Firewall"), Properties.empty());

        assertThatThrownBy(() -> lifecycle.perform(ResourceAction.CREATE, firewall))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(firewall.state()).isEqualTo(ResourceState.INITIAL);
    }

    @Test
    void perform_DELETE_식별자가_없으면_원격_호출_없이_NotFound() {
        // when
        ResourceFailure failure = catchThrowableOfType(
            () -> lifecycle.perform(ResourceAction.DELETE, resource), ResourceFailure.class);

        // then
        assertThat(failure.kind()).isEqualTo(FailureKind.NOT_FOUND);
        assertThat(resource.state()).isEqualTo(ResourceState.of(ResourceAction.DELETE, ResourceStatus.FAILED));
        assertThat(resource.failureReason()).contains("NotFound: Cannot delete remote_stack, resource not found");
        verifyNoInteractions(handler);
    }

    // ============================================================
    // 2. run
    // ============================================================

    @Test
    void run_CREATE는_create_결과를_식별자로_기록한다() {
        // given
        when(handler.create(NAME, resource.properties())).thenReturn(STACK_ID);
        when(handler.probe(STACK_ID)).thenReturn(PollResult.of("CREATE_COMPLETE"));

        // when
        lifecycle.run(lifecycle.perform(ResourceAction.CREATE, resource), 1_000);

        // then
        assertThat(resource.resourceId()).contains(STACK_ID);
        assertThat(resource.state()).isEqualTo(ResourceState.of(ResourceAction.CREATE, ResourceStatus.COMPLETE));
    }

    @Test
    void run_UPDATE_완료시_diff를_속성에_병합한다() {
        // given
        resource.assignResourceId(STACK_ID);
        PropertyDiff diff = PropertyDiff.of(Map.of("timeout", 60));
        when(handler.probe(STACK_ID)).thenReturn(PollResult.of("UPDATE_COMPLETE"));

        // when
        lifecycle.run(lifecycle.update(resource, diff), 1_000);

        // then
        verify(handler).update(STACK_ID, diff);
        assertThat(resource.properties().get("timeout")).contains(60);
        assertThat(resource.properties().get("template")).contains("t");
    }

    @Test
    void update_교체_속성이_포함되면_상태를_바꾸지_않는다() {
        // given
        resource.assignResourceId(STACK_ID);
        when(handler.replacementProperties()).thenReturn(Set.of("template"));

        // when
        ReplacementRequiredException failure = catchThrowableOfType(
            () -> lifecycle.update(resource, PropertyDiff.of(Map.of("template", "new"))),
            ReplacementRequiredException.class);

        // then
        assertThat(failure.offendingProperties()).containsExactly("template");
        assertThat(resource.state()).isEqualTo(ResourceState.INITIAL);
        verify(handler, never()).update(any(), any());
    }

    // ============================================================
    // 3. resolveAttribute
    // ============================================================

    @Test
    void resolveAttribute_show_전송_오류는_TransportError() {
        // given
        resource.assignResourceId(STACK_ID);
        when(handler.show(STACK_ID)).thenThrow(new TransportException("timeout"));

        // when
        ResourceFailure failure = catchThrowableOfType(
            () -> lifecycle.resolveAttribute(resource, "stack_status"), ResourceFailure.class);

        // then
        assertThat(failure.kind()).isEqualTo(FailureKind.TRANSPORT_ERROR);
    }

    @Test
    void resolveAttribute_원격_엔티티가_없으면_NotFound() {
        // given
        resource.assignResourceId(STACK_ID);
        when(handler.show(STACK_ID)).thenThrow(new RemoteNotFoundException(STACK_ID));

        // when
        ResourceFailure failure = catchThrowableOfType(
            () -> lifecycle.resolveAttribute(resource, "stack_status"), ResourceFailure.class);

        // then
        assertThat(failure.kind()).isEqualTo(FailureKind.NOT_FOUND);
    }

    @Test
    void resolveAttribute_빈_이름은_IllegalArgumentException() {
        assertThatThrownBy(() -> lifecycle.resolveAttribute(resource, " "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
