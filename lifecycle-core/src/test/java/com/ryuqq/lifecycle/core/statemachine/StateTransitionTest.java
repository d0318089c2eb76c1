package com.ryuqq.lifecycle.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.lifecycle.core.statemachine.ResourceAction.*;
import static com.ryuqq.lifecycle.core.statemachine.ResourceStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * <ul>
 *   <li>종료 상태에서는 어떤 액션이든 시작 가능</li>
 *   <li>IN_PROGRESS 중에는 새 액션 시작 불가</li>
 *   <li>종료 전이는 IN_PROGRESS에서만 가능하며 액션은 유지</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 시작 전이 ==========

    @Test
    void begin_FromInitial_ReturnsInProgress() {
        // When
        ResourceState next = StateTransition.begin(ResourceState.INITIAL, CREATE);

        // Then
        assertEquals(ResourceState.of(CREATE, IN_PROGRESS), next);
        assertTrue(next.isInFlight());
    }

    @Test
    void begin_FromFailed_AllowsNewAction() {
        // Given
        ResourceState failed = ResourceState.of(SUSPEND, FAILED);

        // When & Then
        assertEquals(ResourceState.of(DELETE, IN_PROGRESS), StateTransition.begin(failed, DELETE));
    }

    @Test
    void begin_WhileInFlight_ThrowsException() {
        // Given
        ResourceState inFlight = ResourceState.of(UPDATE, IN_PROGRESS);

        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.begin(inFlight, DELETE)
        );
        assertTrue(exception.getMessage().contains("in flight"));
    }

    @Test
    void begin_Init_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> StateTransition.begin(ResourceState.INITIAL, INIT));
    }

    @Test
    void begin_Null_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> StateTransition.begin(null, CREATE));
        assertThrows(IllegalArgumentException.class, () -> StateTransition.begin(ResourceState.INITIAL, null));
    }

    // ========== 종료 전이 ==========

    @Test
    void finish_InProgressToComplete_KeepsAction() {
        // When
        ResourceState next = StateTransition.finish(ResourceState.of(RESUME, IN_PROGRESS), COMPLETE);

        // Then
        assertEquals(ResourceState.of(RESUME, COMPLETE), next);
        assertFalse(next.isInFlight());
    }

    @Test
    void finish_InProgressToFailed_KeepsAction() {
        assertEquals(ResourceState.of(CREATE, FAILED),
            StateTransition.finish(ResourceState.of(CREATE, IN_PROGRESS), FAILED));
    }

    @Test
    void finish_FromComplete_ThrowsException() {
        assertThrows(IllegalStateException.class,
            () -> StateTransition.finish(ResourceState.of(CREATE, COMPLETE), FAILED));
    }

    @Test
    void finish_NonTerminalTarget_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> StateTransition.finish(ResourceState.of(CREATE, IN_PROGRESS), UNKNOWN));
        assertThrows(IllegalArgumentException.class,
            () -> StateTransition.finish(ResourceState.of(CREATE, IN_PROGRESS), IN_PROGRESS));
    }

    // ========== ResourceState ==========

    @Test
    void resourceState_ToString_IsActionUnderscoreStatus() {
        assertEquals("SUSPEND_FAILED", ResourceState.of(SUSPEND, FAILED).toString());
        assertEquals("INIT_COMPLETE", ResourceState.INITIAL.toString());
    }

    @Test
    void resourceAction_RequiresIdentity_ExceptInitAndCreate() {
        assertFalse(INIT.requiresIdentity());
        assertFalse(CREATE.requiresIdentity());
        assertTrue(UPDATE.requiresIdentity());
        assertTrue(DELETE.requiresIdentity());
        assertTrue(SUSPEND.requiresIdentity());
        assertTrue(RESUME.requiresIdentity());
    }
}
