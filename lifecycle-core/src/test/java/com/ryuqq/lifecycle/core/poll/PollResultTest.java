package com.ryuqq.lifecycle.core.poll;

import com.ryuqq.lifecycle.core.statemachine.ResourceAction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PollResult 분류 테스트.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class PollResultTest {

    @ParameterizedTest
    @CsvSource({
        "CREATE, CREATE_IN_PROGRESS, IN_PROGRESS",
        "CREATE, CREATE_COMPLETE, COMPLETE",
        "CREATE, CREATE_FAILED, FAILED",
        "DELETE, UPDATE_COMPLETE, UNKNOWN",
        "SUSPEND, SUSPEND_DONE, UNKNOWN",
        "SUSPEND, SUSPEND_UNKNOWN, UNKNOWN",
        "RESUME, RESUME, UNKNOWN",
        "UPDATE, update_complete, UNKNOWN"
    })
    void classify_MatchesOnlyExactActionAndPhase(ResourceAction action, String status, PollPhase expected) {
        assertEquals(expected, PollResult.of(status).classify(action));
    }

    @Test
    void of_ActionAndPhase_BuildsStatusString() {
        // When
        PollResult result = PollResult.of(ResourceAction.SUSPEND, PollPhase.FAILED, "disk full");

        // Then
        assertEquals("SUSPEND_FAILED", result.status());
        assertEquals("disk full", result.reason());
        assertEquals(PollPhase.FAILED, result.classify(ResourceAction.SUSPEND));
    }

    @Test
    void of_UnknownPhase_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> PollResult.of(ResourceAction.CREATE, PollPhase.UNKNOWN, null));
    }

    @Test
    void constructor_BlankStatus_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> PollResult.of(" "));
        assertThrows(IllegalArgumentException.class, () -> PollResult.of(null));
    }

    @Test
    void classify_NullAction_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> PollResult.of("CREATE_COMPLETE").classify(null));
    }

    @Test
    void isPending_OnlyInProgress() {
        assertTrue(PollPhase.IN_PROGRESS.isPending());
        assertFalse(PollPhase.COMPLETE.isPending());
        assertFalse(PollPhase.FAILED.isPending());
        assertFalse(PollPhase.UNKNOWN.isPending());
    }
}
