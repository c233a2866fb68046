package me.golemcore.graph.domain.loop;

import me.golemcore.graph.domain.model.RunError;
import me.golemcore.graph.domain.model.RunErrorKind;
import me.golemcore.graph.domain.model.RunStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunStateTest {

    @Test
    void shouldStartRunningAtStepAndEpochZero() {
        RunState state = new RunState("triage");

        assertEquals("triage", state.getCurrentAgentKey());
        assertEquals(0, state.getStep());
        assertEquals(0, state.getControlEpoch());
        assertTrue(state.isRunning());
    }

    @Test
    void shouldIncrementEpochOnlyWhenAgentChanges() {
        RunState state = new RunState("a");

        assertFalse(state.routeTo("a"));
        assertEquals(0, state.getControlEpoch());
        assertTrue(state.routeTo("b"));
        assertTrue(state.routeTo("a"));
        assertEquals(2, state.getControlEpoch());
    }

    @Test
    void shouldCountAndResetConsecutiveToolFailures() {
        RunState state = new RunState("a");

        state.recordToolFailure();
        assertEquals(2, state.recordToolFailure());
        state.resetToolFailures();
        assertEquals(0, state.getConsecutiveToolFailures());
    }

    @Test
    void shouldRefuseTransitionsAfterTermination() {
        RunState state = new RunState("a");
        state.fail(new RunError(RunErrorKind.CANCELLED, "stop"));

        assertEquals(RunStatus.FAILED, state.getStatus());
        assertThrows(IllegalStateException.class, state::advanceStep);
        assertThrows(IllegalStateException.class, () -> state.complete("late"));
    }
}
