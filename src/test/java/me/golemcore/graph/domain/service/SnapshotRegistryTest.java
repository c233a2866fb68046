package me.golemcore.graph.domain.service;

import me.golemcore.graph.domain.model.CompiledSnapshot;
import me.golemcore.graph.domain.model.RuntimePolicy;
import me.golemcore.graph.domain.validation.GraphValidator;
import me.golemcore.graph.domain.validation.SnapshotValidationException;
import me.golemcore.graph.domain.validation.ValidationErrorKind;
import me.golemcore.graph.testsupport.SnapshotFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.golemcore.graph.testsupport.SnapshotFixtures.agent;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotRegistryTest {

    private SnapshotRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SnapshotRegistry(new GraphValidator());
    }

    @Test
    void shouldPublishValidSnapshotAsCurrent() {
        CompiledSnapshot snapshot = SnapshotFixtures.triageWriter();

        registry.publish(snapshot);

        assertSame(snapshot, registry.current().orElseThrow());
        assertSame(snapshot, registry.find("v1").orElseThrow());
        assertEquals(List.of("v1"), registry.versions());
    }

    @Test
    void shouldNeverMakeInvalidSnapshotCurrent() {
        CompiledSnapshot twoDefaults = new CompiledSnapshot("v2",
                List.of(agent("a", true, true, List.of(), List.of()), agent("b", true, true, List.of(), List.of())),
                List.of(), List.of(), null, RuntimePolicy.defaults());

        SnapshotValidationException error = assertThrows(SnapshotValidationException.class,
                () -> registry.publish(twoDefaults));

        assertTrue(error.getErrors().stream()
                .anyMatch(e -> e.kind() == ValidationErrorKind.DEFAULT_AGENT_UNIQUENESS));
        assertTrue(registry.current().isEmpty());
        assertTrue(registry.find("v2").isEmpty());
    }

    @Test
    void shouldKeepPreviousCurrentWhenNewVersionIsRejected() {
        CompiledSnapshot good = SnapshotFixtures.triageWriter();
        registry.publish(good);
        CompiledSnapshot bad = new CompiledSnapshot("v2",
                List.of(agent("a", false, true, List.of(), List.of())), List.of(), List.of(), "a",
                RuntimePolicy.defaults());

        assertThrows(SnapshotValidationException.class, () -> registry.publish(bad));

        assertSame(good, registry.current().orElseThrow());
    }

    @Test
    void shouldRequireVersionKey() {
        CompiledSnapshot unnamed = new CompiledSnapshot(null, List.of(), List.of(), List.of(), null, null);

        assertThrows(IllegalArgumentException.class, () -> registry.publish(unnamed));
    }
}
