package com.maestro.core.scheduler;

import com.maestro.core.model.CyclicDependencyException;
import com.maestro.core.model.StepDefinition;
import com.maestro.core.model.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyResolverTest {

    private final DependencyResolver resolver = new DependencyResolver();

    private static StepDefinition step(String id, String... dependsOn) {
        return new StepDefinition(id, "writer", "task " + id, List.of(dependsOn));
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("independent steps share stage 0 in definition order")
        void independentSteps() {
            assertEquals(List.of(List.of("C", "A", "B")),
                    resolver.resolve(List.of(step("C"), step("A"), step("B"))));
        }

        @Test
        @DisplayName("diamond resolves into three stages")
        void diamond() {
            var stages = resolver.resolve(List.of(
                    step("D", "B", "C"), step("B", "A"), step("C", "A"), step("A")));
            assertEquals(List.of(List.of("A"), List.of("B", "C"), List.of("D")), stages);
        }

        @Test
        @DisplayName("a step lands one stage after its deepest dependency")
        void deepestDependency() {
            var stages = resolver.resolve(List.of(
                    step("A"), step("B", "A"), step("C", "B"), step("E", "A", "C")));
            assertEquals(List.of(List.of("A"), List.of("B"), List.of("C"), List.of("E")), stages);
        }

        @Test
        @DisplayName("duplicate dependency entries are tolerated")
        void duplicateDependencyEntries() {
            assertEquals(List.of(List.of("A"), List.of("B")),
                    resolver.resolve(List.of(step("A"), step("B", "A", "A"))));
        }

        @Test
        @DisplayName("cycle reports the steps that could not be placed")
        void cycle() {
            var e = assertThrows(CyclicDependencyException.class, () -> resolver.resolve(List.of(
                    step("A"), step("B", "A", "D"), step("C", "B"), step("D", "C"))));
            assertEquals(List.of("B", "C", "D"), e.getUnplacedStepIds());
        }

        @Test
        @DisplayName("self dependency is a cycle")
        void selfDependency() {
            assertThrows(CyclicDependencyException.class, () -> resolver.resolve(List.of(step("A", "A"))));
        }

        @Test
        @DisplayName("unknown dependency is rejected")
        void unknownDependency() {
            var e = assertThrows(ValidationException.class,
                    () -> resolver.resolve(List.of(step("A"), step("B", "Z"))));
            assertTrue(e.getMessage().contains("unknown step Z"));
        }

        @Test
        @DisplayName("null dependency ids and null steps are rejected as invalid")
        void nullEntries() {
            var withNullDependency = new StepDefinition("B", "writer", "task B", Arrays.asList("A", null));
            var e = assertThrows(ValidationException.class,
                    () -> resolver.resolve(List.of(step("A"), withNullDependency)));
            assertTrue(e.getMessage().contains("blank dependency"));

            assertThrows(ValidationException.class, () -> resolver.resolve(Arrays.asList(step("A"), null)));
        }

        @Test
        @DisplayName("duplicate step ids are rejected")
        void duplicateIds() {
            assertThrows(ValidationException.class, () -> resolver.resolve(List.of(step("A"), step("A"))));
        }

        @Test
        @DisplayName("blank step ids and agents are rejected")
        void blankFields() {
            assertThrows(ValidationException.class, () -> resolver.resolve(List.of(step(" "))));
            assertThrows(ValidationException.class,
                    () -> resolver.resolve(List.of(new StepDefinition("A", "", "task", List.of()))));
        }
    }

    @Test
    @DisplayName("transitiveDependents walks the whole downstream graph in definition order")
    void transitiveDependents() {
        var steps = List.of(step("A"), step("B", "A"), step("X"), step("C", "B"), step("D", "C", "X"));
        assertEquals(List.of("B", "C", "D"), resolver.transitiveDependents(steps, "A"));
        assertEquals(List.of("D"), resolver.transitiveDependents(steps, "X"));
        assertEquals(List.of(), resolver.transitiveDependents(steps, "D"));
    }
}
