package com.planforge.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.core.persistence.JsonSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DomainTypesTest {

    // -- Counters ------------------------------------------------------------

    @Nested
    @DisplayName("Iteration and MaxIterations")
    class CounterTests {

        @Test
        @DisplayName("iterations start at one and count up")
        void iterationCounts() {
            assertEquals(1, Iteration.first().value());
            assertEquals(2, Iteration.first().next().value());
            assertThrows(IllegalArgumentException.class, () -> Iteration.of(0));
        }

        @Test
        @DisplayName("reached compares against the limit inclusively")
        void reachedIsInclusive() {
            assertFalse(Iteration.of(2).reached(MaxIterations.of(3)));
            assertTrue(Iteration.of(3).reached(MaxIterations.of(3)));
            assertTrue(Iteration.of(4).reached(MaxIterations.of(3)));
        }

        @Test
        @DisplayName("limits only grow by a positive amount")
        void extendByPositive() {
            assertEquals(MaxIterations.of(5), MaxIterations.DEFAULT.extendBy(2));
            assertThrows(IllegalArgumentException.class, () -> MaxIterations.DEFAULT.extendBy(0));
            assertThrows(IllegalArgumentException.class, () -> MaxIterations.of(0));
        }

        @Test
        @DisplayName("counters serialize as bare numbers")
        void serializeAsNumbers() throws Exception {
            ObjectMapper mapper = JsonSupport.newObjectMapper();
            assertEquals("3", mapper.writeValueAsString(Iteration.of(3)));
            assertEquals(MaxIterations.of(4), mapper.readValue("4", MaxIterations.class));
        }
    }

    // -- Identifiers ---------------------------------------------------------

    @Nested
    @DisplayName("identifiers")
    class IdentifierTests {

        @Test
        @DisplayName("blank names are rejected")
        void blankNamesRejected() {
            assertThrows(IllegalArgumentException.class, () -> FeatureName.of(" "));
            assertThrows(IllegalArgumentException.class, () -> AgentId.of(""));
            assertThrows(IllegalArgumentException.class, () -> WorkingDir.of(null));
        }

        @Test
        @DisplayName("workflow ids round-trip through their string form")
        void workflowIdParses() throws Exception {
            WorkflowId id = WorkflowId.newId();
            assertEquals(id, WorkflowId.parse(id.toString()));

            ObjectMapper mapper = JsonSupport.newObjectMapper();
            assertEquals("\"" + id + "\"", mapper.writeValueAsString(id));
        }

        @Test
        @DisplayName("objective is trimmed and never null")
        void objectiveTrimmed() {
            assertEquals("ship it", Objective.of("  ship it ").value());
            assertEquals("", Objective.of(null).value());
        }
    }

    // -- Phase labels --------------------------------------------------------

    @Nested
    @DisplayName("PhaseLabel")
    class PhaseLabelTests {

        @Test
        @DisplayName("implementation phase takes precedence over planning phase")
        void implementationWins() {
            assertEquals(PhaseLabel.IMPLEMENTATION_REVIEW,
                    PhaseLabel.of(Phase.COMPLETE, ImplementationPhase.IMPLEMENTATION_REVIEW));
            assertEquals(PhaseLabel.AWAITING_IMPLEMENTATION_DECISION,
                    PhaseLabel.of(Phase.COMPLETE, ImplementationPhase.AWAITING_DECISION));
            assertEquals(PhaseLabel.REVISING, PhaseLabel.of(Phase.REVISING, null));
        }

        @Test
        @DisplayName("terminal phases carry no round")
        void terminalWithoutRound() {
            assertEquals("Reviewing #2", PhaseLabel.REVIEWING.withIteration(Iteration.of(2)));
            assertEquals("Complete", PhaseLabel.COMPLETE.withIteration(Iteration.of(2)));
            assertTrue(PhaseLabel.CANCELLED.isTerminal());
            assertFalse(PhaseLabel.AWAITING_PLANNING_DECISION.isTerminal());
        }
    }

    // -- Agent providers -----------------------------------------------------

    @Nested
    @DisplayName("AgentKind")
    class AgentKindTests {

        @Test
        @DisplayName("resolves the provider from the agent id prefix")
        void resolvesByPrefix() {
            assertEquals(AgentKind.CLAUDE, AgentKind.forAgent(AgentId.of("claude-reviewer")));
            assertEquals(AgentKind.GEMINI, AgentKind.forAgent(AgentId.of("Gemini-2")));
            assertThrows(IllegalArgumentException.class, () -> AgentKind.forAgent(AgentId.of("gpt-x")));
        }

        @Test
        @DisplayName("resume strategy depends on provider and known conversation")
        void resumeStrategy() {
            var conversation = ConversationId.of("c-1");
            assertEquals(ResumeStrategy.CONVERSATION_RESUME, AgentKind.CLAUDE.resumeStrategy(conversation));
            assertEquals(ResumeStrategy.RESUME_LATEST, AgentKind.CODEX.resumeStrategy(conversation));
            assertEquals(ResumeStrategy.STATELESS, AgentKind.GEMINI.resumeStrategy(conversation));
            assertEquals(ResumeStrategy.STATELESS, AgentKind.CLAUDE.resumeStrategy(null));
        }
    }

    // -- Implementation state ------------------------------------------------

    @Test
    @DisplayName("implementation state advances rounds and stops at the limit")
    void implementationStateRounds() {
        var state = ImplementationPhaseState.start(MaxIterations.of(2));
        assertTrue(state.canContinue());

        var second = state.withReview(ImplementationVerdict.NEEDS_CHANGES, "more").nextRound();
        assertEquals(2, second.iteration().value());
        assertEquals(ImplementationPhase.IMPLEMENTING, second.phase());
        assertFalse(second.canContinue());
        assertFalse(second.isApproved());
    }
}
