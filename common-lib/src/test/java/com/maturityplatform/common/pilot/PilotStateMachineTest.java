package com.maturityplatform.common.pilot;

import com.maturityplatform.common.Fixtures;
import com.maturityplatform.common.exception.StateException;
import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.PilotStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PilotStateMachineTest {

    private final PilotStateMachine machine = new PilotStateMachine(new PilotValidator());

    private static PilotSnapshot valid(PilotStatus status) {
        return Fixtures.pilot(status, Fixtures.validDesign(), List.of());
    }

    // ── transitions ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("transition()")
    class Transitions {

        @Test
        @DisplayName("designed → approved → in_progress → completed is accepted")
        void happyPath() {
            assertEquals(new PilotTransition(PilotStatus.DESIGNED, PilotStatus.APPROVED),
                machine.transition(valid(PilotStatus.DESIGNED), PilotStatus.APPROVED));
            assertEquals(new PilotTransition(PilotStatus.APPROVED, PilotStatus.IN_PROGRESS),
                machine.transition(valid(PilotStatus.APPROVED), PilotStatus.IN_PROGRESS));
            assertEquals(new PilotTransition(PilotStatus.IN_PROGRESS, PilotStatus.COMPLETED),
                machine.transition(valid(PilotStatus.IN_PROGRESS), PilotStatus.COMPLETED));
        }

        @Test
        @DisplayName("designed → in_progress skips approval and is rejected")
        void skipApproval() {
            StateException e = assertThrows(StateException.class,
                () -> machine.transition(valid(PilotStatus.DESIGNED), PilotStatus.IN_PROGRESS));
            assertEquals("Illegal pilot transition designed -> in_progress", e.getMessage());
        }

        @Test
        @DisplayName("approval of an incomplete design fails the gate")
        void approvalGate() {
            PilotSnapshot pilot = Fixtures.pilot(PilotStatus.DESIGNED,
                Fixtures.design(2, 1, Map.of("sponsor", "COO")), List.of());

            assertThrows(ValidationException.class, () -> machine.transition(pilot, PilotStatus.APPROVED));
        }

        @Test
        @DisplayName("cancellation does not need a valid design")
        void cancelIncomplete() {
            PilotSnapshot pilot = Fixtures.pilot(PilotStatus.DESIGNED, Fixtures.design(0, 0, Map.of()), List.of());

            assertEquals(PilotStatus.CANCELLED, machine.transition(pilot, PilotStatus.CANCELLED).to());
        }

        @ParameterizedTest
        @EnumSource(value = PilotStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
        @DisplayName("terminal states accept no transition")
        void terminal(PilotStatus terminal) {
            for (PilotStatus target : PilotStatus.values()) {
                assertThrows(StateException.class, () -> machine.transition(valid(terminal), target));
            }
            assertTrue(machine.allowedTargets(terminal).isEmpty());
        }

        @Test
        @DisplayName("in_progress may complete, fail or be cancelled")
        void inProgressTargets() {
            assertEquals(Set.of(PilotStatus.COMPLETED, PilotStatus.FAILED, PilotStatus.CANCELLED),
                machine.allowedTargets(PilotStatus.IN_PROGRESS));
            assertFalse(machine.isLegal(PilotStatus.IN_PROGRESS, PilotStatus.APPROVED));
        }
    }

    // ── execution log ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("appendLogEntry()")
    class ExecutionLog {

        @Test
        @DisplayName("appends to an in-progress pilot")
        void appends() {
            PilotSnapshot pilot = Fixtures.pilot(PilotStatus.IN_PROGRESS, Fixtures.validDesign(),
                List.of(Fixtures.entry(1, Map.of("csat", 4.0), List.of())));

            ExecutionLogUpdate update = machine.appendLogEntry(pilot,
                Fixtures.entry(2, Map.of("csat", 4.1), List.of()));

            assertEquals(2, update.executionLog().size());
            assertEquals(2, update.appended().weekIndex());
            assertFalse(update.risk().atRisk());
        }

        @Test
        @DisplayName("a logged entry keeps the metrics it was recorded with")
        void loggedMetricsAreFixed() {
            Map<String, Double> reported = new HashMap<>(Map.of("csat", 4.0));
            ExecutionLogEntry entry = Fixtures.entry(1, reported, List.of());
            reported.put("csat", 1.0);

            ExecutionLogUpdate update = machine.appendLogEntry(valid(PilotStatus.IN_PROGRESS), entry);

            assertEquals(4.0, update.appended().metrics().get("csat"));
            assertThrows(UnsupportedOperationException.class, () -> update.appended().metrics().put("csat", 0.0));
        }

        @Test
        @DisplayName("pilot not in progress rejects entries")
        void notInProgress() {
            assertThrows(StateException.class,
                () -> machine.appendLogEntry(valid(PilotStatus.APPROVED), Fixtures.entry(1, Map.of(), List.of())));
        }

        @Test
        @DisplayName("duplicate and out-of-order weeks are rejected")
        void weekOrdering() {
            PilotSnapshot pilot = Fixtures.pilot(PilotStatus.IN_PROGRESS, Fixtures.validDesign(),
                List.of(Fixtures.entry(1, Map.of(), List.of()), Fixtures.entry(3, Map.of(), List.of())));

            ValidationException dup = assertThrows(ValidationException.class,
                () -> machine.appendLogEntry(pilot, Fixtures.entry(3, Map.of(), List.of())));
            assertTrue(dup.getMessage().contains("already logged"));
            ValidationException old = assertThrows(ValidationException.class,
                () -> machine.appendLogEntry(pilot, Fixtures.entry(2, Map.of(), List.of())));
            assertTrue(old.getMessage().contains("out of order"));
            assertThrows(ValidationException.class,
                () -> machine.appendLogEntry(valid(PilotStatus.IN_PROGRESS), Fixtures.entry(0, Map.of(), List.of())));
        }
    }

    // ── risk ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("assessRisk()")
    class Risk {

        @Test
        @DisplayName("blockers in two consecutive weeks → at risk")
        void blockerStreak() {
            RiskSignal risk = machine.assessRisk(Fixtures.criteria(3), List.of(
                Fixtures.entry(1, Map.of(), List.of()),
                Fixtures.entry(2, Map.of(), List.of("No API access")),
                Fixtures.entry(3, Map.of(), List.of("No API access"))));

            assertTrue(risk.atRisk());
            assertEquals(1, risk.reasons().size());
        }

        @Test
        @DisplayName("a single blocked week is not enough")
        void singleBlocker() {
            RiskSignal risk = machine.assessRisk(Fixtures.criteria(3), List.of(
                Fixtures.entry(1, Map.of(), List.of("No API access")),
                Fixtures.entry(2, Map.of(), List.of())));

            assertEquals(RiskSignal.CLEAR, risk);
        }

        @Test
        @DisplayName("tracked metric lower than the prior week → at risk")
        void decliningMetric() {
            RiskSignal risk = machine.assessRisk(Fixtures.criteria(3), List.of(
                Fixtures.entry(1, Map.of("csat", 4.3, "ticket_deflection_rate", 20.0), List.of()),
                Fixtures.entry(2, Map.of("csat", 4.1, "ticket_deflection_rate", 22.0), List.of())));

            assertTrue(risk.atRisk());
            assertTrue(risk.reasons().get(0).startsWith("Metric 'csat' declined"));
        }

        @Test
        @DisplayName("untracked metric decline is ignored")
        void untrackedMetric() {
            RiskSignal risk = machine.assessRisk(Fixtures.criteria(3), List.of(
                Fixtures.entry(1, Map.of("agent_logins", 40.0), List.of()),
                Fixtures.entry(2, Map.of("agent_logins", 12.0), List.of())));

            assertFalse(risk.atRisk());
        }

        @Test
        @DisplayName("risk never changes the pilot status")
        void advisoryOnly() {
            PilotSnapshot pilot = Fixtures.pilot(PilotStatus.IN_PROGRESS, Fixtures.validDesign(),
                List.of(Fixtures.entry(1, Map.of(), List.of("Vendor delay"))));

            ExecutionLogUpdate update = machine.appendLogEntry(pilot,
                Fixtures.entry(2, Map.of(), List.of("Vendor delay")));

            assertTrue(update.risk().atRisk());
            assertEquals(PilotStatus.IN_PROGRESS, pilot.status());
        }
    }

    @Test
    @DisplayName("week index counts whole weeks since start, from 1")
    void weekIndex() {
        Instant start = Fixtures.NOW;
        assertEquals(1, PilotStateMachine.weekIndexAt(start, start));
        assertEquals(1, PilotStateMachine.weekIndexAt(start, start.plusSeconds(6 * 86_400)));
        assertEquals(2, PilotStateMachine.weekIndexAt(start, start.plusSeconds(7 * 86_400)));
        assertEquals(1, PilotStateMachine.weekIndexAt(null, start));
    }
}
