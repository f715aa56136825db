package com.maturityplatform.common.pilot;

import com.maturityplatform.common.exception.StateException;
import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.PilotStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pilot lifecycle as an explicit transition table.
 *
 * <pre>
 *   designed    → approved (approval gate must pass), cancelled
 *   approved    → in_progress, cancelled
 *   in_progress → completed, failed, cancelled
 *   completed, failed, cancelled → (terminal)
 * </pre>
 *
 * <p>Also owns weekly execution-log ingestion and the advisory at-risk rule:
 * <ul>
 *   <li>the last {@value #BLOCKER_STREAK} entries all report blockers, or</li>
 *   <li>a success-criterion metric present in the latest and the prior entry
 *       has a lower value in the latest one.</li>
 * </ul>
 *
 * <p>Stateless after construction and thread-safe. Serialising concurrent
 * transitions on the same pilot is the caller's job.
 */
public final class PilotStateMachine {

    public static final int BLOCKER_STREAK = 2;

    /** Precondition attached to one edge of the table. */
    @FunctionalInterface
    interface TransitionGuard {
        void check(PilotSnapshot pilot);
    }

    private static final TransitionGuard ALWAYS = pilot -> { };

    private final Map<PilotStatus, Map<PilotStatus, TransitionGuard>> table;

    public PilotStateMachine(PilotValidator validator) {
        TransitionGuard approvalGate = pilot -> validator.requireValid(pilot.design());

        Map<PilotStatus, Map<PilotStatus, TransitionGuard>> t = new EnumMap<>(PilotStatus.class);
        t.put(PilotStatus.DESIGNED, edges(Map.of(
            PilotStatus.APPROVED,    approvalGate,
            PilotStatus.CANCELLED,   ALWAYS)));
        t.put(PilotStatus.APPROVED, edges(Map.of(
            PilotStatus.IN_PROGRESS, ALWAYS,
            PilotStatus.CANCELLED,   ALWAYS)));
        t.put(PilotStatus.IN_PROGRESS, edges(Map.of(
            PilotStatus.COMPLETED,   ALWAYS,
            PilotStatus.FAILED,      ALWAYS,
            PilotStatus.CANCELLED,   ALWAYS)));
        for (PilotStatus s : PilotStatus.values()) {
            t.putIfAbsent(s, Map.of());
        }
        this.table = Collections.unmodifiableMap(t);
    }

    public Set<PilotStatus> allowedTargets(PilotStatus from) {
        return table.get(from).keySet();
    }

    public boolean isLegal(PilotStatus from, PilotStatus to) {
        return table.get(from).containsKey(to);
    }

    /**
     * @throws StateException      when the pair is not in the table
     * @throws ValidationException when the edge's precondition fails
     */
    public PilotTransition transition(PilotSnapshot pilot, PilotStatus target) {
        PilotStatus from = pilot.status();
        if (from.isTerminal()) {
            throw new StateException("Pilot " + pilot.id() + " is " + from.key()
                + " (terminal); transition to " + target.key() + " rejected");
        }
        TransitionGuard guard = table.get(from).get(target);
        if (guard == null) {
            throw new StateException("Illegal pilot transition " + from.key() + " -> " + target.key());
        }
        guard.check(pilot);
        return new PilotTransition(from, target);
    }

    /**
     * Appends one weekly entry.
     *
     * @throws StateException      unless the pilot is in progress
     * @throws ValidationException on a non-positive, duplicate or out-of-order week index
     */
    public ExecutionLogUpdate appendLogEntry(PilotSnapshot pilot, ExecutionLogEntry entry) {
        if (pilot.status() != PilotStatus.IN_PROGRESS) {
            throw new StateException("Cannot log execution for pilot " + pilot.id()
                + ": status is " + pilot.status().key() + ", not in_progress");
        }
        if (entry.weekIndex() < 1) {
            throw new ValidationException("Week index must be >= 1, got " + entry.weekIndex());
        }
        List<ExecutionLogEntry> log = pilot.executionLog();
        if (!log.isEmpty()) {
            int lastWeek = log.get(log.size() - 1).weekIndex();
            if (entry.weekIndex() <= lastWeek) {
                throw new ValidationException("Week index " + entry.weekIndex()
                    + (entry.weekIndex() == lastWeek ? " is already logged" : " is out of order")
                    + "; last logged week is " + lastWeek);
            }
        }
        List<ExecutionLogEntry> next = new ArrayList<>(log);
        next.add(entry);
        return new ExecutionLogUpdate(entry, next, assessRisk(pilot.design().successCriteria(), next));
    }

    public RiskSignal assessRisk(List<SuccessCriterion> criteria, List<ExecutionLogEntry> log) {
        List<String> reasons = new ArrayList<>();
        if (log.size() >= BLOCKER_STREAK
                && log.subList(log.size() - BLOCKER_STREAK, log.size()).stream()
                    .allMatch(ExecutionLogEntry::hasBlockers)) {
            reasons.add("Blockers reported in " + BLOCKER_STREAK + " consecutive weeks");
        }
        if (log.size() >= 2) {
            ExecutionLogEntry latest = log.get(log.size() - 1);
            ExecutionLogEntry prior = log.get(log.size() - 2);
            for (String metric : trackedMetrics(criteria)) {
                Double now = latest.metrics().get(metric);
                Double before = prior.metrics().get(metric);
                if (now != null && before != null && now < before) {
                    reasons.add("Metric '" + metric + "' declined from " + before + " to " + now
                        + " (week " + prior.weekIndex() + " -> " + latest.weekIndex() + ")");
                }
            }
        }
        return reasons.isEmpty() ? RiskSignal.CLEAR : new RiskSignal(true, reasons);
    }

    /** 1-based week index of {@code now} relative to the pilot start. */
    public static int weekIndexAt(Instant startedAt, Instant now) {
        if (startedAt == null || now.isBefore(startedAt)) {
            return 1;
        }
        return (int) (Duration.between(startedAt, now).toDays() / 7) + 1;
    }

    private static Set<String> trackedMetrics(List<SuccessCriterion> criteria) {
        Set<String> names = new LinkedHashSet<>();
        for (SuccessCriterion c : criteria) {
            if (c.metricName() != null) {
                names.add(c.metricName());
            }
        }
        return names;
    }

    private static Map<PilotStatus, TransitionGuard> edges(Map<PilotStatus, TransitionGuard> targets) {
        return Collections.unmodifiableMap(new EnumMap<>(targets));
    }
}
