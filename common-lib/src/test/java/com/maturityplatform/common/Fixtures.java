package com.maturityplatform.common;

import com.maturityplatform.common.classifier.MaturityClassifier;
import com.maturityplatform.common.model.AssessmentSnapshot;
import com.maturityplatform.common.model.AssessmentStatus;
import com.maturityplatform.common.model.Dimension;
import com.maturityplatform.common.model.DimensionScores;
import com.maturityplatform.common.model.PilotStatus;
import com.maturityplatform.common.pilot.ExecutionLogEntry;
import com.maturityplatform.common.pilot.FailureMode;
import com.maturityplatform.common.pilot.PilotDesign;
import com.maturityplatform.common.pilot.PilotSnapshot;
import com.maturityplatform.common.pilot.ReportedHealth;
import com.maturityplatform.common.pilot.SuccessCriterion;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Shared test data for engine tests. */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");
    public static final String TENANT = "tenant-a";

    private Fixtures() {}

    public static DimensionScores scores(double data, double process, double people,
                                         double technology, double governance, double overall) {
        Map<Dimension, Double> m = new EnumMap<>(Dimension.class);
        m.put(Dimension.DATA, data);
        m.put(Dimension.PROCESS, process);
        m.put(Dimension.PEOPLE, people);
        m.put(Dimension.TECHNOLOGY, technology);
        m.put(Dimension.GOVERNANCE, governance);
        return new DimensionScores(m, overall);
    }

    public static AssessmentSnapshot completed(long id, DimensionScores scores) {
        return new AssessmentSnapshot(id, TENANT, "financial_services", AssessmentStatus.COMPLETED,
            scores, new MaturityClassifier().classify(scores.overallScore()),
            NOW.minusSeconds(86_400), NOW);
    }

    public static AssessmentSnapshot inProgress(long id) {
        return new AssessmentSnapshot(id, TENANT, "financial_services", AssessmentStatus.IN_PROGRESS,
            null, null, NOW.minusSeconds(86_400), null);
    }

    public static List<SuccessCriterion> criteria(int count) {
        List<SuccessCriterion> all = List.of(
            new SuccessCriterion("ticket_deflection_rate", 30.0, "helpdesk export, weekly"),
            new SuccessCriterion("csat", 4.2, "post-interaction survey"),
            new SuccessCriterion("avg_handle_time_min", 6.0, "contact-centre telemetry"),
            new SuccessCriterion("escalation_rate", 5.0, "ticket audit sample"));
        return all.subList(0, count);
    }

    public static PilotDesign design(int criteria, int failureModes, Map<String, String> stakeholders) {
        List<FailureMode> modes = List.of(
            new FailureMode("Model hallucinates policy answers", "Restrict to retrieved policy snippets"),
            new FailureMode("Agents bypass the assistant", "Weekly adoption review with team leads"));
        return new PilotDesign("Support copilot", Dimension.PROCESS, 8, criteria(criteria),
            modes.subList(0, failureModes), stakeholders, Map.of("budget", 40_000));
    }

    public static PilotDesign validDesign() {
        return design(3, 1, Map.of("sponsor", "VP Customer Operations"));
    }

    public static PilotSnapshot pilot(PilotStatus status, PilotDesign design, List<ExecutionLogEntry> log) {
        return new PilotSnapshot(7L, TENANT, 1L, 3L, status, design, log,
            status == PilotStatus.DESIGNED || status == PilotStatus.APPROVED ? null : NOW, null);
    }

    public static ExecutionLogEntry entry(int week, Map<String, Double> metrics, List<String> blockers) {
        return new ExecutionLogEntry(week, blockers.isEmpty() ? ReportedHealth.ON_TRACK : ReportedHealth.BLOCKED,
            metrics, blockers, "week " + week, NOW.plusSeconds(week * 604_800L));
    }
}
