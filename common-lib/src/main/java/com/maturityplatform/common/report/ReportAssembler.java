package com.maturityplatform.common.report;

import com.maturityplatform.common.benchmark.BenchmarkComparison;
import com.maturityplatform.common.classifier.MaturityClassifier;
import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.AssessmentSnapshot;
import com.maturityplatform.common.model.Dimension;
import com.maturityplatform.common.model.MaturityLevel;
import com.maturityplatform.common.pilot.PilotSnapshot;
import com.maturityplatform.common.pilot.PilotStateMachine;
import com.maturityplatform.common.roadmap.RoadmapPlan;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Composes assessment, benchmark comparison, roadmap and optional pilot into one
 * {@link MaturityReport}. Pure aggregation: identical inputs produce equal reports.
 */
public final class ReportAssembler {

    private final MaturityClassifier classifier;
    private final PilotStateMachine stateMachine;

    public ReportAssembler(MaturityClassifier classifier, PilotStateMachine stateMachine) {
        this.classifier = classifier;
        this.stateMachine = stateMachine;
    }

    /**
     * @param pilot may be {@code null}
     * @throws com.maturityplatform.common.exception.StateException when the assessment is not completed
     * @throws ValidationException when a part belongs to another assessment
     */
    public MaturityReport assemble(ReportType type,
                                   AssessmentSnapshot assessment,
                                   BenchmarkComparison comparison,
                                   Long roadmapId,
                                   RoadmapPlan roadmap,
                                   PilotSnapshot pilot,
                                   Instant generatedAt) {
        assessment.requireCompleted("generate report");
        requireSameAssessment(assessment, "benchmark comparison", comparison.assessmentId());
        requireSameAssessment(assessment, "roadmap " + roadmapId, roadmap.assessmentId());
        if (pilot != null) {
            requireSameAssessment(assessment, "pilot " + pilot.id(), pilot.assessmentId());
        }

        Map<Dimension, MaturityLevel> levels = new EnumMap<>(Dimension.class);
        Dimension strongest = null;
        Dimension weakest = null;
        for (Dimension d : Dimension.values()) {
            double score = assessment.scores().score(d);
            levels.put(d, classifier.classify(score));
            if (strongest == null || score > assessment.scores().score(strongest)) {
                strongest = d;
            }
            if (weakest == null || score < assessment.scores().score(weakest)) {
                weakest = d;
            }
        }

        return new MaturityReport(
            type,
            assessment.id(),
            assessment.tenantId(),
            roadmapId,
            pilot != null ? pilot.id() : null,
            assessment.industry(),
            assessment.scores(),
            assessment.maturityLevel(),
            levels,
            strongest,
            weakest,
            comparison,
            roadmap.targetMaturityLevel(),
            roadmap.initiatives(),
            pilot != null ? pilot.status() : null,
            pilot != null
                ? stateMachine.assessRisk(pilot.design().successCriteria(), pilot.executionLog())
                : null,
            generatedAt);
    }

    private static void requireSameAssessment(AssessmentSnapshot assessment, String part, Long ownerId) {
        if (!Objects.equals(assessment.id(), ownerId)) {
            throw new ValidationException("The " + part + " belongs to assessment " + ownerId
                + ", not " + assessment.id());
        }
    }
}
