package com.maturityplatform.assessment.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maturityplatform.assessment.dto.AssessmentDTO;
import com.maturityplatform.assessment.dto.BenchmarkDTO;
import com.maturityplatform.assessment.dto.RoadmapDTO;
import com.maturityplatform.assessment.model.Assessment;
import com.maturityplatform.assessment.model.AssessmentResponse;
import com.maturityplatform.assessment.model.Benchmark;
import com.maturityplatform.assessment.model.Pilot;
import com.maturityplatform.assessment.model.Roadmap;
import com.maturityplatform.common.benchmark.BenchmarkDistribution;
import com.maturityplatform.common.benchmark.BenchmarkMetric;
import com.maturityplatform.common.model.AssessmentSnapshot;
import com.maturityplatform.common.model.AssessmentStatus;
import com.maturityplatform.common.model.Dimension;
import com.maturityplatform.common.model.DimensionResponse;
import com.maturityplatform.common.model.DimensionScores;
import com.maturityplatform.common.model.MaturityLevel;
import com.maturityplatform.common.model.PilotStatus;
import com.maturityplatform.common.pilot.ExecutionLogEntry;
import com.maturityplatform.common.pilot.PilotDesign;
import com.maturityplatform.common.pilot.PilotSnapshot;
import com.maturityplatform.common.roadmap.Initiative;
import com.maturityplatform.common.roadmap.RoadmapPlan;
import com.maturityplatform.common.rules.RuleSet;
import com.maturityplatform.common.weighting.DimensionWeights;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts between persisted rows and the engine's read-only snapshots / API records.
 * JSON text columns are (de)serialised with the shared {@link ObjectMapper}.
 */
@Component
public class MaturityMapper {

    private static final TypeReference<Map<String, Double>> WEIGHTS = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> METADATA = new TypeReference<>() {};
    private static final TypeReference<List<Double>> PEER_SCORES = new TypeReference<>() {};
    private static final TypeReference<List<Initiative>> INITIATIVES = new TypeReference<>() {};
    private static final TypeReference<List<ExecutionLogEntry>> EXECUTION_LOG = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final RuleSet ruleSet;

    public MaturityMapper(ObjectMapper objectMapper, RuleSet ruleSet) {
        this.objectMapper = objectMapper;
        this.ruleSet = ruleSet;
    }

    // ── Assessment ──────────────────────────────────────────────────────────

    public AssessmentSnapshot toSnapshot(Assessment a) {
        DimensionScores scores = null;
        MaturityLevel level = null;
        if (a.getOverallScore() != null) {
            Map<Dimension, Double> byDimension = new EnumMap<>(Dimension.class);
            byDimension.put(Dimension.DATA, a.getDataScore());
            byDimension.put(Dimension.PROCESS, a.getProcessScore());
            byDimension.put(Dimension.PEOPLE, a.getPeopleScore());
            byDimension.put(Dimension.TECHNOLOGY, a.getTechnologyScore());
            byDimension.put(Dimension.GOVERNANCE, a.getGovernanceScore());
            scores = new DimensionScores(byDimension, a.getOverallScore());
        }
        if (a.getMaturityLevel() != null) {
            level = new MaturityLevel(a.getMaturityLevel(), a.getMaturityLabel());
        }
        return new AssessmentSnapshot(a.getId(), a.getTenantId(), a.getIndustry(),
            AssessmentStatus.valueOf(a.getStatus()), scores, level,
            toInstant(a.getCreatedAt()), toInstant(a.getCompletedAt()));
    }

    /** The assessment's own weight table, or the rule-set default when it has none. */
    public DimensionWeights weightsOf(Assessment a) {
        if (a.getDimensionWeights() == null) {
            return ruleSet.dimensionWeights();
        }
        return DimensionWeights.fromKeys(read(a.getDimensionWeights(), WEIGHTS));
    }

    public void applyScores(Assessment a, DimensionScores scores, MaturityLevel level) {
        a.setDataScore(scores.score(Dimension.DATA));
        a.setProcessScore(scores.score(Dimension.PROCESS));
        a.setPeopleScore(scores.score(Dimension.PEOPLE));
        a.setTechnologyScore(scores.score(Dimension.TECHNOLOGY));
        a.setGovernanceScore(scores.score(Dimension.GOVERNANCE));
        a.setOverallScore(scores.overallScore());
        a.setMaturityLevel(level.level());
        a.setMaturityLabel(level.label());
    }

    public DimensionResponse toDimensionResponse(AssessmentResponse r) {
        return new DimensionResponse(r.getQuestionId(), Dimension.fromKey(r.getDimension()),
            r.getNumericScore(), r.getWeight());
    }

    public AssessmentDTO toDTO(Assessment a) {
        Map<String, Double> dimensionScores = null;
        if (a.getOverallScore() != null) {
            dimensionScores = new LinkedHashMap<>();
            dimensionScores.put(Dimension.DATA.key(), a.getDataScore());
            dimensionScores.put(Dimension.PROCESS.key(), a.getProcessScore());
            dimensionScores.put(Dimension.PEOPLE.key(), a.getPeopleScore());
            dimensionScores.put(Dimension.TECHNOLOGY.key(), a.getTechnologyScore());
            dimensionScores.put(Dimension.GOVERNANCE.key(), a.getGovernanceScore());
        }
        return new AssessmentDTO(
            a.getId(), a.getTenantId(), a.getOrganizationName(), a.getIndustry(),
            a.getOrganizationSize(), statusKey(a.getStatus()),
            a.getOverallScore(), a.getMaturityLevel(), a.getMaturityLabel(),
            dimensionScores, weightsOf(a).asKeyMap(),
            a.getMetadata() == null ? Map.of() : read(a.getMetadata(), METADATA),
            a.getCreatedAt(), a.getUpdatedAt(), a.getCompletedAt());
    }

    // ── Benchmark ───────────────────────────────────────────────────────────

    public BenchmarkDistribution toDistribution(Benchmark b) {
        return new BenchmarkDistribution(b.getIndustry(), BenchmarkMetric.fromKey(b.getMetric()),
            b.getPeriod(), read(b.getPeerScores(), PEER_SCORES));
    }

    public BenchmarkDTO toDTO(Benchmark b) {
        return new BenchmarkDTO(b.getId(), b.getIndustry(), b.getMetric(), b.getPeriod(),
            b.getPeerCount(), b.getPeerMedian(), read(b.getPeerScores(), PEER_SCORES), b.getUpdatedAt());
    }

    // ── Roadmap ─────────────────────────────────────────────────────────────

    public Roadmap toEntity(String tenantId, RoadmapPlan plan) {
        Roadmap r = new Roadmap();
        r.setTenantId(tenantId);
        r.setAssessmentId(plan.assessmentId());
        r.setStatus(Roadmap.DRAFT);
        r.setCatalogVersion(plan.catalogVersion());
        r.setCurrentMaturityLevel(plan.currentMaturityLevel());
        r.setTargetMaturityLevel(plan.targetMaturityLevel());
        r.setHorizonMonths(plan.horizonMonths());
        r.setInitiatives(write(plan.initiatives()));
        r.setGeneratedAt(toLocal(plan.generatedAt()));
        return r;
    }

    public RoadmapPlan toPlan(Roadmap r) {
        return new RoadmapPlan(r.getAssessmentId(), r.getCatalogVersion(), r.getCurrentMaturityLevel(),
            r.getTargetMaturityLevel(), r.getHorizonMonths(), read(r.getInitiatives(), INITIATIVES),
            toInstant(r.getGeneratedAt()));
    }

    public RoadmapDTO toDTO(Roadmap r) {
        RoadmapPlan plan = toPlan(r);
        return new RoadmapDTO(r.getId(), r.getAssessmentId(), r.getStatus().toLowerCase(Locale.ROOT),
            r.getCatalogVersion(), plan.currentMaturityLevel(), plan.targetMaturityLevel(),
            plan.horizonMonths(), plan.initiatives(), plan.quickWins(),
            r.getGeneratedAt(), r.getPublishedAt());
    }

    // ── Pilot ───────────────────────────────────────────────────────────────

    public PilotSnapshot toSnapshot(Pilot p) {
        return new PilotSnapshot(p.getId(), p.getTenantId(), p.getAssessmentId(), p.getRoadmapId(),
            PilotStatus.valueOf(p.getStatus()), designOf(p), executionLogOf(p),
            toInstant(p.getStartedAt()), toInstant(p.getClosedAt()));
    }

    public PilotDesign designOf(Pilot p) {
        return read(p.getDesign(), PilotDesign.class);
    }

    public List<ExecutionLogEntry> executionLogOf(Pilot p) {
        return p.getExecutionLog() == null ? List.of() : read(p.getExecutionLog(), EXECUTION_LOG);
    }

    // ── JSON columns ────────────────────────────────────────────────────────

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName()
                + " for persistence", e);
        }
    }

    public <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize stored " + type.getSimpleName(), e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize stored column", e);
        }
    }

    // ── Time ────────────────────────────────────────────────────────────────

    public static LocalDateTime toLocal(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    public static Instant toInstant(LocalDateTime time) {
        return time == null ? null : time.toInstant(ZoneOffset.UTC);
    }

    public static String statusKey(String enumName) {
        return enumName == null ? null : enumName.toLowerCase(Locale.ROOT);
    }
}
