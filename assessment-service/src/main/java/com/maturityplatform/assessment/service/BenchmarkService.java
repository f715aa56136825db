package com.maturityplatform.assessment.service;

import com.maturityplatform.assessment.dto.BenchmarkUpsertRequest;
import com.maturityplatform.assessment.mapper.MaturityMapper;
import com.maturityplatform.assessment.model.Benchmark;
import com.maturityplatform.assessment.repository.BenchmarkRepository;
import com.maturityplatform.common.benchmark.BenchmarkComparator;
import com.maturityplatform.common.benchmark.BenchmarkComparison;
import com.maturityplatform.common.benchmark.BenchmarkDistribution;
import com.maturityplatform.common.benchmark.BenchmarkMetric;
import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.AssessmentSnapshot;
import com.maturityplatform.common.model.Dimension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Industry peer distributions and the comparison of completed assessments against them.
 */
@Service
public class BenchmarkService {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkService.class);

    private final BenchmarkRepository benchmarkRepository;
    private final AssessmentService assessmentService;
    private final BenchmarkComparator comparator;
    private final MaturityMapper mapper;
    private final Clock clock;

    public BenchmarkService(BenchmarkRepository benchmarkRepository,
                            AssessmentService assessmentService,
                            BenchmarkComparator comparator,
                            MaturityMapper mapper,
                            Clock clock) {
        this.benchmarkRepository = benchmarkRepository;
        this.assessmentService   = assessmentService;
        this.comparator          = comparator;
        this.mapper              = mapper;
        this.clock               = clock;
    }

    /**
     * Inserts or replaces the distribution for (industry, metric, period).
     */
    public Mono<Benchmark> upsert(BenchmarkUpsertRequest request) {
        return Mono.fromCallable(() -> validate(request))
            .flatMap(distribution -> benchmarkRepository
                .findByIndustryAndMetricAndPeriod(distribution.industry(),
                    distribution.metric().key(), distribution.period())
                .defaultIfEmpty(new Benchmark())
                .flatMap(row -> {
                    row.setIndustry(distribution.industry());
                    row.setMetric(distribution.metric().key());
                    row.setPeriod(distribution.period());
                    row.setPeerScores(mapper.write(distribution.peerScores()));
                    row.setPeerCount(distribution.peerCount());
                    row.setPeerMedian(distribution.median());
                    row.setUpdatedAt(LocalDateTime.now(clock));
                    return benchmarkRepository.save(row);
                }))
            .doOnSuccess(b -> log.info("Benchmark stored. industry={} metric={} period={} peers={}",
                b.getIndustry(), b.getMetric(), b.getPeriod(), b.getPeerCount()))
            .doOnError(e -> log.warn("Benchmark upsert rejected. reason={}", e.getMessage()));
    }

    /** All stored periods for the industry, newest first. */
    public Flux<Benchmark> listByIndustry(String industry) {
        return benchmarkRepository.findByIndustryOrderByPeriodDesc(normalize(industry));
    }

    public Mono<BenchmarkComparison> compare(String tenantId, Long assessmentId) {
        if (assessmentId == null) {
            return Mono.error(new ValidationException("assessmentId is required"));
        }
        return assessmentService.get(tenantId, assessmentId)
            .map(mapper::toSnapshot)
            .flatMap(this::compare)
            .doOnSuccess(c -> log.info("Benchmark comparison done. assessmentId={} tenant={} overallPercentile={} topGaps={}",
                assessmentId, tenantId, c.overall().percentile(),
                c.topGaps().stream().map(Dimension::key).toList()));
    }

    /**
     * Compares against the newest period of every metric for the assessment's industry.
     */
    public Mono<BenchmarkComparison> compare(AssessmentSnapshot snapshot) {
        return latestDistributions(snapshot.industry())
            .map(latest -> comparator.compareAll(snapshot, latest));
    }

    private Mono<Map<BenchmarkMetric, BenchmarkDistribution>> latestDistributions(String industry) {
        return benchmarkRepository.findByIndustryOrderByPeriodDesc(normalize(industry))
            .collectList()
            .map(rows -> {
                Map<BenchmarkMetric, BenchmarkDistribution> latest = new EnumMap<>(BenchmarkMetric.class);
                for (Benchmark row : rows) {
                    BenchmarkMetric metric = BenchmarkMetric.fromKey(row.getMetric());
                    latest.putIfAbsent(metric, mapper.toDistribution(row));
                }
                return latest;
            });
    }

    private static BenchmarkDistribution validate(BenchmarkUpsertRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        List<String> violations = new ArrayList<>();
        if (request.industry() == null || request.industry().isBlank()) {
            violations.add("industry is required");
        }
        if (request.period() == null || request.period().isBlank()) {
            violations.add("period is required");
        }
        BenchmarkMetric metric = null;
        try {
            metric = BenchmarkMetric.fromKey(request.metric());
        } catch (ValidationException e) {
            violations.add(e.getMessage());
        }
        List<Double> peers = request.peerScores();
        if (peers == null || peers.isEmpty()) {
            violations.add("peerScores must contain at least one score");
        } else {
            for (int i = 0; i < peers.size(); i++) {
                Double score = peers.get(i);
                if (score == null || score.isNaN() || score < 0.0 || score > 100.0) {
                    violations.add("peerScores[" + i + "] " + score + " is outside [0,100]");
                }
            }
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid benchmark", violations);
        }
        return new BenchmarkDistribution(normalize(request.industry()), metric,
            request.period().trim(), peers);
    }

    private static String normalize(String industry) {
        return industry == null ? null : industry.trim().toLowerCase(Locale.ROOT);
    }
}
