package com.maturityplatform.assessment.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Peer distribution for one (industry, metric, period). Refreshed out-of-band
 * through the upsert endpoint; read-only for comparisons.
 *
 * peerScores: JSON-serialised {@code List<Double>}
 */
@Data
@NoArgsConstructor
@Table("benchmarks")
public class Benchmark {

    @Id
    private Long id;

    private String industry;

    /** Wire key of {@link com.maturityplatform.common.benchmark.BenchmarkMetric} */
    private String metric;

    private String period;

    private String peerScores;

    private Integer peerCount;

    private Double peerMedian;

    private LocalDateTime updatedAt;
}
