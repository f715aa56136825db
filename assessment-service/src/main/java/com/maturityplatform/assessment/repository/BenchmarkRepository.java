package com.maturityplatform.assessment.repository;

import com.maturityplatform.assessment.model.Benchmark;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface BenchmarkRepository extends ReactiveCrudRepository<Benchmark, Long> {

    Mono<Benchmark> findByIndustryAndMetricAndPeriod(String industry, String metric, String period);

    /** Newest period first; the comparison uses the first row seen per metric. */
    Flux<Benchmark> findByIndustryOrderByPeriodDesc(String industry);
}
