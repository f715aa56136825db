package com.maturityplatform.assessment.repository;

import com.maturityplatform.assessment.model.Report;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface ReportRepository extends ReactiveCrudRepository<Report, Long> {

    Mono<Report> findByIdAndTenantId(Long id, String tenantId);
}
