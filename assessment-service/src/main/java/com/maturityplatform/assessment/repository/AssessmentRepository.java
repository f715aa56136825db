package com.maturityplatform.assessment.repository;

import com.maturityplatform.assessment.model.Assessment;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface AssessmentRepository extends ReactiveCrudRepository<Assessment, Long> {

    Mono<Assessment> findByIdAndTenantId(Long id, String tenantId);

    Flux<Assessment> findByTenantIdOrderByCreatedAtDesc(String tenantId);

    Flux<Assessment> findByTenantIdAndStatusOrderByCreatedAtDesc(String tenantId, String status);
}
