package com.maturityplatform.assessment.repository;

import com.maturityplatform.assessment.model.Pilot;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface PilotRepository extends ReactiveCrudRepository<Pilot, Long> {

    Mono<Pilot> findByIdAndTenantId(Long id, String tenantId);
}
