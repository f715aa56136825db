package com.maturityplatform.assessment.repository;

import com.maturityplatform.assessment.model.Roadmap;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface RoadmapRepository extends ReactiveCrudRepository<Roadmap, Long> {

    Mono<Roadmap> findByIdAndTenantId(Long id, String tenantId);

    Mono<Roadmap> findFirstByAssessmentIdAndTenantIdOrderByGeneratedAtDesc(Long assessmentId, String tenantId);

    /**
     * Compare-and-set publish: only a draft row flips. Returns the number of
     * rows updated, 0 when the roadmap is missing or already published.
     */
    @Modifying
    @Query("""
        UPDATE roadmaps
        SET status = 'PUBLISHED', published_at = :publishedAt
        WHERE id = :id
          AND tenant_id = :tenantId
          AND status = 'DRAFT'
        """)
    Mono<Integer> publishDraft(Long id, String tenantId, LocalDateTime publishedAt);
}
