package com.maturityplatform.assessment.repository;

import com.maturityplatform.assessment.model.AssessmentResponse;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

@Repository
public interface AssessmentResponseRepository extends ReactiveCrudRepository<AssessmentResponse, Long> {

    Flux<AssessmentResponse> findByAssessmentIdOrderByIdAsc(Long assessmentId);

    /**
     * Removes earlier answers to the given questions so a resubmission replaces them.
     * Runs inside the submission transaction.
     */
    @Modifying
    @Query("""
        DELETE FROM assessment_responses
        WHERE assessment_id = :assessmentId
          AND question_id IN (:questionIds)
        """)
    Mono<Integer> deleteByAssessmentIdAndQuestionIds(Long assessmentId, Collection<String> questionIds);
}
