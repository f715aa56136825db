package com.maturityplatform.assessment.service;

import com.maturityplatform.assessment.dto.CreateAssessmentRequest;
import com.maturityplatform.assessment.dto.ResponseItem;
import com.maturityplatform.assessment.dto.SubmitResponsesRequest;
import com.maturityplatform.assessment.model.Assessment;
import com.maturityplatform.assessment.model.AssessmentResponse;
import com.maturityplatform.assessment.repository.AssessmentRepository;
import com.maturityplatform.assessment.repository.AssessmentResponseRepository;
import com.maturityplatform.common.event.MaturityEvent;
import com.maturityplatform.common.event.MaturityEventPublisher;
import com.maturityplatform.common.event.MaturityEventType;
import com.maturityplatform.common.exception.ConcurrencyException;
import com.maturityplatform.common.exception.NotFoundException;
import com.maturityplatform.common.exception.StateException;
import com.maturityplatform.common.exception.ValidationException;
import com.maturityplatform.common.model.AssessmentStatus;
import com.maturityplatform.common.model.Dimension;
import com.maturityplatform.common.scoring.DimensionScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static com.maturityplatform.assessment.ServiceFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AssessmentServiceTest {

    private AssessmentRepository assessments;
    private AssessmentResponseRepository responses;
    private MaturityEventPublisher events;
    private AssessmentService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        assessments = mock(AssessmentRepository.class);
        responses = mock(AssessmentResponseRepository.class);
        events = mock(MaturityEventPublisher.class);
        TransactionalOperator tx = mock(TransactionalOperator.class);
        when(tx.transactional(any(Mono.class))).thenAnswer(inv -> inv.getArgument(0));

        when(assessments.save(any(Assessment.class))).thenAnswer(inv -> {
            Assessment a = inv.getArgument(0);
            if (a.getId() == null) {
                a.setId(42L);
            }
            return Mono.just(a);
        });

        service = new AssessmentService(assessments, responses, new DimensionScorer(), CLASSIFIER,
            MAPPER, events, tx, CLOCK);
    }

    private static ResponseItem item(String questionId, String dimension, Double score) {
        return new ResponseItem(questionId, dimension, score, null, "answer");
    }

    // ── create ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("create()")
    class Create {

        @Test
        @DisplayName("stores a draft assessment and publishes assessment.created")
        void createsDraft() {
            CreateAssessmentRequest request = new CreateAssessmentRequest(
                "Acme Insurance", " Insurance ", "enterprise", null, Map.of("region", "emea"));

            StepVerifier.create(service.create(TENANT, request))
                .assertNext(a -> {
                    assertEquals(42L, a.getId());
                    assertEquals("DRAFT", a.getStatus());
                    assertEquals("insurance", a.getIndustry());
                    assertEquals(NOW_UTC, a.getCreatedAt());
                    assertNull(a.getOverallScore());
                })
                .verifyComplete();

            ArgumentCaptor<MaturityEvent> event = ArgumentCaptor.forClass(MaturityEvent.class);
            verify(events).publish(event.capture());
            assertEquals(MaturityEventType.ASSESSMENT_CREATED, event.getValue().eventType());
            assertEquals(42L, event.getValue().entityId());
            assertEquals(TENANT, event.getValue().tenantId());
        }

        @Test
        @DisplayName("reports every invalid field at once and stores nothing")
        void collectsViolations() {
            CreateAssessmentRequest request = new CreateAssessmentRequest(" ", null, "huge", null, null);

            StepVerifier.create(service.create(TENANT, request))
                .expectErrorSatisfies(e -> {
                    ValidationException v = assertInstanceOf(ValidationException.class, e);
                    assertEquals(3, v.getViolations().size());
                    assertTrue(v.getViolations().contains("organizationName is required"));
                    assertTrue(v.getViolations().contains("industry is required"));
                })
                .verify();

            verify(assessments, never()).save(any());
            verifyNoInteractions(events);
        }

        @Test
        @DisplayName("custom weights that do not sum to 1 are rejected")
        void badWeights() {
            Map<String, Double> weights = Map.of("data", 0.5, "process", 0.5, "people", 0.5,
                "technology", 0.5, "governance", 0.5);

            StepVerifier.create(service.create(TENANT,
                    new CreateAssessmentRequest("Acme", "insurance", "smb", weights, null)))
                .expectError(ValidationException.class)
                .verify();
        }
    }

    // ── list ────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("list() pages the tenant's assessments newest first")
    void listPages() {
        when(assessments.findByTenantIdOrderByCreatedAtDesc(TENANT)).thenReturn(Flux.just(
            assessment(5, AssessmentStatus.DRAFT), assessment(4, AssessmentStatus.DRAFT),
            assessment(3, AssessmentStatus.DRAFT)));

        StepVerifier.create(service.list(TENANT, null, 2, 2))
            .assertNext(page -> {
                assertEquals(3, page.total());
                assertEquals(1, page.items().size());
                assertEquals(3L, page.items().get(0).id());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("list() returns an empty page far past the end without overflowing the offset")
    void listPastEnd() {
        when(assessments.findByTenantIdOrderByCreatedAtDesc(TENANT)).thenReturn(Flux.just(
            assessment(5, AssessmentStatus.DRAFT), assessment(4, AssessmentStatus.DRAFT)));

        StepVerifier.create(service.list(TENANT, null, Integer.MAX_VALUE, 100))
            .assertNext(page -> {
                assertEquals(2, page.total());
                assertTrue(page.items().isEmpty());
                assertEquals(Integer.MAX_VALUE, page.page());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("list() rejects an unknown status filter")
    void listUnknownStatus() {
        StepVerifier.create(service.list(TENANT, "archived", 1, 20))
            .expectError(ValidationException.class)
            .verify();
    }

    // ── submitResponses ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("submitResponses()")
    class Submit {

        @Test
        @DisplayName("replaces earlier answers and moves a draft to in_progress")
        @SuppressWarnings("unchecked")
        void replacesAnswers() {
            Assessment draft = assessment(42, AssessmentStatus.DRAFT);
            when(assessments.findByIdAndTenantId(42L, TENANT)).thenReturn(Mono.just(draft));
            when(responses.deleteByAssessmentIdAndQuestionIds(eq(42L), anyCollection())).thenReturn(Mono.just(1));
            when(responses.saveAll(anyList())).thenAnswer(inv ->
                Flux.fromIterable((List<AssessmentResponse>) inv.getArgument(0)));

            SubmitResponsesRequest request = new SubmitResponsesRequest(List.of(
                item("q1", "data", 70.0), item("q2", "people", 30.0)));

            StepVerifier.create(service.submitResponses(TENANT, 42L, request))
                .assertNext(result -> {
                    assertEquals(2, result.submittedCount());
                    assertEquals("in_progress", result.status());
                })
                .verifyComplete();

            assertEquals("IN_PROGRESS", draft.getStatus());
            assertEquals(NOW_UTC, draft.getResponsesUpdatedAt());
            verify(responses).deleteByAssessmentIdAndQuestionIds(42L, List.of("q1", "q2"));
        }

        @Test
        @DisplayName("a completed assessment's responses are immutable")
        void completedIsImmutable() {
            when(assessments.findByIdAndTenantId(42L, TENANT)).thenReturn(Mono.just(completedAssessment(42)));

            StepVerifier.create(service.submitResponses(TENANT, 42L,
                    new SubmitResponsesRequest(List.of(item("q1", "data", 70.0)))))
                .expectError(StateException.class)
                .verify();

            verify(responses, never()).saveAll(anyList());
        }

        @Test
        @DisplayName("out-of-range scores, unknown dimensions and repeated questions are all reported")
        void invalidItems() {
            SubmitResponsesRequest request = new SubmitResponsesRequest(List.of(
                item("q1", "data", 140.0), item("q1", "ethics", 50.0)));

            StepVerifier.create(service.submitResponses(TENANT, 42L, request))
                .expectErrorSatisfies(e -> assertEquals(3,
                    assertInstanceOf(ValidationException.class, e).getViolations().size()))
                .verify();

            verifyNoInteractions(assessments);
        }

        @Test
        @DisplayName("a stale version surfaces as a retryable conflict")
        void staleVersion() {
            when(assessments.findByIdAndTenantId(42L, TENANT)).thenReturn(
                Mono.just(assessment(42, AssessmentStatus.IN_PROGRESS)),
                Mono.just(assessment(42, AssessmentStatus.IN_PROGRESS)));
            when(assessments.save(any(Assessment.class)))
                .thenReturn(Mono.error(new OptimisticLockingFailureException("stale")));

            StepVerifier.create(service.submitResponses(TENANT, 42L,
                    new SubmitResponsesRequest(List.of(item("q1", "data", 70.0)))))
                .expectError(ConcurrencyException.class)
                .verify();
        }
    }

    // ── score ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("score()")
    class Score {

        private void storedResponses() {
            when(responses.findByAssessmentIdOrderByIdAsc(42L)).thenReturn(Flux.just(
                response(42, "d1", Dimension.DATA, 40),
                response(42, "p1", Dimension.PROCESS, 60),
                response(42, "h1", Dimension.PEOPLE, 20),
                response(42, "t1", Dimension.TECHNOLOGY, 80),
                response(42, "g1", Dimension.GOVERNANCE, 50)));
        }

        @Test
        @DisplayName("completes the assessment with weighted scores and publishes assessment.completed")
        void completes() {
            when(assessments.findByIdAndTenantId(42L, TENANT))
                .thenReturn(Mono.just(assessment(42, AssessmentStatus.IN_PROGRESS)));
            storedResponses();

            StepVerifier.create(service.score(TENANT, 42L))
                .assertNext(a -> {
                    assertEquals("COMPLETED", a.getStatus());
                    assertEquals(49.5, a.getOverallScore(), 1e-9);
                    assertEquals(3, a.getMaturityLevel());
                    assertEquals("Defined", a.getMaturityLabel());
                    assertEquals(80.0, a.getTechnologyScore(), 1e-9);
                    assertEquals(NOW_UTC, a.getCompletedAt());
                })
                .verifyComplete();

            ArgumentCaptor<MaturityEvent> event = ArgumentCaptor.forClass(MaturityEvent.class);
            verify(events).publish(event.capture());
            assertEquals(MaturityEventType.ASSESSMENT_COMPLETED, event.getValue().eventType());
            assertEquals(3, event.getValue().payload().get("maturityLevel"));
        }

        @Test
        @DisplayName("a dimension without responses fails and nothing is saved")
        void missingDimension() {
            when(assessments.findByIdAndTenantId(42L, TENANT))
                .thenReturn(Mono.just(assessment(42, AssessmentStatus.IN_PROGRESS)));
            when(responses.findByAssessmentIdOrderByIdAsc(42L)).thenReturn(Flux.just(
                response(42, "d1", Dimension.DATA, 40)));

            StepVerifier.create(service.score(TENANT, 42L))
                .expectError(ValidationException.class)
                .verify();

            verify(assessments, never()).save(any());
            verifyNoInteractions(events);
        }

        @Test
        @DisplayName("scoring twice fails with a state error instead of recomputing")
        void alreadyCompleted() {
            when(assessments.findByIdAndTenantId(42L, TENANT)).thenReturn(Mono.just(completedAssessment(42)));
            storedResponses();

            StepVerifier.create(service.score(TENANT, 42L))
                .expectError(StateException.class)
                .verify();

            verify(assessments, never()).save(any());
        }

        @Test
        @DisplayName("losing a race to a concurrent scorer reports the assessment as completed")
        void lostRaceToScorer() {
            when(assessments.findByIdAndTenantId(42L, TENANT)).thenReturn(
                Mono.just(assessment(42, AssessmentStatus.IN_PROGRESS)),
                Mono.just(completedAssessment(42)));
            when(assessments.save(any(Assessment.class)))
                .thenReturn(Mono.error(new OptimisticLockingFailureException("stale")));
            storedResponses();

            StepVerifier.create(service.score(TENANT, 42L))
                .expectError(StateException.class)
                .verify();

            verifyNoInteractions(events);
        }

        @Test
        @DisplayName("losing a race to a response submission is retryable")
        void lostRaceToSubmission() {
            when(assessments.findByIdAndTenantId(42L, TENANT)).thenReturn(
                Mono.just(assessment(42, AssessmentStatus.IN_PROGRESS)),
                Mono.just(assessment(42, AssessmentStatus.IN_PROGRESS)));
            when(assessments.save(any(Assessment.class)))
                .thenReturn(Mono.error(new OptimisticLockingFailureException("stale")));
            storedResponses();

            StepVerifier.create(service.score(TENANT, 42L))
                .expectError(ConcurrencyException.class)
                .verify();

            verifyNoInteractions(events);
        }

        @Test
        @DisplayName("another tenant's assessment is not found")
        void otherTenant() {
            when(assessments.findByIdAndTenantId(42L, "globex")).thenReturn(Mono.empty());

            StepVerifier.create(service.score("globex", 42L))
                .expectError(NotFoundException.class)
                .verify();
        }
    }

    @Test
    @DisplayName("detailedScores() reports each dimension's band and response count")
    void detailedScores() {
        when(assessments.findByIdAndTenantId(42L, TENANT)).thenReturn(Mono.just(completedAssessment(42)));
        when(responses.findByAssessmentIdOrderByIdAsc(42L)).thenReturn(Flux.just(
            response(42, "d1", Dimension.DATA, 30), response(42, "d2", Dimension.DATA, 50),
            response(42, "h1", Dimension.PEOPLE, 20)));

        StepVerifier.create(service.detailedScores(TENANT, 42L))
            .assertNext(d -> {
                assertEquals("completed", d.status());
                assertEquals(2, d.dimensions().get("data").responseCount());
                assertEquals(3, d.dimensions().get("data").level());
                assertEquals("Developing", d.dimensions().get("people").label());
                assertEquals(0, d.dimensions().get("governance").responseCount());
                assertEquals(0.25, d.dimensions().get("data").weight(), 1e-9);
            })
            .verifyComplete();
    }
}
