package com.maturityplatform.assessment.publisher;

import com.maturityplatform.common.event.MaturityEvent;
import com.maturityplatform.common.event.MaturityEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * REST-based implementation of {@link MaturityEventPublisher}.
 *
 * <p>POSTs each {@link MaturityEvent} to the event sink without blocking the caller.
 * Failed deliveries are retried with exponential backoff; a final failure is
 * logged and does not affect the already committed state change.
 */
@Component
public class RestMaturityEventPublisher implements MaturityEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestMaturityEventPublisher.class);

    private static final Duration FIRST_BACKOFF = Duration.ofMillis(200);

    private final WebClient eventsClient;
    private final int maxRetries;

    public RestMaturityEventPublisher(WebClient eventsClient,
                                      @Value("${maturity.events.max-retries:3}") int maxRetries) {
        this.eventsClient = eventsClient;
        this.maxRetries   = maxRetries;
    }

    @Override
    public void publish(MaturityEvent event) {
        eventsClient.post()
            .uri("/api/v1/events")
            .header("X-Tenant-Id", event.tenantId())
            .bodyValue(event)
            .retrieve()
            .toBodilessEntity()
            .retryWhen(Retry.backoff(maxRetries, FIRST_BACKOFF))
            .subscribe(
                r   -> log.info("Maturity event published. type={} entityId={} tenant={} status={}",
                                event.eventType().wireName(), event.entityId(), event.tenantId(),
                                r.getStatusCode()),
                err -> log.warn("Maturity event publish failed after retries. type={} entityId={} tenant={}",
                                event.eventType().wireName(), event.entityId(), event.tenantId(), err)
            );
    }
}
