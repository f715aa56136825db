package com.maturityplatform.common.event;

/**
 * Abstraction for publishing {@link MaturityEvent}s after a state change commits.
 *
 * <p>Callers invoke it only after the triggering write succeeded, never before
 * and never when the write failed. Delivery is at-least-once; consumers must
 * tolerate duplicates.
 *
 * <p>Current implementation: {@code RestMaturityEventPublisher}, an HTTP POST to
 * the event sink. Implementations MUST be non-blocking.
 */
public interface MaturityEventPublisher {

    void publish(MaturityEvent event);
}
