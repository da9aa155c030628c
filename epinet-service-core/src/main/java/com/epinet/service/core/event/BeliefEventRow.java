package com.epinet.service.core.event;

import java.time.Instant;

/**
 * Held-belief row. {@code object} is {@code null} for plain beliefs and carries the identity for
 * identify-as events.
 */
public record BeliefEventRow(Instant updatedAt, String beliefId, String visitorId, String verb, String object) {}
