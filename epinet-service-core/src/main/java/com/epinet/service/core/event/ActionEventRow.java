package com.epinet.service.core.event;

import java.time.Instant;

/** Content action row: a visitor applied {@code verb} to the object identified by type and id. */
public record ActionEventRow(Instant createdAt, String objectId, String objectType, String visitorId, String verb) {}
