package com.epinet.service.core.funnel;

/** Raw funnel row as stored: the payload is unparsed JSON. */
public record FunnelRecord(String id, String title, String optionsPayload) {}
