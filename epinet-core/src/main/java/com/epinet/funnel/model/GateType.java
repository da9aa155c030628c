package com.epinet.funnel.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/**
 * Discriminator of a funnel step. Wire names match the stored {@code gateType} values.
 */
public enum GateType {
    BELIEF("belief"),
    IDENTIFY_AS("identifyAs"),
    COMMITMENT_ACTION("commitmentAction"),
    CONVERSION_ACTION("conversionAction");

    private final String wireName;

    GateType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isAction() {
        return this == COMMITMENT_ACTION || this == CONVERSION_ACTION;
    }

    public boolean isBelief() {
        return this == BELIEF || this == IDENTIFY_AS;
    }

    public static Optional<GateType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(trimmed))
                .findFirst();
    }
}
