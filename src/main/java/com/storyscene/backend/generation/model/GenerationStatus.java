package com.storyscene.backend.generation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum GenerationStatus {
    PENDING,
    GENERATING,
    COMPLETED,
    ERROR;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
