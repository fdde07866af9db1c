package com.storyscene.backend.generation.model;

public enum AttemptStatus {
    STARTED,
    SUCCEEDED,
    FAILED
}
