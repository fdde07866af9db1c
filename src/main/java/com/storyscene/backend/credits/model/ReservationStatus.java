package com.storyscene.backend.credits.model;

public enum ReservationStatus {
    RESERVED,
    COMMITTED,
    RELEASED,
    REFUNDED
}
