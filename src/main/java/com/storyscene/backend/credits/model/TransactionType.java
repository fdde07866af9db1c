package com.storyscene.backend.credits.model;

public enum TransactionType {
    RESERVATION,
    USAGE,
    RELEASE,
    REFUND
}
