package org.pokernight.model;

public enum PaymentStatus {
    PENDING,
    PAID
}
