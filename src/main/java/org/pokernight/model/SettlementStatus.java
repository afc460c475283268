package org.pokernight.model;

public enum SettlementStatus {
    UNSETTLED,
    SETTLING,
    SETTLED
}
