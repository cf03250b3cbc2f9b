package uk.gegc.formbatch.features.billing.domain.model;

public enum ReservationState {
    ACTIVE,
    COMMITTED,
    RELEASED,
    EXPIRED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
