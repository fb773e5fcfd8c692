package com.lunchmate.backend.order.model;

/**
 * Pending -> Ready | Delivered | Cancelled, Ready -> Delivered | Cancelled. Delivered and Cancelled are terminal
 * (a cancelled order comes back only through a customer re-selection before cutoff).
 */
public enum OrderStatus {
    PENDING,
    READY,
    DELIVERED,
    CANCELLED;

    public boolean canTransitionTo(OrderStatus next) {
        if (next == null || next == this) return false;
        return switch (this) {
            case PENDING -> true;
            case READY -> next == DELIVERED || next == CANCELLED;
            case DELIVERED, CANCELLED -> false;
        };
    }

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED;
    }

    /** Counted in MenuDay.confirmationsCount */
    public boolean isActive() {
        return this != CANCELLED;
    }
}
