package com.lunchmate.backend.menuday.model;

/**
 * Draft -> Published -> Closed, or Draft -> Closed. Nothing leaves Closed and nothing goes back to Draft.
 */
public enum MenuDayStatus {
    DRAFT,
    PUBLISHED,
    CLOSED;

    public boolean canTransitionTo(MenuDayStatus next) {
        if (next == null) return false;
        if (next == this) return true;
        return switch (this) {
            case DRAFT -> true;
            case PUBLISHED -> next == CLOSED;
            case CLOSED -> false;
        };
    }
}
