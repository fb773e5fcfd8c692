package com.lunchmate.backend.menuday;

import com.lunchmate.backend.menuday.model.MenuDayStatus;
import org.junit.jupiter.api.Test;

import static com.lunchmate.backend.menuday.model.MenuDayStatus.*;
import static org.junit.jupiter.api.Assertions.*;

class MenuDayStatusTest {

    @Test
    void forwardTransitions_allowed() {
        assertTrue(DRAFT.canTransitionTo(PUBLISHED));
        assertTrue(DRAFT.canTransitionTo(CLOSED));
        assertTrue(PUBLISHED.canTransitionTo(CLOSED));
        for (MenuDayStatus s : MenuDayStatus.values()) assertTrue(s.canTransitionTo(s));
    }

    @Test
    void regressions_rejected() {
        assertFalse(CLOSED.canTransitionTo(DRAFT));
        assertFalse(CLOSED.canTransitionTo(PUBLISHED));
        assertFalse(PUBLISHED.canTransitionTo(DRAFT));
        assertFalse(DRAFT.canTransitionTo(null));
    }
}
