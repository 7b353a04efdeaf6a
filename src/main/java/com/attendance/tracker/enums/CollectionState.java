package com.attendance.tracker.enums;

public enum CollectionState {
    IDLE,
    AWAITING_DECISION,
    AWAITING_REASON,
    COMPLETE,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETE || this == CANCELLED;
    }
}
