package com.example.servicedesk.domain;

import java.util.List;

public enum EscalationStatus {
    PENDING, EXECUTING, COMPLETED, FAILED, CANCELLED;

    public static final List<EscalationStatus> ACTIVE = List.of(PENDING, EXECUTING);
    public static final List<EscalationStatus> TERMINAL = List.of(COMPLETED, FAILED, CANCELLED);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
