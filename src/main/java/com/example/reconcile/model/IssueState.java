package com.example.reconcile.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a routed issue:
 * {@code detected -> (auto_fix_available | needs_human) -> resolved | deferred}.
 */
public enum IssueState {
    DETECTED("detected"),
    AUTO_FIX_AVAILABLE("auto_fix_available"),
    NEEDS_HUMAN("needs_human"),
    RESOLVED("resolved"),
    DEFERRED("deferred");

    private final String wireName;

    IssueState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == RESOLVED || this == DEFERRED;
    }

    public boolean canTransitionTo(IssueState target) {
        return successors().contains(target);
    }

    private Set<IssueState> successors() {
        return switch (this) {
            case DETECTED -> EnumSet.of(AUTO_FIX_AVAILABLE, NEEDS_HUMAN);
            case AUTO_FIX_AVAILABLE, NEEDS_HUMAN -> EnumSet.of(RESOLVED, DEFERRED);
            case RESOLVED, DEFERRED -> EnumSet.noneOf(IssueState.class);
        };
    }
}
