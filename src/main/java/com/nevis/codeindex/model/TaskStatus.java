package com.nevis.codeindex.model;

import java.util.EnumSet;
import java.util.Set;

public enum TaskStatus {
    PENDING,
    ACQUIRING,
    PARSING,
    EMBEDDING,
    GENERATING_ARTIFACTS,
    COMPLETED,
    FAILED,
    CANCELLED,
    INTERRUPTED;

    private static final Set<TaskStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED, INTERRUPTED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canTransitionTo(TaskStatus next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED || next == CANCELLED || next == INTERRUPTED || next == PENDING) {
            return true;
        }
        return next.ordinal() > this.ordinal();
    }

    public static Set<TaskStatus> active() {
        return EnumSet.complementOf(EnumSet.copyOf(TERMINAL));
    }

    public static Set<TaskStatus> terminal() {
        return EnumSet.copyOf(TERMINAL);
    }
}
