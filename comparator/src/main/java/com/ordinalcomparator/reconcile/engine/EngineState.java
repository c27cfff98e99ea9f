package com.ordinalcomparator.reconcile.engine;

public enum EngineState {
    INITIALIZING,
    RESOLVING_RANGE,
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
