package io.avscheduler.model;

public enum RunStatus {
    EXECUTED,
    SKIPPED_CONDITION,
    SKIPPED_OVERLAP
}
