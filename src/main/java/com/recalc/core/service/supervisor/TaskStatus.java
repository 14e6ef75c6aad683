package com.recalc.core.service.supervisor;

public enum TaskStatus {
    RUNNING,
    RESTARTING,
    CRASHED,
    COMPLETED,
    CANCELLED
}
