package org.caureq.homesentry.scheduler;

public enum SchedulerState {
    IDLE, RUNNING, CANCELLED
}
