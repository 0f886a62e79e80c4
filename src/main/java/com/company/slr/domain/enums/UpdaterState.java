package com.company.slr.domain.enums;

public enum UpdaterState {
    IDLE,
    RUNNING,
    SLEEPING,
    STOPPED
}
