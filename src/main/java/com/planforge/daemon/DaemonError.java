package com.planforge.daemon;

public enum DaemonError {
    SESSION_NOT_FOUND,
    ALREADY_REGISTERED,
    SHUTTING_DOWN,
    AUTHENTICATION_FAILED,
    INTERNAL
}
