package com.example.transcribe_backend.util;

public enum HeartbeatAction {
    NO_ASSIGNMENT,
    ASSIGNMENT,
    DROP_JOB
}
