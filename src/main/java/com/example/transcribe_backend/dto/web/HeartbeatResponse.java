package com.example.transcribe_backend.dto.web;

import com.example.transcribe_backend.util.HeartbeatAction;

public record HeartbeatResponse(HeartbeatAction action, Long jobId) {

    public static HeartbeatResponse noAssignment() {
        return new HeartbeatResponse(HeartbeatAction.NO_ASSIGNMENT, null);
    }

    public static HeartbeatResponse assignment(long jobId) {
        return new HeartbeatResponse(HeartbeatAction.ASSIGNMENT, jobId);
    }

    public static HeartbeatResponse dropJob(long jobId) {
        return new HeartbeatResponse(HeartbeatAction.DROP_JOB, jobId);
    }
}
