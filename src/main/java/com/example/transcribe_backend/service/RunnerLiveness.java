package com.example.transcribe_backend.service;

import com.example.transcribe_backend.dto.web.HeartbeatRequest;
import com.example.transcribe_backend.dto.web.RunnerRegisterRequest;
import jakarta.annotation.Nullable;

import java.util.List;

/**
 * Ephemeral liveness record of a connected runner, stored as JSON in the coordination store with
 * a TTL equal to the heartbeat timeout.
 */
public record RunnerLiveness(
        long runnerId,
        String name,
        String version,
        String gitHash,
        String sourceCodeUrl,
        List<String> capabilities,
        long lastHeartbeatMillis,
        @Nullable Long currentJobId
) {
    public RunnerLiveness {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    static RunnerLiveness registered(long runnerId, RunnerRegisterRequest req, long nowMillis, @Nullable Long currentJobId) {
        return new RunnerLiveness(runnerId, req.name(), req.version(), req.gitHash(), req.sourceCodeUrl(),
                req.capabilities(), nowMillis, currentJobId);
    }

    /** Refreshes the record from a heartbeat; metadata the runner omits is carried over. */
    static RunnerLiveness heartbeat(long runnerId, HeartbeatRequest req, @Nullable RunnerLiveness previous, long nowMillis) {
        if (previous == null) {
            return new RunnerLiveness(runnerId, req.name(), req.version(), req.gitHash(), req.sourceCodeUrl(),
                    req.capabilities(), nowMillis, null);
        }
        return new RunnerLiveness(runnerId,
                req.name() != null ? req.name() : previous.name(),
                req.version() != null ? req.version() : previous.version(),
                req.gitHash() != null ? req.gitHash() : previous.gitHash(),
                req.sourceCodeUrl() != null ? req.sourceCodeUrl() : previous.sourceCodeUrl(),
                req.capabilities() != null ? req.capabilities() : previous.capabilities(),
                nowMillis, previous.currentJobId());
    }

    public RunnerLiveness withCurrentJob(@Nullable Long jobId) {
        return new RunnerLiveness(runnerId, name, version, gitHash, sourceCodeUrl, capabilities, lastHeartbeatMillis, jobId);
    }
}
