package com.example.transcribe_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Heartbeat, sweep and claim settings for runner dispatch.
 */
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    private Duration heartbeatInterval = Duration.ofSeconds(15);
    private Duration heartbeatTimeout = Duration.ofSeconds(45);
    private int artifactFetchMissedHeartbeats = 3;
    private Duration sweepInterval = Duration.ofSeconds(10);
    private Duration sweepLockTtl = Duration.ofSeconds(8);
    private int claimBatchSize = 10;
    private int maxTransitionAttempts = 5;

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
    }

    public Duration getHeartbeatTimeout() {
        return heartbeatTimeout;
    }

    public void setHeartbeatTimeout(Duration heartbeatTimeout) {
        this.heartbeatTimeout = heartbeatTimeout;
    }

    public int getArtifactFetchMissedHeartbeats() {
        return artifactFetchMissedHeartbeats;
    }

    public void setArtifactFetchMissedHeartbeats(int artifactFetchMissedHeartbeats) {
        this.artifactFetchMissedHeartbeats = artifactFetchMissedHeartbeats;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public Duration getSweepLockTtl() {
        return sweepLockTtl;
    }

    public void setSweepLockTtl(Duration sweepLockTtl) {
        this.sweepLockTtl = sweepLockTtl;
    }

    public int getClaimBatchSize() {
        return claimBatchSize;
    }

    public void setClaimBatchSize(int claimBatchSize) {
        this.claimBatchSize = claimBatchSize;
    }

    public int getMaxTransitionAttempts() {
        return maxTransitionAttempts;
    }

    public void setMaxTransitionAttempts(int maxTransitionAttempts) {
        this.maxTransitionAttempts = maxTransitionAttempts;
    }

    /**
     * How long a job may stay assigned without the runner fetching its audio before the runner is
     * treated as crashed.
     *
     * @return artifact fetch timeout.
     */
    public Duration artifactFetchTimeout() {
        return heartbeatInterval.multipliedBy(Math.max(1, artifactFetchMissedHeartbeats));
    }
}
