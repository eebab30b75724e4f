package com.example.transcribe_backend.service;

import com.example.transcribe_backend.config.DispatchProperties;
import com.example.transcribe_backend.coordination.CoordinationKeys;
import com.example.transcribe_backend.coordination.CoordinationStore;
import com.example.transcribe_backend.exception.CoordinationStoreUnavailableException;
import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.repository.JobRepository;
import com.example.transcribe_backend.util.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Periodic reclaim pass. Every replica schedules it; a short-lived lock in the coordination store
 * lets only one of them run at a time. Concurrent evictions of the same runner are still safe
 * because every requeue is a compare-and-set on the job row.
 */
@Service
public class LivenessSweeper {
    private static final Logger LOGGER = LoggerFactory.getLogger(LivenessSweeper.class);

    private final CoordinationStore store;
    private final CoordinationKeys keys;
    private final RunnerLivenessTracker tracker;
    private final JobRepository jobRepository;
    private final Clock clock;
    private final DispatchProperties properties;

    public LivenessSweeper(CoordinationStore store,
                           CoordinationKeys keys,
                           RunnerLivenessTracker tracker,
                           JobRepository jobRepository,
                           Clock clock,
                           DispatchProperties properties) {
        this.store = store;
        this.keys = keys;
        this.tracker = tracker;
        this.jobRepository = jobRepository;
        this.clock = clock;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${dispatch.sweep-interval:PT10S}")
    public void scheduledSweep() {
        try {
            SweepReport report = sweep();
            if (report.changedAnything()) {
                LOGGER.info("Sweep done staleRunners={} fetchTimeouts={} orphans={}",
                        report.staleRunners(), report.artifactFetchTimeouts(), report.orphanedJobs());
            }
        } catch (CoordinationStoreUnavailableException e) {
            LOGGER.warn("Sweep skipped, coordination store unavailable: {}", e.getMessage());
        }
    }

    /**
     * Runs one pass if no other replica holds the sweep lock.
     */
    public SweepReport sweep() {
        String lockKey = keys.sweepLock();
        String token = UUID.randomUUID().toString();
        Duration lockTtl = properties.getSweepLockTtl();
        if (!store.setIfAbsent(lockKey, token, lockTtl)) {
            LOGGER.debug("Sweep skipped, lock held elsewhere");
            return SweepReport.SKIPPED;
        }
        try {
            int stale = evictStaleRunners();
            if (!store.compareAndSet(lockKey, token, token, lockTtl)) {
                LOGGER.warn("Sweep lock lost mid-pass, stopping");
                return new SweepReport(true, stale, 0, 0);
            }
            int fetchTimeouts = evictArtifactFetchTimeouts();
            int orphans = releaseOrphanedJobs();
            return new SweepReport(true, stale, fetchTimeouts, orphans);
        } finally {
            try {
                store.deleteIfEquals(lockKey, token);
            } catch (CoordinationStoreUnavailableException e) {
                LOGGER.warn("Sweep lock not released, expires in {}: {}", lockTtl, e.getMessage());
            }
        }
    }

    private int evictStaleRunners() {
        long cutoff = clock.millis() - properties.getHeartbeatTimeout().toMillis();
        int evicted = 0;
        for (String member : store.members(keys.onlineRunners())) {
            long runnerId;
            try {
                runnerId = Long.parseLong(member);
            } catch (NumberFormatException e) {
                LOGGER.warn("Dropping malformed online runner member={}", member);
                store.removeMember(keys.onlineRunners(), member);
                continue;
            }
            Optional<String> raw = tracker.findRaw(runnerId);
            if (raw.isEmpty()) {
                // record already expired through its TTL
                store.removeMember(keys.onlineRunners(), member);
                tracker.releaseHeldJob(runnerId, "heartbeat timeout");
                evicted++;
                continue;
            }
            Optional<RunnerLiveness> record = tracker.decode(raw.get());
            if (record.isEmpty() || record.get().lastHeartbeatMillis() < cutoff) {
                if (tracker.evictIfUnchanged(runnerId, raw.get(), "heartbeat timeout")) {
                    evicted++;
                }
            }
        }
        return evicted;
    }

    private int evictArtifactFetchTimeouts() {
        Instant cutoff = clock.instant().minus(properties.artifactFetchTimeout());
        List<Job> stuck = jobRepository.findByStateAndAssignedAtBefore(JobState.RUNNER_ASSIGNED, cutoff);
        int evicted = 0;
        for (Job job : stuck) {
            LOGGER.info("Artifact fetch timeout jobId={} runnerId={} assignedAt={}",
                    job.getId(), job.getAssignedRunnerId(), job.getAssignedAt());
            if (tracker.evictForFetchTimeout(job)) {
                evicted++;
            }
        }
        return evicted;
    }

    private int releaseOrphanedJobs() {
        Instant cutoff = clock.instant().minus(properties.getHeartbeatTimeout());
        List<Job> candidates = jobRepository.findByStateInAndUpdatedAtBefore(JobState.HELD_BY_RUNNER, cutoff);
        int released = 0;
        for (Job job : candidates) {
            Long runnerId = job.getAssignedRunnerId();
            if (runnerId == null || tracker.findRaw(runnerId).isPresent()) {
                continue;
            }
            if (tracker.releaseHeldJob(runnerId, "no liveness record")) {
                released++;
            }
        }
        return released;
    }

    /**
     * Outcome of one sweep pass.
     *
     * @param ran                   whether this replica held the lock
     * @param staleRunners          runners evicted for missed heartbeats
     * @param artifactFetchTimeouts runners evicted for never fetching their audio
     * @param orphanedJobs          jobs released whose runner had no liveness record
     */
    public record SweepReport(boolean ran, int staleRunners, int artifactFetchTimeouts, int orphanedJobs) {
        static final SweepReport SKIPPED = new SweepReport(false, 0, 0, 0);

        public boolean changedAnything() {
            return staleRunners + artifactFetchTimeouts + orphanedJobs > 0;
        }
    }
}
