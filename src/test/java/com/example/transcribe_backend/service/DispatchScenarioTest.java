package com.example.transcribe_backend.service;

import com.example.transcribe_backend.config.DispatchProperties;
import com.example.transcribe_backend.coordination.CoordinationKeys;
import com.example.transcribe_backend.coordination.InMemoryCoordinationStore;
import com.example.transcribe_backend.dto.web.AbortResponse;
import com.example.transcribe_backend.dto.web.HeartbeatRequest;
import com.example.transcribe_backend.dto.web.HeartbeatResponse;
import com.example.transcribe_backend.dto.web.JobSettingsRequest;
import com.example.transcribe_backend.dto.web.RunnerCreatedResponse;
import com.example.transcribe_backend.dto.web.RunnerRegisterRequest;
import com.example.transcribe_backend.dto.web.RunnerResultRequest;
import com.example.transcribe_backend.dto.web.TranscriptPayload;
import com.example.transcribe_backend.events.JobChangeEvent;
import com.example.transcribe_backend.events.JobEventBus;
import com.example.transcribe_backend.exception.CoordinationStoreUnavailableException;
import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.repository.JobRepository;
import com.example.transcribe_backend.repository.JobSettingsRepository;
import com.example.transcribe_backend.repository.RunnerRepository;
import com.example.transcribe_backend.statemachine.JobStateMachine;
import com.example.transcribe_backend.testutil.MutableClock;
import com.example.transcribe_backend.util.AbortOutcome;
import com.example.transcribe_backend.util.HeartbeatAction;
import com.example.transcribe_backend.util.JobEventKind;
import com.example.transcribe_backend.util.JobState;
import com.example.transcribe_backend.util.TranscriptFormat;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Heartbeat, dispatch, sweep and client flows against a real H2 job table and the in-memory
 * coordination store. Runs without a surrounding transaction so that every compare-and-set
 * commits on its own, as it does in production.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class DispatchScenarioTest {

    private static final long OWNER = 42L;
    private static final long RUNNER_A = 1001L;
    private static final long RUNNER_B = 1002L;

    @Autowired
    private JobRepository jobRepository;

    @Autowired
    private JobSettingsRepository settingsRepository;

    @Autowired
    private RunnerRepository runnerRepository;

    @TempDir
    Path storageDir;

    private MutableClock clock;
    private FlakyStore store;
    private DispatchProperties properties;
    private RunnerLivenessTracker tracker;
    private LivenessSweeper sweeper;
    private JobService jobService;
    private JobSettingsService settingsService;
    private RunnerJobService runnerJobService;
    private RunnerRegistryService registry;
    private final List<JobChangeEvent> events = new CopyOnWriteArrayList<>();
    private long settingsId;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        store = new FlakyStore(clock);
        CoordinationKeys keys = new CoordinationKeys("test");
        properties = new DispatchProperties();
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

        JobEventBus bus = new JobEventBus(store, keys, mapper);
        bus.subscribe(OWNER, events::add);
        JobTransitionService transitions = new JobTransitionService(jobRepository, new JobStateMachine(), bus, clock, properties);
        Dispatcher dispatcher = new Dispatcher(jobRepository, transitions, new ModelCapabilityMatcher(settingsRepository), properties);
        tracker = new RunnerLivenessTracker(store, keys, mapper, jobRepository, transitions, dispatcher, clock, properties);
        sweeper = new LivenessSweeper(store, keys, tracker, jobRepository, clock, properties);
        LocalBlobStore blobs = new LocalBlobStore(storageDir, "audio", "transcripts");
        settingsService = new JobSettingsService(settingsRepository, jobRepository, transitions);
        jobService = new JobService(jobRepository, settingsService, transitions, bus, blobs, mapper, clock);
        runnerJobService = new RunnerJobService(jobRepository, settingsService, transitions, tracker, blobs, mapper);
        registry = new RunnerRegistryService(runnerRepository, tracker, clock);

        settingsId = createSettings(true, null);
    }

    @AfterEach
    void cleanUp() {
        jobRepository.deleteAll();
        settingsRepository.deleteAll();
        runnerRepository.deleteAll();
    }

    private long createSettings(boolean finalized, String model) {
        return settingsService.create(new JobSettingsRequest(OWNER, model, "en", null, null, null,
                null, null, null, null, finalized)).id();
    }

    private long submit() {
        return submit(settingsId);
    }

    private long submit(long settings) {
        return jobService.submit(OWNER, settings, "talk.mp3",
                new ByteArrayInputStream("RIFF".getBytes(StandardCharsets.UTF_8))).getId();
    }

    private static HeartbeatRequest idle() {
        return new HeartbeatRequest(null, null, "runner", "1.0.0", "abc123", null, null);
    }

    private static HeartbeatRequest working(long jobId, Double progress) {
        return new HeartbeatRequest(jobId, progress, "runner", "1.0.0", "abc123", null, null);
    }

    private Job job(long id) {
        return jobRepository.findById(id).orElseThrow();
    }

    @Test
    void freeRunnerReceivesQueuedJobAndStartsOnAudioFetch() {
        long jobId = submit();
        assertThat(job(jobId).getState()).isEqualTo(JobState.PENDING_RUNNER);

        HeartbeatResponse response = tracker.heartbeat(RUNNER_A, idle());

        assertThat(response.action()).isEqualTo(HeartbeatAction.ASSIGNMENT);
        assertThat(response.jobId()).isEqualTo(jobId);
        assertThat(job(jobId).getState()).isEqualTo(JobState.RUNNER_ASSIGNED);
        assertThat(job(jobId).getAssignedRunnerId()).isEqualTo(RUNNER_A);
        assertThat(tracker.find(RUNNER_A)).map(RunnerLiveness::currentJobId).contains(jobId);

        Path audio = runnerJobService.openAudio(RUNNER_A, jobId);

        assertThat(audio).exists();
        assertThat(job(jobId).getState()).isEqualTo(JobState.RUNNER_IN_PROGRESS);
    }

    @Test
    void silentRunnerLosesJobToAnotherRunner() {
        long jobId = submit();
        tracker.heartbeat(RUNNER_A, idle());
        tracker.heartbeat(RUNNER_A, working(jobId, 0.2));
        assertThat(job(jobId).getState()).isEqualTo(JobState.RUNNER_IN_PROGRESS);

        clock.advance(Duration.ofSeconds(46));
        LivenessSweeper.SweepReport report = sweeper.sweep();

        assertThat(report.ran()).isTrue();
        assertThat(report.staleRunners()).isEqualTo(1);
        Job requeued = job(jobId);
        assertThat(requeued.getState()).isEqualTo(JobState.PENDING_RUNNER);
        assertThat(requeued.getAssignedRunnerId()).isNull();
        assertThat(requeued.getProgress()).isNull();

        HeartbeatResponse other = tracker.heartbeat(RUNNER_B, idle());
        assertThat(other.action()).isEqualTo(HeartbeatAction.ASSIGNMENT);
        assertThat(other.jobId()).isEqualTo(jobId);
        assertThat(job(jobId).getAssignedRunnerId()).isEqualTo(RUNNER_B);
    }

    @Test
    void simultaneousHeartbeatsAssignSingleJobOnce() throws Exception {
        long jobId = submit();
        CyclicBarrier barrier = new CyclicBarrier(2);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<HeartbeatResponse> a = pool.submit(() -> {
                barrier.await(5, TimeUnit.SECONDS);
                return tracker.heartbeat(RUNNER_A, idle());
            });
            Future<HeartbeatResponse> b = pool.submit(() -> {
                barrier.await(5, TimeUnit.SECONDS);
                return tracker.heartbeat(RUNNER_B, idle());
            });

            List<HeartbeatResponse> responses = List.of(a.get(10, TimeUnit.SECONDS), b.get(10, TimeUnit.SECONDS));

            assertThat(responses).filteredOn(r -> r.action() == HeartbeatAction.ASSIGNMENT).hasSize(1);
            assertThat(responses).filteredOn(r -> r.action() == HeartbeatAction.NO_ASSIGNMENT).hasSize(1);
            Long holder = job(jobId).getAssignedRunnerId();
            assertThat(holder).isIn(RUNNER_A, RUNNER_B);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void successfulJobIsDownloadedOnce() {
        long jobId = submit();
        tracker.register(RUNNER_A, new RunnerRegisterRequest("gpu-box", "2.1.0", "deadbeef", null, List.of()));
        // heartbeats without metadata keep what the runner registered with
        tracker.heartbeat(RUNNER_A, new HeartbeatRequest(null, null, null, null, null, null, null));
        runnerJobService.openAudio(RUNNER_A, jobId);

        var transcript = new TranscriptPayload("hello world", "1\n00:00:00,000 --> 00:00:01,000\nhello world\n",
                null, null, Map.of("segments", List.of()));
        runnerJobService.submitResult(RUNNER_A, jobId, new RunnerResultRequest(null, transcript));

        Job done = job(jobId);
        assertThat(done.getState()).isEqualTo(JobState.SUCCESS);
        assertThat(done.getAssignedRunnerId()).isNull();
        assertThat(done.getRunnerName()).isEqualTo("gpu-box");
        assertThat(done.getRunnerGitHash()).isEqualTo("deadbeef");
        assertThat(done.getFinishedAt()).isNotNull();
        assertThat(done.getTranscriptKey()).startsWith(jobId + "-").endsWith(".json");

        JobService.TranscriptDownload download = jobService.downloadTranscript(OWNER, jobId, TranscriptFormat.AS_TXT);
        assertThat(download.body()).isEqualTo("hello world");
        assertThat(download.fileName()).isEqualTo("talk.txt");
        assertThat(job(jobId).getState()).isEqualTo(JobState.DOWNLOADED);

        jobService.downloadTranscript(OWNER, jobId, TranscriptFormat.AS_SRT);
        assertThat(job(jobId).getState()).isEqualTo(JobState.DOWNLOADED);
    }

    @Test
    void abortBeforeAssignmentFailsRightAwayAndIsIdempotent() {
        long jobId = submit();

        AbortResponse first = jobService.abort(OWNER, jobId);
        assertThat(first.outcome()).isEqualTo(AbortOutcome.ABORTED);
        Job failed = job(jobId);
        assertThat(failed.getState()).isEqualTo(JobState.FAILED);
        assertThat(failed.getErrorMessage()).isEqualTo("aborted before assignment");

        AbortResponse second = jobService.abort(OWNER, jobId);
        assertThat(second.outcome()).isEqualTo(AbortOutcome.ALREADY_FINISHED);
        assertThat(job(jobId).getState()).isEqualTo(JobState.FAILED);
        assertThat(job(jobId).getErrorMessage()).isEqualTo("aborted before assignment");
    }

    @Test
    void abortOfRunningJobCompletesWhenRunnerDropsIt() {
        long jobId = submit();
        tracker.heartbeat(RUNNER_A, idle());
        tracker.heartbeat(RUNNER_A, working(jobId, 0.1));

        assertThat(jobService.abort(OWNER, jobId).outcome()).isEqualTo(AbortOutcome.ABORT_REQUESTED);
        assertThat(jobService.abort(OWNER, jobId).outcome()).isEqualTo(AbortOutcome.ABORT_REQUESTED);
        assertThat(job(jobId).getState()).isEqualTo(JobState.ABORTING);

        HeartbeatResponse drop = tracker.heartbeat(RUNNER_A, working(jobId, 0.3));
        assertThat(drop.action()).isEqualTo(HeartbeatAction.DROP_JOB);
        assertThat(drop.jobId()).isEqualTo(jobId);
        assertThat(job(jobId).getState()).isEqualTo(JobState.ABORTING);

        HeartbeatResponse afterAck = tracker.heartbeat(RUNNER_A, idle());
        assertThat(afterAck.action()).isEqualTo(HeartbeatAction.NO_ASSIGNMENT);
        Job aborted = job(jobId);
        assertThat(aborted.getState()).isEqualTo(JobState.FAILED);
        assertThat(aborted.getErrorMessage()).isEqualTo("aborted by user");
        assertThat(aborted.getAssignedRunnerId()).isNull();
    }

    @Test
    void abortingJobOfVanishedRunnerIsFinalizedBySweep() {
        long jobId = submit();
        tracker.heartbeat(RUNNER_A, idle());
        tracker.heartbeat(RUNNER_A, working(jobId, null));
        jobService.abort(OWNER, jobId);

        clock.advance(Duration.ofSeconds(50));
        sweeper.sweep();

        assertThat(job(jobId).getState()).isEqualTo(JobState.FAILED);
        assertThat(job(jobId).getErrorMessage()).isEqualTo("aborted by user");
    }

    @Test
    void reportForForeignJobIsDropped() {
        long jobId = submit();
        tracker.heartbeat(RUNNER_A, idle());

        HeartbeatResponse response = tracker.heartbeat(RUNNER_B, working(jobId, 0.5));

        assertThat(response.action()).isEqualTo(HeartbeatAction.DROP_JOB);
        assertThat(job(jobId).getAssignedRunnerId()).isEqualTo(RUNNER_A);
        assertThat(job(jobId).getState()).isEqualTo(JobState.RUNNER_ASSIGNED);
        assertThat(job(jobId).getProgress()).isNull();
    }

    @Test
    void progressIsRecordedWhileWorking() {
        long jobId = submit();
        tracker.heartbeat(RUNNER_A, idle());

        HeartbeatResponse response = tracker.heartbeat(RUNNER_A, working(jobId, 0.5));

        assertThat(response.action()).isEqualTo(HeartbeatAction.ASSIGNMENT);
        assertThat(job(jobId).getState()).isEqualTo(JobState.RUNNER_IN_PROGRESS);
        assertThat(job(jobId).getProgress()).isEqualTo(0.5);
    }

    @Test
    void restartedRunnerThatForgotItsJobGetsItRequeued() {
        long first = submit();
        long second = submit();
        tracker.heartbeat(RUNNER_A, idle());
        tracker.heartbeat(RUNNER_A, working(first, 0.4));

        HeartbeatResponse response = tracker.heartbeat(RUNNER_A, idle());

        // the lost job keeps its queue position and is handed out again
        assertThat(response.action()).isEqualTo(HeartbeatAction.ASSIGNMENT);
        assertThat(response.jobId()).isEqualTo(first);
        assertThat(job(first).getState()).isEqualTo(JobState.RUNNER_ASSIGNED);
        assertThat(job(second).getState()).isEqualTo(JobState.PENDING_RUNNER);
    }

    @Test
    void assignedButUnfetchedJobIsReclaimedAfterFetchTimeout() {
        long jobId = submit();
        tracker.heartbeat(RUNNER_A, idle());

        clock.advance(Duration.ofSeconds(20));
        HeartbeatResponse redelivered = tracker.heartbeat(RUNNER_A, idle());
        assertThat(redelivered.action()).isEqualTo(HeartbeatAction.ASSIGNMENT);
        assertThat(redelivered.jobId()).isEqualTo(jobId);

        clock.advance(Duration.ofSeconds(30));
        LivenessSweeper.SweepReport report = sweeper.sweep();

        assertThat(report.artifactFetchTimeouts()).isEqualTo(1);
        assertThat(job(jobId).getState()).isEqualTo(JobState.PENDING_RUNNER);
        assertThat(tracker.find(RUNNER_A)).isEmpty();
    }

    @Test
    void fetchTimeoutDoesNotReclaimJobThatStartedAfterTheScan() {
        long jobId = submit();
        tracker.heartbeat(RUNNER_A, idle());
        Job scanned = job(jobId);

        runnerJobService.openAudio(RUNNER_A, jobId);

        assertThat(tracker.evictForFetchTimeout(scanned)).isFalse();
        Job running = job(jobId);
        assertThat(running.getState()).isEqualTo(JobState.RUNNER_IN_PROGRESS);
        assertThat(running.getAssignedRunnerId()).isEqualTo(RUNNER_A);
        assertThat(tracker.find(RUNNER_A)).isPresent();
    }

    @Test
    void longFailureMessageIsKeptVerbatim() {
        long jobId = submit();
        tracker.heartbeat(RUNNER_A, idle());
        runnerJobService.openAudio(RUNNER_A, jobId);
        String message = "x".repeat(5000);

        runnerJobService.submitResult(RUNNER_A, jobId, new RunnerResultRequest(message, null));

        Job failed = job(jobId);
        assertThat(failed.getState()).isEqualTo(JobState.FAILED);
        assertThat(failed.getErrorMessage()).isEqualTo(message);
        assertThat(failed.getAssignedRunnerId()).isNull();
    }

    @Test
    void oversizedRunnerMetadataIsCutToColumnLength() {
        long jobId = submit();
        tracker.heartbeat(RUNNER_A, new HeartbeatRequest(null, null, "n".repeat(60), "v".repeat(80), "g".repeat(50), null, null));
        runnerJobService.openAudio(RUNNER_A, jobId);

        runnerJobService.submitResult(RUNNER_A, jobId, new RunnerResultRequest("unsupported codec", null));

        Job failed = job(jobId);
        assertThat(failed.getState()).isEqualTo(JobState.FAILED);
        assertThat(failed.getRunnerName()).isEqualTo("n".repeat(40));
        assertThat(failed.getRunnerVersion()).hasSize(64);
        assertThat(failed.getRunnerGitHash()).hasSize(40);
    }

    @Test
    void revokingRunnerReleasesItsJob() {
        RunnerCreatedResponse created = registry.create("lab-gpu");
        long runnerId = registry.authenticate("Bearer " + created.token());
        long jobId = submit();
        tracker.heartbeat(runnerId, idle());
        assertThat(job(jobId).getAssignedRunnerId()).isEqualTo(runnerId);

        registry.revoke(runnerId);

        assertThat(job(jobId).getState()).isEqualTo(JobState.PENDING_RUNNER);
        assertThat(tracker.find(runnerId)).isEmpty();
        assertThatThrownBy(() -> registry.authenticate("Bearer " + created.token()))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("RUNNER_TOKEN_INVALID");
    }

    @Test
    void storeOutageMeansNoAssignment() {
        long jobId = submit();
        store.down = true;

        assertThatThrownBy(() -> tracker.heartbeat(RUNNER_A, idle()))
                .isInstanceOf(CoordinationStoreUnavailableException.class);

        store.down = false;
        assertThat(job(jobId).getState()).isEqualTo(JobState.PENDING_RUNNER);
        assertThat(job(jobId).getAssignedRunnerId()).isNull();
    }

    @Test
    void jobsWaitForSettingsToBeFinalized() {
        long draft = createSettings(false, null);
        long jobId = submit(draft);
        assertThat(job(jobId).getState()).isEqualTo(JobState.NOT_QUEUED);
        assertThat(tracker.heartbeat(RUNNER_A, idle()).action()).isEqualTo(HeartbeatAction.NO_ASSIGNMENT);

        settingsService.finalizeSettings(draft);

        assertThat(job(jobId).getState()).isEqualTo(JobState.PENDING_RUNNER);
        assertThat(tracker.heartbeat(RUNNER_A, idle()).jobId()).isEqualTo(jobId);
    }

    @Test
    void runnerOnlyGetsModelsItDeclares() {
        long tiny = createSettings(true, "tiny");
        long largeJob = submit();
        long tinyJob = submit(tiny);

        HeartbeatResponse response = tracker.heartbeat(RUNNER_A,
                new HeartbeatRequest(null, null, "cpu", "1.0.0", "abc", null, List.of("tiny")));

        assertThat(response.jobId()).isEqualTo(tinyJob);
        assertThat(job(largeJob).getState()).isEqualTo(JobState.PENDING_RUNNER);
    }

    @Test
    void orphanedJobIsReleasedWhenLivenessWasLost() {
        long jobId = submit();
        tracker.heartbeat(RUNNER_A, idle());
        tracker.heartbeat(RUNNER_A, working(jobId, 0.1));
        // store flushed: neither the record nor the online set remember the runner
        store.delete("test:runner:" + RUNNER_A);
        store.removeMember("test:runners:online", Long.toString(RUNNER_A));

        clock.advance(Duration.ofSeconds(46));
        LivenessSweeper.SweepReport report = sweeper.sweep();

        assertThat(report.orphanedJobs()).isEqualTo(1);
        assertThat(job(jobId).getState()).isEqualTo(JobState.PENDING_RUNNER);
    }

    @Test
    void sweepRunsOnlyWhereLockIsHeld() {
        store.setIfAbsent("test:sweep-lock", "other-replica", Duration.ofSeconds(8));

        assertThat(sweeper.sweep().ran()).isFalse();

        clock.advance(Duration.ofSeconds(9));
        assertThat(sweeper.sweep().ran()).isTrue();
    }

    @Test
    void finishedJobCanBeDeletedButRunningJobCannot() {
        long jobId = submit();
        tracker.heartbeat(RUNNER_A, idle());

        assertThatThrownBy(() -> jobService.delete(OWNER, jobId))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("JOB_NOT_FINISHED");

        runnerJobService.submitResult(RUNNER_A, jobId, new RunnerResultRequest("unsupported codec", null));
        assertThat(job(jobId).getErrorMessage()).isEqualTo("unsupported codec");

        jobService.delete(OWNER, jobId);

        assertThat(jobRepository.existsById(jobId)).isFalse();
        assertThat(events).extracting(JobChangeEvent::kind).contains(JobEventKind.JOB_DELETED);
    }

    @Test
    void stateChangesArePublishedToOwner() {
        long jobId = submit();
        tracker.heartbeat(RUNNER_A, idle());

        assertThat(events).containsExactly(
                new JobChangeEvent(jobId, JobEventKind.JOB_CREATED),
                new JobChangeEvent(jobId, JobEventKind.JOB_UPDATED));
    }

    @Test
    void otherOwnersCannotTouchJob() {
        long jobId = submit();

        assertThatThrownBy(() -> jobService.abort(OWNER + 1, jobId))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("NOT_JOB_OWNER");
        assertThat(job(jobId).getState()).isEqualTo(JobState.PENDING_RUNNER);
    }

    /** In-memory store that can be switched off. */
    static class FlakyStore extends InMemoryCoordinationStore {
        volatile boolean down;

        FlakyStore(Clock clock) {
            super(clock);
        }

        private void check() {
            if (down) {
                throw new CoordinationStoreUnavailableException("store down", null);
            }
        }

        @Override
        public synchronized Optional<String> get(String key) {
            check();
            return super.get(key);
        }

        @Override
        public synchronized void set(String key, String value, Duration ttl) {
            check();
            super.set(key, value, ttl);
        }
    }
}
