package com.example.transcribe_backend.model;

import com.example.transcribe_backend.util.JobState;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

@Entity
@Table(
        name = "job",
        indexes = {
                @Index(name = "idx_job_state_created", columnList = "state, created_at"),
                @Index(name = "idx_job_owner", columnList = "owner_id")
        },
        uniqueConstraints = {
                // one job per runner
                @UniqueConstraint(name = "uq_job_assigned_runner", columnNames = "assigned_runner_id")
        }
)
public class Job {
    public static final int RUNNER_NAME_LENGTH = 40;
    public static final int RUNNER_VERSION_LENGTH = 64;
    public static final int RUNNER_GIT_HASH_LENGTH = 40;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private Long ownerId;

    // settings rows are shared between jobs and never change once finalized
    @Column(name = "settings_id", nullable = false, updatable = false)
    private Long settingsId;

    @Column(name = "file_name", length = 255)
    private String fileName;

    @Column(name = "audio_key", length = 512)
    private String audioKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 32)
    private JobState state = JobState.PENDING_RUNNER;

    @Column(name = "progress")
    private Double progress;

    @Column(name = "assigned_runner_id")
    private Long assignedRunnerId;

    @Column(name = "assigned_at")
    private Instant assignedAt;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "transcript_key", length = 512)
    private String transcriptKey;

    @Column(name = "runner_name", length = RUNNER_NAME_LENGTH)
    private String runnerName;

    @Column(name = "runner_version", length = RUNNER_VERSION_LENGTH)
    private String runnerVersion;

    @Column(name = "runner_git_hash", length = RUNNER_GIT_HASH_LENGTH)
    private String runnerGitHash;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected Job() {}

    public Job(Long ownerId, Long settingsId, JobState state) {
        this.ownerId = ownerId;
        this.settingsId = settingsId;
        this.state = state;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getOwnerId() {
        return ownerId;
    }

    public Long getSettingsId() {
        return settingsId;
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    public String getAudioKey() {
        return audioKey;
    }

    public void setAudioKey(String audioKey) {
        this.audioKey = audioKey;
    }

    public JobState getState() {
        return state;
    }

    public void setState(JobState state) {
        this.state = state;
    }

    public Double getProgress() {
        return progress;
    }

    public void setProgress(Double progress) {
        this.progress = progress;
    }

    public Long getAssignedRunnerId() {
        return assignedRunnerId;
    }

    public void setAssignedRunnerId(Long assignedRunnerId) {
        this.assignedRunnerId = assignedRunnerId;
    }

    public Instant getAssignedAt() {
        return assignedAt;
    }

    public void setAssignedAt(Instant assignedAt) {
        this.assignedAt = assignedAt;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String getTranscriptKey() {
        return transcriptKey;
    }

    public void setTranscriptKey(String transcriptKey) {
        this.transcriptKey = transcriptKey;
    }

    public String getRunnerName() {
        return runnerName;
    }

    public void setRunnerName(String runnerName) {
        this.runnerName = runnerName;
    }

    public String getRunnerVersion() {
        return runnerVersion;
    }

    public void setRunnerVersion(String runnerVersion) {
        this.runnerVersion = runnerVersion;
    }

    public String getRunnerGitHash() {
        return runnerGitHash;
    }

    public void setRunnerGitHash(String runnerGitHash) {
        this.runnerGitHash = runnerGitHash;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    @PrePersist
    void prePersist() {
        if (updatedAt == null) updatedAt = Instant.now();
        if (state == null) state = JobState.PENDING_RUNNER;
    }
}
