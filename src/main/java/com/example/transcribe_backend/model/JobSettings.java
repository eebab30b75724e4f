package com.example.transcribe_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of transcription parameters. Several jobs may reference the same row; once
 * {@link #isFinalized()} is true the row is never mutated.
 */
@Entity
@Table(name = "job_settings")
public class JobSettings {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private Long ownerId;

    @Column(name = "model", nullable = false, length = 32)
    private String model = "large";

    @Column(name = "language", length = 8)
    private String language;

    @Column(name = "task", nullable = false, length = 16)
    private String task = "transcribe";

    @Column(name = "alignment", nullable = false)
    private boolean alignment = true;

    @Column(name = "diarization", nullable = false)
    private boolean diarization = false;

    @Column(name = "min_speakers")
    private Integer minSpeakers;

    @Column(name = "max_speakers")
    private Integer maxSpeakers;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "asr_settings")
    private Map<String, Object> asrSettings;

    @Column(name = "email_notification", nullable = false)
    private boolean emailNotification = false;

    @Column(name = "finalized", nullable = false)
    private boolean finalized = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected JobSettings() {}

    public JobSettings(Long ownerId) {
        this.ownerId = ownerId;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Long getOwnerId() { return ownerId; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getLanguage() { return language; }
    public void setLanguage(String language) { this.language = language; }

    public String getTask() { return task; }
    public void setTask(String task) { this.task = task; }

    public boolean isAlignment() { return alignment; }
    public void setAlignment(boolean alignment) { this.alignment = alignment; }

    public boolean isDiarization() { return diarization; }
    public void setDiarization(boolean diarization) { this.diarization = diarization; }

    public Integer getMinSpeakers() { return minSpeakers; }
    public void setMinSpeakers(Integer minSpeakers) { this.minSpeakers = minSpeakers; }

    public Integer getMaxSpeakers() { return maxSpeakers; }
    public void setMaxSpeakers(Integer maxSpeakers) { this.maxSpeakers = maxSpeakers; }

    public Map<String, Object> getAsrSettings() { return asrSettings; }
    public void setAsrSettings(Map<String, Object> asrSettings) { this.asrSettings = asrSettings; }

    public boolean isEmailNotification() { return emailNotification; }
    public void setEmailNotification(boolean emailNotification) { this.emailNotification = emailNotification; }

    public boolean isFinalized() { return finalized; }
    public void setFinalized(boolean finalized) { this.finalized = finalized; }

    public Instant getCreatedAt() { return createdAt; }
}
