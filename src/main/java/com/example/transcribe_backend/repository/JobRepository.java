package com.example.transcribe_backend.repository;

import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.util.JobState;
import jakarta.transaction.Transactional;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface JobRepository extends JpaRepository<Job, Long> {
    /** FIFO candidates for dispatch; requeued jobs keep their original position. */
    List<Job> findByStateOrderByCreatedAtAscIdAsc(JobState state, Pageable pageable);

    Optional<Job> findByAssignedRunnerId(Long runnerId);

    List<Job> findByStateAndAssignedAtBefore(JobState state, Instant cutoff);

    List<Job> findByStateInAndUpdatedAtBefore(Collection<JobState> states, Instant cutoff);

    List<Job> findBySettingsIdAndState(Long settingsId, JobState state);

    Page<Job> findByOwnerIdOrderByCreatedAtDescIdDesc(Long ownerId, Pageable pageable);

    /**
     * Writes every mutable column of a job if, and only if, nobody changed the row since
     * {@code expectedVersion} was read. Returns the number of updated rows (0 on conflict).
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        UPDATE Job j
           SET j.state = :state,
               j.assignedRunnerId = :assignedRunnerId,
               j.assignedAt = :assignedAt,
               j.progress = :progress,
               j.errorMessage = :errorMessage,
               j.transcriptKey = :transcriptKey,
               j.runnerName = :runnerName,
               j.runnerVersion = :runnerVersion,
               j.runnerGitHash = :runnerGitHash,
               j.finishedAt = :finishedAt,
               j.updatedAt = :updatedAt,
               j.version = j.version + 1
         WHERE j.id = :id
           AND j.version = :expectedVersion
        """)
    int compareAndSet(@Param("id") Long id,
                      @Param("expectedVersion") long expectedVersion,
                      @Param("state") JobState state,
                      @Param("assignedRunnerId") Long assignedRunnerId,
                      @Param("assignedAt") Instant assignedAt,
                      @Param("progress") Double progress,
                      @Param("errorMessage") String errorMessage,
                      @Param("transcriptKey") String transcriptKey,
                      @Param("runnerName") String runnerName,
                      @Param("runnerVersion") String runnerVersion,
                      @Param("runnerGitHash") String runnerGitHash,
                      @Param("finishedAt") Instant finishedAt,
                      @Param("updatedAt") Instant updatedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        DELETE FROM Job j
         WHERE j.id = :id
           AND j.version = :expectedVersion
           AND j.state IN :states
        """)
    int deleteIfUnchanged(@Param("id") Long id,
                          @Param("expectedVersion") long expectedVersion,
                          @Param("states") Collection<JobState> states);
}
