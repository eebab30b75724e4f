package com.example.transcribe_backend.repository;

import com.example.transcribe_backend.model.JobSettings;
import org.springframework.data.jpa.repository.JpaRepository;

public interface JobSettingsRepository extends JpaRepository<JobSettings, Long> {
}
