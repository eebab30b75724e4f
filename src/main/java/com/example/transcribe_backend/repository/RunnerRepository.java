package com.example.transcribe_backend.repository;

import com.example.transcribe_backend.model.Runner;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface RunnerRepository extends JpaRepository<Runner, Long> {
    Optional<Runner> findByTokenHash(String tokenHash);
}
