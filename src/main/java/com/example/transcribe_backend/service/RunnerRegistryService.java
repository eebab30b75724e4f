package com.example.transcribe_backend.service;

import com.example.transcribe_backend.dto.web.RunnerCreatedResponse;
import com.example.transcribe_backend.model.Runner;
import com.example.transcribe_backend.repository.RunnerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Runner identities. Tokens are handed out once and only their SHA-256 hash is kept.
 */
@Service
public class RunnerRegistryService {
    private static final Logger LOGGER = LoggerFactory.getLogger(RunnerRegistryService.class);
    private static final String BEARER = "Bearer ";

    private final RunnerRepository runnerRepository;
    private final RunnerLivenessTracker tracker;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public RunnerRegistryService(RunnerRepository runnerRepository, RunnerLivenessTracker tracker, Clock clock) {
        this.runnerRepository = runnerRepository;
        this.tracker = tracker;
        this.clock = clock;
    }

    @Transactional
    public RunnerCreatedResponse create(String label) {
        byte[] secret = new byte[32];
        random.nextBytes(secret);
        String token = Base64.getUrlEncoder().withoutPadding().encodeToString(secret);
        Runner runner = runnerRepository.save(new Runner(hash(token), label));
        LOGGER.info("Runner identity created runnerId={} label={}", runner.getId(), label);
        return new RunnerCreatedResponse(runner.getId(), label, token);
    }

    /**
     * Resolves an {@code Authorization} header to a runner id.
     *
     * @throws ResponseStatusException 401 {@code RUNNER_TOKEN_INVALID} for missing, unknown or
     *                                 revoked tokens
     */
    @Transactional(readOnly = true)
    public long authenticate(String authorization) {
        if (authorization == null || !authorization.startsWith(BEARER)) {
            throw invalidToken();
        }
        String token = authorization.substring(BEARER.length()).trim();
        if (token.isEmpty()) {
            throw invalidToken();
        }
        return runnerRepository.findByTokenHash(hash(token))
                .filter(r -> !r.isRevoked())
                .map(Runner::getId)
                .orElseThrow(RunnerRegistryService::invalidToken);
    }

    /**
     * Revokes the identity and evicts the runner right away, releasing any held job.
     */
    @Transactional
    public void revoke(long runnerId) {
        Runner runner = runnerRepository.findById(runnerId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "RUNNER_NOT_FOUND"));
        if (!runner.isRevoked()) {
            runner.setRevoked(true);
            runner.setRevokedAt(clock.instant());
            runnerRepository.save(runner);
        }
        tracker.evict(runnerId, "revoked");
        LOGGER.info("Runner revoked runnerId={}", runnerId);
    }

    static String hash(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static ResponseStatusException invalidToken() {
        return new ResponseStatusException(HttpStatus.UNAUTHORIZED, "RUNNER_TOKEN_INVALID");
    }
}
