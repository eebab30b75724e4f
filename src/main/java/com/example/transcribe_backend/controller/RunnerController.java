package com.example.transcribe_backend.controller;

import com.example.transcribe_backend.dto.web.HeartbeatRequest;
import com.example.transcribe_backend.dto.web.HeartbeatResponse;
import com.example.transcribe_backend.dto.web.JobInfoResponse;
import com.example.transcribe_backend.dto.web.RunnerRegisterRequest;
import com.example.transcribe_backend.dto.web.RunnerResultRequest;
import com.example.transcribe_backend.dto.web.RunnerResultResponse;
import com.example.transcribe_backend.service.RunnerJobService;
import com.example.transcribe_backend.service.RunnerLivenessTracker;
import com.example.transcribe_backend.service.RunnerRegistryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;

/**
 * Endpoints polled by runners from outside the network. Every call carries the runner's bearer
 * token.
 */
@RestController
@RequestMapping("/v1/runners")
public class RunnerController {
    private final RunnerRegistryService registry;
    private final RunnerLivenessTracker tracker;
    private final RunnerJobService runnerJobService;

    public RunnerController(RunnerRegistryService registry,
                            RunnerLivenessTracker tracker,
                            RunnerJobService runnerJobService) {
        this.registry = registry;
        this.tracker = tracker;
        this.runnerJobService = runnerJobService;
    }

    @Operation(summary = "Announce a runner and its capabilities")
    @ApiResponse(responseCode = "204", description = "Liveness record created")
    @ApiResponse(responseCode = "401", description = "Unknown or revoked token")
    @PostMapping("/register")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void register(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                         @Valid @RequestBody RunnerRegisterRequest request) {
        tracker.register(registry.authenticate(authorization), request);
    }

    @Operation(summary = "Disconnect a runner; a held job is requeued")
    @PostMapping("/unregister")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void unregister(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        tracker.evict(registry.authenticate(authorization), "unregistered");
    }

    @Operation(summary = "Refresh liveness, report progress and receive work")
    @ApiResponse(responseCode = "200", description = "Assignment, drop instruction or nothing to do")
    @ApiResponse(responseCode = "400", description = "Progress outside [0, 1]")
    @ApiResponse(responseCode = "503", description = "Coordination store unavailable, retry on the next interval")
    @PostMapping("/heartbeat")
    public HeartbeatResponse heartbeat(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                       @Valid @RequestBody HeartbeatRequest request) {
        long runnerId = registry.authenticate(authorization);
        Double progress = request.progress();
        if (progress != null && (progress.isNaN() || progress < 0.0 || progress > 1.0)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_PROGRESS");
        }
        return tracker.heartbeat(runnerId, request);
    }

    @Operation(summary = "Settings of the job assigned to this runner")
    @ApiResponse(responseCode = "400", description = "No job assigned")
    @ApiResponse(responseCode = "409", description = "Job is being aborted")
    @GetMapping("/job-info")
    public JobInfoResponse jobInfo(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return runnerJobService.jobInfo(registry.authenticate(authorization));
    }

    @Operation(summary = "Download the audio of the assigned job")
    @GetMapping("/jobs/{jobId}/audio")
    public ResponseEntity<Resource> audio(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                          @PathVariable long jobId) {
        Path audio = runnerJobService.openAudio(registry.authenticate(authorization), jobId);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + audio.getFileName() + "\"")
                .body(new FileSystemResource(audio));
    }

    @Operation(summary = "Report the transcript or the failure of the assigned job")
    @ApiResponse(responseCode = "409", description = "Job is not held by this runner")
    @PostMapping("/jobs/{jobId}/result")
    public RunnerResultResponse result(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                       @PathVariable long jobId,
                                       @RequestBody RunnerResultRequest request) {
        return runnerJobService.submitResult(registry.authenticate(authorization), jobId, request);
    }
}
