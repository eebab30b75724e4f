package com.example.transcribe_backend.controller;

import com.example.transcribe_backend.events.JobEventStreamService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Live job updates. Each event only names the job and the kind of change; clients re-read the
 * job through {@code /v1/jobs/{id}}.
 */
@RestController
@RequestMapping("/v1/job-events")
public class JobEventsController {
    private final JobEventStreamService streamService;

    public JobEventsController(JobEventStreamService streamService) {
        this.streamService = streamService;
    }

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam("ownerId") long ownerId) {
        return streamService.open(ownerId);
    }
}
