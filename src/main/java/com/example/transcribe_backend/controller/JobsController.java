package com.example.transcribe_backend.controller;

import com.example.transcribe_backend.api.dto.PageResponse;
import com.example.transcribe_backend.dto.web.AbortResponse;
import com.example.transcribe_backend.dto.web.JobResponse;
import com.example.transcribe_backend.service.JobService;
import com.example.transcribe_backend.util.TranscriptFormat;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/v1/jobs")
public class JobsController {
    private final JobService jobService;

    public JobsController(JobService jobService) {
        this.jobService = jobService;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public JobResponse submit(@RequestParam("ownerId") long ownerId,
                              @RequestParam("settingsId") long settingsId,
                              @RequestPart("file") MultipartFile file) {
        return jobService.submit(ownerId, settingsId, file);
    }

    @GetMapping
    public PageResponse<JobResponse> list(@RequestParam("ownerId") long ownerId,
                                          @RequestParam(value = "page", defaultValue = "0") int page,
                                          @RequestParam(value = "size", defaultValue = "20") int size) {
        return jobService.list(ownerId, page, size);
    }

    @GetMapping("/{id}")
    public JobResponse get(@PathVariable long id, @RequestParam("ownerId") long ownerId) {
        return jobService.get(ownerId, id);
    }

    @GetMapping("/{id}/transcript")
    public ResponseEntity<String> transcript(@PathVariable long id,
                                             @RequestParam("ownerId") long ownerId,
                                             @RequestParam(value = "format", defaultValue = "as_txt") String format) {
        TranscriptFormat f;
        try { f = TranscriptFormat.parse(format); }
        catch (IllegalArgumentException ex) { throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "UNKNOWN_FORMAT"); }

        JobService.TranscriptDownload download = jobService.downloadTranscript(ownerId, id, f);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(download.contentType() + ";charset=UTF-8"))
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(download.fileName(), StandardCharsets.UTF_8).build().toString())
                .body(download.body());
    }

    @PostMapping("/{id}/abort")
    public AbortResponse abort(@PathVariable long id, @RequestParam("ownerId") long ownerId) {
        return jobService.abort(ownerId, id);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable long id, @RequestParam("ownerId") long ownerId) {
        jobService.delete(ownerId, id);
    }
}
