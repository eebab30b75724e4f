package com.example.transcribe_backend.controller;

import com.example.transcribe_backend.dto.web.RunnerCreateRequest;
import com.example.transcribe_backend.dto.web.RunnerCreatedResponse;
import com.example.transcribe_backend.service.RunnerRegistryService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/admin/runners")
public class RunnerAdminController {
    private final RunnerRegistryService registry;

    public RunnerAdminController(RunnerRegistryService registry) {
        this.registry = registry;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public RunnerCreatedResponse create(@Valid @RequestBody RunnerCreateRequest request) {
        return registry.create(request.label());
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void revoke(@PathVariable long id) {
        registry.revoke(id);
    }
}
