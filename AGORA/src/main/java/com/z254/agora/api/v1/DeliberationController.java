package com.z254.agora.api.v1;

import com.z254.agora.api.dto.DeliberateRequest;
import com.z254.agora.api.dto.JobCreatedResponse;
import com.z254.agora.api.dto.JobStatusResponse;
import com.z254.agora.job.DeliberationJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * REST controller for deliberation jobs.
 */
@RestController
@RequestMapping("/v1")
@Tag(name = "Deliberations", description = "Submit and poll multi-agent deliberations")
@Slf4j
public class DeliberationController {

    private final DeliberationJobService jobService;

    public DeliberationController(DeliberationJobService jobService) {
        this.jobService = jobService;
    }

    @PostMapping("/deliberate")
    @Operation(summary = "Start deliberation",
               description = "Start a three-round deliberation in the background and return a job to poll")
    @ApiResponse(responseCode = "202", description = "Deliberation accepted")
    @ApiResponse(responseCode = "400", description = "Invalid request")
    public Mono<ResponseEntity<JobCreatedResponse>> deliberate(@Valid @RequestBody DeliberateRequest request) {
        return jobService.submit(request.toDeliberationRequest())
                .map(job -> ResponseEntity.status(HttpStatus.ACCEPTED).body(JobCreatedResponse.from(job)));
    }

    @GetMapping("/jobs/{id}")
    @Operation(summary = "Get job", description = "Poll until status is completed or failed")
    @ApiResponse(responseCode = "200", description = "Job found")
    @ApiResponse(responseCode = "404", description = "Job not found")
    public Mono<ResponseEntity<JobStatusResponse>> getJob(
            @Parameter(description = "Job ID") @PathVariable String id) {

        return jobService.get(id)
                .map(job -> ResponseEntity.ok(JobStatusResponse.from(job)));
    }

    @GetMapping("/jobs")
    @Operation(summary = "List jobs", description = "List recent jobs, newest first")
    @ApiResponse(responseCode = "200", description = "Jobs listed")
    public Flux<JobStatusResponse> listJobs(
            @Parameter(description = "Maximum number of jobs") @RequestParam(required = false) Integer limit) {

        return jobService.listRecent(limit)
                .map(JobStatusResponse::from);
    }
}
