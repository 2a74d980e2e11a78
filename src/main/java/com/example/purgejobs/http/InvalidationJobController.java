package com.example.purgejobs.http;

import com.example.purgejobs.models.User;
import com.example.purgejobs.requests.CreateJobHttpRequest;
import com.example.purgejobs.requests.CreateJobServiceRequest;
import com.example.purgejobs.requests.ReplaceJobHttpRequest;
import com.example.purgejobs.requests.ReplaceJobServiceRequest;
import com.example.purgejobs.service.InvalidationJobService;
import com.example.purgejobs.service.InvalidationJobService.JobMutationResult;
import com.example.purgejobs.service.JobQueryService;
import com.example.purgejobs.service.JobQueryService.JobListing;
import jakarta.validation.Valid;
import java.net.URI;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for content invalidation jobs. The acting user is resolved upstream by
 * {@link RequestIdentityFilter}; this controller only translates between the wire format and
 * the job services.
 */
@RestController
@RequestMapping("/api/jobs")
@Slf4j
public class InvalidationJobController {

    private final InvalidationJobService jobService;
    private final JobQueryService queryService;

    public InvalidationJobController(InvalidationJobService jobService, JobQueryService queryService) {
        this.jobService = jobService;
        this.queryService = queryService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<JobResponse>>> listJobs(
            @RequestAttribute(RequestIdentityFilter.ACTING_USER_ATTRIBUTE) User actingUser,
            @RequestParam Map<String, String> parameters,
            @RequestHeader(value = HttpHeaders.IF_MODIFIED_SINCE, required = false) String ifModifiedSince
    ) {
        JobListing listing = queryService.list(actingUser, parameters, parseHttpDate(ifModifiedSince));

        ResponseEntity.BodyBuilder builder = listing.notModified()
                ? ResponseEntity.status(HttpStatus.NOT_MODIFIED)
                : ResponseEntity.ok();
        if (listing.lastModified() != null) {
            builder.lastModified(listing.lastModified());
        }
        if (listing.notModified()) {
            return builder.build();
        }
        List<JobResponse> jobs = listing.jobs().stream()
                .map(JobResponse::from)
                .toList();
        return builder.body(ApiResponse.of(jobs));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<JobResponse>> createJob(
            @RequestAttribute(RequestIdentityFilter.ACTING_USER_ATTRIBUTE) User actingUser,
            @Valid @RequestBody CreateJobHttpRequest request
    ) {
        CreateJobServiceRequest createRequest = new CreateJobServiceRequest(
                request.deliveryService(),
                request.assetUrl(),
                request.startTime(),
                request.ttlHours()
        );
        JobMutationResult result = jobService.create(actingUser, createRequest);

        return ResponseEntity.ok()
                .location(URI.create("/api/jobs?id=" + result.job().getId()))
                .body(envelope(result));
    }

    @PutMapping
    public ResponseEntity<ApiResponse<JobResponse>> replaceJob(
            @RequestAttribute(RequestIdentityFilter.ACTING_USER_ATTRIBUTE) User actingUser,
            @RequestParam("id") long id,
            @Valid @RequestBody ReplaceJobHttpRequest request
    ) {
        ReplaceJobServiceRequest replaceRequest = new ReplaceJobServiceRequest(
                id,
                request.id(),
                request.deliveryService(),
                request.createdBy(),
                request.assetUrl(),
                request.startTime(),
                request.ttlHours()
        );
        return ResponseEntity.ok(envelope(jobService.replace(actingUser, replaceRequest)));
    }

    @DeleteMapping
    public ResponseEntity<ApiResponse<JobResponse>> deleteJob(
            @RequestAttribute(RequestIdentityFilter.ACTING_USER_ATTRIBUTE) User actingUser,
            @RequestParam("id") long id
    ) {
        return ResponseEntity.ok(envelope(jobService.delete(actingUser, id)));
    }

    private static ApiResponse<JobResponse> envelope(JobMutationResult result) {
        List<Alert> alerts = new ArrayList<>();
        alerts.add(Alert.success(result.message()));
        result.warnings().forEach(warning -> alerts.add(Alert.warning(warning)));
        return new ApiResponse<>(alerts, JobResponse.from(result.job()));
    }

    // An unparseable If-Modified-Since is ignored, as HTTP requires.
    private static Instant parseHttpDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException ex) {
            log.debug("Ignoring malformed If-Modified-Since header '{}'", value);
            return null;
        }
    }
}
