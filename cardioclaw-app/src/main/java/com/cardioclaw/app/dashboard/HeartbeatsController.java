package com.cardioclaw.app.dashboard;

import com.cardioclaw.engine.discovery.DiscoveryResult;
import com.cardioclaw.engine.store.CacheStore;
import com.cardioclaw.engine.store.JobFilter;
import com.cardioclaw.engine.store.JobRow;
import com.cardioclaw.engine.store.StatusCounts;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Cached jobs, the status summary and manual refresh.
 */
@RestController
@RequestMapping("/api")
public class HeartbeatsController {

    private final DashboardService service;
    private final RefreshRateLimiter rateLimiter;

    public HeartbeatsController(DashboardService service, RefreshRateLimiter rateLimiter) {
        this.service = service;
        this.rateLimiter = rateLimiter;
    }

    public record StatusResponse(int active, int failing, int managed, int unmanaged, JobRow nextJob,
                                 List<JobRow> failingJobs) {
    }

    @GetMapping("/heartbeats")
    public Map<String, List<JobRow>> heartbeats() {
        return Map.of("jobs", service.cache().listJobs(JobFilter.ALL));
    }

    @GetMapping("/heartbeats/{id}")
    public ResponseEntity<?> heartbeat(@PathVariable String id) {
        return service.cache().findJob(id)
                .<ResponseEntity<?>>map(job -> ResponseEntity.ok(Map.of("job", job)))
                .orElseGet(() -> ApiExceptionHandler.error(HttpStatus.NOT_FOUND, "Job not found"));
    }

    @GetMapping("/status")
    public StatusResponse status() {
        CacheStore cache = service.cache();
        StatusCounts counts = cache.statusCounts();
        return new StatusResponse(counts.active(), counts.failing(), counts.managed(), counts.unmanaged(),
                cache.nextActiveJob().orElse(null), cache.listJobs(JobFilter.FAILING));
    }

    @PostMapping("/refresh")
    public ResponseEntity<?> refresh() {
        OptionalLong wait = rateLimiter.tryAcquire();
        if (wait.isPresent()) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .header(HttpHeaders.RETRY_AFTER, String.valueOf(wait.getAsLong()))
                    .body(Map.of("error", "Rate limited. Try again in " + wait.getAsLong() + "s."));
        }
        DiscoveryResult result = service.refresh();
        return ResponseEntity.ok(Map.of("success", true, "found", result.found(),
                "runs_recorded", result.runsRecorded()));
    }
}
