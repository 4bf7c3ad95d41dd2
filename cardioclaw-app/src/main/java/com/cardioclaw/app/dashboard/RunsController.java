package com.cardioclaw.app.dashboard;

import com.cardioclaw.engine.store.RunRow;
import com.cardioclaw.engine.store.RunSummary;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/runs")
public class RunsController {

    private final DashboardService service;

    public RunsController(DashboardService service) {
        this.service = service;
    }

    @GetMapping
    public Map<String, List<RunRow>> runs(@RequestParam(name = "job_id", required = false) String jobId,
                                          @RequestParam(defaultValue = "50") String limit) {
        if (jobId == null || jobId.isBlank()) {
            throw new BadRequestException("job_id parameter required");
        }
        return Map.of("runs", service.cache().listRuns(jobId, QueryParams.positiveInt(limit, "limit")));
    }

    /**
     * Per-job totals over the last {@code days} days.
     */
    @GetMapping("/summary")
    public Map<String, List<RunSummary>> summary(@RequestParam(defaultValue = "7") String days) {
        return Map.of("summary", service.cache().summary(QueryParams.positiveInt(days, "days")));
    }
}
