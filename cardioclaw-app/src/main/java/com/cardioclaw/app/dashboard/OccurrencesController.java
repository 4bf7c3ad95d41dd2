package com.cardioclaw.app.dashboard;

import com.cardioclaw.app.dashboard.OccurrenceCalculator.Occurrence;
import com.cardioclaw.engine.store.JobFilter;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
public class OccurrencesController {

    private final DashboardService service;
    private final OccurrenceCalculator calculator;

    public OccurrencesController(DashboardService service, OccurrenceCalculator calculator) {
        this.service = service;
        this.calculator = calculator;
    }

    @GetMapping("/api/occurrences")
    public Map<String, List<Occurrence>> occurrences(@RequestParam(required = false) String start,
                                                     @RequestParam(required = false) String end) {
        if (start == null || start.isBlank() || end == null || end.isBlank()) {
            throw new BadRequestException("start and end parameters required (ISO timestamps)");
        }
        Instant from = QueryParams.instant(start);
        Instant to = QueryParams.instant(end);
        if (from == null || to == null) {
            throw new BadRequestException("Invalid date format");
        }
        return Map.of("occurrences", calculator.occurrences(service.cache().listJobs(JobFilter.ALL), from, to));
    }
}
