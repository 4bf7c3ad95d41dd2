package com.cardioclaw.engine.scheduler;

import com.cardioclaw.common.errors.ExternalQueryException;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.ScheduledJob;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes the output of {@code openclaw cron list --json}. The CLI may print
 * warning lines before the JSON document, so decoding starts at the first
 * {@code '{'}.
 */
public final class JobListParser {

    private JobListParser() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static List<ScheduledJob> parse(String output) {
        if (output == null || output.isBlank()) {
            throw new ExternalQueryException("openclaw cron list returned no output");
        }
        int start = output.indexOf('{');
        if (start < 0) {
            throw new ExternalQueryException("openclaw cron list returned no JSON");
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(output.substring(start));
        } catch (JsonProcessingException e) {
            throw new ExternalQueryException("Failed to parse openclaw cron list output: " + e.getOriginalMessage(), e);
        }

        JsonNode jobs = root.get("jobs");
        if (jobs == null || !jobs.isArray()) {
            throw new ExternalQueryException("Unexpected response shape from openclaw cron list (expected a jobs array)");
        }

        List<ScheduledJob> result = new ArrayList<>(jobs.size());
        for (JsonNode node : jobs) {
            try {
                ScheduledJob job = MAPPER.treeToValue(node, ScheduledJob.class);
                if (job != null && job.getId() != null) {
                    result.add(job);
                }
            } catch (JsonProcessingException e) {
                throw new ExternalQueryException("Malformed job entry in openclaw cron list: " + e.getOriginalMessage(), e);
            }
        }
        return result;
    }
}
