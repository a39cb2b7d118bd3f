package me.botfleet.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Fleet counters for the dashboard header.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStatsResponse {
    private int totalInstances;
    private int runningInstances;
    private int errorInstances;
    private Map<String, Integer> byState;
    private int credentials;
    private int templates;
    private long uptimeMs;
}
