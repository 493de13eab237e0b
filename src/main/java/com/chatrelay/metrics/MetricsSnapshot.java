package com.chatrelay.metrics;

import com.chatrelay.error.ErrorCategory;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Immutable snapshot of relay metrics, served by /metrics and the stats command.
 *
 * This is a READ MODEL:
 * - No logic
 * - Each counter group was read in one critical section
 * - errorsByType holds every category, in enum order, zero when unseen
 */
public record MetricsSnapshot(

        /* -------- Commands -------- */
        @JsonProperty("commands_total") long commandsTotal,
        @JsonProperty("commands_successful") long commandsSuccessful,
        @JsonProperty("commands_failed") long commandsFailed,
        @JsonProperty("commands_per_second") double commandsPerSecond,
        @JsonProperty("command_success_rate_percent") double commandSuccessRatePercent,

        /* -------- External requests -------- */
        @JsonProperty("api_requests_total") long externalRequestsTotal,
        @JsonProperty("api_requests_successful") long externalRequestsSuccessful,
        @JsonProperty("api_requests_failed") long externalRequestsFailed,
        @JsonProperty("api_requests_per_second") double externalRequestsPerSecond,
        @JsonProperty("api_success_rate_percent") double externalSuccessRatePercent,
        @JsonProperty("average_response_time_ms") double averageResponseTimeMillis,

        /* -------- Errors -------- */
        @JsonProperty("errors_by_type") Map<ErrorCategory, Long> errorsByType,

        /* -------- Process -------- */
        @JsonProperty("uptime_seconds") double uptimeSeconds,
        @JsonProperty("bot_start_time") String botStartTime
) {}
