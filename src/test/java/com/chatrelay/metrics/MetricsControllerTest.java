package com.chatrelay.metrics;

import com.chatrelay.error.ErrorCategory;
import com.chatrelay.testutil.MutableClock;
import com.chatrelay.testutil.TestFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class MetricsControllerTest {

    private final MutableClock clock = new MutableClock(TestFactory.START);
    private final MetricsRegistry registry = TestFactory.registry(clock);
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new MetricsController(registry))
                .setMessageConverters(new MappingJackson2HttpMessageConverter(new ObjectMapper()))
                .build();
    }

    @Test
    void testMetricsEndpointUsesSnakeCaseNames() throws Exception {
        registry.recordCommand(true);
        registry.recordCommand(false);
        registry.recordExternalRequest(true, 40);
        registry.recordError(ErrorCategory.RATE_LIMIT);
        clock.advance(Duration.ofSeconds(30));

        mockMvc.perform(get("/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.commands_total").value(2))
                .andExpect(jsonPath("$.commands_successful").value(1))
                .andExpect(jsonPath("$.commands_failed").value(1))
                .andExpect(jsonPath("$.command_success_rate_percent").value(50.0))
                .andExpect(jsonPath("$.api_requests_total").value(1))
                .andExpect(jsonPath("$.average_response_time_ms").value(40.0))
                .andExpect(jsonPath("$.errors_by_type.rate_limit").value(1))
                .andExpect(jsonPath("$.errors_by_type.not_found").value(0))
                .andExpect(jsonPath("$.uptime_seconds").value(30.0))
                .andExpect(jsonPath("$.bot_start_time").value("2026-01-24T12:00:00Z"));
    }
}
