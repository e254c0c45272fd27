package com.chatbi.test;

import com.chatbi.api.response.Response;
import com.chatbi.config.ObservabilityHttpLogProperties;
import com.chatbi.config.RequestTraceLoggingFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class RequestTraceLoggingFilterTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        ObservabilityHttpLogProperties properties = new ObservabilityHttpLogProperties();
        properties.setEnabled(true);
        properties.setSampleRate(1.0D);

        RequestTraceLoggingFilter filter = new RequestTraceLoggingFilter(new ObjectMapper(), properties);
        this.mockMvc = MockMvcBuilders.standaloneSetup(new TestController())
                .addFilters(filter)
                .build();
    }

    @Test
    public void shouldInjectTraceHeadersForApiRequests() throws Exception {
        mockMvc.perform(post("/api/v1/planning/executions/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"planId\":\"p-1\",\"token\":\"secret\"}"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Trace-Id"))
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.planId").value("p-1"));
    }

    @Test
    public void shouldEchoIncomingTraceId() throws Exception {
        mockMvc.perform(post("/api/v1/planning/executions/start")
                        .header("X-Trace-Id", "trace-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Trace-Id", "trace-123"))
                .andExpect(header().exists("X-Request-Id"));
    }

    @Test
    public void shouldSkipExcludedActuatorPath() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("X-Trace-Id"))
                .andExpect(header().doesNotExist("X-Request-Id"));
    }

    @RestController
    private static class TestController {

        @PostMapping("/api/v1/planning/executions/start")
        public Response<Map<String, Object>> start(@RequestBody(required = false) Map<String, Object> request) {
            return Response.<Map<String, Object>>builder()
                    .code("0000")
                    .info("成功")
                    .data(request)
                    .build();
        }

        @GetMapping("/actuator/health")
        public Response<String> health() {
            return Response.<String>builder()
                    .code("0000")
                    .info("成功")
                    .data("UP")
                    .build();
        }
    }
}
