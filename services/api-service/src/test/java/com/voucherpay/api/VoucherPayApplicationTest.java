package com.voucherpay.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.voucherpay.api.config.ServiceProperties;
import com.voucherpay.pipeline.MiddlewarePipeline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Boots the full application with the {@code test} profile, which needs no external
 * infrastructure.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("VoucherPay API application")
class VoucherPayApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;

    @Test
    @DisplayName("loads service properties from the test profile")
    void servicePropertiesAreLoaded() {
        var props = context.getBean(ServiceProperties.class);
        assertThat(props.name()).isEqualTo("voucherpay-api-test");
        assertThat(props.environment()).isEqualTo("test");
    }

    @Test
    @DisplayName("assembles the pipeline with every stage enabled")
    void pipelineHasAllStages() {
        var pipeline = context.getBean(MiddlewarePipeline.class);
        assertThat(pipeline.requestStages()).hasSize(1);
        assertThat(pipeline.responseStages()).hasSize(2);
    }

    @Test
    @DisplayName("root endpoint describes the platform")
    void rootEndpoint() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("voucherpay-api-test"))
                .andExpect(jsonPath("$.status").value("operational"))
                .andExpect(jsonPath("$._accessibility.wcag_level").value("AA"))
                .andExpect(header().exists("X-Correlation-ID"))
                .andExpect(header().string("X-Content-Type-Options", "nosniff"));
    }

    @Test
    @DisplayName("health endpoint reports healthy")
    void healthEndpoint() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.timestamp").isNumber());
    }

    @Test
    @DisplayName("actuator health is available and not enriched")
    void actuatorHealth() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$._accessibility").doesNotExist())
                .andExpect(header().string("X-Frame-Options", "DENY"));
    }

    @Test
    @DisplayName("accessibility endpoints are public")
    void accessibilityEndpointsArePublic() throws Exception {
        mockMvc.perform(get("/api/v1/accessibility"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.platform_accessibility.wcag_compliance").value("2.1 AA"));
        mockMvc.perform(get("/api/v1/accessibility/audit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.compliance_level").value("AA"));
        mockMvc.perform(get("/api/v1/accessibility/guidelines"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.wcag_guidelines.principles.length()").value(4));
    }

    @Test
    @DisplayName("unknown paths get the error envelope")
    void unknownPathIsEnvelopedNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/nowhere"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value(404))
                .andExpect(jsonPath("$.error.user_friendly_message").exists());
    }
}
