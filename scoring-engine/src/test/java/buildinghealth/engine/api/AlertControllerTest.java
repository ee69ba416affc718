package buildinghealth.engine.api;

import buildinghealth.config.ApiRoutes;
import buildinghealth.domain.dto.alert.AlertSeverity;
import buildinghealth.domain.dto.alert.AlertStatus;
import buildinghealth.engine.TestSecurityConfig;
import buildinghealth.engine.entity.AlertEntity;
import buildinghealth.engine.repository.AlertRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.ANY)
@Import(TestSecurityConfig.class)
class AlertControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AlertRepository alertRepository;

    @BeforeEach
    void setUp() {
        alertRepository.deleteAll();
    }

    private AlertEntity saveAlert(String message, AlertStatus status) {
        return alertRepository.save(AlertEntity.builder()
                .sourceId("sensor-1")
                .message(message)
                .severity(AlertSeverity.WARNING)
                .status(status)
                .timestamp(LocalDateTime.now())
                .sampleTimestamp(Instant.now())
                .score(0.71)
                .threshold(0.6)
                .modelVersion(1L)
                .metrics(Map.of("temperature", 41.0))
                .build());
    }

    private static SimpleGrantedAuthority role(String name) {
        return new SimpleGrantedAuthority("ROLE_" + name);
    }

    @Test
    void testGetAlerts() throws Exception {
        saveAlert("Test Alert", AlertStatus.NEW);

        mockMvc.perform(get(ApiRoutes.ALERTS)
                        .with(jwt()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[*].message", hasItem("Test Alert")))
                .andExpect(jsonPath("$.content[0].metrics.temperature").value(41.0));
    }

    @Test
    void testGetAlerts_requiresAuthentication() throws Exception {
        mockMvc.perform(get(ApiRoutes.ALERTS))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void testActiveAlertsExcludeResolved() throws Exception {
        saveAlert("Open", AlertStatus.NEW);
        saveAlert("Closed", AlertStatus.RESOLVED);

        mockMvc.perform(get(ApiRoutes.ALERTS + "/active")
                        .with(jwt()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].message", hasItem("Open")))
                .andExpect(jsonPath("$[*].message", not(hasItem("Closed"))));
    }

    @Test
    void testAcknowledgeAlert() throws Exception {
        AlertEntity alert = saveAlert("To Ack", AlertStatus.NEW);

        mockMvc.perform(post(ApiRoutes.ALERTS + "/" + alert.getId() + "/ack")
                        .with(jwt().authorities(role("OFFICER"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACKNOWLEDGED"));
    }

    @Test
    void testResolveAlert_forbiddenForGuest() throws Exception {
        AlertEntity alert = saveAlert("To Resolve", AlertStatus.NEW);

        mockMvc.perform(post(ApiRoutes.ALERTS + "/" + alert.getId() + "/resolve")
                        .with(jwt().authorities(role("GUEST"))))
                .andExpect(status().isForbidden());
    }

    @Test
    void testResolveUnknownAlert() throws Exception {
        mockMvc.perform(post(ApiRoutes.ALERTS + "/does-not-exist/resolve")
                        .with(jwt().authorities(role("ADMIN"))))
                .andExpect(status().isNotFound());
    }
}
