package buildinghealth.engine.api;

import buildinghealth.config.ApiRoutes;
import buildinghealth.domain.feature.FeatureSchema;
import buildinghealth.engine.TestModels;
import buildinghealth.engine.model.ModelStore;
import buildinghealth.engine.service.RetrainService;
import buildinghealth.engine.training.TrainingOutcome;
import buildinghealth.engine.training.TrainingStatus;
import buildinghealth.security.SecurityConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.data.jpa.JpaRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.autoconfigure.security.oauth2.resource.servlet.OAuth2ResourceServerAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.SecurityFilterAutoConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(
        controllers = ModelController.class,
        excludeFilters = @ComponentScan.Filter(type = FilterType.ASSIGNABLE_TYPE, classes = SecurityConfig.class),
        excludeAutoConfiguration = {
                SecurityAutoConfiguration.class,
                SecurityFilterAutoConfiguration.class,
                OAuth2ResourceServerAutoConfiguration.class,
                DataSourceAutoConfiguration.class,
                JpaRepositoriesAutoConfiguration.class,
                HibernateJpaAutoConfiguration.class
        }
)
@AutoConfigureMockMvc(addFilters = false)
class ModelControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ModelStore modelStore;

    @MockBean
    private RetrainService retrainService;

    @Test
    void getCurrentModel_ShouldReturnMetadata_WhenModelIsLoaded() throws Exception {
        given(modelStore.current()).willReturn(Optional.of(
                TestModels.linear(9, FeatureSchema.of("temperature", "humidity"))));

        mockMvc.perform(get(ApiRoutes.MODELS + "/current"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.degraded").value(false))
                .andExpect(jsonPath("$.version").value(9))
                .andExpect(jsonPath("$.featureSchema[1]").value("humidity"))
                .andExpect(jsonPath("$.threshold").value(0.5));
    }

    @Test
    void getCurrentModel_ShouldReportDegraded_WhenNoModel() throws Exception {
        given(modelStore.current()).willReturn(Optional.empty());
        given(modelStore.lastLoadError()).willReturn("No model artifact at data/model.json");

        mockMvc.perform(get(ApiRoutes.MODELS + "/current"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.degraded").value(true))
                .andExpect(jsonPath("$.version").doesNotExist())
                .andExpect(jsonPath("$.lastLoadError").value("No model artifact at data/model.json"));
    }

    @Test
    void retrain_ShouldReturn200_WhenTrainingSucceeds() throws Exception {
        TrainingOutcome outcome = TrainingOutcome.success(
                TestModels.linear(4, FeatureSchema.of("temperature")), Duration.ofMillis(120));
        given(retrainService.retrain(isNull())).willReturn(CompletableFuture.completedFuture(outcome));

        mockMvc.perform(post(ModelController.RETRAIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.exitCode").value(0))
                .andExpect(jsonPath("$.modelVersion").value(4));
    }

    @Test
    void retrain_ShouldReturn409_WhenDataIsInsufficient() throws Exception {
        TrainingOutcome outcome = TrainingOutcome.of(TrainingStatus.INSUFFICIENT_DATA,
                "Insufficient training data: 3 feature vectors available, 50 required", Duration.ZERO);
        given(retrainService.retrain(any())).willReturn(CompletableFuture.completedFuture(outcome));

        mockMvc.perform(post(ModelController.RETRAIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"numTrees\": 50}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.exitCode").value(2));
    }

    @Test
    void retrain_ShouldReturn400_WhenOverridesAreInvalid() throws Exception {
        mockMvc.perform(post(ModelController.RETRAIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"contamination\": 0.9}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void cancel_ShouldReturn404_WhenNothingIsRunning() throws Exception {
        given(retrainService.cancel()).willReturn(false);

        mockMvc.perform(delete(ModelController.RETRAIN))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.cancelled").value(false));
    }
}
