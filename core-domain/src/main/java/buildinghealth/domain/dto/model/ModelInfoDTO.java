package buildinghealth.domain.dto.model;

import buildinghealth.config.TrainingHyperparameters;
import buildinghealth.domain.model.AnomalyModel;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Metadatos del modelo activo. Con {@code degraded = true} el resto de campos de modelo van a null.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelInfoDTO(
        boolean degraded,
        Long version,
        Instant trainedAt,
        String algorithm,
        List<String> featureSchema,
        Double threshold,
        String thresholdPolicy,
        Integer trainingSampleCount,
        TrainingHyperparameters hyperparameters,
        String lastLoadError
) {
    public static ModelInfoDTO of(AnomalyModel model) {
        return ModelInfoDTO.builder()
                .degraded(false)
                .version(model.getVersion())
                .trainedAt(model.getTrainedAt())
                .algorithm(model.getScorer().algorithm())
                .featureSchema(model.getFeatureSchema().names())
                .threshold(model.getThreshold().value())
                .thresholdPolicy(model.getThreshold().policy())
                .trainingSampleCount(model.getTrainingSampleCount())
                .hyperparameters(model.getHyperparameters())
                .build();
    }

    public static ModelInfoDTO degraded(String reason) {
        return ModelInfoDTO.builder().degraded(true).lastLoadError(reason).build();
    }
}
