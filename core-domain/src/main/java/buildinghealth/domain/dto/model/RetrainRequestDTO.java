package buildinghealth.domain.dto.model;

import buildinghealth.config.TrainingHyperparameters;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;

/**
 * Ajustes opcionales para un reentrenamiento manual. Los campos nulos heredan la configuración.
 */
public record RetrainRequestDTO(
        @Min(1) Integer numTrees,
        @Min(2) Integer subsampleSize,
        Long seed,
        @DecimalMin(value = "0.0", inclusive = false) @DecimalMax(value = "0.5", inclusive = false) Double contamination,
        String thresholdPolicy,
        Double fixedThreshold,
        @Min(2) Integer minTrainingSamples
) {
    public TrainingHyperparameters applyTo(TrainingHyperparameters base) {
        TrainingHyperparameters.TrainingHyperparametersBuilder b = base.toBuilder();
        if (numTrees != null) b.numTrees(numTrees);
        if (subsampleSize != null) b.subsampleSize(subsampleSize);
        if (seed != null) b.seed(seed);
        if (contamination != null) b.contamination(contamination);
        if (thresholdPolicy != null) b.thresholdPolicy(thresholdPolicy);
        if (fixedThreshold != null) b.fixedThreshold(fixedThreshold);
        if (minTrainingSamples != null) b.minTrainingSamples(minTrainingSamples);
        return b.build();
    }
}
