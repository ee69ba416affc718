package buildinghealth.ml;

import buildinghealth.config.TrainingHyperparameters;
import buildinghealth.domain.model.ScoreDirection;
import buildinghealth.domain.model.Threshold;

/**
 * Estrategia para fijar el umbral de decisión a partir de los scores de entrenamiento.
 */
public interface ThresholdPolicy {

    Threshold derive(double[] trainingScores, ScoreDirection direction);

    String name();

    static ThresholdPolicy from(TrainingHyperparameters hp) {
        if (TrainingHyperparameters.POLICY_FIXED.equalsIgnoreCase(hp.getThresholdPolicy())) {
            return new FixedThresholdPolicy(hp.getFixedThreshold());
        }
        return new ContaminationThresholdPolicy(hp.getContamination());
    }
}
