package buildinghealth.ml;

import buildinghealth.domain.model.ScoreDirection;
import buildinghealth.domain.model.Threshold;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Umbral en el cuantil de los scores de entrenamiento que deja fuera la fracción
 * {@code contamination} más anómala. Cuantil con interpolación lineal entre vecinos
 * (estimador R-7 de commons-math, el mismo que numpy por defecto).
 */
public class ContaminationThresholdPolicy implements ThresholdPolicy {

    public static final String NAME = "contamination";

    private final double contamination;

    public ContaminationThresholdPolicy(double contamination) {
        if (!(contamination > 0.0 && contamination < 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5), got " + contamination);
        }
        this.contamination = contamination;
    }

    @Override
    public Threshold derive(double[] trainingScores, ScoreDirection direction) {
        if (trainingScores.length == 0) {
            throw new IllegalArgumentException("Cannot derive a threshold from an empty score set");
        }
        double q = direction == ScoreDirection.HIGHER_IS_ANOMALOUS ? 1.0 - contamination : contamination;
        // Percentile no es thread-safe: una instancia por derivación
        double value = new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(trainingScores, q * 100.0);
        return new Threshold(value, direction, NAME);
    }

    @Override
    public String name() {
        return NAME;
    }
}
