package buildinghealth.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Hiperparámetros de un entrenamiento del Random Cut Forest y de su política de umbral.
 * Se guardan dentro del artefacto para poder reproducir el modelo.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class TrainingHyperparameters {

    public static final String POLICY_CONTAMINATION = "contamination";
    public static final String POLICY_FIXED = "fixed";

    @Builder.Default
    int numTrees = 100;

    /**
     * Puntos que guarda cada árbol (sampleSize de la librería).
     */
    @Builder.Default
    int subsampleSize = 256;

    @Builder.Default
    long seed = 42L;

    /**
     * Fracción esperada de anomalías en los datos de entrenamiento.
     */
    @Builder.Default
    double contamination = 0.01;

    @Builder.Default
    String thresholdPolicy = POLICY_CONTAMINATION;

    /**
     * Umbral usado cuando la política es {@code fixed}.
     */
    @Builder.Default
    double fixedThreshold = 1.5;

    @Builder.Default
    int minTrainingSamples = 50;

    public static TrainingHyperparameters defaults() {
        return TrainingHyperparameters.builder().build();
    }

    /**
     * Comprueba rangos. Lanza {@link IllegalArgumentException} con el primer problema encontrado.
     */
    public TrainingHyperparameters validate() {
        if (numTrees < 1) {
            throw new IllegalArgumentException("numTrees must be >= 1, got " + numTrees);
        }
        if (subsampleSize < 2) {
            throw new IllegalArgumentException("subsampleSize must be >= 2, got " + subsampleSize);
        }
        if (!(contamination > 0.0 && contamination < 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5), got " + contamination);
        }
        if (minTrainingSamples < 2) {
            throw new IllegalArgumentException("minTrainingSamples must be >= 2, got " + minTrainingSamples);
        }
        if (!POLICY_CONTAMINATION.equalsIgnoreCase(thresholdPolicy) && !POLICY_FIXED.equalsIgnoreCase(thresholdPolicy)) {
            throw new IllegalArgumentException("Unknown threshold policy: " + thresholdPolicy);
        }
        return this;
    }
}
