package buildinghealth.domain.model;

import java.util.Objects;

/**
 * Frontera de decisión de un modelo. Un score que la supera estrictamente en el sentido
 * anómalo se clasifica como anomalía; el empate cuenta como normal.
 *
 * @param value     valor del umbral
 * @param direction sentido anómalo del score
 * @param policy    nombre de la política que lo calculó (para trazabilidad)
 */
public record Threshold(double value, ScoreDirection direction, String policy) {

    public Threshold {
        Objects.requireNonNull(direction, "direction");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Threshold must be finite, got " + value);
        }
    }

    public boolean isAnomalous(double score) {
        return direction == ScoreDirection.HIGHER_IS_ANOMALOUS ? score > value : score < value;
    }

    /**
     * Distancia con signo entre el score y el umbral; positiva en el lado anómalo.
     */
    public double marginOf(double score) {
        return direction == ScoreDirection.HIGHER_IS_ANOMALOUS ? score - value : value - score;
    }
}
