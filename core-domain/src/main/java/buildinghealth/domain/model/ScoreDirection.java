package buildinghealth.domain.model;

/**
 * Sentido en el que un score indica anomalía.
 */
public enum ScoreDirection {
    /** Cuanto más alto, más anómalo (Random Cut Forest). */
    HIGHER_IS_ANOMALOUS,
    /** Cuanto más bajo, más anómalo. */
    LOWER_IS_ANOMALOUS
}
