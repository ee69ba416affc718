package buildinghealth.domain.model;

public enum ResultStatus {
    /** Puntuado por un modelo cargado. */
    SCORED,
    /** Sin modelo: no hay score ni decisión. */
    DEGRADED
}
