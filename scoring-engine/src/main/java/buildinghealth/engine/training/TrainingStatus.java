package buildinghealth.engine.training;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Resultado de una ejecución de entrenamiento y el código de salida que ve el CI.
 */
@Getter
@RequiredArgsConstructor
public enum TrainingStatus {
    SUCCESS(0),
    FAILED(1),
    INSUFFICIENT_DATA(2),
    CANCELLED(3),
    BUSY(4);

    private final int exitCode;
}
