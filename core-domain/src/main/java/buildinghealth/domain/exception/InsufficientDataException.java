package buildinghealth.domain.exception;

import lombok.Getter;

/**
 * El lote de entrenamiento es demasiado pequeño para producir un modelo útil.
 * Recuperable: el llamador puede reintentar cuando haya más historia acumulada.
 */
@Getter
public class InsufficientDataException extends AnomalyDetectionException {

    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required) {
        super(String.format("Insufficient training data: %d feature vectors available, %d required",
                available, required));
        this.available = available;
        this.required = required;
    }
}
