package buildinghealth.domain.exception;

/**
 * Petición de ingesta mal formada (campos obligatorios ausentes, valores no numéricos...).
 */
public class InvalidSampleException extends AnomalyDetectionException {

    public InvalidSampleException(String message) {
        super(message);
    }
}
