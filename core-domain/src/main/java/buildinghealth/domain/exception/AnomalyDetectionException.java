package buildinghealth.domain.exception;

/**
 * Raíz de la jerarquía de errores del dominio de detección de anomalías.
 * Todas son unchecked: cada capa decide si las recupera (por muestra) o las propaga.
 */
public class AnomalyDetectionException extends RuntimeException {

    public AnomalyDetectionException(String message) {
        super(message);
    }

    public AnomalyDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
