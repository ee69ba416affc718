package buildinghealth.domain.exception;

/**
 * El artefacto persistido del modelo no se puede leer o no supera la validación.
 */
public class CorruptArtifactException extends AnomalyDetectionException {

    public CorruptArtifactException(String message) {
        super(message);
    }

    public CorruptArtifactException(String message, Throwable cause) {
        super(message, cause);
    }
}
