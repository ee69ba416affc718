package buildinghealth.domain.exception;

public class ResourceNotFoundException extends AnomalyDetectionException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
