package buildinghealth.domain.exception;

public class NoModelLoadedException extends AnomalyDetectionException {

    public NoModelLoadedException() {
        super("No scoring model is loaded (degraded mode)");
    }
}
