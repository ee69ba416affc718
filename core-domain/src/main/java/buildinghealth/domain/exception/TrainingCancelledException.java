package buildinghealth.domain.exception;

public class TrainingCancelledException extends AnomalyDetectionException {

    public TrainingCancelledException() {
        super("Training run was cancelled");
    }
}
