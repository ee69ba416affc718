package buildinghealth.engine.training;

import buildinghealth.domain.dto.model.TrainingOutcomeDTO;
import buildinghealth.domain.model.AnomalyModel;

import java.time.Duration;

public record TrainingOutcome(
        TrainingStatus status,
        Long modelVersion,
        Integer trainingSampleCount,
        Double threshold,
        String message,
        Duration duration
) {
    public static TrainingOutcome success(AnomalyModel model, Duration duration) {
        return new TrainingOutcome(TrainingStatus.SUCCESS, model.getVersion(), model.getTrainingSampleCount(),
                model.getThreshold().value(), "Model v" + model.getVersion() + " is now active", duration);
    }

    public static TrainingOutcome of(TrainingStatus status, String message, Duration duration) {
        return new TrainingOutcome(status, null, null, null, message, duration);
    }

    public static TrainingOutcome busy() {
        return of(TrainingStatus.BUSY, "A training run is already in progress", Duration.ZERO);
    }

    public int exitCode() {
        return status.getExitCode();
    }

    public TrainingOutcomeDTO toDTO() {
        return new TrainingOutcomeDTO(status.name(), exitCode(), modelVersion, trainingSampleCount, threshold,
                message, duration.toMillis());
    }
}
