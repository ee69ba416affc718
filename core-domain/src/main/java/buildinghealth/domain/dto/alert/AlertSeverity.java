package buildinghealth.domain.dto.alert;

public enum AlertSeverity {
    WARNING,
    CRITICAL
}
