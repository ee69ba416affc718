package buildinghealth.domain.dto.alert;

public enum AlertStatus {
    NEW,
    ACKNOWLEDGED,
    RESOLVED
}
