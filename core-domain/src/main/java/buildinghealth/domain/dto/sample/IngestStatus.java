package buildinghealth.domain.dto.sample;

public enum IngestStatus {
    SCORED,
    WARMING_UP,
    DEGRADED
}
