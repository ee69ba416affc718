package buildinghealth.domain.dto.alert;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;

public record AlertDTO(
        String id,
        String sourceId,
        AlertSeverity severity,
        AlertStatus status,
        String message,
        LocalDateTime timestamp,
        Instant sampleTimestamp,
        double score,
        double threshold,
        long modelVersion,
        Map<String, Double> metrics) {
}
