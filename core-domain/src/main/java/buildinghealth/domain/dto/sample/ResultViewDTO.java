package buildinghealth.domain.dto.sample;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Resultado clasificado tal como lo ven el panel y el feed en vivo: la muestra y su veredicto.
 */
@Builder
public record ResultViewDTO(
        String sourceId,
        Instant timestamp,
        Map<String, Double> metrics,
        @JsonProperty("is_anomaly") boolean anomaly,
        Double score,
        Double threshold,
        Long modelVersion,
        String status
) {}
