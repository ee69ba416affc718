package buildinghealth.domain.dto.sample;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestResponseDTO(
        IngestStatus status,
        @JsonProperty("is_anomaly") boolean anomaly,
        Double score,
        Double threshold,
        Long modelVersion,
        String sourceId,
        Instant timestamp,
        String message
) {}
