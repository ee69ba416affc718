package buildinghealth.domain.dto.sample;

import buildinghealth.domain.sample.Sample;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Cuerpo de {@code POST /v1/samples}. Si no viene {@code timestamp} se usa la hora del servidor.
 */
@Builder
public record SampleRequestDTO(
        @Size(max = 128) String sourceId,
        Instant timestamp,
        @NotEmpty Map<@NotNull String, @NotNull Double> metrics
) {
    public Sample toSample(Instant receivedAt) {
        return new Sample(timestamp != null ? timestamp : receivedAt, metrics, sourceId);
    }
}
