package buildinghealth.domain.sample;

import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Lectura multimétrica de un sensor en un instante dado.
 * <p>
 * Inmutable: el mapa de métricas se copia preservando el orden de inserción.
 * Si no se indica {@code sourceId}, la muestra pertenece al flujo por defecto.
 */
@Builder
public record Sample(
        Instant timestamp,
        Map<String, Double> metricValues,
        String sourceId
) {
    public static final String DEFAULT_SOURCE = "default";

    public Sample {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(metricValues, "metricValues");
        metricValues = Collections.unmodifiableMap(new LinkedHashMap<>(metricValues));
        if (sourceId == null || sourceId.isBlank()) {
            sourceId = DEFAULT_SOURCE;
        }
    }

    public static Sample of(Instant timestamp, Map<String, Double> metricValues) {
        return new Sample(timestamp, metricValues, DEFAULT_SOURCE);
    }

    public OptionalDouble value(String metric) {
        Double value = metricValues.get(metric);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public SampleRef ref() {
        return new SampleRef(sourceId, timestamp);
    }
}
