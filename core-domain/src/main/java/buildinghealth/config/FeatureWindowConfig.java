package buildinghealth.config;

import buildinghealth.domain.feature.WindowAggregation;
import buildinghealth.domain.sample.MetricType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Forma de la ventana de características de un flujo.
 * El mismo objeto se usa en ingesta y en entrenamiento para que ambos produzcan el mismo esquema.
 */
@Value
@Builder
@With
public class FeatureWindowConfig {

    /**
     * Métricas a extraer de cada muestra, en el orden en que formarán el vector.
     */
    @Singular
    List<String> metrics;

    /**
     * Número de muestras que necesita la ventana antes de emitir un vector.
     */
    @Builder.Default
    int windowSize = 1;

    @Builder.Default
    WindowAggregation aggregation = WindowAggregation.LAST;

    /**
     * Ventana de una muestra sobre las cuatro sondas clásicas de un edificio.
     */
    public static FeatureWindowConfig defaults() {
        return FeatureWindowConfig.builder()
                .metrics(MetricType.defaultSchema().stream().map(MetricType::getCode).toList())
                .build();
    }
}
