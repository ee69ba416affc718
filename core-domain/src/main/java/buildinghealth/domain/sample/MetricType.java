package buildinghealth.domain.sample;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Métricas de salud del edificio conocidas por el simulador y la UI.
 * <p>
 * El esquema real de cada despliegue se configura por nombre ({@code health.stream.metrics});
 * este enum solo aporta unidades y los rangos normal/anómalo de la simulación.
 */
@Getter
@RequiredArgsConstructor
public enum MetricType {

    TEMPERATURE("temperature", "ºC",
            new MetricRange(20.0, 25.0, 1.0), new MetricRange(30.0, 40.0, 3.0)),
    HUMIDITY("humidity", "%",
            new MetricRange(40.0, 60.0, 5.0), new MetricRange(80.0, 95.0, 5.0)),
    PRESSURE("pressure", "hPa",
            new MetricRange(1000.0, 1015.0, 2.0), new MetricRange(980.0, 990.0, 3.0)),
    VIBRATION("vibration", "Hz",
            new MetricRange(0.5, 2.0, 0.3), new MetricRange(5.0, 10.0, 2.0)),
    POWER_DRAW("power_draw", "kW",
            new MetricRange(3.0, 6.0, 0.5), new MetricRange(12.0, 20.0, 2.0)),

    // --- FALLBACK ---
    UNKNOWN("unknown", "-", new MetricRange(0, 0, 0), new MetricRange(0, 0, 0));

    private final String code;
    private final String unit;
    private final MetricRange normalRange;
    private final MetricRange anomalyRange;

    private static final Map<String, MetricType> BY_CODE = Collections.unmodifiableMap(
            Arrays.stream(values())
                    .collect(Collectors.toMap(type -> type.code.toLowerCase(), type -> type))
    );

    /**
     * Busca la métrica por su código (sin distinguir mayúsculas). Nunca devuelve null.
     */
    public static MetricType fromString(String text) {
        if (text == null) return UNKNOWN;
        return BY_CODE.getOrDefault(text.trim().toLowerCase(), UNKNOWN);
    }

    /**
     * Esquema por defecto del monitor: las cuatro sondas clásicas de un edificio.
     */
    public static List<MetricType> defaultSchema() {
        return List.of(TEMPERATURE, HUMIDITY, PRESSURE, VIBRATION);
    }
}
