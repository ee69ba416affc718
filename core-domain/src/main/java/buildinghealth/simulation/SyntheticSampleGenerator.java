package buildinghealth.simulation;

import buildinghealth.domain.sample.MetricRange;
import buildinghealth.domain.sample.MetricType;
import buildinghealth.domain.sample.Sample;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Genera lecturas sintéticas de las sondas de un edificio: ruido gaussiano alrededor del
 * punto medio del rango, recortado a sus límites. Se usa para el entrenamiento inicial y
 * para el simulador de sensores.
 */
public class SyntheticSampleGenerator {

    private final Random random;
    private final List<MetricType> metrics;

    public SyntheticSampleGenerator(long seed) {
        this(seed, MetricType.defaultSchema());
    }

    public SyntheticSampleGenerator(long seed, List<MetricType> metrics) {
        this.random = new Random(seed);
        this.metrics = List.copyOf(metrics);
    }

    /**
     * Generador para las métricas configuradas por nombre.
     *
     * @throws IllegalArgumentException si alguna métrica no tiene rango conocido: la ventana exige todas.
     */
    public static SyntheticSampleGenerator forMetrics(long seed, List<String> codes) {
        List<String> unknown = codes.stream()
                .filter(code -> MetricType.fromString(code) == MetricType.UNKNOWN)
                .toList();
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Metrics " + unknown + " have no known simulation range");
        }
        if (codes.isEmpty()) {
            throw new IllegalArgumentException("At least one metric is required");
        }
        return new SyntheticSampleGenerator(seed, codes.stream().map(MetricType::fromString).toList());
    }

    public List<MetricType> metrics() {
        return metrics;
    }

    public Sample normal(Instant timestamp, String sourceId) {
        return generate(timestamp, sourceId, false);
    }

    public Sample anomalous(Instant timestamp, String sourceId) {
        return generate(timestamp, sourceId, true);
    }

    /**
     * Lectura normal o, con probabilidad {@code anomalyProbability}, anómala.
     */
    public Sample next(Instant timestamp, String sourceId, double anomalyProbability) {
        return generate(timestamp, sourceId, random.nextDouble() < anomalyProbability);
    }

    /**
     * {@code count} lecturas normales espaciadas un segundo, terminando en {@code end}.
     */
    public List<Sample> normalBatch(int count, Instant end, String sourceId) {
        List<Sample> batch = new ArrayList<>(count);
        Instant start = end.minus(Duration.ofSeconds(count));
        for (int i = 0; i < count; i++) {
            batch.add(normal(start.plusSeconds(i + 1L), sourceId));
        }
        return batch;
    }

    private Sample generate(Instant timestamp, String sourceId, boolean anomaly) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (MetricType metric : metrics) {
            MetricRange range = anomaly ? metric.getAnomalyRange() : metric.getNormalRange();
            double value = range.midpoint() + random.nextGaussian() * range.stdDev();
            values.put(metric.getCode(), range.clamp(value));
        }
        return new Sample(timestamp, values, sourceId);
    }
}
