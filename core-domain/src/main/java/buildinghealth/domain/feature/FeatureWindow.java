package buildinghealth.domain.feature;

import buildinghealth.config.FeatureWindowConfig;
import buildinghealth.domain.exception.SchemaMismatchException;
import buildinghealth.domain.sample.Sample;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Ventana deslizante acotada que convierte muestras en vectores de características.
 * <p>
 * Una instancia por flujo lógico. No es thread-safe: quien la comparta entre productores
 * debe serializar los {@link #push(Sample)} para conservar el orden temporal.
 */
public class FeatureWindow {

    private final List<String> metrics;
    private final int windowSize;
    private final WindowAggregation aggregation;
    private final FeatureSchema schema;
    private final Deque<double[]> buffer;

    public FeatureWindow(FeatureWindowConfig config) {
        if (config.getMetrics() == null || config.getMetrics().isEmpty()) {
            throw new IllegalArgumentException("Feature window needs at least one metric");
        }
        if (config.getWindowSize() < 1) {
            throw new IllegalArgumentException("Window size must be >= 1, got " + config.getWindowSize());
        }
        this.metrics = List.copyOf(config.getMetrics());
        this.windowSize = config.getWindowSize();
        this.aggregation = config.getAggregation();
        this.schema = new FeatureSchema(aggregation.featureNames(metrics));
        this.buffer = new ArrayDeque<>(windowSize);
    }

    /**
     * Añade la muestra a la ventana.
     *
     * @return el vector de características, o vacío mientras la ventana se calienta
     *         (las primeras {@code windowSize - 1} muestras).
     * @throws SchemaMismatchException si a la muestra le falta alguna métrica configurada
     *         o trae un valor no finito. La muestra no entra en la ventana.
     */
    public Optional<FeatureVector> push(Sample sample) {
        double[] row = extract(sample);

        if (buffer.size() == windowSize) {
            buffer.removeFirst();
        }
        buffer.addLast(row);

        if (buffer.size() < windowSize) {
            return Optional.empty();
        }
        return Optional.of(new FeatureVector(schema, aggregation.aggregate(buffer, metrics.size())));
    }

    public FeatureSchema schema() {
        return schema;
    }

    public int windowSize() {
        return windowSize;
    }

    public int bufferedCount() {
        return buffer.size();
    }

    public boolean isWarm() {
        return buffer.size() >= windowSize;
    }

    public void reset() {
        buffer.clear();
    }

    private double[] extract(Sample sample) {
        double[] row = new double[metrics.size()];
        for (int i = 0; i < metrics.size(); i++) {
            String metric = metrics.get(i);
            Double value = sample.metricValues().get(metric);
            if (value == null) {
                throw new SchemaMismatchException(String.format(
                        "Sample from '%s' is missing metric '%s' (expected %s, got %s)",
                        sample.sourceId(), metric, metrics, sample.metricValues().keySet()));
            }
            if (!Double.isFinite(value)) {
                throw new SchemaMismatchException(String.format(
                        "Sample from '%s' has a non-finite value for '%s': %s", sample.sourceId(), metric, value));
            }
            row[i] = value;
        }
        return row;
    }
}
