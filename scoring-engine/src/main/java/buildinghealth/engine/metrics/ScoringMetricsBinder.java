package buildinghealth.engine.metrics;

import buildinghealth.engine.model.ModelStore;
import buildinghealth.engine.scoring.RecentResultsBuffer;
import buildinghealth.engine.scoring.ScoringStats;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;

/**
 * Expone los contadores del motor y el estado del modelo en el registro de Micrometer.
 * En Prometheus aparecen como {@code samples_processed_total}, {@code model_version}, etc.
 */
@RequiredArgsConstructor
public class ScoringMetricsBinder implements MeterBinder {

    private final ScoringStats stats;
    private final ModelStore modelStore;
    private final RecentResultsBuffer recentResults;

    @Override
    public void bindTo(MeterRegistry registry) {
        FunctionCounter.builder("samples.processed", stats, ScoringStats::processed)
                .description("Samples accepted by the scoring engine")
                .register(registry);
        FunctionCounter.builder("anomalies.detected", stats, ScoringStats::anomalies)
                .description("Samples classified as anomalous")
                .register(registry);
        FunctionCounter.builder("samples.dropped", stats, ScoringStats::dropped)
                .description("Samples rejected for not matching the feature schema")
                .register(registry);
        FunctionCounter.builder("samples.degraded", stats, ScoringStats::degraded)
                .description("Samples processed without a loaded model")
                .register(registry);

        Gauge.builder("model.version", modelStore, s -> s.current().map(m -> (double) m.getVersion()).orElse(-1.0))
                .description("Version of the active model, -1 when degraded")
                .register(registry);
        Gauge.builder("model.degraded", modelStore, s -> s.isDegraded() ? 1.0 : 0.0)
                .description("1 when no model is loaded")
                .register(registry);
        Gauge.builder("active.anomalies", recentResults, RecentResultsBuffer::anomalyCount)
                .description("Entries in the in-memory anomaly log")
                .register(registry);
    }
}
