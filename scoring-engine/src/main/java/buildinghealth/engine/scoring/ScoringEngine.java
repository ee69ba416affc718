package buildinghealth.engine.scoring;

import buildinghealth.domain.exception.SchemaMismatchException;
import buildinghealth.domain.feature.FeatureVector;
import buildinghealth.domain.model.AnomalyModel;
import buildinghealth.domain.model.ClassificationResult;
import buildinghealth.domain.sample.Sample;
import buildinghealth.domain.sample.SampleRef;
import buildinghealth.engine.model.ModelStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Camino caliente de la ingesta: ventana, puntuación, clasificación y publicación.
 * <p>
 * Las muestras de un mismo flujo se procesan en orden bajo su cerrojo; flujos distintos
 * avanzan en paralelo. Cada puntuación usa una única instantánea del modelo activo, así
 * que un intercambio concurrente nunca mezcla versiones dentro de un resultado.
 */
@Slf4j
public class ScoringEngine {

    private final ModelStore modelStore;
    private final FeatureWindowRegistry windows;
    private final List<ResultListener> listeners;
    private final Clock clock;
    private final ScoringStats stats = new ScoringStats();

    public ScoringEngine(ModelStore modelStore, FeatureWindowRegistry windows,
                         List<ResultListener> listeners, Clock clock) {
        this.modelStore = modelStore;
        this.windows = windows;
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
    }

    /**
     * Procesa una muestra.
     *
     * @return el resultado, o vacío mientras la ventana del flujo se calienta.
     * @throws SchemaMismatchException si la muestra no encaja con el esquema; se cuenta como descartada.
     */
    public Optional<ClassificationResult> ingest(Sample sample) {
        StreamChannel channel = windows.channelFor(sample.sourceId());
        ReentrantLock lock = channel.lock();
        lock.lock();
        try {
            Optional<FeatureVector> vector;
            try {
                vector = channel.window().push(sample);
            } catch (SchemaMismatchException e) {
                recordDropped(sample.ref(), e);
                throw e;
            }
            if (vector.isEmpty()) {
                stats.recordProcessed();
                stats.recordWarmingUp();
                return Optional.empty();
            }
            // score() ya contabiliza su propio descarte
            ClassificationResult result = score(sample.ref(), vector.get());
            stats.recordProcessed();
            publish(sample, result);
            return Optional.of(result);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puntúa un vector ya construido contra una instantánea del modelo activo.
     * Sin modelo devuelve un resultado DEGRADED, nunca un score inventado.
     *
     * @throws SchemaMismatchException si el vector no encaja con el esquema del modelo; se cuenta como descartado.
     */
    public ClassificationResult score(SampleRef ref, FeatureVector vector) {
        Optional<AnomalyModel> snapshot = modelStore.current();
        if (snapshot.isEmpty()) {
            stats.recordDegraded();
            return ClassificationResult.degraded(ref, clock.instant());
        }
        AnomalyModel model = snapshot.get();
        double score;
        try {
            score = model.score(vector);
        } catch (SchemaMismatchException e) {
            recordDropped(ref, e);
            throw e;
        }
        ClassificationResult result = ClassificationResult.scored(ref, score, model, clock.instant());
        stats.recordScored(result.anomaly());
        if (result.anomaly()) {
            log.info("ANOMALÍA en '{}' @ {}: score {} > umbral {} (modelo v{})", ref.sourceId(), ref.timestamp(),
                    String.format("%.4f", score), String.format("%.4f", result.threshold()), result.modelVersion());
        }
        return result;
    }

    public ClassificationResult score(FeatureVector vector) {
        return score(new SampleRef(Sample.DEFAULT_SOURCE, clock.instant()), vector);
    }

    public ScoringStats stats() {
        return stats;
    }

    public FeatureWindowRegistry windows() {
        return windows;
    }

    private void recordDropped(SampleRef ref, SchemaMismatchException e) {
        stats.recordDropped();
        log.warn("Muestra descartada de '{}' @ {}: {}", ref.sourceId(), ref.timestamp(), e.getMessage());
    }

    private void publish(Sample sample, ClassificationResult result) {
        for (ResultListener listener : listeners) {
            try {
                listener.onResult(sample, result);
            } catch (RuntimeException e) {
                log.error("El listener {} falló procesando el resultado de '{}'",
                        listener.getClass().getSimpleName(), sample.sourceId(), e);
            }
        }
    }
}
