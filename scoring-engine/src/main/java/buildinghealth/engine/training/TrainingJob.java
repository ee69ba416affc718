package buildinghealth.engine.training;

import buildinghealth.config.FeatureWindowConfig;
import buildinghealth.config.TrainingHyperparameters;
import buildinghealth.domain.exception.InsufficientDataException;
import buildinghealth.domain.exception.SchemaMismatchException;
import buildinghealth.domain.exception.TrainingCancelledException;
import buildinghealth.domain.feature.FeatureVector;
import buildinghealth.domain.feature.FeatureWindow;
import buildinghealth.domain.model.AnomalyModel;
import buildinghealth.domain.sample.Sample;
import buildinghealth.engine.model.ModelStore;
import buildinghealth.ml.AnomalyModelTrainer;
import buildinghealth.ml.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ciclo de vida del modelo: instantánea de datos, ajuste, persistencia e intercambio.
 * <p>
 * El ajuste no toma ningún cerrojo del almacén; la ingesta sigue puntuando con el modelo
 * anterior hasta el {@code replace}. Solo puede haber una ejecución a la vez.
 */
@Slf4j
public class TrainingJob {

    private final ModelStore modelStore;
    private final FeatureWindowConfig windowConfig;
    private final SampleArchive archive;
    private final AnomalyModelTrainer trainer;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile CancellationToken activeToken;

    public TrainingJob(ModelStore modelStore, FeatureWindowConfig windowConfig, SampleArchive archive,
                       AnomalyModelTrainer trainer, Clock clock) {
        this.modelStore = modelStore;
        this.windowConfig = windowConfig;
        this.archive = archive;
        this.trainer = trainer;
        this.clock = clock;
    }

    /**
     * Entrena un modelo candidato sin publicarlo. Las muestras se agrupan por flujo y se
     * pasan por una ventana nueva con la misma configuración que la ingesta.
     *
     * @throws InsufficientDataException si salen menos vectores que {@code minTrainingSamples}
     * @throws TrainingCancelledException si se cancela durante el ajuste
     */
    public AnomalyModel train(List<Sample> samples, TrainingHyperparameters hp, CancellationToken token) {
        hp.validate();
        List<FeatureVector> vectors = buildVectors(samples);
        if (vectors.size() < hp.getMinTrainingSamples()) {
            throw new InsufficientDataException(vectors.size(), hp.getMinTrainingSamples());
        }
        long version = modelStore.nextVersion();
        return trainer.train(vectors, new FeatureWindow(windowConfig).schema(), hp, version, clock.instant(), token);
    }

    /**
     * Reentrena con el contenido actual del archivo de muestras.
     */
    public TrainingOutcome runOnce(TrainingHyperparameters hp) {
        return run(archive.snapshot(), hp);
    }

    /**
     * Entrena, persiste y publica. Nunca lanza: todo fallo se traduce a un {@link TrainingOutcome}.
     */
    public TrainingOutcome run(List<Sample> samples, TrainingHyperparameters hp) {
        if (!running.compareAndSet(false, true)) {
            log.warn("Entrenamiento rechazado: ya hay uno en curso");
            return TrainingOutcome.busy();
        }
        CancellationToken token = CancellationToken.create();
        activeToken = token;
        long start = System.nanoTime();
        try {
            log.info("Iniciando entrenamiento con {} muestras ({} árboles, psi={}, semilla {})",
                    samples.size(), hp.getNumTrees(), hp.getSubsampleSize(), hp.getSeed());

            AnomalyModel candidate = train(samples, hp, token);
            token.throwIfCancelled();
            modelStore.persist(candidate);
            modelStore.replace(candidate);

            TrainingOutcome outcome = TrainingOutcome.success(candidate, elapsed(start));
            log.info("Entrenamiento completado: modelo v{} activo en {} ms", candidate.getVersion(),
                    outcome.duration().toMillis());
            return outcome;
        } catch (InsufficientDataException e) {
            log.warn("Entrenamiento abortado: {}", e.getMessage());
            return TrainingOutcome.of(TrainingStatus.INSUFFICIENT_DATA, e.getMessage(), elapsed(start));
        } catch (TrainingCancelledException e) {
            log.warn("Entrenamiento cancelado; se descarta el candidato");
            return TrainingOutcome.of(TrainingStatus.CANCELLED, e.getMessage(), elapsed(start));
        } catch (IOException | UncheckedIOException e) {
            log.error("No se pudo persistir el modelo candidato", e);
            return TrainingOutcome.of(TrainingStatus.FAILED, "Persistence failed: " + e.getMessage(), elapsed(start));
        } catch (RuntimeException e) {
            log.error("Error inesperado entrenando el modelo", e);
            return TrainingOutcome.of(TrainingStatus.FAILED, e.getMessage(), elapsed(start));
        } finally {
            activeToken = null;
            running.set(false);
        }
    }

    /**
     * @return {@code true} si había un entrenamiento en curso al que se ha pedido parar.
     */
    public boolean cancel() {
        CancellationToken token = activeToken;
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("Cancelación solicitada para el entrenamiento en curso");
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    private List<FeatureVector> buildVectors(List<Sample> samples) {
        Map<String, List<Sample>> bySource = new LinkedHashMap<>();
        for (Sample sample : samples) {
            bySource.computeIfAbsent(sample.sourceId(), k -> new ArrayList<>()).add(sample);
        }
        List<FeatureVector> vectors = new ArrayList<>(samples.size());
        int skipped = 0;
        for (List<Sample> stream : bySource.values()) {
            stream.sort(Comparator.comparing(Sample::timestamp));
            FeatureWindow window = new FeatureWindow(windowConfig);
            for (Sample sample : stream) {
                try {
                    window.push(sample).ifPresent(vectors::add);
                } catch (SchemaMismatchException e) {
                    skipped++;
                }
            }
        }
        if (skipped > 0) {
            log.warn("{} muestras ignoradas en el entrenamiento por no encajar con el esquema", skipped);
        }
        return vectors;
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
