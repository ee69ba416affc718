package buildinghealth.engine.service;

import buildinghealth.config.TrainingHyperparameters;
import buildinghealth.domain.dto.model.RetrainRequestDTO;
import buildinghealth.engine.training.TrainingJob;
import buildinghealth.engine.training.TrainingOutcome;
import buildinghealth.engine.training.TrainingStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Lanza reentrenamientos en un hilo dedicado, bajo demanda o por cron
 * ({@code health.training.cron}, desactivado con {@code -}).
 */
@Slf4j
@Service
public class RetrainService {

    private final TrainingJob trainingJob;
    private final TrainingHyperparameters defaults;
    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "retrain-worker");
        t.setDaemon(true);
        return t;
    });
    private final Map<TrainingStatus, Counter> runs = new EnumMap<>(TrainingStatus.class);

    public RetrainService(TrainingJob trainingJob, TrainingHyperparameters defaults, MeterRegistry meterRegistry) {
        this.trainingJob = trainingJob;
        this.defaults = defaults;
        for (TrainingStatus status : TrainingStatus.values()) {
            runs.put(status, Counter.builder("training.runs")
                    .description("Training runs by outcome")
                    .tag("outcome", status.name().toLowerCase())
                    .register(meterRegistry));
        }
    }

    /**
     * Encola un reentrenamiento con el archivo de muestras actual.
     *
     * @param overrides ajustes opcionales sobre los hiperparámetros configurados
     */
    public CompletableFuture<TrainingOutcome> retrain(RetrainRequestDTO overrides) {
        TrainingHyperparameters hp = overrides == null ? defaults : overrides.applyTo(defaults).validate();
        if (trainingJob.isRunning()) {
            return CompletableFuture.completedFuture(record(TrainingOutcome.busy()));
        }
        return CompletableFuture.supplyAsync(() -> record(trainingJob.runOnce(hp)), worker);
    }

    @Scheduled(cron = "${health.training.cron:-}")
    public void scheduledRetrain() {
        log.info("Reentrenamiento programado");
        retrain(null);
    }

    public boolean cancel() {
        return trainingJob.cancel();
    }

    public boolean isRunning() {
        return trainingJob.isRunning();
    }

    TrainingOutcome record(TrainingOutcome outcome) {
        runs.get(outcome.status()).increment();
        return outcome;
    }

    @PreDestroy
    public void shutdown() {
        trainingJob.cancel();
        worker.shutdownNow();
    }
}
