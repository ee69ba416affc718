package buildinghealth.engine.service;

import buildinghealth.config.TrainingHyperparameters;
import buildinghealth.domain.sample.Sample;
import buildinghealth.engine.config.MonitorProperties;
import buildinghealth.engine.model.ModelStore;
import buildinghealth.engine.training.TrainingJob;
import buildinghealth.engine.training.TrainingOutcome;
import buildinghealth.simulation.SyntheticSampleGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Arranque del modelo: carga el artefacto y, si no hay ninguno válido, entrena uno inicial
 * con lecturas sintéticas normales para no quedarse en modo degradado.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class ModelBootstrap implements ApplicationRunner {

    private final ModelStore modelStore;
    private final TrainingJob trainingJob;
    private final TrainingHyperparameters defaults;
    private final MonitorProperties properties;
    private final Clock clock;

    @Override
    public void run(ApplicationArguments args) {
        log.info(">>> BOOTSTRAP: cargando modelo desde {}", modelStore.artifactLocation());
        if (modelStore.loadOnStartup()) {
            return;
        }
        MonitorProperties.Training training = properties.getTraining();
        if (training.isRunOnce() || !training.isBootstrapSynthetic()) {
            log.warn(">>> BOOTSTRAP: sin modelo; la ingesta devolverá resultados DEGRADED hasta el primer entrenamiento");
            return;
        }

        log.info(">>> BOOTSTRAP: entrenando modelo inicial con {} lecturas sintéticas", training.getBootstrapSampleCount());
        List<Sample> synthetic = syntheticBatch();
        TrainingOutcome outcome = trainingJob.run(synthetic, defaults);
        if (outcome.exitCode() == 0) {
            log.info(">>> BOOTSTRAP: {}", outcome.message());
        } else {
            log.error(">>> BOOTSTRAP: el entrenamiento inicial terminó en {}: {}", outcome.status(), outcome.message());
        }
    }

    List<Sample> syntheticBatch() {
        MonitorProperties.Training training = properties.getTraining();
        return SyntheticSampleGenerator.forMetrics(training.getSeed(), properties.getStream().getMetrics())
                .normalBatch(training.getBootstrapSampleCount(), clock.instant(), Sample.DEFAULT_SOURCE);
    }
}
