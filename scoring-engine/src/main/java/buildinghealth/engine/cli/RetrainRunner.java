package buildinghealth.engine.cli;

import buildinghealth.config.TrainingHyperparameters;
import buildinghealth.domain.sample.Sample;
import buildinghealth.engine.config.MonitorProperties;
import buildinghealth.engine.training.SampleArchive;
import buildinghealth.engine.training.TrainingJob;
import buildinghealth.engine.training.TrainingOutcome;
import buildinghealth.engine.training.TrainingStatus;
import buildinghealth.io.JsonFileHandler;
import buildinghealth.simulation.SyntheticSampleGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Modo "entrenar y salir" para el pipeline de CI:
 * {@code java -jar scoring-engine.jar --health.training.run-once=true [--health.training.dataset-path=...]}.
 * <p>
 * El proceso termina con el código de salida del resultado (0 éxito, 1 fallo, 2 datos insuficientes,
 * 3 cancelado, 4 ocupado).
 */
@Slf4j
@Component
@Order(2)
@ConditionalOnProperty(prefix = "health.training", name = "run-once", havingValue = "true")
@RequiredArgsConstructor
public class RetrainRunner implements ApplicationRunner {

    private static final TypeReference<List<Sample>> SAMPLE_LIST = new TypeReference<>() {};

    private final TrainingJob trainingJob;
    private final TrainingHyperparameters defaults;
    private final SampleArchive sampleArchive;
    private final MonitorProperties properties;
    private final JsonFileHandler jsonFileHandler;
    private final ApplicationContext context;
    private final Clock clock;

    @Override
    public void run(ApplicationArguments args) {
        int exitCode = execute().exitCode();
        log.info(">>> RUN-ONCE: saliendo con código {}", exitCode);
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }

    /**
     * Entrena una vez y devuelve el resultado sin terminar el proceso.
     */
    public TrainingOutcome execute() {
        List<Sample> samples;
        try {
            samples = trainingSamples();
        } catch (IOException e) {
            log.error(">>> RUN-ONCE: no se pudo leer el dataset de entrenamiento", e);
            return TrainingOutcome.of(TrainingStatus.FAILED, "Cannot read dataset: " + e.getMessage(),
                    Duration.ZERO);
        } catch (IllegalArgumentException e) {
            log.error(">>> RUN-ONCE: configuración de métricas inválida: {}", e.getMessage());
            return TrainingOutcome.of(TrainingStatus.FAILED, "Invalid metric configuration: " + e.getMessage(),
                    Duration.ZERO);
        }
        TrainingOutcome outcome = trainingJob.run(samples, defaults);
        log.info(">>> RUN-ONCE: {} ({})", outcome.status(), outcome.message());
        return outcome;
    }

    List<Sample> trainingSamples() throws IOException {
        MonitorProperties.Training training = properties.getTraining();
        if (training.getDatasetPath() != null && !training.getDatasetPath().isBlank()) {
            List<Sample> samples = jsonFileHandler.readFromFile(Path.of(training.getDatasetPath()), SAMPLE_LIST);
            if (samples == null) {
                throw new IOException("Dataset " + training.getDatasetPath() + " does not contain a sample list");
            }
            log.info(">>> RUN-ONCE: {} muestras leídas de {}", samples.size(), training.getDatasetPath());
            return samples;
        }
        List<Sample> archived = sampleArchive.snapshot();
        if (!archived.isEmpty() || !training.isBootstrapSynthetic()) {
            return archived;
        }
        log.info(">>> RUN-ONCE: sin dataset; generando {} lecturas sintéticas", training.getBootstrapSampleCount());
        return SyntheticSampleGenerator.forMetrics(training.getSeed(), properties.getStream().getMetrics())
                .normalBatch(training.getBootstrapSampleCount(), clock.instant(), Sample.DEFAULT_SOURCE);
    }
}
