package buildinghealth.engine.config;

import buildinghealth.config.FeatureWindowConfig;
import buildinghealth.config.TrainingHyperparameters;
import buildinghealth.domain.feature.WindowAggregation;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuración del monitor bajo el prefijo {@code health.*}.
 */
@ConfigurationProperties(prefix = "health")
@NoArgsConstructor
@Getter
@Setter
public class MonitorProperties {

    private Stream stream = new Stream();
    private Model model = new Model();
    private Training training = new Training();
    private Feed feed = new Feed();
    private Simulator simulator = new Simulator();

    @Getter
    @Setter
    public static class Stream {
        /** Métricas que forman el vector, en orden. */
        private List<String> metrics = new ArrayList<>(List.of("temperature", "humidity", "pressure", "vibration"));
        private int windowSize = 1;
        private WindowAggregation aggregation = WindowAggregation.LAST;
    }

    @Getter
    @Setter
    public static class Model {
        private String artifactPath = "data/model.json";
    }

    @Getter
    @Setter
    public static class Training {
        private int numTrees = 100;
        private int subsampleSize = 256;
        private long seed = 42L;
        private double contamination = 0.01;
        private String thresholdPolicy = TrainingHyperparameters.POLICY_CONTAMINATION;
        private double fixedThreshold = 1.5;
        private int minTrainingSamples = 50;
        /** Muestras recientes que se guardan para reentrenar. */
        private int archiveCapacity = 5000;
        /** Entrenar con datos sintéticos si no hay artefacto al arrancar. */
        private boolean bootstrapSynthetic = true;
        private int bootstrapSampleCount = 1000;
        /** Entrenar una vez y salir con el código del resultado. */
        private boolean runOnce = false;
        /** Dataset JSON opcional para el modo run-once. */
        private String datasetPath;
        private String cron = "-";
    }

    @Getter
    @Setter
    public static class Feed {
        private int recentCapacity = 100;
        /** Margen sobre el umbral a partir del cual una alerta es CRITICAL. */
        private double criticalMargin = 0.1;
    }

    @Getter
    @Setter
    public static class Simulator {
        private boolean enabled = false;
        private long intervalMs = 1000;
        private double anomalyProbability = 0.15;
        private String sourceId = "simulator";
    }

    public FeatureWindowConfig toWindowConfig() {
        return FeatureWindowConfig.builder()
                .metrics(stream.getMetrics())
                .windowSize(stream.getWindowSize())
                .aggregation(stream.getAggregation())
                .build();
    }

    public TrainingHyperparameters toHyperparameters() {
        return TrainingHyperparameters.builder()
                .numTrees(training.getNumTrees())
                .subsampleSize(training.getSubsampleSize())
                .seed(training.getSeed())
                .contamination(training.getContamination())
                .thresholdPolicy(training.getThresholdPolicy())
                .fixedThreshold(training.getFixedThreshold())
                .minTrainingSamples(training.getMinTrainingSamples())
                .build()
                .validate();
    }
}
