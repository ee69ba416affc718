package buildinghealth.engine.config;

import buildinghealth.config.FeatureWindowConfig;
import buildinghealth.config.TrainingHyperparameters;
import buildinghealth.engine.metrics.ScoringMetricsBinder;
import buildinghealth.engine.model.FileModelArtifactRepository;
import buildinghealth.engine.model.ModelArtifactRepository;
import buildinghealth.engine.model.ModelStore;
import buildinghealth.engine.scoring.FeatureWindowRegistry;
import buildinghealth.engine.scoring.RecentResultsBuffer;
import buildinghealth.engine.scoring.ResultListener;
import buildinghealth.engine.scoring.ScoringEngine;
import buildinghealth.engine.training.SampleArchive;
import buildinghealth.engine.training.TrainingJob;
import buildinghealth.io.JsonFileHandler;
import buildinghealth.ml.AnomalyModelTrainer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Cableado del motor. Un único {@link ModelStore} por proceso, inyectado donde haga falta.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(MonitorProperties.class)
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JsonFileHandler jsonFileHandler() {
        return new JsonFileHandler();
    }

    @Bean
    public ModelArtifactRepository modelArtifactRepository(MonitorProperties properties, JsonFileHandler jsonFileHandler) {
        return new FileModelArtifactRepository(Path.of(properties.getModel().getArtifactPath()), jsonFileHandler);
    }

    @Bean
    public ModelStore modelStore(ModelArtifactRepository repository) {
        return new ModelStore(repository);
    }

    @Bean
    public FeatureWindowConfig featureWindowConfig(MonitorProperties properties) {
        FeatureWindowConfig config = properties.toWindowConfig();
        log.info("Ventana de características: métricas {}, tamaño {}, agregación {}",
                config.getMetrics(), config.getWindowSize(), config.getAggregation());
        return config;
    }

    @Bean
    public TrainingHyperparameters trainingHyperparameters(MonitorProperties properties) {
        return properties.toHyperparameters();
    }

    @Bean
    public FeatureWindowRegistry featureWindowRegistry(FeatureWindowConfig featureWindowConfig) {
        return new FeatureWindowRegistry(featureWindowConfig);
    }

    @Bean
    public RecentResultsBuffer recentResultsBuffer(MonitorProperties properties) {
        return new RecentResultsBuffer(properties.getFeed().getRecentCapacity());
    }

    @Bean
    public ScoringEngine scoringEngine(ModelStore modelStore, FeatureWindowRegistry registry,
                                       List<ResultListener> listeners, Clock clock) {
        return new ScoringEngine(modelStore, registry, listeners, clock);
    }

    @Bean
    public SampleArchive sampleArchive(MonitorProperties properties) {
        return new SampleArchive(properties.getTraining().getArchiveCapacity());
    }

    @Bean
    public TrainingJob trainingJob(ModelStore modelStore, FeatureWindowConfig featureWindowConfig,
                                   SampleArchive sampleArchive, Clock clock) {
        return new TrainingJob(modelStore, featureWindowConfig, sampleArchive, new AnomalyModelTrainer(), clock);
    }

    @Bean
    public ScoringMetricsBinder scoringMetricsBinder(ScoringEngine scoringEngine, ModelStore modelStore,
                                                     RecentResultsBuffer recentResultsBuffer) {
        return new ScoringMetricsBinder(scoringEngine.stats(), modelStore, recentResultsBuffer);
    }

    @Bean(name = "alertExecutor", destroyMethod = "shutdown")
    public ExecutorService alertExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "alert-writer");
            t.setDaemon(true);
            return t;
        });
    }
}
