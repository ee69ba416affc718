package buildinghealth.engine.service;

import buildinghealth.domain.dto.sample.IngestResponseDTO;
import buildinghealth.domain.dto.sample.IngestStatus;
import buildinghealth.domain.exception.AnomalyDetectionException;
import buildinghealth.domain.sample.Sample;
import buildinghealth.engine.config.MonitorProperties;
import buildinghealth.simulation.SyntheticSampleGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Productor de lecturas simuladas dentro del propio proceso, para demos.
 * Con probabilidad {@code health.simulator.anomaly-probability} genera una lectura anómala.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "health.simulator", name = "enabled", havingValue = "true")
public class SensorSimulator {

    private final IngestionService ingestionService;
    private final SyntheticSampleGenerator generator;
    private final MonitorProperties.Simulator config;
    private final Clock clock;

    public SensorSimulator(IngestionService ingestionService, MonitorProperties properties, Clock clock) {
        this.ingestionService = ingestionService;
        this.config = properties.getSimulator();
        this.generator = SyntheticSampleGenerator.forMetrics(System.nanoTime(), properties.getStream().getMetrics());
        this.clock = clock;
        log.info("Simulador de sensores activo: una lectura cada {} ms, P(anomalía)={}",
                config.getIntervalMs(), config.getAnomalyProbability());
    }

    @Scheduled(fixedDelayString = "${health.simulator.interval-ms:1000}")
    public void tick() {
        Sample sample = generator.next(clock.instant(), config.getSourceId(), config.getAnomalyProbability());
        try {
            IngestResponseDTO response = ingestionService.ingest(sample);
            if (response.status() == IngestStatus.SCORED) {
                log.debug("Simulada {} -> {}", sample.metricValues(), response.message());
            }
        } catch (AnomalyDetectionException e) {
            log.warn("Lectura simulada rechazada: {}", e.getMessage());
        }
    }
}
