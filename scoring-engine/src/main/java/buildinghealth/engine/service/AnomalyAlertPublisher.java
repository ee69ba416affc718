package buildinghealth.engine.service;

import buildinghealth.domain.dto.alert.AlertSeverity;
import buildinghealth.domain.dto.alert.AlertStatus;
import buildinghealth.domain.model.ClassificationResult;
import buildinghealth.domain.sample.Sample;
import buildinghealth.engine.config.MonitorProperties;
import buildinghealth.engine.entity.AlertEntity;
import buildinghealth.engine.repository.AlertRepository;
import buildinghealth.engine.scoring.ResultListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.concurrent.Executor;

/**
 * Convierte cada anomalía en una alerta persistida. La escritura en base de datos se hace
 * en un executor propio para no bloquear la ingesta.
 */
@Slf4j
@Component
public class AnomalyAlertPublisher implements ResultListener {

    private final AlertRepository alertRepository;
    private final Executor alertExecutor;
    private final double criticalMargin;

    public AnomalyAlertPublisher(AlertRepository alertRepository,
                                 @Qualifier("alertExecutor") Executor alertExecutor,
                                 MonitorProperties properties) {
        this.alertRepository = alertRepository;
        this.alertExecutor = alertExecutor;
        this.criticalMargin = properties.getFeed().getCriticalMargin();
    }

    @Override
    public void onResult(Sample sample, ClassificationResult result) {
        if (!result.anomaly()) {
            return;
        }
        AlertEntity alert = buildAlert(sample, result);
        alertExecutor.execute(() -> {
            try {
                alertRepository.save(alert);
                log.debug("Alerta {} guardada para '{}'", alert.getSeverity(), alert.getSourceId());
            } catch (RuntimeException e) {
                log.error("No se pudo guardar la alerta de '{}' @ {}", alert.getSourceId(), alert.getSampleTimestamp(), e);
            }
        });
    }

    AlertEntity buildAlert(Sample sample, ClassificationResult result) {
        double score = result.score();
        double threshold = result.threshold();
        AlertSeverity severity = score - threshold > criticalMargin ? AlertSeverity.CRITICAL : AlertSeverity.WARNING;
        return AlertEntity.builder()
                .sourceId(sample.sourceId())
                .timestamp(LocalDateTime.now())
                .sampleTimestamp(sample.timestamp())
                .severity(severity)
                .status(AlertStatus.NEW)
                .message(String.format("Anomalía detectada: score %.4f supera el umbral %.4f (modelo v%d)",
                        score, threshold, result.modelVersion()))
                .score(score)
                .threshold(threshold)
                .modelVersion(result.modelVersion())
                .metrics(sample.metricValues())
                .build();
    }
}
