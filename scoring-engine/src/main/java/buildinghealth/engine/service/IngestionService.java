package buildinghealth.engine.service;

import buildinghealth.domain.dto.sample.IngestResponseDTO;
import buildinghealth.domain.dto.sample.IngestStatus;
import buildinghealth.domain.dto.sample.SampleRequestDTO;
import buildinghealth.domain.exception.InvalidSampleException;
import buildinghealth.domain.model.ClassificationResult;
import buildinghealth.domain.sample.Sample;
import buildinghealth.engine.scoring.ScoringEngine;
import buildinghealth.engine.training.SampleArchive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Puerta de entrada de las muestras: las pasa al motor y guarda las aceptadas para reentrenar.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    private final ScoringEngine scoringEngine;
    private final SampleArchive sampleArchive;
    private final Clock clock;

    public IngestResponseDTO ingest(SampleRequestDTO request) {
        return ingest(request.toSample(clock.instant()));
    }

    public IngestResponseDTO ingest(Sample sample) {
        Optional<ClassificationResult> result = scoringEngine.ingest(sample);
        sampleArchive.add(sample);
        return result.map(r -> toResponse(sample, r)).orElseGet(() -> IngestResponseDTO.builder()
                .status(IngestStatus.WARMING_UP)
                .anomaly(false)
                .sourceId(sample.sourceId())
                .timestamp(sample.timestamp())
                .message("Feature window warming up")
                .build());
    }

    /**
     * Formato plano heredado: {@code {"temperature": 22.1, "humidity": 51.0, ...}}.
     * Todas las métricas configuradas son obligatorias y numéricas; la hora la pone el servidor.
     *
     * @throws InvalidSampleException si el cuerpo está vacío, falta alguna métrica o no es numérica.
     */
    public IngestResponseDTO ingestLegacy(Map<String, Object> body) {
        if (body == null || body.isEmpty()) {
            throw new InvalidSampleException("No JSON data received");
        }
        List<String> required = scoringEngine.windows().config().getMetrics();
        List<String> missing = new ArrayList<>();
        Map<String, Double> values = new LinkedHashMap<>();
        for (String metric : required) {
            Object raw = body.get(metric);
            if (raw == null) {
                missing.add(metric);
            } else if (raw instanceof Number number) {
                values.put(metric, number.doubleValue());
            } else {
                throw new InvalidSampleException("Field '" + metric + "' must be numeric");
            }
        }
        if (!missing.isEmpty()) {
            throw new InvalidSampleException("Missing required sensor data fields: " + missing);
        }
        Object sourceId = body.get("source_id");
        return ingest(new Sample(clock.instant(), values, sourceId == null ? null : sourceId.toString()));
    }

    private IngestResponseDTO toResponse(Sample sample, ClassificationResult result) {
        if (result.isDegraded()) {
            return IngestResponseDTO.builder()
                    .status(IngestStatus.DEGRADED)
                    .anomaly(false)
                    .sourceId(sample.sourceId())
                    .timestamp(sample.timestamp())
                    .message("Model not loaded")
                    .build();
        }
        return IngestResponseDTO.builder()
                .status(IngestStatus.SCORED)
                .anomaly(result.anomaly())
                .score(result.score())
                .threshold(result.threshold())
                .modelVersion(result.modelVersion())
                .sourceId(sample.sourceId())
                .timestamp(sample.timestamp())
                .message(result.anomaly() ? "Detected" : "Normal")
                .build();
    }
}
