package buildinghealth.engine.api;

import buildinghealth.config.ApiRoutes;
import buildinghealth.domain.dto.sample.IngestResponseDTO;
import buildinghealth.domain.dto.sample.SampleRequestDTO;
import buildinghealth.engine.service.IngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "Ingesta", description = "Entrada de lecturas de sensores y puntuación en línea")
public class SampleController {

    private final IngestionService ingestionService;

    @PostMapping(ApiRoutes.SAMPLES)
    @Operation(summary = "Ingerir una lectura multimétrica y devolver su clasificación")
    public IngestResponseDTO ingest(@Valid @RequestBody SampleRequestDTO request) {
        return ingestionService.ingest(request);
    }

    /**
     * Ruta heredada de los primeros simuladores: cuerpo plano con una clave por métrica.
     */
    @PostMapping(ApiRoutes.LEGACY_SENSOR_DATA)
    @Operation(summary = "Ingesta en formato plano heredado", deprecated = true)
    public Map<String, Object> ingestLegacy(@RequestBody(required = false) Map<String, Object> body) {
        IngestResponseDTO response = ingestionService.ingestLegacy(body);
        Map<String, Object> legacy = new LinkedHashMap<>();
        legacy.put("status", "success");
        legacy.put("message", "Data received and processed");
        legacy.put("is_anomaly", response.anomaly());
        legacy.put("detection", response.status().name());
        return legacy;
    }
}
