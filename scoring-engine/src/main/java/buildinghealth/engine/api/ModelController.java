package buildinghealth.engine.api;

import buildinghealth.config.ApiRoutes;
import buildinghealth.domain.dto.model.ModelInfoDTO;
import buildinghealth.domain.dto.model.RetrainRequestDTO;
import buildinghealth.domain.dto.model.TrainingOutcomeDTO;
import buildinghealth.engine.model.ModelStore;
import buildinghealth.engine.service.RetrainService;
import buildinghealth.engine.training.TrainingOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Modelos", description = "Estado del modelo activo y reentrenamiento")
public class ModelController {

    public static final String RETRAIN = ApiRoutes.ADMIN + "/retrain";

    private final ModelStore modelStore;
    private final RetrainService retrainService;

    @GetMapping(ApiRoutes.MODELS + "/current")
    @Operation(summary = "Metadatos del modelo activo o estado degradado")
    public ModelInfoDTO getCurrentModel() {
        return modelStore.current()
                .map(ModelInfoDTO::of)
                .orElseGet(() -> ModelInfoDTO.degraded(modelStore.lastLoadError()));
    }

    @PostMapping(RETRAIN)
    @Operation(summary = "Reentrenar con las muestras archivadas y publicar el nuevo modelo")
    public ResponseEntity<TrainingOutcomeDTO> retrain(@Valid @RequestBody(required = false) RetrainRequestDTO overrides) {
        log.info("Reentrenamiento manual solicitado");
        TrainingOutcome outcome = retrainService.retrain(overrides).join();
        return ResponseEntity.status(statusFor(outcome)).body(outcome.toDTO());
    }

    @DeleteMapping(RETRAIN)
    @Operation(summary = "Cancelar el reentrenamiento en curso")
    public ResponseEntity<Map<String, Object>> cancel() {
        boolean cancelled = retrainService.cancel();
        return ResponseEntity.status(cancelled ? HttpStatus.ACCEPTED : HttpStatus.NOT_FOUND)
                .body(Map.of("cancelled", cancelled));
    }

    private static HttpStatus statusFor(TrainingOutcome outcome) {
        return switch (outcome.status()) {
            case SUCCESS -> HttpStatus.OK;
            case INSUFFICIENT_DATA, BUSY, CANCELLED -> HttpStatus.CONFLICT;
            case FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
