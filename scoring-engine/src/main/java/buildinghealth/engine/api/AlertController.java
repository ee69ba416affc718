package buildinghealth.engine.api;

import buildinghealth.config.ApiRoutes;
import buildinghealth.domain.dto.PaginatedResponse;
import buildinghealth.domain.dto.alert.AlertDTO;
import buildinghealth.domain.dto.alert.AlertStatus;
import buildinghealth.domain.exception.ResourceNotFoundException;
import buildinghealth.engine.entity.AlertEntity;
import buildinghealth.engine.repository.AlertRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@RestController
@RequestMapping(ApiRoutes.ALERTS)
@RequiredArgsConstructor
@Tag(name = "Alertas", description = "Alertas generadas por las anomalías detectadas")
public class AlertController {

    private final AlertRepository alertRepository;

    @GetMapping
    @Operation(summary = "Obtener alertas paginadas por fecha")
    public PaginatedResponse<AlertDTO> getAlerts(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime end,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "10") int size) {

        if (start == null)
            start = LocalDateTime.now().minusMonths(1);
        if (end == null)
            end = LocalDateTime.now();

        log.debug("Buscando alertas entre {} y {} (página {})", start, end, page);

        Page<AlertDTO> dtoPage = alertRepository.findByTimestampBetween(start, end,
                        PageRequest.of(page, size, Sort.by("timestamp").descending()))
                .map(AlertController::toDTO);

        return new PaginatedResponse<>(
                dtoPage.getContent(),
                dtoPage.getNumber(),
                dtoPage.getSize(),
                dtoPage.getTotalElements(),
                dtoPage.getTotalPages(),
                dtoPage.isLast(),
                dtoPage.isFirst(),
                dtoPage.isEmpty());
    }

    @GetMapping("/active")
    @Operation(summary = "Obtener alertas activas (NEW y ACKNOWLEDGED)")
    public List<AlertDTO> getActiveAlerts() {
        return alertRepository.findByStatusIn(List.of(AlertStatus.NEW, AlertStatus.ACKNOWLEDGED)).stream()
                .map(AlertController::toDTO)
                .toList();
    }

    @PostMapping("/{id}/ack")
    @Operation(summary = "Reconocer (Acknowledge) una alerta")
    @Transactional
    public AlertDTO acknowledgeAlert(@PathVariable String id) {
        return toDTO(transition(id, AlertStatus.ACKNOWLEDGED));
    }

    @PostMapping("/{id}/resolve")
    @Operation(summary = "Resolver una alerta")
    @Transactional
    public AlertDTO resolveAlert(@PathVariable String id) {
        return toDTO(transition(id, AlertStatus.RESOLVED));
    }

    private AlertEntity transition(String id, AlertStatus target) {
        AlertEntity alert = alertRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Alert not found: " + id));
        log.info("Alerta {} pasa de {} a {}", id, alert.getStatus(), target);
        alert.setStatus(target);
        return alertRepository.save(alert);
    }

    static AlertDTO toDTO(AlertEntity entity) {
        return new AlertDTO(
                entity.getId(),
                entity.getSourceId(),
                entity.getSeverity(),
                entity.getStatus(),
                entity.getMessage(),
                entity.getTimestamp(),
                entity.getSampleTimestamp(),
                entity.getScore(),
                entity.getThreshold(),
                entity.getModelVersion(),
                entity.getMetrics());
    }
}
