package buildinghealth.domain.dto.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrainingOutcomeDTO(
        String status,
        int exitCode,
        Long modelVersion,
        Integer trainingSampleCount,
        Double threshold,
        String message,
        long durationMs
) {}
