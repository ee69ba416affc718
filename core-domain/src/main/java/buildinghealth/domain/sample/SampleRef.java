package buildinghealth.domain.sample;

import java.time.Instant;

/**
 * Referencia ligera a la muestra que originó un resultado (flujo + instante).
 */
public record SampleRef(String sourceId, Instant timestamp) {
}
