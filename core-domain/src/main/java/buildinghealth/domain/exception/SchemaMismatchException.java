package buildinghealth.domain.exception;

import java.util.List;

/**
 * El vector de características (o la muestra) no coincide con el esquema esperado.
 * Error de configuración: la muestra se descarta, nunca se "arregla" en silencio.
 */
public class SchemaMismatchException extends AnomalyDetectionException {

    public SchemaMismatchException(String message) {
        super(message);
    }

    public SchemaMismatchException(List<String> expected, List<String> actual) {
        super(String.format("Feature schema mismatch: expected %s (%d) but got %s (%d)",
                expected, expected.size(), actual, actual.size()));
    }
}
