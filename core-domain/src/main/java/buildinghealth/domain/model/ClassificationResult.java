package buildinghealth.domain.model;

import buildinghealth.domain.sample.SampleRef;

import java.time.Instant;
import java.util.Objects;

/**
 * Resultado de puntuar un vector de características.
 * <p>
 * En modo degradado {@code score}, {@code modelVersion} y {@code threshold} son nulos y
 * {@code anomaly} es siempre {@code false}: nunca se emite una decisión inventada.
 */
public record ClassificationResult(
        SampleRef sampleRef,
        Double score,
        boolean anomaly,
        Long modelVersion,
        Double threshold,
        ResultStatus status,
        Instant classifiedAt
) {
    public ClassificationResult {
        Objects.requireNonNull(sampleRef, "sampleRef");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(classifiedAt, "classifiedAt");
    }

    public static ClassificationResult scored(SampleRef ref, double score, AnomalyModel model, Instant now) {
        Threshold threshold = model.getThreshold();
        return new ClassificationResult(ref, score, threshold.isAnomalous(score), model.getVersion(),
                threshold.value(), ResultStatus.SCORED, now);
    }

    public static ClassificationResult degraded(SampleRef ref, Instant now) {
        return new ClassificationResult(ref, null, false, null, null, ResultStatus.DEGRADED, now);
    }

    public boolean isDegraded() {
        return status == ResultStatus.DEGRADED;
    }
}
