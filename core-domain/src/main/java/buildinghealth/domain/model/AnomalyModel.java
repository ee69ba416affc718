package buildinghealth.domain.model;

import buildinghealth.config.TrainingHyperparameters;
import buildinghealth.domain.exception.SchemaMismatchException;
import buildinghealth.domain.feature.FeatureSchema;
import buildinghealth.domain.feature.FeatureVector;
import buildinghealth.ml.OutlierScorer;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;

/**
 * Modelo entrenado e inmutable: scorer, umbral y esquema de características con el que se entrenó.
 * <p>
 * Una vez publicado en el almacén de modelos no cambia; un reentrenamiento produce una
 * instancia nueva con versión mayor.
 */
@Getter
@ToString(exclude = "scorer")
public class AnomalyModel {

    private final long version;
    private final Instant trainedAt;
    private final FeatureSchema featureSchema;
    private final Threshold threshold;
    private final OutlierScorer scorer;
    private final TrainingHyperparameters hyperparameters;
    private final int trainingSampleCount;

    @Builder(toBuilder = true)
    private AnomalyModel(long version, Instant trainedAt, FeatureSchema featureSchema, Threshold threshold,
                         OutlierScorer scorer, TrainingHyperparameters hyperparameters, int trainingSampleCount) {
        this.version = version;
        this.trainedAt = Objects.requireNonNull(trainedAt, "trainedAt");
        this.featureSchema = Objects.requireNonNull(featureSchema, "featureSchema");
        this.threshold = Objects.requireNonNull(threshold, "threshold");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.hyperparameters = hyperparameters == null ? TrainingHyperparameters.defaults() : hyperparameters;
        this.trainingSampleCount = trainingSampleCount;

        if (scorer.dimensions() != featureSchema.size()) {
            throw new IllegalArgumentException(String.format(
                    "Scorer expects %d features but schema declares %d", scorer.dimensions(), featureSchema.size()));
        }
        if (scorer.direction() != threshold.direction()) {
            throw new IllegalArgumentException("Threshold direction " + threshold.direction()
                    + " does not match scorer direction " + scorer.direction());
        }
    }

    /**
     * Puntúa un vector. Lanza {@link SchemaMismatchException} si el vector no se construyó
     * con el mismo esquema (nombres, orden y longitud) que el modelo.
     */
    public double score(FeatureVector vector) {
        if (!featureSchema.isCompatibleWith(vector.schema())) {
            throw new SchemaMismatchException(featureSchema.names(), vector.schema().names());
        }
        return scorer.score(vector.toArray());
    }

    public boolean isAnomalous(double score) {
        return threshold.isAnomalous(score);
    }

    public AnomalyModel withVersion(long newVersion) {
        return toBuilder().version(newVersion).build();
    }
}
