package buildinghealth.domain.model;

import buildinghealth.config.TrainingHyperparameters;
import buildinghealth.domain.exception.CorruptArtifactException;
import buildinghealth.domain.feature.FeatureSchema;
import buildinghealth.ml.RandomCutForestScorer;
import com.amazon.randomcutforest.state.RandomCutForestState;

import java.time.Instant;
import java.util.List;

/**
 * Representación serializable de un {@link AnomalyModel}. Es lo que se escribe en disco.
 * <p>
 * Guarda todo lo necesario para puntuar sin reentrenar: esquema, umbral, hiperparámetros y
 * el estado completo del bosque tal como lo exporta {@code RandomCutForestMapper}.
 */
public record ModelArtifact(
        int formatVersion,
        long version,
        Instant trainedAt,
        String algorithm,
        List<String> featureSchema,
        Threshold threshold,
        TrainingHyperparameters hyperparameters,
        int trainingSampleCount,
        RandomCutForestState forest
) {
    public static final int CURRENT_FORMAT = 2;

    public static ModelArtifact from(AnomalyModel model) {
        if (!(model.getScorer() instanceof RandomCutForestScorer forest)) {
            throw new IllegalArgumentException("Unsupported scorer for persistence: " + model.getScorer().algorithm());
        }
        return new ModelArtifact(
                CURRENT_FORMAT,
                model.getVersion(),
                model.getTrainedAt(),
                forest.algorithm(),
                model.getFeatureSchema().names(),
                model.getThreshold(),
                model.getHyperparameters(),
                model.getTrainingSampleCount(),
                forest.toState());
    }

    /**
     * Reconstruye el modelo comprobando la coherencia interna del artefacto.
     *
     * @throws CorruptArtifactException si falta algún campo o el estado del bosque no cuadra.
     */
    public AnomalyModel toModel() {
        if (formatVersion != CURRENT_FORMAT) {
            throw new CorruptArtifactException("Unsupported artifact format " + formatVersion);
        }
        if (forest == null || threshold == null || trainedAt == null || featureSchema == null || featureSchema.isEmpty()) {
            throw new CorruptArtifactException("Model artifact v" + version + " is incomplete");
        }
        if (!RandomCutForestScorer.ALGORITHM.equals(algorithm)) {
            throw new CorruptArtifactException("Unknown algorithm '" + algorithm + "'");
        }
        if (forest.getDimensions() != featureSchema.size()) {
            throw new CorruptArtifactException(String.format(
                    "Forest dimensions (%d) do not match feature schema %s", forest.getDimensions(), featureSchema));
        }
        RandomCutForestScorer scorer;
        try {
            scorer = RandomCutForestScorer.fromState(forest);
        } catch (RuntimeException e) {
            throw new CorruptArtifactException("Forest state of model v" + version + " cannot be restored: " + e.getMessage(), e);
        }
        try {
            return AnomalyModel.builder()
                    .version(version)
                    .trainedAt(trainedAt)
                    .featureSchema(new FeatureSchema(featureSchema))
                    .threshold(threshold)
                    .scorer(scorer)
                    .hyperparameters(hyperparameters)
                    .trainingSampleCount(trainingSampleCount)
                    .build();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new CorruptArtifactException("Model artifact v" + version + " is inconsistent: " + e.getMessage(), e);
        }
    }
}
