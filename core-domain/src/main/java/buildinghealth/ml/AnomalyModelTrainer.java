package buildinghealth.ml;

import buildinghealth.config.TrainingHyperparameters;
import buildinghealth.domain.exception.InsufficientDataException;
import buildinghealth.domain.exception.SchemaMismatchException;
import buildinghealth.domain.feature.FeatureSchema;
import buildinghealth.domain.feature.FeatureVector;
import buildinghealth.domain.model.AnomalyModel;
import buildinghealth.domain.model.Threshold;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;

/**
 * Entrena un {@link AnomalyModel} completo a partir de vectores de características:
 * ajusta el bosque, puntúa con él el propio conjunto de entrenamiento y deriva el umbral
 * de esos scores.
 * Función pura: no toca el almacén de modelos ni el disco.
 */
@Slf4j
public class AnomalyModelTrainer {

    public AnomalyModel train(List<FeatureVector> vectors, FeatureSchema schema, TrainingHyperparameters hp,
                              long version, Instant trainedAt, CancellationToken token) {
        hp.validate();
        if (vectors.size() < hp.getMinTrainingSamples()) {
            throw new InsufficientDataException(vectors.size(), hp.getMinTrainingSamples());
        }

        double[][] matrix = new double[vectors.size()][];
        for (int i = 0; i < vectors.size(); i++) {
            FeatureVector v = vectors.get(i);
            if (!schema.isCompatibleWith(v.schema())) {
                throw new SchemaMismatchException(schema.names(), v.schema().names());
            }
            matrix[i] = v.toArray();
        }

        token.throwIfCancelled();
        RandomCutForestScorer forest = RandomCutForestTrainer.from(hp).fit(matrix, token);

        token.throwIfCancelled();
        double[] trainingScores = forest.scoreAll(matrix);
        Threshold threshold = ThresholdPolicy.from(hp).derive(trainingScores, forest.direction());

        log.info("Modelo v{} entrenado con {} vectores: umbral {} ({})",
                version, vectors.size(), String.format("%.4f", threshold.value()), threshold.policy());

        return AnomalyModel.builder()
                .version(version)
                .trainedAt(trainedAt)
                .featureSchema(schema)
                .threshold(threshold)
                .scorer(forest)
                .hyperparameters(hp)
                .trainingSampleCount(vectors.size())
                .build();
    }
}
