package buildinghealth.ml;

import buildinghealth.config.TrainingHyperparameters;
import com.amazon.randomcutforest.RandomCutForest;
import lombok.extern.slf4j.Slf4j;

/**
 * Ajusta un Random Cut Forest sobre una matriz de entrenamiento.
 * <p>
 * Determinista: ejecución secuencial y semilla fija, así que los mismos datos dan el mismo
 * bosque. Consulta el {@link CancellationToken} cada {@value #CANCELLATION_CHECK_INTERVAL} puntos.
 */
@Slf4j
public class RandomCutForestTrainer {

    static final int CANCELLATION_CHECK_INTERVAL = 64;

    private final int numberOfTrees;
    private final int sampleSize;
    private final long seed;

    public RandomCutForestTrainer(int numberOfTrees, int sampleSize, long seed) {
        if (numberOfTrees < 1) throw new IllegalArgumentException("numberOfTrees must be >= 1");
        if (sampleSize < 2) throw new IllegalArgumentException("sampleSize must be >= 2");
        this.numberOfTrees = numberOfTrees;
        this.sampleSize = sampleSize;
        this.seed = seed;
    }

    public static RandomCutForestTrainer from(TrainingHyperparameters hp) {
        return new RandomCutForestTrainer(hp.getNumTrees(), hp.getSubsampleSize(), hp.getSeed());
    }

    /**
     * Inserta cada fila de {@code data} (filas = muestras, columnas = características) en el bosque.
     */
    public RandomCutForestScorer fit(double[][] data, CancellationToken token) {
        if (data.length < 2) {
            throw new IllegalArgumentException("Random Cut Forest needs at least 2 rows, got " + data.length);
        }
        int dimensions = data[0].length;
        for (double[] row : data) {
            if (row.length != dimensions) {
                throw new IllegalArgumentException("Ragged training matrix: expected " + dimensions + " columns");
            }
        }

        log.debug("Entrenando Random Cut Forest: {} árboles, sampleSize={}, {} filas x {} columnas",
                numberOfTrees, sampleSize, data.length, dimensions);

        RandomCutForest forest = RandomCutForest
                .builder()
                .dimensions(dimensions)
                .numberOfTrees(numberOfTrees)
                .sampleSize(sampleSize)
                .outputAfter(1)
                .randomSeed(seed)
                .parallelExecutionEnabled(false)
                .build();
        for (int i = 0; i < data.length; i++) {
            if (i % CANCELLATION_CHECK_INTERVAL == 0) {
                token.throwIfCancelled();
            }
            forest.update(data[i]);
        }
        return new RandomCutForestScorer(forest);
    }
}
