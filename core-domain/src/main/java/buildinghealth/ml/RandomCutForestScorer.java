package buildinghealth.ml;

import buildinghealth.domain.model.ScoreDirection;
import com.amazon.randomcutforest.RandomCutForest;
import com.amazon.randomcutforest.state.RandomCutForestMapper;
import com.amazon.randomcutforest.state.RandomCutForestState;

/**
 * Random Cut Forest ya entrenado, envuelto tras {@link OutlierScorer}.
 * <p>
 * El score es el de desplazamiento de la librería: en torno a 1 o menos para puntos que
 * se parecen a la muestra, y crece cuanto más alteraría el punto la estructura de los árboles.
 * Tras el entrenamiento el bosque solo se consulta, nunca se actualiza.
 */
public final class RandomCutForestScorer implements OutlierScorer {

    public static final String ALGORITHM = "random_cut_forest";

    private final RandomCutForest forest;

    RandomCutForestScorer(RandomCutForest forest) {
        this.forest = forest;
    }

    /**
     * Reconstruye el bosque desde el estado guardado en un artefacto.
     *
     * @throws RuntimeException de la librería si el estado no es coherente.
     */
    public static RandomCutForestScorer fromState(RandomCutForestState state) {
        return new RandomCutForestScorer(mapper().toModel(state));
    }

    public RandomCutForestState toState() {
        synchronized (forest) {
            return mapper().toState(forest);
        }
    }

    // Con el estado de los árboles el bosque recargado puntúa exactamente igual.
    private static RandomCutForestMapper mapper() {
        RandomCutForestMapper mapper = new RandomCutForestMapper();
        mapper.setSaveExecutorContextEnabled(true);
        mapper.setSaveTreeStateEnabled(true);
        return mapper;
    }

    @Override
    public double score(double[] features) {
        if (features.length != forest.getDimensions()) {
            throw new IllegalArgumentException("Expected " + forest.getDimensions() + " features, got " + features.length);
        }
        // La librería no documenta que las consultas concurrentes sean seguras.
        synchronized (forest) {
            return forest.getAnomalyScore(features);
        }
    }

    public double[] scoreAll(double[][] rows) {
        double[] scores = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            scores[i] = score(rows[i]);
        }
        return scores;
    }

    @Override
    public int dimensions() {
        return forest.getDimensions();
    }

    public int numberOfTrees() {
        return forest.getNumberOfTrees();
    }

    public int sampleSize() {
        return forest.getSampleSize();
    }

    @Override
    public ScoreDirection direction() {
        return ScoreDirection.HIGHER_IS_ANOMALOUS;
    }

    @Override
    public String algorithm() {
        return ALGORITHM;
    }
}
