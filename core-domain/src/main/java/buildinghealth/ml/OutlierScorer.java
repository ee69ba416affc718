package buildinghealth.ml;

import buildinghealth.domain.model.ScoreDirection;

/**
 * Función de puntuación de un modelo ya entrenado.
 * Implementaciones inmutables y seguras para lectura concurrente.
 */
public interface OutlierScorer {

    /**
     * @param features vector de longitud {@link #dimensions()}
     * @return score de anomalía; su interpretación depende de {@link #direction()}
     */
    double score(double[] features);

    int dimensions();

    ScoreDirection direction();

    String algorithm();
}
