package buildinghealth.engine.scoring;

import buildinghealth.domain.model.ClassificationResult;
import buildinghealth.domain.sample.Sample;

/**
 * Consumidor de resultados clasificados. Se invoca en el hilo de ingesta con el flujo
 * bloqueado, así que no debe hacer E/S: lo que sea lento se delega en un executor.
 */
@FunctionalInterface
public interface ResultListener {

    void onResult(Sample sample, ClassificationResult result);
}
