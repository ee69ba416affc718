package buildinghealth.engine.scoring;

import buildinghealth.domain.feature.FeatureWindow;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Ventana de un flujo junto con el cerrojo justo que ordena sus escritores.
 */
public record StreamChannel(String sourceId, FeatureWindow window, ReentrantLock lock) {

    public static StreamChannel open(String sourceId, FeatureWindow window) {
        return new StreamChannel(sourceId, window, new ReentrantLock(true));
    }
}
