package buildinghealth.engine.scoring;

import buildinghealth.config.FeatureWindowConfig;
import buildinghealth.domain.feature.FeatureSchema;
import buildinghealth.domain.feature.FeatureWindow;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Una ventana por {@code sourceId}, creada la primera vez que llega una muestra de ese flujo.
 */
@Slf4j
public class FeatureWindowRegistry {

    private final FeatureWindowConfig config;
    private final FeatureSchema schema;
    private final Map<String, StreamChannel> channels = new ConcurrentHashMap<>();

    public FeatureWindowRegistry(FeatureWindowConfig config) {
        this.config = config;
        this.schema = new FeatureWindow(config).schema();
    }

    public StreamChannel channelFor(String sourceId) {
        return channels.computeIfAbsent(sourceId, id -> {
            log.debug("Nueva ventana para el flujo '{}'", id);
            return StreamChannel.open(id, new FeatureWindow(config));
        });
    }

    public FeatureSchema schema() {
        return schema;
    }

    public FeatureWindowConfig config() {
        return config;
    }

    public int streamCount() {
        return channels.size();
    }
}
