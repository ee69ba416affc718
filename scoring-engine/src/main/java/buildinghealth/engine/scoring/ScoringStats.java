package buildinghealth.engine.scoring;

import java.util.concurrent.atomic.LongAdder;

/**
 * Contadores del motor de puntuación.
 */
public class ScoringStats {

    private final LongAdder processed = new LongAdder();
    private final LongAdder scored = new LongAdder();
    private final LongAdder anomalies = new LongAdder();
    private final LongAdder dropped = new LongAdder();
    private final LongAdder degraded = new LongAdder();
    private final LongAdder warmingUp = new LongAdder();

    void recordProcessed() { processed.increment(); }
    void recordScored(boolean anomaly) {
        scored.increment();
        if (anomaly) anomalies.increment();
    }
    void recordDropped() { dropped.increment(); }
    void recordDegraded() { degraded.increment(); }
    void recordWarmingUp() { warmingUp.increment(); }

    public long processed() { return processed.sum(); }
    public long scored() { return scored.sum(); }
    public long anomalies() { return anomalies.sum(); }
    public long dropped() { return dropped.sum(); }
    public long degraded() { return degraded.sum(); }
    public long warmingUp() { return warmingUp.sum(); }

    public Snapshot snapshot() {
        return new Snapshot(processed(), scored(), anomalies(), dropped(), degraded(), warmingUp());
    }

    public record Snapshot(long processed, long scored, long anomalies, long dropped, long degraded, long warmingUp) {}
}
