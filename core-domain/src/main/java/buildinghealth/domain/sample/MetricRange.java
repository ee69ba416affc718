package buildinghealth.domain.sample;

/**
 * Rango físico de una métrica: límites duros y dispersión del ruido gaussiano.
 */
public record MetricRange(double min, double max, double stdDev) {

    public double midpoint() {
        return (min + max) / 2.0;
    }

    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
