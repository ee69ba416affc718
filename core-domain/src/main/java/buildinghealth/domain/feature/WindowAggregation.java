package buildinghealth.domain.feature;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Cómo se resume el contenido de la ventana en un vector de características.
 */
public enum WindowAggregation {

    /**
     * Valores crudos de la muestra más reciente.
     */
    LAST {
        @Override
        public List<String> featureNames(List<String> metrics) {
            return List.copyOf(metrics);
        }

        @Override
        public double[] aggregate(Collection<double[]> rows, int metricCount) {
            double[] newest = null;
            for (double[] row : rows) newest = row;
            return newest == null ? new double[metricCount] : newest.clone();
        }
    },

    /**
     * Media móvil de cada métrica sobre la ventana.
     */
    MEAN {
        @Override
        public List<String> featureNames(List<String> metrics) {
            return suffixed(metrics, "_mean");
        }

        @Override
        public double[] aggregate(Collection<double[]> rows, int metricCount) {
            return means(rows, metricCount);
        }
    },

    /**
     * Media y desviación típica (poblacional) de cada métrica: primero todas las medias.
     */
    MEAN_STDDEV {
        @Override
        public List<String> featureNames(List<String> metrics) {
            List<String> names = new ArrayList<>(suffixed(metrics, "_mean"));
            names.addAll(suffixed(metrics, "_stddev"));
            return List.copyOf(names);
        }

        @Override
        public double[] aggregate(Collection<double[]> rows, int metricCount) {
            DescriptiveStatistics[] stats = statistics(rows, metricCount);
            double[] out = new double[metricCount * 2];
            for (int i = 0; i < metricCount; i++) {
                out[i] = mean(stats[i]);
                out[metricCount + i] = rows.isEmpty() ? 0.0 : Math.sqrt(stats[i].getPopulationVariance());
            }
            return out;
        }
    };

    public abstract List<String> featureNames(List<String> metrics);

    public abstract double[] aggregate(Collection<double[]> rows, int metricCount);

    private static List<String> suffixed(List<String> metrics, String suffix) {
        return metrics.stream().map(m -> m + suffix).toList();
    }

    private static double[] means(Collection<double[]> rows, int metricCount) {
        DescriptiveStatistics[] stats = statistics(rows, metricCount);
        double[] out = new double[metricCount];
        for (int i = 0; i < metricCount; i++) {
            out[i] = mean(stats[i]);
        }
        return out;
    }

    // Una ventana vacía resume a ceros, no a NaN.
    private static double mean(DescriptiveStatistics stats) {
        return stats.getN() == 0 ? 0.0 : stats.getMean();
    }

    private static DescriptiveStatistics[] statistics(Collection<double[]> rows, int metricCount) {
        DescriptiveStatistics[] stats = new DescriptiveStatistics[metricCount];
        for (int i = 0; i < metricCount; i++) {
            stats[i] = new DescriptiveStatistics();
        }
        for (double[] row : rows) {
            for (int i = 0; i < metricCount; i++) {
                stats[i].addValue(row[i]);
            }
        }
        return stats;
    }
}
