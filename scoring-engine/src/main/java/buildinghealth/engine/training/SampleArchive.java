package buildinghealth.engine.training;

import buildinghealth.domain.sample.Sample;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Últimas muestras aceptadas, para reentrenar. Acotado: al llenarse descarta las más antiguas.
 */
public class SampleArchive {

    private final int capacity;
    private final Deque<Sample> samples;

    public SampleArchive(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Archive capacity must be >= 1");
        }
        this.capacity = capacity;
        this.samples = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public synchronized void add(Sample sample) {
        if (samples.size() == capacity) {
            samples.removeFirst();
        }
        samples.addLast(sample);
    }

    public synchronized void addAll(List<Sample> batch) {
        batch.forEach(this::add);
    }

    /**
     * Copia del contenido; el entrenamiento trabaja sobre ella sin retener el cerrojo.
     */
    public synchronized List<Sample> snapshot() {
        return List.copyOf(samples);
    }

    public synchronized int size() {
        return samples.size();
    }

    public int capacity() {
        return capacity;
    }
}
