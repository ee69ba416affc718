package buildinghealth.engine.scoring;

import buildinghealth.domain.dto.sample.DashboardSnapshotDTO;
import buildinghealth.domain.dto.sample.ResultViewDTO;
import buildinghealth.domain.model.ClassificationResult;
import buildinghealth.domain.sample.Sample;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Últimos resultados y registro de anomalías en memoria, para el panel.
 * Ambos acotados a la misma capacidad; al llenarse se descarta lo más antiguo.
 */
public class RecentResultsBuffer implements ResultListener {

    private final int capacity;
    private final Deque<ResultViewDTO> recent = new ArrayDeque<>();
    private final Deque<ResultViewDTO> anomalies = new ArrayDeque<>();

    public RecentResultsBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Buffer capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    @Override
    public void onResult(Sample sample, ClassificationResult result) {
        ResultViewDTO view = toView(sample, result);
        synchronized (this) {
            append(recent, view);
            if (result.anomaly()) {
                append(anomalies, view);
            }
        }
    }

    public synchronized DashboardSnapshotDTO snapshot() {
        return new DashboardSnapshotDTO(List.copyOf(recent), List.copyOf(anomalies));
    }

    public synchronized int anomalyCount() {
        return anomalies.size();
    }

    public static ResultViewDTO toView(Sample sample, ClassificationResult result) {
        return ResultViewDTO.builder()
                .sourceId(sample.sourceId())
                .timestamp(sample.timestamp())
                .metrics(sample.metricValues())
                .anomaly(result.anomaly())
                .score(result.score())
                .threshold(result.threshold())
                .modelVersion(result.modelVersion())
                .status(result.status().name())
                .build();
    }

    private void append(Deque<ResultViewDTO> deque, ResultViewDTO view) {
        if (deque.size() == capacity) {
            deque.removeFirst();
        }
        deque.addLast(view);
    }
}
