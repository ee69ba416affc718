package buildinghealth.engine.scoring;

import buildinghealth.config.FeatureWindowConfig;
import buildinghealth.domain.exception.SchemaMismatchException;
import buildinghealth.domain.feature.FeatureSchema;
import buildinghealth.domain.feature.FeatureVector;
import buildinghealth.domain.model.ClassificationResult;
import buildinghealth.domain.model.ResultStatus;
import buildinghealth.domain.sample.Sample;
import buildinghealth.engine.TestModels;
import buildinghealth.engine.model.ModelArtifactRepository;
import buildinghealth.engine.model.ModelStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class ScoringEngineTest {

    private static final Instant T0 = Instant.parse("2025-04-01T08:00:00Z");
    private static final Clock CLOCK = Clock.fixed(T0, ZoneOffset.UTC);

    private ModelStore modelStore;
    private final List<ClassificationResult> published = new ArrayList<>();

    @BeforeEach
    void setUp() {
        modelStore = new ModelStore(mock(ModelArtifactRepository.class));
        published.clear();
    }

    private ScoringEngine engine(int windowSize, ResultListener... extra) {
        FeatureWindowConfig config = FeatureWindowConfig.builder()
                .metric("temperature")
                .metric("humidity")
                .windowSize(windowSize)
                .build();
        List<ResultListener> listeners = new ArrayList<>(List.of(extra));
        listeners.add((sample, result) -> published.add(result));
        return new ScoringEngine(modelStore, new FeatureWindowRegistry(config), listeners, CLOCK);
    }

    private static Sample sample(int second, double temperature, String source) {
        return new Sample(T0.plusSeconds(second), Map.of("temperature", temperature, "humidity", 45.0), source);
    }

    @Test
    @DisplayName("Con ventana W las primeras W-1 muestras de cada flujo no producen resultado")
    void ingest_shouldWarmUpPerStream() {
        ScoringEngine engine = engine(3);
        modelStore.replace(TestModels.linear(1, engine.windows().schema()));

        assertThat(engine.ingest(sample(0, 20, "a"))).isEmpty();
        assertThat(engine.ingest(sample(1, 20, "a"))).isEmpty();
        assertThat(engine.ingest(sample(2, 20, "b"))).isEmpty();
        assertThat(engine.ingest(sample(3, 20, "a"))).isPresent();

        assertThat(engine.stats().warmingUp()).isEqualTo(3);
        assertThat(engine.stats().processed()).isEqualTo(4);
        assertThat(engine.windows().streamCount()).isEqualTo(2);
        assertThat(published).hasSize(1);
    }

    @Test
    @DisplayName("Sin modelo cargado el resultado es DEGRADED y sin score")
    void ingest_withoutModel_shouldReturnDegraded() {
        ScoringEngine engine = engine(1);

        ClassificationResult result = engine.ingest(sample(0, 99, "a")).orElseThrow();

        assertThat(result.status()).isEqualTo(ResultStatus.DEGRADED);
        assertThat(result.score()).isNull();
        assertThat(result.anomaly()).isFalse();
        assertThat(engine.stats().degraded()).isEqualTo(1);
    }

    @Test
    @DisplayName("Score estrictamente por encima del umbral es anomalía; el empate no")
    void ingest_shouldClassifyAgainstThreshold() {
        ScoringEngine engine = engine(1);
        modelStore.replace(TestModels.linear(4, engine.windows().schema()));

        ClassificationResult tie = engine.ingest(sample(0, 50, "a")).orElseThrow();
        ClassificationResult high = engine.ingest(sample(1, 80, "a")).orElseThrow();

        assertThat(tie.anomaly()).isFalse();
        assertThat(high.anomaly()).isTrue();
        assertThat(high.score()).isEqualTo(0.8);
        assertThat(high.modelVersion()).isEqualTo(4L);
        assertThat(high.classifiedAt()).isEqualTo(T0);
        assertThat(engine.stats().anomalies()).isEqualTo(1);
    }

    @Test
    @DisplayName("Una muestra sin alguna métrica se descarta, se cuenta y no entra en la ventana")
    void ingest_missingMetric_shouldBeDroppedAndCounted() {
        ScoringEngine engine = engine(2);
        modelStore.replace(TestModels.linear(1, engine.windows().schema()));
        Sample incomplete = new Sample(T0, Map.of("temperature", 21.0), "a");

        assertThatThrownBy(() -> engine.ingest(incomplete)).isInstanceOf(SchemaMismatchException.class);

        assertThat(engine.stats().dropped()).isEqualTo(1);
        assertThat(engine.stats().processed()).isZero();
        assertThat(engine.windows().channelFor("a").window().bufferedCount()).isZero();
    }

    @Test
    @DisplayName("Un modelo con otro esquema nunca puntúa: la muestra se descarta")
    void ingest_modelWithDifferentSchema_shouldBeRejected() {
        ScoringEngine engine = engine(1);
        modelStore.replace(TestModels.linear(1, FeatureSchema.of("humidity", "temperature")));

        assertThatThrownBy(() -> engine.ingest(sample(0, 20, "a"))).isInstanceOf(SchemaMismatchException.class);
        assertThat(engine.stats().dropped()).isEqualTo(1);
        assertThat(published).isEmpty();
    }

    @Test
    void ingest_sameInputs_shouldGiveSameResults() {
        ScoringEngine first = engine(1);
        ScoringEngine second = engine(1);
        modelStore.replace(TestModels.linear(1, first.windows().schema()));

        Optional<ClassificationResult> a = first.ingest(sample(0, 33.3, "a"));
        Optional<ClassificationResult> b = second.ingest(sample(0, 33.3, "a"));

        assertThat(a).isEqualTo(b);
    }

    @Test
    @DisplayName("Puntuar un vector suelto no toca ventanas ni listeners")
    void score_vector_shouldUseActiveModel() {
        ScoringEngine engine = engine(1);
        modelStore.replace(TestModels.linear(2, engine.windows().schema()));

        ClassificationResult result = engine.score(new FeatureVector(engine.windows().schema(), new double[]{70, 40}));

        assertThat(result.score()).isEqualTo(0.7);
        assertThat(result.anomaly()).isTrue();
        assertThat(result.sampleRef().sourceId()).isEqualTo(Sample.DEFAULT_SOURCE);
        assertThat(engine.windows().streamCount()).isZero();
        assertThat(published).isEmpty();
    }

    @Test
    @DisplayName("Un vector con más features que el modelo se rechaza y cuenta una sola vez como descartado")
    void score_vectorOfWrongLength_shouldBeCountedAsDropped() {
        ScoringEngine engine = engine(1);
        modelStore.replace(TestModels.linear(1, engine.windows().schema()));
        FeatureVector wide = new FeatureVector(FeatureSchema.of("temperature", "humidity", "vibration"),
                new double[]{1, 2, 3});

        assertThatThrownBy(() -> engine.score(wide)).isInstanceOf(SchemaMismatchException.class);

        assertThat(engine.stats().dropped()).isEqualTo(1);
        assertThat(engine.stats().processed()).isZero();
        assertThat(engine.stats().scored()).isZero();
    }

    @Test
    @DisplayName("Un listener que falla no impide el resultado ni al resto de listeners")
    void ingest_failingListener_shouldBeIsolated() {
        ScoringEngine engine = engine(1, (sample, result) -> {
            throw new IllegalStateException("broker down");
        });
        modelStore.replace(TestModels.linear(1, engine.windows().schema()));

        Optional<ClassificationResult> result = engine.ingest(sample(0, 20, "a"));

        assertThat(result).isPresent();
        assertThat(published).hasSize(1);
    }
}
