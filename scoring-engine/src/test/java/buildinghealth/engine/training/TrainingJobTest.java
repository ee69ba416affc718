package buildinghealth.engine.training;

import buildinghealth.config.FeatureWindowConfig;
import buildinghealth.config.TrainingHyperparameters;
import buildinghealth.domain.sample.Sample;
import buildinghealth.engine.model.FileModelArtifactRepository;
import buildinghealth.engine.model.ModelStore;
import buildinghealth.io.JsonFileHandler;
import buildinghealth.ml.AnomalyModelTrainer;
import buildinghealth.ml.CancellationToken;
import buildinghealth.simulation.SyntheticSampleGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class TrainingJobTest {

    private static final Instant NOW = Instant.parse("2025-07-01T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final List<String> METRICS = List.of("temperature", "humidity", "pressure", "vibration");
    private static final FeatureWindowConfig WINDOW = FeatureWindowConfig.builder().metrics(METRICS).build();
    private static final TrainingHyperparameters HP = TrainingHyperparameters.builder()
            .numTrees(20)
            .subsampleSize(64)
            .minTrainingSamples(50)
            .build();

    @TempDir
    Path tempDir;

    private static List<Sample> normalSamples(int count) {
        return SyntheticSampleGenerator.forMetrics(7L, METRICS).normalBatch(count, NOW, "plant-a");
    }

    private TrainingJob job(ModelStore store, AnomalyModelTrainer trainer) {
        return new TrainingJob(store, WINDOW, new SampleArchive(1000), trainer, CLOCK);
    }

    @Test
    @DisplayName("Entrenar, persistir y publicar deja el nuevo modelo activo y en disco")
    void run_shouldPublishAndPersistModel() {
        // --- 1. Arrange ---
        FileModelArtifactRepository repository =
                new FileModelArtifactRepository(tempDir.resolve("model.json"), new JsonFileHandler());
        ModelStore store = new ModelStore(repository);
        TrainingJob job = job(store, new AnomalyModelTrainer());

        // --- 2. Act ---
        TrainingOutcome outcome = job.run(normalSamples(200), HP);

        // --- 3. Assert ---
        assertThat(outcome.status()).isEqualTo(TrainingStatus.SUCCESS);
        assertThat(outcome.exitCode()).isZero();
        assertThat(outcome.modelVersion()).isEqualTo(1L);
        assertThat(outcome.trainingSampleCount()).isEqualTo(200);
        assertThat(store.require().getTrainedAt()).isEqualTo(NOW);
        assertThat(store.require().getFeatureSchema().names()).containsExactlyElementsOf(METRICS);
        assertThat(repository.getArtifactPath()).exists();
        assertThat(repository.getStagedPath()).doesNotExist();
        assertThat(job.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Con menos vectores que el mínimo no se entrena y el modelo activo no cambia")
    void run_withTooFewSamples_shouldReturnInsufficientData() {
        ModelStore store = mock(ModelStore.class);

        TrainingOutcome outcome = job(store, new AnomalyModelTrainer()).run(normalSamples(10), HP);

        assertThat(outcome.status()).isEqualTo(TrainingStatus.INSUFFICIENT_DATA);
        assertThat(outcome.exitCode()).isEqualTo(2);
        assertThat(outcome.message()).contains("10");
        verify(store, never()).replace(any());
    }

    @Test
    void run_shouldSkipSamplesThatDoNotMatchSchema() {
        ModelStore store = new ModelStore(new FileModelArtifactRepository(tempDir.resolve("m.json"), new JsonFileHandler()));
        List<Sample> samples = new ArrayList<>(normalSamples(60));
        samples.add(new Sample(NOW.plusSeconds(1), Map.of("temperature", 20.0), "plant-a"));

        TrainingOutcome outcome = job(store, new AnomalyModelTrainer()).run(samples, HP);

        assertThat(outcome.status()).isEqualTo(TrainingStatus.SUCCESS);
        assertThat(outcome.trainingSampleCount()).isEqualTo(60);
    }

    @Test
    @DisplayName("El artefacto se persiste antes de publicar el modelo")
    void run_shouldPersistBeforeReplace() throws IOException {
        ModelStore store = mock(ModelStore.class);
        when(store.nextVersion()).thenReturn(3L);

        TrainingOutcome outcome = job(store, new AnomalyModelTrainer()).run(normalSamples(100), HP);

        assertThat(outcome.modelVersion()).isEqualTo(3L);
        InOrder inOrder = inOrder(store);
        inOrder.verify(store).persist(any());
        inOrder.verify(store).replace(any());
    }

    @Test
    @DisplayName("Si la persistencia falla el modelo no se publica")
    void run_persistFailure_shouldNotReplace() throws IOException {
        ModelStore store = mock(ModelStore.class);
        when(store.nextVersion()).thenReturn(1L);
        doThrow(new IOException("read-only filesystem")).when(store).persist(any());

        TrainingOutcome outcome = job(store, new AnomalyModelTrainer()).run(normalSamples(100), HP);

        assertThat(outcome.status()).isEqualTo(TrainingStatus.FAILED);
        assertThat(outcome.exitCode()).isEqualTo(1);
        verify(store, never()).replace(any());
    }

    @Test
    @DisplayName("Un segundo entrenamiento mientras hay uno en curso se rechaza como BUSY")
    void run_whileRunning_shouldReturnBusy() throws Exception {
        ModelStore store = mock(ModelStore.class);
        when(store.nextVersion()).thenReturn(1L);
        CountDownLatch persisting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            persisting.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(store).persist(any());
        TrainingJob job = job(store, new AnomalyModelTrainer());

        CompletableFuture<TrainingOutcome> first = CompletableFuture.supplyAsync(() -> job.run(normalSamples(100), HP));
        assertThat(persisting.await(10, TimeUnit.SECONDS)).isTrue();
        TrainingOutcome second = job.run(normalSamples(100), HP);
        release.countDown();

        assertThat(second.status()).isEqualTo(TrainingStatus.BUSY);
        assertThat(second.exitCode()).isEqualTo(4);
        assertThat(first.get(10, TimeUnit.SECONDS).status()).isEqualTo(TrainingStatus.SUCCESS);
    }

    @Test
    @DisplayName("Cancelar durante el ajuste descarta el candidato")
    void cancel_duringFit_shouldDiscardCandidate() throws Exception {
        ModelStore store = mock(ModelStore.class);
        when(store.nextVersion()).thenReturn(1L);
        AnomalyModelTrainer trainer = mock(AnomalyModelTrainer.class);
        CountDownLatch fitting = new CountDownLatch(1);
        when(trainer.train(anyList(), any(), any(), anyLong(), any(), any())).thenAnswer(invocation -> {
            CancellationToken token = invocation.getArgument(5);
            fitting.countDown();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!token.isCancelled() && System.nanoTime() < deadline) {
                Thread.onSpinWait();
            }
            token.throwIfCancelled();
            return null;
        });
        TrainingJob job = job(store, trainer);

        CompletableFuture<TrainingOutcome> run = CompletableFuture.supplyAsync(() -> job.run(normalSamples(100), HP));
        assertThat(fitting.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(job.cancel()).isTrue();

        TrainingOutcome outcome = run.get(10, TimeUnit.SECONDS);
        assertThat(outcome.status()).isEqualTo(TrainingStatus.CANCELLED);
        assertThat(outcome.exitCode()).isEqualTo(3);
        verify(store, never()).persist(any());
        verify(store, never()).replace(any());
    }

    @Test
    void cancel_whenIdle_shouldReturnFalse() {
        assertThat(job(mock(ModelStore.class), new AnomalyModelTrainer()).cancel()).isFalse();
    }

    @Test
    void runOnce_shouldTrainOnArchivedSamples() {
        ModelStore store = new ModelStore(new FileModelArtifactRepository(tempDir.resolve("a.json"), new JsonFileHandler()));
        SampleArchive archive = new SampleArchive(80);
        archive.addAll(normalSamples(120));
        TrainingJob job = new TrainingJob(store, WINDOW, archive, new AnomalyModelTrainer(), CLOCK);

        TrainingOutcome outcome = job.runOnce(HP);

        assertThat(archive.size()).isEqualTo(80);
        assertThat(outcome.trainingSampleCount()).isEqualTo(80);
    }
}
