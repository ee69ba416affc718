package buildinghealth.engine.model;

import buildinghealth.domain.exception.CorruptArtifactException;
import buildinghealth.domain.exception.NoModelLoadedException;
import buildinghealth.domain.feature.FeatureSchema;
import buildinghealth.domain.model.AnomalyModel;
import buildinghealth.engine.TestModels;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelStoreTest {

    private static final FeatureSchema SCHEMA = FeatureSchema.of("temperature", "humidity");

    @Mock
    private ModelArtifactRepository repository;

    private ModelStore store;

    @BeforeEach
    void setUp() {
        store = new ModelStore(repository);
    }

    @Test
    @DisplayName("Sin modelo el almacén está degradado y require() falla")
    void emptyStore_shouldBeDegraded() {
        assertThat(store.isDegraded()).isTrue();
        assertThat(store.current()).isEmpty();
        assertThatThrownBy(store::require).isInstanceOf(NoModelLoadedException.class);
    }

    @Test
    @DisplayName("Tras replace(vN) las lecturas ven vN")
    void replace_shouldPublishModel() {
        store.replace(TestModels.linear(1, SCHEMA));
        store.replace(TestModels.linear(2, SCHEMA));

        assertThat(store.require().getVersion()).isEqualTo(2L);
        assertThat(store.isDegraded()).isFalse();
        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("Una versión que no es mayor que la activa se rechaza y no cambia nada")
    void replace_shouldRejectStaleVersion() {
        store.replace(TestModels.linear(5, SCHEMA));

        assertThatThrownBy(() -> store.replace(TestModels.linear(5, SCHEMA)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.replace(TestModels.linear(3, SCHEMA)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(store.require().getVersion()).isEqualTo(5L);
    }

    @Test
    @DisplayName("persist prepara el artefacto y replace lo promociona antes de publicar")
    void persistThenReplace_shouldStageThenCommit() throws IOException {
        AnomalyModel candidate = forestModel(1);

        store.persist(candidate);
        assertThat(store.isDegraded()).isTrue();
        store.replace(candidate);

        InOrder inOrder = inOrder(repository);
        inOrder.verify(repository).stage(any());
        inOrder.verify(repository).commit(1L);
        assertThat(store.require().getVersion()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Si la promoción falla, el modelo activo no cambia")
    void replace_shouldKeepPreviousModel_whenCommitFails() throws IOException {
        store.replace(forestModel(1));
        AnomalyModel candidate = forestModel(2);
        store.persist(candidate);
        doThrow(new IOException("disk full")).when(repository).commit(2L);

        assertThatThrownBy(() -> store.replace(candidate)).isInstanceOf(UncheckedIOException.class);
        assertThat(store.require().getVersion()).isEqualTo(1L);
    }

    @Test
    void loadOnStartup_shouldStayDegraded_whenNoArtifact() throws IOException {
        when(repository.load()).thenReturn(Optional.empty());
        when(repository.describe()).thenReturn("/tmp/model.json");

        assertThat(store.loadOnStartup()).isFalse();
        assertThat(store.isDegraded()).isTrue();
        assertThat(store.lastLoadError()).contains("/tmp/model.json");
        verify(repository).discardStaged();
    }

    @Test
    void loadOnStartup_shouldStayDegraded_whenArtifactIsCorrupt() throws IOException {
        when(repository.load()).thenThrow(new CorruptArtifactException("bad tree"));
        when(repository.describe()).thenReturn("/tmp/model.json");

        assertThat(store.loadOnStartup()).isFalse();
        assertThat(store.isDegraded()).isTrue();
        assertThat(store.lastLoadError()).isEqualTo("bad tree");
    }

    @Test
    @DisplayName("nextVersion nunca repite versiones, ni siquiera en paralelo")
    void nextVersion_shouldBeUniqueAndAboveActive() throws InterruptedException, IOException {
        store.replace(TestModels.linear(7, SCHEMA));
        Set<Long> versions = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 400; i++) {
            pool.execute(() -> versions.add(store.nextVersion()));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(versions).hasSize(400).allMatch(v -> v > 7);
        verify(repository, never()).commit(anyLong());
    }

    /**
     * {@link buildinghealth.domain.model.ModelArtifact#from} solo acepta bosques de aislamiento.
     */
    private static AnomalyModel forestModel(long version) {
        return ForestModels.tiny(version, SCHEMA);
    }
}
