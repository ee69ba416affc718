package buildinghealth.engine.model;

import buildinghealth.domain.exception.CorruptArtifactException;
import buildinghealth.domain.exception.NoModelLoadedException;
import buildinghealth.domain.model.AnomalyModel;
import buildinghealth.domain.model.ModelArtifact;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Dueño único del modelo activo.
 * <p>
 * Las lecturas ({@link #current()}) son una lectura volátil sin bloqueo. El intercambio
 * ({@link #replace}) solo sincroniza la comprobación de versión, la promoción del artefacto
 * preparado y la publicación de la referencia: una vez que {@code replace(vN)} vuelve,
 * cualquier lectura posterior ve {@code vN} o una versión mayor.
 */
@Slf4j
public class ModelStore {

    private final ModelArtifactRepository repository;
    private final AtomicReference<AnomalyModel> active = new AtomicReference<>();
    private final AtomicLong highestVersion = new AtomicLong(0L);
    private final Object swapLock = new Object();
    private volatile long stagedVersion = -1L;
    private volatile String lastLoadError;

    public ModelStore(ModelArtifactRepository repository) {
        this.repository = repository;
    }

    public Optional<AnomalyModel> current() {
        return Optional.ofNullable(active.get());
    }

    public AnomalyModel require() {
        AnomalyModel model = active.get();
        if (model == null) {
            throw new NoModelLoadedException();
        }
        return model;
    }

    public boolean isDegraded() {
        return active.get() == null;
    }

    public String lastLoadError() {
        return lastLoadError;
    }

    /**
     * Publica {@code model} como modelo activo. Si antes se hizo {@link #persist} de esa misma
     * versión, el artefacto preparado se promociona antes de publicar la referencia.
     *
     * @throws IllegalStateException si la versión no es estrictamente mayor que la activa.
     * @throws UncheckedIOException  si la promoción del artefacto falla; el modelo activo no cambia.
     */
    public void replace(AnomalyModel model) {
        synchronized (swapLock) {
            AnomalyModel previous = active.get();
            if (previous != null && model.getVersion() <= previous.getVersion()) {
                throw new IllegalStateException(String.format(
                        "Model version must increase: active v%d, candidate v%d",
                        previous.getVersion(), model.getVersion()));
            }
            if (stagedVersion == model.getVersion()) {
                try {
                    repository.commit(model.getVersion());
                } catch (IOException e) {
                    throw new UncheckedIOException("Could not promote artifact v" + model.getVersion(), e);
                }
                stagedVersion = -1L;
            }
            active.set(model);
            highestVersion.accumulateAndGet(model.getVersion(), Math::max);
            lastLoadError = null;
        }
        log.info("Modelo activo: v{} ({} features, umbral {})",
                model.getVersion(), model.getFeatureSchema().size(), model.getThreshold().value());
    }

    /**
     * Escribe el artefacto del modelo de forma duradera sin hacerlo visible.
     */
    public void persist(AnomalyModel model) throws IOException {
        repository.stage(ModelArtifact.from(model));
        stagedVersion = model.getVersion();
    }

    /**
     * Lee y valida el artefacto vigente.
     *
     * @throws CorruptArtifactException si el artefacto existe pero es inválido.
     */
    public Optional<AnomalyModel> load() throws IOException {
        return repository.load().map(ModelArtifact::toModel);
    }

    /**
     * Carga inicial. Nunca lanza: ante un artefacto ausente o corrupto el almacén queda
     * vacío (modo degradado) y el motivo se guarda en {@link #lastLoadError()}.
     */
    public boolean loadOnStartup() {
        try {
            repository.discardStaged();
            Optional<AnomalyModel> loaded = load();
            if (loaded.isEmpty()) {
                lastLoadError = "No model artifact at " + repository.describe();
                log.warn("No hay artefacto de modelo en {}. Arrancando en modo degradado.", repository.describe());
                return false;
            }
            replace(loaded.get());
            log.info("Modelo v{} cargado desde {}", loaded.get().getVersion(), repository.describe());
            return true;
        } catch (CorruptArtifactException e) {
            lastLoadError = e.getMessage();
            log.error("Artefacto de modelo corrupto en {}. Arrancando en modo degradado.", repository.describe(), e);
            return false;
        } catch (IOException | UncheckedIOException e) {
            lastLoadError = "I/O error reading model artifact: " + e.getMessage();
            log.error("No se pudo leer el artefacto de modelo {}", repository.describe(), e);
            return false;
        }
    }

    /**
     * Reserva la siguiente versión para un entrenamiento. Dos llamadas nunca devuelven la misma.
     */
    public long nextVersion() {
        return highestVersion.incrementAndGet();
    }

    public String artifactLocation() {
        return repository.describe();
    }
}
