package buildinghealth.engine.model;

import buildinghealth.domain.exception.CorruptArtifactException;
import buildinghealth.domain.model.ModelArtifact;

import java.io.IOException;
import java.util.Optional;

/**
 * Almacenamiento duradero del artefacto del modelo, en dos fases.
 * <p>
 * {@link #stage} deja el candidato escrito y sincronizado sin tocar el artefacto vigente;
 * {@link #commit} lo promociona con un renombrado atómico. Un reinicio entre ambas fases
 * sigue cargando el modelo anterior.
 */
public interface ModelArtifactRepository {

    void stage(ModelArtifact artifact) throws IOException;

    /**
     * Promociona el candidato preparado con {@code version}.
     *
     * @throws IllegalStateException si no hay candidato o su versión no coincide.
     */
    void commit(long version) throws IOException;

    /**
     * @return el artefacto vigente, o vacío si nunca se ha guardado ninguno.
     * @throws CorruptArtifactException si existe pero no se puede interpretar.
     */
    Optional<ModelArtifact> load() throws IOException;

    /**
     * Borra un candidato huérfano de una ejecución anterior.
     */
    void discardStaged() throws IOException;

    String describe();
}
