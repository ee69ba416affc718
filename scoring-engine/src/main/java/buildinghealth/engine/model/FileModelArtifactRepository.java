package buildinghealth.engine.model;

import buildinghealth.domain.exception.CorruptArtifactException;
import buildinghealth.domain.model.ModelArtifact;
import buildinghealth.io.JsonFileHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Artefacto en un fichero JSON. El candidato vive junto al vigente como {@code <fichero>.staged}.
 */
@Slf4j
public class FileModelArtifactRepository implements ModelArtifactRepository {

    static final String STAGED_SUFFIX = ".staged";

    private final Path artifactPath;
    private final Path stagedPath;
    private final JsonFileHandler jsonFileHandler;
    private volatile Long stagedVersion;

    public FileModelArtifactRepository(Path artifactPath, JsonFileHandler jsonFileHandler) {
        this.artifactPath = artifactPath.toAbsolutePath();
        this.stagedPath = this.artifactPath.resolveSibling(this.artifactPath.getFileName() + STAGED_SUFFIX);
        this.jsonFileHandler = jsonFileHandler;
    }

    @Override
    public void stage(ModelArtifact artifact) throws IOException {
        jsonFileHandler.writeToFile(artifact, stagedPath);
        stagedVersion = artifact.version();
        log.info("Artefacto v{} preparado en {}", artifact.version(), stagedPath);
    }

    @Override
    public void commit(long version) throws IOException {
        Long staged = stagedVersion;
        if (staged == null || staged != version || !Files.exists(stagedPath)) {
            throw new IllegalStateException("No staged artifact for version " + version + " (staged: " + staged + ")");
        }
        JsonFileHandler.moveAtomically(stagedPath, artifactPath);
        stagedVersion = null;
        log.info("Artefacto v{} promocionado a {}", version, artifactPath);
    }

    @Override
    public Optional<ModelArtifact> load() throws IOException {
        if (!Files.exists(artifactPath)) {
            return Optional.empty();
        }
        try {
            ModelArtifact artifact = jsonFileHandler.readFromFile(artifactPath, ModelArtifact.class);
            if (artifact == null) {
                throw new CorruptArtifactException("Model artifact " + artifactPath + " is empty");
            }
            return Optional.of(artifact);
        } catch (JsonProcessingException e) {
            throw new CorruptArtifactException("Model artifact " + artifactPath + " is not valid JSON: "
                    + e.getOriginalMessage(), e);
        }
    }

    @Override
    public void discardStaged() throws IOException {
        if (Files.deleteIfExists(stagedPath)) {
            log.warn("Descartado artefacto preparado sin promocionar: {}", stagedPath);
        }
        stagedVersion = null;
    }

    @Override
    public String describe() {
        return artifactPath.toString();
    }

    public Path getArtifactPath() {
        return artifactPath;
    }

    public Path getStagedPath() {
        return stagedPath;
    }
}
