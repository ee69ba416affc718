package buildinghealth.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Serialización de objetos a ficheros JSON y vuelta.
 * <p>
 * Las escrituras son atómicas y duraderas: se escribe un temporal en el mismo directorio, se
 * fuerza a disco y solo entonces se renombra sobre el destino, así un lector nunca ve un
 * fichero a medio escribir, tampoco tras un corte de luz.
 */
@Slf4j
public class JsonFileHandler {

    // Costoso de crear y thread-safe: uno para toda la aplicación.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // Fechas de java.time
        mapper.findAndRegisterModules();
        return mapper;
    }

    public static ObjectMapper mapper() {
        return objectMapper;
    }

    /**
     * Serializa {@code data} en {@code path}, sustituyendo atómicamente lo que hubiera.
     *
     * @throws IOException si falla la escritura o el renombrado; el destino queda intacto.
     */
    public <T> void writeToFile(T data, Path path) throws IOException {
        log.info("Serializando objeto de tipo {} a archivo: {}", data.getClass().getSimpleName(), path.toAbsolutePath());

        // Si no se puede serializar, no se toca el disco.
        byte[] json = objectMapper.writeValueAsBytes(data);
        Path parent = path.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
        try {
            writeSynced(tmp, json);
            moveAtomically(tmp, path);
            log.debug("Escritura a JSON completada con éxito.");
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            Files.deleteIfExists(tmp);
            throw e;
        }
    }

    private static void writeSynced(Path file, byte[] content) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            // Datos y metadatos en disco antes del rename
            channel.force(true);
        }
    }

    public <T> T readFromFile(Path path, Class<T> objectType) throws IOException {
        log.info("Deserializando archivo {} a un objeto de tipo {}", path.toAbsolutePath(), objectType.getSimpleName());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error al leer o parsear el archivo JSON desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public <T> T readFromFile(Path path, TypeReference<T> type) throws IOException {
        log.info("Deserializando archivo {}", path.toAbsolutePath());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        return objectMapper.readValue(path.toFile(), type);
    }

    /**
     * Renombra {@code source} sobre {@code target}. Si el sistema de ficheros no soporta
     * movimientos atómicos se cae a un reemplazo normal.
     */
    public static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("ATOMIC_MOVE no soportado en {}, usando reemplazo simple", target.getParent());
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
