package fbgsimulator.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import fbgsimulator.config.SimulationRequest;
import fbgsimulator.domain.simulation.SimulationResult;
import fbgsimulator.exception.FileAccessException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Gestiona la serialización (escritura) y deserialización (lectura) de las
 * peticiones y resultados de simulación hacia y desde archivos JSON.
 * <p>
 * Los métodos genéricos trabajan con cualquier tipo compatible con Jackson;
 * los específicos traducen los errores de E/S a {@link FileAccessException}.
 */
@Slf4j
public class JsonFileHandler {

    // El ObjectMapper es costoso de crear y thread-safe: se reutiliza.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        // JSON legible por humanos
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // Campos desconocidos de versiones futuras del formulario se ignoran
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto a un archivo JSON. Si el archivo ya existe, será sobrescrito.
     *
     * @throws IOException Si ocurre un error durante la escritura del archivo.
     */
    public <T> void writeToFile(T data, Path path) throws IOException {
        log.info("Serializando objeto de tipo {} a archivo: {}", data.getClass().getSimpleName(), path.toAbsolutePath());

        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura a JSON completada con éxito.");
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Deserializa un archivo JSON para reconstruir un objeto de un tipo específico.
     *
     * @throws IOException Si el archivo no se encuentra o hay un error de lectura o formato.
     */
    public <T> T readFromFile(Path path, Class<T> objectType) throws IOException {
        log.info("Deserializando archivo {} a un objeto de tipo {}", path.toAbsolutePath(), objectType.getSimpleName());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo JSON desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Lee la petición de simulación (el estado del formulario).
     *
     * @throws FileAccessException si el archivo no existe o no es un JSON válido.
     */
    public SimulationRequest readRequest(Path path) {
        try {
            return readFromFile(path, SimulationRequest.class);
        } catch (IOException e) {
            throw new FileAccessException("No se pudo leer la petición de simulación " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Escribe el resultado de una ejecución correcta.
     *
     * @throws FileAccessException si no se puede escribir el archivo.
     */
    public void writeResult(SimulationResult result, Path path) {
        try {
            writeToFile(result, path);
        } catch (IOException e) {
            throw new FileAccessException("No se pudo escribir el resultado en " + path + ": " + e.getMessage(), e);
        }
    }
}
