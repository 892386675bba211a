package fbgsimulator.exception;

/**
 * La ruta del dataset no existe o no se puede leer.
 */
public class FileAccessException extends FbgSimulationException {

    public FileAccessException(String message) {
        super(ErrorKind.FILE_ACCESS, message);
    }

    public FileAccessException(String message, Throwable cause) {
        super(ErrorKind.FILE_ACCESS, message, cause);
    }
}
