package fbgsimulator.exception;

/**
 * Parámetro físico mal formado o fuera de rango.
 */
public class InvalidParameterException extends FbgSimulationException {

    public InvalidParameterException(String message) {
        super(ErrorKind.INVALID_PARAMETER, message);
    }
}
