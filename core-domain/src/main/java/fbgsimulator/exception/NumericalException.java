package fbgsimulator.exception;

/**
 * Caso numérico degenerado detectado durante el cálculo de la reflectancia.
 */
public class NumericalException extends FbgSimulationException {

    public NumericalException(String message) {
        super(ErrorKind.NUMERICAL, message);
    }
}
