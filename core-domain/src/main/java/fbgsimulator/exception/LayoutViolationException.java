package fbgsimulator.exception;

/**
 * Dos sensores de la matriz están más próximos que la longitud de red más la tolerancia.
 */
public class LayoutViolationException extends FbgSimulationException {

    public LayoutViolationException(String message) {
        super(ErrorKind.LAYOUT_VIOLATION, message);
    }
}
