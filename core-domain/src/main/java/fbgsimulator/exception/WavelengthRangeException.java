package fbgsimulator.exception;

/**
 * Una longitud de onda (original o deformada) cae fuera de [min_bandwidth, max_bandwidth].
 */
public class WavelengthRangeException extends FbgSimulationException {

    public WavelengthRangeException(String message) {
        super(ErrorKind.WAVELENGTH_RANGE, message);
    }
}
