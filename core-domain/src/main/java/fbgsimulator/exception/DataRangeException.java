package fbgsimulator.exception;

/**
 * El dataset de deformación/tensión no cubre el tramo requerido, o el número de sensores no coincide con sus posiciones o longitudes de onda.
 */
public class DataRangeException extends FbgSimulationException {

    public DataRangeException(String message) {
        super(ErrorKind.DATA_RANGE, message);
    }
}
