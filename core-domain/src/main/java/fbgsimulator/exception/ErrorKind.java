package fbgsimulator.exception;

/**
 * Categorías de fallo que una ejecución del simulador puede reportar.
 * Cada una se corresponde con una subclase de {@link FbgSimulationException}.
 */
public enum ErrorKind {
    /** Constante física mal formada o fuera de rango. */
    INVALID_PARAMETER,
    /** El dataset no cubre el tramo requerido o los recuentos no cuadran. */
    DATA_RANGE,
    /** Dos sensores más cerca que la longitud de red más la tolerancia. */
    LAYOUT_VIOLATION,
    /** Una longitud de onda cae fuera de la banda simulada. */
    WAVELENGTH_RANGE,
    /** El fichero de datos no se puede leer. */
    FILE_ACCESS,
    /** Caso numérico degenerado detectado durante el cálculo. */
    NUMERICAL,
    /** Cualquier otro fallo no previsto. */
    INTERNAL
}
