package fbgsimulator.domain.deformation;

/**
 * Tipo de tensión transversal aplicada a la fibra.
 */
public enum StressType {
    NONE,
    /** Tensión transversal interpolada a partir del fichero de datos. */
    INCLUDED
}
