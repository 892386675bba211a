package fbgsimulator.domain.deformation;

/**
 * Tipo de deformación longitudinal aplicada a la fibra.
 */
public enum StrainType {
    /** Sin deformación: ε(x) = 0. */
    NONE,
    /** Deformación longitudinal uniforme ε₀ en toda la fibra. */
    UNIFORM,
    /** Deformación interpolada a partir del fichero de datos. */
    NON_UNIFORM
}
