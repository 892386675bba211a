package fbgsimulator.physics.model;

/**
 * Condición mecánica en un punto de la fibra.
 *
 * @param strain Deformación longitudinal ε.
 * @param stress Tensión transversal σ [MPa].
 */
public record LocalCondition(double strain, double stress) {
}
