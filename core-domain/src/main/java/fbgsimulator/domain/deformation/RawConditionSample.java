package fbgsimulator.domain.deformation;

/**
 * Una fila del fichero de datos: posición longitudinal con su deformación y su
 * tensión transversal medidas.
 *
 * @param position Posición a lo largo de la fibra [mm].
 * @param strain   Deformación longitudinal ε (adimensional).
 * @param stress   Tensión transversal σ [MPa], o {@code NaN} si el fichero no la trae.
 */
public record RawConditionSample(double position, double strain, double stress) {

    public static RawConditionSample strainOnly(double position, double strain) {
        return new RawConditionSample(position, strain, Double.NaN);
    }

    public boolean hasStress() {
        return !Double.isNaN(stress);
    }
}
