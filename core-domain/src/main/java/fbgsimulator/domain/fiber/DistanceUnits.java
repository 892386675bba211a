package fbgsimulator.domain.fiber;

/**
 * Unidades en que vienen expresadas las distancias del fichero de datos.
 * El motor trabaja siempre en milímetros.
 */
public enum DistanceUnits {
    MILLIMETERS(1.0),
    METERS(1000.0);

    private final double factorToMillimeters;

    DistanceUnits(double factorToMillimeters) {
        this.factorToMillimeters = factorToMillimeters;
    }

    public double toMillimeters(double value) {
        return value * factorToMillimeters;
    }
}
