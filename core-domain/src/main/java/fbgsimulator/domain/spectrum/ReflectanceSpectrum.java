package fbgsimulator.domain.spectrum;

import com.fasterxml.jackson.annotation.JsonValue;
import fbgsimulator.exception.NumericalException;

import java.util.Arrays;

/**
 * Reflectancia en intensidad [0, 1] muestreada sobre una {@link WavelengthGrid}.
 * Inmutable: el array se copia al construir y al exportar.
 */
public final class ReflectanceSpectrum {

    private final double[] reflectance;

    public ReflectanceSpectrum(double[] reflectance) {
        if (reflectance == null) {
            throw new NumericalException("El espectro de reflectancia no puede ser nulo.");
        }
        for (int i = 0; i < reflectance.length; i++) {
            double r = reflectance[i];
            if (!(r >= 0.0 && r <= 1.0)) {
                throw new NumericalException("Reflectancia fuera de [0, 1] en la muestra " + i + ": " + r);
            }
        }
        this.reflectance = reflectance.clone();
    }

    public int size() {
        return reflectance.length;
    }

    public double valueAt(int index) {
        return reflectance[index];
    }

    @JsonValue
    public double[] toArray() {
        return reflectance.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(reflectance, ((ReflectanceSpectrum) o).reflectance);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(reflectance);
    }
}
