package fbgsimulator.domain.spectrum;

import com.fasterxml.jackson.annotation.JsonProperty;
import fbgsimulator.config.SpectrumConfig;
import fbgsimulator.exception.InvalidParameterException;
import lombok.Getter;

/**
 * Rejilla inmutable de longitudes de onda [nm] desde {@code minBandwidth} hasta
 * {@code maxBandwidth} (inclusive) con paso {@code resolution}.
 * <p>
 * Su longitud es {@code floor((max - min) / resolution) + 1}. Cada valor se
 * calcula como {@code min + k * resolution} para no acumular error de redondeo.
 *
 * @since 2025-11-04
 */
public final class WavelengthGrid {

    // Margen relativo para que (max-min)/res = 2000 no caiga a 1999.9999 por redondeo
    private static final double FLOOR_EPSILON = 1e-9;

    @Getter
    private final double minBandwidth;
    @Getter
    private final double maxBandwidth;
    @Getter
    private final double resolution;
    private final double[] wavelengths;

    private WavelengthGrid(double minBandwidth, double maxBandwidth, double resolution) {
        this.minBandwidth = minBandwidth;
        this.maxBandwidth = maxBandwidth;
        this.resolution = resolution;

        int size = (int) Math.floor((maxBandwidth - minBandwidth) / resolution + FLOOR_EPSILON) + 1;
        this.wavelengths = new double[size];
        for (int k = 0; k < size; k++) {
            wavelengths[k] = minBandwidth + k * resolution;
        }
    }

    /**
     * Construye la rejilla validando la banda y la resolución.
     *
     * @throws InvalidParameterException si la banda está vacía o la resolución no es positiva.
     */
    public static WavelengthGrid of(double minBandwidth, double maxBandwidth, double resolution) {
        if (!Double.isFinite(minBandwidth) || !Double.isFinite(maxBandwidth) || !Double.isFinite(resolution)) {
            throw new InvalidParameterException("La banda y la resolución deben ser números finitos.");
        }
        if (minBandwidth <= 0) {
            throw new InvalidParameterException("La banda mínima debe ser positiva (" + minBandwidth + " nm).");
        }
        if (maxBandwidth <= minBandwidth) {
            throw new InvalidParameterException(String.format(
                    "La banda máxima (%.3f nm) debe ser mayor que la mínima (%.3f nm).", maxBandwidth, minBandwidth));
        }
        if (resolution <= 0) {
            throw new InvalidParameterException("La resolución debe ser positiva (" + resolution + " nm).");
        }
        if (resolution > maxBandwidth - minBandwidth) {
            throw new InvalidParameterException("La resolución es mayor que la anchura de banda.");
        }
        return new WavelengthGrid(minBandwidth, maxBandwidth, resolution);
    }

    public static WavelengthGrid from(SpectrumConfig config) {
        if (config == null) {
            throw new InvalidParameterException("Falta la configuración del espectro.");
        }
        return of(config.minBandwidth(), config.maxBandwidth(), config.resolution());
    }

    public int size() {
        return wavelengths.length;
    }

    public double wavelengthAt(int index) {
        return wavelengths[index];
    }

    /**
     * Índice de la muestra más próxima a {@code wavelength}, recortado a la rejilla.
     */
    public int indexOfNearest(double wavelength) {
        long k = Math.round((wavelength - minBandwidth) / resolution);
        return (int) Math.max(0, Math.min(wavelengths.length - 1, k));
    }

    public boolean contains(double wavelength) {
        return wavelength >= minBandwidth && wavelength <= maxBandwidth;
    }

    @JsonProperty("wavelengths")
    public double[] toArray() {
        return wavelengths.clone();
    }
}
