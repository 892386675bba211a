package fbgsimulator.domain.spectrum;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Resumen del pico reflejado por un sensor en el espectro deformado.
 * Todos los valores espectrales son {@code NaN} si no se detectó ningún pico.
 *
 * @param sensorIndex        Índice del sensor (mismo orden que la matriz).
 * @param originalWavelength Longitud de onda original [nm].
 * @param peakWavelength     Longitud de onda del pico [nm].
 * @param shift              Desplazamiento = pico - original [nm].
 * @param fwhm               Anchura a media altura [nm].
 * @param peakReflectance    Reflectancia en el pico.
 */
public record PeakSummary(
        int sensorIndex,
        double originalWavelength,
        double peakWavelength,
        double shift,
        double fwhm,
        double peakReflectance
) {

    public static PeakSummary undetected(int sensorIndex, double originalWavelength) {
        return new PeakSummary(sensorIndex, originalWavelength, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
    }

    @JsonIgnore
    public boolean isDetected() {
        return !Double.isNaN(peakWavelength);
    }
}
