package fbgsimulator.domain.fiber;

import fbgsimulator.config.SensorArrayConfig;
import fbgsimulator.exception.DataRangeException;
import fbgsimulator.exception.InvalidParameterException;
import fbgsimulator.exception.LayoutViolationException;
import fbgsimulator.exception.WavelengthRangeException;
import fbgsimulator.domain.spectrum.WavelengthGrid;

import java.util.List;

/**
 * Disposición inmutable de la matriz de sensores FBG a lo largo de la fibra.
 * <p>
 * Cada sensor {@code i} ocupa el tramo {@code [position(i), position(i) + L]} (mm).
 * Entre el final de un sensor y el inicio del siguiente debe quedar al menos la
 * tolerancia τ; si no, la matriz se rechaza antes de calcular ningún espectro.
 *
 * @param sensorCount         Número de sensores N (&ge; 1).
 * @param gratingLength       Longitud de red L [mm] (&gt; 0).
 * @param tolerance           Tolerancia τ [mm] (&gt; 0).
 * @param positions           Posiciones de inicio, estrictamente crecientes [mm].
 * @param originalWavelengths Longitudes de onda de Bragg originales [nm].
 *
 * @since 2025-11-04
 */
public record SensorArrayLayout(
        int sensorCount,
        double gratingLength,
        double tolerance,
        List<Double> positions,
        List<Double> originalWavelengths
) {

    public SensorArrayLayout {
        if (sensorCount < 1) {
            throw new InvalidParameterException("La matriz debe tener al menos un sensor (N=" + sensorCount + ").");
        }
        if (!Double.isFinite(gratingLength) || gratingLength <= 0) {
            throw new InvalidParameterException("La longitud de red debe ser positiva (L=" + gratingLength + ").");
        }
        if (!Double.isFinite(tolerance) || tolerance <= 0) {
            throw new InvalidParameterException("La tolerancia debe ser positiva (τ=" + tolerance + ").");
        }
        if (positions == null || positions.size() != sensorCount) {
            throw new DataRangeException(String.format(
                    "Sensors count (%d) and positions count (%d) should be equal.",
                    sensorCount, positions == null ? 0 : positions.size()));
        }
        if (originalWavelengths == null || originalWavelengths.size() != sensorCount) {
            throw new DataRangeException(String.format(
                    "Sensors count (%d) and original wavelengths count (%d) should be equal.",
                    sensorCount, originalWavelengths == null ? 0 : originalWavelengths.size()));
        }
        for (int i = 0; i < sensorCount; i++) {
            Double p = positions.get(i);
            Double w = originalWavelengths.get(i);
            if (p == null || !Double.isFinite(p)) {
                throw new InvalidParameterException("La posición del sensor " + i + " no es un número finito.");
            }
            if (w == null || !Double.isFinite(w) || w <= 0) {
                throw new InvalidParameterException("La longitud de onda original del sensor " + i + " no es válida.");
            }
        }

        // Separación mínima: longitud de red + tolerancia entre inicios consecutivos
        for (int i = 0; i < sensorCount - 1; i++) {
            double spacing = positions.get(i + 1) - positions.get(i);
            if (spacing < gratingLength + tolerance) {
                throw new LayoutViolationException(String.format(
                        "Los sensores %d (%.3f mm) y %d (%.3f mm) están separados %.3f mm; el mínimo es L + τ = %.3f mm.",
                        i, positions.get(i), i + 1, positions.get(i + 1), spacing, gratingLength + tolerance));
            }
        }

        // Dos sensores con la misma longitud de onda no se pueden distinguir en el espectro
        for (int i = 0; i < sensorCount; i++) {
            for (int j = i + 1; j < sensorCount; j++) {
                if (originalWavelengths.get(i).doubleValue() == originalWavelengths.get(j).doubleValue()) {
                    throw new LayoutViolationException(String.format(
                            "Los sensores %d y %d comparten la longitud de onda original %.3f nm.",
                            i, j, originalWavelengths.get(i)));
                }
            }
        }

        positions = List.copyOf(positions);
        originalWavelengths = List.copyOf(originalWavelengths);
    }

    /**
     * Construye la disposición desde la configuración del formulario. Si las listas
     * están vacías se usa la matriz de ejemplo.
     */
    public static SensorArrayLayout from(SensorArrayConfig config) {
        if (config == null) {
            throw new InvalidParameterException("Falta la configuración de la matriz de sensores.");
        }
        List<Double> positions = isEmpty(config.positions()) ? SensorArrayConfig.EXAMPLE_POSITIONS : config.positions();
        List<Double> wavelengths = isEmpty(config.originalWavelengths()) ? SensorArrayConfig.EXAMPLE_WAVELENGTHS : config.originalWavelengths();
        return new SensorArrayLayout(config.sensorCount(), config.gratingLength(), config.tolerance(), positions, wavelengths);
    }

    private static boolean isEmpty(List<Double> values) {
        return values == null || values.isEmpty();
    }

    public double positionOf(int sensorIndex) {
        return positions.get(sensorIndex);
    }

    public double originalWavelengthOf(int sensorIndex) {
        return originalWavelengths.get(sensorIndex);
    }

    public double spanEnd(int sensorIndex) {
        return positions.get(sensorIndex) + gratingLength;
    }

    /**
     * Longitud de fibra sin red entre el final del sensor {@code i} y el inicio del siguiente [mm].
     */
    public double gapAfter(int sensorIndex) {
        if (sensorIndex >= sensorCount - 1) {
            return 0.0;
        }
        return positions.get(sensorIndex + 1) - spanEnd(sensorIndex);
    }

    /**
     * Comprueba que todas las longitudes de onda originales caen dentro de la banda.
     *
     * @throws WavelengthRangeException si alguna queda fuera.
     */
    public void requireWithin(WavelengthGrid grid) {
        for (int i = 0; i < sensorCount; i++) {
            double w = originalWavelengths.get(i);
            if (!grid.contains(w)) {
                throw new WavelengthRangeException(String.format(
                        "La longitud de onda original del sensor %d (%.3f nm) está fuera de la banda [%.3f, %.3f] nm.",
                        i, w, grid.getMinBandwidth(), grid.getMaxBandwidth()));
            }
        }
    }
}
