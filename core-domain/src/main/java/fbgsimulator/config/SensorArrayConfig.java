package fbgsimulator.config;

import lombok.Builder;
import lombok.With;

import java.util.List;

/**
 * Configuración de la matriz virtual de sensores FBG.
 * Las listas vacías (o nulas) se sustituyen por la configuración de ejemplo
 * al construir el dominio.
 *
 * @param sensorCount         Número de sensores.
 * @param gratingLength       Longitud de cada red [mm].
 * @param tolerance           Tolerancia espacial [mm].
 * @param positions           Posiciones de inicio de cada red respecto al origen [mm].
 * @param originalWavelengths Longitudes de onda de Bragg originales [nm].
 */
@Builder
@With
public record SensorArrayConfig(
        int sensorCount,
        double gratingLength,
        double tolerance,
        List<Double> positions,
        List<Double> originalWavelengths
) {

    public static final List<Double> EXAMPLE_POSITIONS = List.of(22.0, 50.0, 70.0);
    public static final List<Double> EXAMPLE_WAVELENGTHS = List.of(1500.0, 1525.0, 1550.0);

    /**
     * Matriz de ejemplo de tres sensores de 10 mm.
     */
    public static SensorArrayConfig getExampleArray() {
        return SensorArrayConfig.builder()
                .sensorCount(3)
                .gratingLength(10.0)
                .tolerance(0.01)
                .positions(EXAMPLE_POSITIONS)
                .originalWavelengths(EXAMPLE_WAVELENGTHS)
                .build();
    }
}
