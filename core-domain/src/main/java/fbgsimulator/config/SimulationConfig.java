package fbgsimulator.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Parámetros internos del motor de cálculo, independientes de la física de la
 * fibra.
 */
@Value
@Builder
@With
public class SimulationConfig {

    /**
     * Número de núcleos CPU a utilizar para evaluar la rejilla de longitudes de onda.
     */
    int cpuProcessorCount;

    /**
     * Número M de sub-redes uniformes en que se discretiza cada sensor.
     */
    int gratingSegmentCount;

    /**
     * Reflectancia mínima para considerar detectado un pico.
     */
    double peakDetectionThreshold;

    public static SimulationConfig getDefault() {
        return SimulationConfig.builder()
                .cpuProcessorCount(Runtime.getRuntime().availableProcessors())
                .gratingSegmentCount(50)
                .peakDetectionThreshold(0.01)
                .build();
    }
}
