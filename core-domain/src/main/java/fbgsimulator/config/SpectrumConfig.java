package fbgsimulator.config;

import lombok.Builder;
import lombok.With;

/**
 * Banda y resolución del espectro simulado, en nanómetros.
 */
@Builder
@With
public record SpectrumConfig(
        double resolution,
        double minBandwidth,
        double maxBandwidth
) {

    public static SpectrumConfig getDefault() {
        return new SpectrumConfig(0.05, 1500.0, 1600.0);
    }
}
