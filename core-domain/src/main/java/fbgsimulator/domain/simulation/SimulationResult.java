package fbgsimulator.domain.simulation;

import fbgsimulator.domain.spectrum.PeakSummary;
import fbgsimulator.domain.spectrum.ReflectanceSpectrum;
import fbgsimulator.domain.spectrum.WavelengthGrid;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Salida completa de una ejecución correcta: lo que consume la ventana de
 * gráficos.
 *
 * @param grid               Rejilla de longitudes de onda compartida por ambos espectros.
 * @param undeformedSpectrum Espectro sin deformar, o {@code null} si no se pidió.
 * @param deformedSpectrum   Espectro deformado.
 * @param peakSummaries      Un resumen por sensor, en el orden de la matriz.
 * @param executionTimeMs    Duración de la ejecución [ms].
 */
public record SimulationResult(
        WavelengthGrid grid,
        ReflectanceSpectrum undeformedSpectrum,
        ReflectanceSpectrum deformedSpectrum,
        List<PeakSummary> peakSummaries,
        long executionTimeMs
) {

    public SimulationResult {
        Objects.requireNonNull(grid, "La rejilla no puede ser nula.");
        Objects.requireNonNull(deformedSpectrum, "El espectro deformado no puede ser nulo.");
        Objects.requireNonNull(peakSummaries, "Los resúmenes de pico no pueden ser nulos.");
        if (deformedSpectrum.size() != grid.size()
                || (undeformedSpectrum != null && undeformedSpectrum.size() != grid.size())) {
            throw new IllegalArgumentException("Los espectros deben tener la misma longitud que la rejilla.");
        }
        peakSummaries = List.copyOf(peakSummaries);
    }

    public Optional<ReflectanceSpectrum> undeformed() {
        return Optional.ofNullable(undeformedSpectrum);
    }
}
