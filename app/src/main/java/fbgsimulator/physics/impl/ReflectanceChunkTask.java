package fbgsimulator.physics.impl;

import fbgsimulator.domain.spectrum.BraggProfile;
import fbgsimulator.domain.spectrum.WavelengthGrid;
import fbgsimulator.physics.solver.CoupledModeSolver;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Tarea ejecutable (Callable) que calcula la reflectancia de la matriz de
 * sensores en un tramo contiguo de la rejilla de longitudes de onda.
 * Está diseñada para ser ejecutada en un pool de hilos: cada longitud de onda
 * es independiente de las demás.
 */
@Getter
@RequiredArgsConstructor
public class ReflectanceChunkTask implements Callable<ReflectanceChunkTask> {

    // --- Entradas para la tarea ---
    private final WavelengthGrid grid;
    private final int fromIndex; // inclusivo
    private final int toIndex;   // exclusivo
    private final List<BraggProfile> profiles; // compartidos, solo lectura
    private final double[] gaps; // fibra sin red tras cada sensor [mm]
    private final double initialRefractiveIndex;
    private final double meanIndexChange;
    private final double fringeVisibility;

    // --- Resultados de la tarea ---
    private double[] calculatedReflectance;

    @Override
    public ReflectanceChunkTask call() {
        this.calculatedReflectance = new double[toIndex - fromIndex];

        for (int k = fromIndex; k < toIndex; k++) {
            calculatedReflectance[k - fromIndex] = CoupledModeSolver.arrayReflectance(
                    grid.wavelengthAt(k),
                    profiles,
                    gaps,
                    initialRefractiveIndex,
                    meanIndexChange,
                    fringeVisibility
            );
        }
        return this;
    }
}
