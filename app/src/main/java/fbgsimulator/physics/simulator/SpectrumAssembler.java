package fbgsimulator.physics.simulator;

import fbgsimulator.domain.fiber.SensorArrayLayout;
import fbgsimulator.domain.spectrum.BraggProfile;
import fbgsimulator.domain.spectrum.ReflectanceSpectrum;
import fbgsimulator.domain.spectrum.WavelengthGrid;
import fbgsimulator.physics.model.PerturbationProfile;
import fbgsimulator.physics.solver.BraggConditionSolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Ensambla los espectros sin deformar y deformado sobre la misma rejilla,
 * combinando el solver de Bragg con el motor de reflectancia.
 */
@Slf4j
@RequiredArgsConstructor
public class SpectrumAssembler {

    private final BraggConditionSolver braggSolver;
    private final GratingReflectanceEngine engine;

    /**
     * Espectro de la matriz sin perturbar, a temperatura ambiente.
     */
    public ReflectanceSpectrum undeformed(SensorArrayLayout layout, WavelengthGrid grid) {
        log.info("Calculando espectro sin deformar ({} sensores, {} puntos)", layout.sensorCount(), grid.size());
        return engine.compute(grid, braggSolver.solveUndeformed(layout), layout);
    }

    /**
     * Perfiles de Bragg perturbados, comprobados contra la banda.
     */
    public List<BraggProfile> deformedProfiles(SensorArrayLayout layout, PerturbationProfile perturbation,
                                               WavelengthGrid grid) {
        return braggSolver.solve(layout, perturbation, grid);
    }

    /**
     * Espectro a partir de perfiles ya resueltos por {@link #deformedProfiles}.
     */
    public ReflectanceSpectrum deformed(SensorArrayLayout layout, List<BraggProfile> profiles, WavelengthGrid grid) {
        log.info("Calculando espectro deformado ({} sensores, {} puntos)", layout.sensorCount(), grid.size());
        return engine.compute(grid, profiles, layout);
    }
}
