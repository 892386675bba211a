package fbgsimulator.physics.solver;

import fbgsimulator.domain.deformation.StressType;
import fbgsimulator.domain.fiber.SensorArrayLayout;
import fbgsimulator.domain.spectrum.BraggProfile;
import fbgsimulator.domain.spectrum.WavelengthGrid;
import fbgsimulator.exception.InvalidParameterException;
import fbgsimulator.exception.WavelengthRangeException;
import fbgsimulator.physics.model.LocalCondition;
import fbgsimulator.physics.model.PerturbationProfile;
import fbgsimulator.physics.model.PhotoelasticModel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resuelve la condición de Bragg local de cada sensor.
 * <p>
 * Discretiza cada red en M sub-redes, evalúa la perturbación en el centro de
 * cada una y aplica el modelo fotoelástico:
 * <pre>
 *   λB(x) = λ₀ · (1 + (1 − pe)·ε(x) + ξ·ΔT + α·ΔT·(1 − pe))
 * </pre>
 * Con perturbación nula y sin temperatura emulada el perfil resultante es
 * idéntico al del espectro sin deformar.
 */
@Slf4j
public class BraggConditionSolver {

    private final PhotoelasticModel model;
    private final int segmentCount;

    public BraggConditionSolver(PhotoelasticModel model, int segmentCount) {
        this.model = Objects.requireNonNull(model, "El modelo fotoelástico no puede ser nulo.");
        if (segmentCount < 1) {
            throw new InvalidParameterException("El número de sub-redes debe ser >= 1 (recibido " + segmentCount + ").");
        }
        this.segmentCount = segmentCount;
    }

    /**
     * Perfiles planos en las longitudes de onda originales, con índice n₀.
     */
    public List<BraggProfile> solveUndeformed(SensorArrayLayout layout) {
        double n0 = model.getParameters().initialRefractiveIndex();
        List<BraggProfile> profiles = new ArrayList<>(layout.sensorCount());
        for (int i = 0; i < layout.sensorCount(); i++) {
            profiles.add(BraggProfile.flat(i, layout.positionOf(i), layout.gratingLength(), segmentCount,
                    layout.originalWavelengthOf(i), n0));
        }
        return profiles;
    }

    /**
     * Perfiles perturbados de todos los sensores.
     *
     * @throws WavelengthRangeException si alguna longitud de onda local (incluido el
     *                                  desdoblamiento de polarización) sale de la banda.
     */
    public List<BraggProfile> solve(SensorArrayLayout layout, PerturbationProfile perturbation, WavelengthGrid grid) {
        List<BraggProfile> profiles = new ArrayList<>(layout.sensorCount());
        for (int i = 0; i < layout.sensorCount(); i++) {
            BraggProfile profile = solveSensor(i, layout, perturbation);
            if (profile.minBraggWavelength() < grid.getMinBandwidth()
                    || profile.maxBraggWavelength() > grid.getMaxBandwidth()) {
                throw new WavelengthRangeException(String.format(
                        "La longitud de onda de Bragg del sensor %d se desplaza a [%.4f, %.4f] nm, fuera de la banda [%.2f, %.2f] nm.",
                        i, profile.minBraggWavelength(), profile.maxBraggWavelength(),
                        grid.getMinBandwidth(), grid.getMaxBandwidth()));
            }
            log.debug("Sensor {}: λB medio = {} nm, rango [{}, {}] nm", i, profile.meanBraggWavelength(),
                    profile.minBraggWavelength(), profile.maxBraggWavelength());
            profiles.add(profile);
        }
        log.debug("Resueltos {} perfiles de Bragg con {} sub-redes", profiles.size(), segmentCount);
        return profiles;
    }

    /**
     * Perfil de un único sensor, sin comprobar la banda.
     */
    public BraggProfile solveSensor(int sensorIndex, SensorArrayLayout layout, PerturbationProfile perturbation) {
        double start = layout.positionOf(sensorIndex);
        double dz = layout.gratingLength() / segmentCount;
        double original = layout.originalWavelengthOf(sensorIndex);
        boolean stressIncluded = perturbation.getMode().stressType() == StressType.INCLUDED;

        double[] positions = new double[segmentCount];
        double[] wavelengths = new double[segmentCount];
        double[] indices = new double[segmentCount];
        double[] splits = new double[segmentCount];

        for (int j = 0; j < segmentCount; j++) {
            double x = start + (j + 0.5) * dz;
            LocalCondition condition = perturbation.conditionAt(x);

            positions[j] = x;
            wavelengths[j] = original * (1.0 + model.fractionalBraggShift(condition.strain()));
            indices[j] = model.perturbedEffectiveIndex(condition.strain());
            splits[j] = stressIncluded ? model.polarizationSplit(wavelengths[j], condition.stress()) : 0.0;
        }
        return new BraggProfile(sensorIndex, dz, positions, wavelengths, indices, splits);
    }
}
