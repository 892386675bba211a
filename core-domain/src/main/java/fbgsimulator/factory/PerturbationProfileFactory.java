package fbgsimulator.factory;

import fbgsimulator.domain.deformation.ConditionDataset;
import fbgsimulator.domain.deformation.PerturbationMode;
import fbgsimulator.domain.deformation.StressType;
import fbgsimulator.domain.fiber.SensorArrayLayout;
import fbgsimulator.exception.DataRangeException;
import fbgsimulator.physics.model.PerturbationProfile;
import fbgsimulator.utils.LinearInterpolator;
import lombok.extern.slf4j.Slf4j;

import java.util.function.DoubleUnaryOperator;

/**
 * Fábrica del perfil de perturbación: convierte las muestras crudas del fichero
 * y la selección de modos en una función continua sobre el eje de la fibra.
 * <ul>
 * <li>Deformación NONE: ε(x) = 0.</li>
 * <li>Deformación UNIFORM: ε(x) = ε₀ (ignora el fichero).</li>
 * <li>Deformación NON_UNIFORM: interpolación lineal entre muestras, recortada en los extremos.</li>
 * <li>Tensión NONE / INCLUDED: idem de forma simétrica.</li>
 * </ul>
 */
@Slf4j
public class PerturbationProfileFactory {

    /**
     * Construye el perfil validando que el fichero cubra todos los sensores.
     *
     * @throws DataRangeException si el modo necesita el fichero y este está vacío,
     *                            no trae tensión, o algún sensor cae fuera de su rango.
     */
    public PerturbationProfile create(ConditionDataset dataset, PerturbationMode mode, SensorArrayLayout layout) {
        ConditionDataset data = dataset != null ? dataset : ConditionDataset.empty();

        if (mode.requiresDataset()) {
            validateCoverage(data, mode, layout);
        }

        DoubleUnaryOperator strain = switch (mode.strainType()) {
            case NONE -> x -> 0.0;
            case UNIFORM -> {
                double eps0 = mode.uniformStrain();
                yield x -> eps0;
            }
            case NON_UNIFORM -> interpolated(data.clonePositions(), data.cloneStrains());
        };

        DoubleUnaryOperator stress = mode.stressType() == StressType.INCLUDED
                ? interpolated(data.clonePositions(), data.cloneStresses())
                : x -> 0.0;

        log.debug("Perfil de perturbación creado (strain={}, stress={}, muestras={})",
                mode.strainType(), mode.stressType(), data.size());
        return new PerturbationProfile(mode, strain, stress);
    }

    private static DoubleUnaryOperator interpolated(double[] xs, double[] ys) {
        return x -> LinearInterpolator.interpolate(xs, ys, x);
    }

    private static void validateCoverage(ConditionDataset data, PerturbationMode mode, SensorArrayLayout layout) {
        if (data.isEmpty()) {
            throw new DataRangeException(String.format(
                    "El modo seleccionado (strain=%s, stress=%s) necesita datos, pero el fichero está vacío.",
                    mode.strainType(), mode.stressType()));
        }
        if (mode.stressType() == StressType.INCLUDED && !data.hasStress()) {
            throw new DataRangeException("Se ha incluido la tensión transversal, pero el fichero no trae la columna de tensión.");
        }

        double tolerance = layout.tolerance();
        for (int i = 0; i < layout.sensorCount(); i++) {
            double from = layout.positionOf(i) - tolerance;
            double to = layout.spanEnd(i) + tolerance;
            if (!data.overlaps(from, to)) {
                throw new DataRangeException(String.format(
                        "El sensor %d [%.3f, %.3f] mm queda fuera del rango de datos [%.3f, %.3f] mm.",
                        i, layout.positionOf(i), layout.spanEnd(i), data.firstPosition(), data.lastPosition()));
            }
        }
    }
}
