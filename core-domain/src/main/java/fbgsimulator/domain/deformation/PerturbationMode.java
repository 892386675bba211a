package fbgsimulator.domain.deformation;

import fbgsimulator.config.DeformationConfig;
import fbgsimulator.exception.InvalidParameterException;

/**
 * Selección validada de deformación y tensión para una ejecución.
 *
 * @param strainType    Variante de deformación.
 * @param uniformStrain ε₀, solo relevante para {@link StrainType#UNIFORM}.
 * @param stressType    Variante de tensión.
 */
public record PerturbationMode(StrainType strainType, double uniformStrain, StressType stressType) {

    public PerturbationMode {
        if (strainType == null) {
            throw new InvalidParameterException("Falta el tipo de deformación.");
        }
        if (stressType == null) {
            throw new InvalidParameterException("Falta el tipo de tensión.");
        }
        if (strainType == StrainType.UNIFORM && !Double.isFinite(uniformStrain)) {
            throw new InvalidParameterException("La deformación uniforme debe ser un número finito (ε0=" + uniformStrain + ").");
        }
    }

    public static PerturbationMode none() {
        return new PerturbationMode(StrainType.NONE, 0.0, StressType.NONE);
    }

    public static PerturbationMode uniformStrain(double strain) {
        return new PerturbationMode(StrainType.UNIFORM, strain, StressType.NONE);
    }

    public static PerturbationMode from(DeformationConfig config) {
        if (config == null) {
            return none();
        }
        return new PerturbationMode(config.strainType(), config.uniformStrain(), config.stressType());
    }

    /**
     * Indica si algún componente se interpola desde el fichero de datos.
     */
    public boolean requiresDataset() {
        return strainType == StrainType.NON_UNIFORM || stressType == StressType.INCLUDED;
    }
}
