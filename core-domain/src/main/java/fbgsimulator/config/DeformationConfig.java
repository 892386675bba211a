package fbgsimulator.config;

import fbgsimulator.domain.deformation.StrainType;
import fbgsimulator.domain.deformation.StressType;
import lombok.Builder;
import lombok.With;

/**
 * Tipo de simulación elegido: deformación longitudinal y tensión transversal.
 *
 * @param strainType    Tipo de deformación longitudinal.
 * @param uniformStrain Deformación ε₀ aplicada cuando el tipo es {@link StrainType#UNIFORM}.
 * @param stressType    Tipo de tensión transversal.
 */
@Builder
@With
public record DeformationConfig(
        StrainType strainType,
        double uniformStrain,
        StressType stressType
) {

    public static DeformationConfig none() {
        return new DeformationConfig(StrainType.NONE, 0.0, StressType.NONE);
    }
}
