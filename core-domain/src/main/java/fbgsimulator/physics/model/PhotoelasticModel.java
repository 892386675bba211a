package fbgsimulator.physics.model;

import fbgsimulator.domain.fiber.FiberParameters;

import java.util.Objects;

/**
 * Modelo de parámetros físicos de la fibra.
 * <p>
 * Deriva, a partir de las constantes del material, los coeficientes efectivos
 * que relacionan deformación, tensión y temperatura con el desplazamiento de la
 * longitud de onda de Bragg:
 * <ul>
 * <li>Coeficiente fotoelástico efectivo: {@code pe = n₀²/2 · [p₁₂ − ν(p₁₁ + p₁₂)]}</li>
 * <li>Sensibilidad a la deformación: {@code 1 − pe}</li>
 * <li>Dilatación térmica efectiva: αh si hay anfitrión, αf en otro caso</li>
 * <li>Birrefringencia por tensión transversal: {@code n₀³/(2E) · (1 + ν)(p₁₂ − p₁₁)} por Pa</li>
 * </ul>
 * Es una función pura de sus entradas y por tanto thread-safe.
 */
public final class PhotoelasticModel {

    private static final double PASCALS_PER_MEGAPASCAL = 1e6;

    private final FiberParameters parameters;
    private final double effectivePhotoelastic;

    public PhotoelasticModel(FiberParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters, "Los parámetros de la fibra no pueden ser nulos.");
        double n0 = parameters.initialRefractiveIndex();
        this.effectivePhotoelastic = (n0 * n0 / 2.0)
                * (parameters.p12() - parameters.poissonsRatio() * (parameters.p11() + parameters.p12()));
    }

    public FiberParameters getParameters() {
        return parameters;
    }

    /**
     * Coeficiente fotoelástico efectivo pe.
     */
    public double effectivePhotoelasticCoefficient() {
        return effectivePhotoelastic;
    }

    /**
     * Sensibilidad de Bragg a la deformación longitudinal: {@code 1 − pe}.
     */
    public double strainSensitivity() {
        return 1.0 - effectivePhotoelastic;
    }

    /**
     * Coeficiente de dilatación que gobierna la deformación térmica del sensor.
     */
    public double thermalExpansionCoefficient() {
        return parameters.isHostExpansionActive()
                ? parameters.hostExpansionCoefficient()
                : parameters.fiberExpansionCoefficient();
    }

    /**
     * ΔT respecto al ambiente; cero si no se emula la temperatura.
     */
    public double temperatureChange() {
        return parameters.isTemperatureEmulated()
                ? parameters.emulatedTemperature() - parameters.ambientTemperature()
                : 0.0;
    }

    /**
     * Parte térmica del desplazamiento relativo: {@code ξ·ΔT + α·ΔT·(1 − pe)}.
     */
    public double thermalFractionalShift() {
        double dT = temperatureChange();
        return parameters.thermoOptic() * dT + thermalExpansionCoefficient() * dT * strainSensitivity();
    }

    /**
     * Desplazamiento relativo Δλ/λ para una deformación local dada.
     */
    public double fractionalBraggShift(double strain) {
        return strainSensitivity() * strain + thermalFractionalShift();
    }

    /**
     * Índice efectivo perturbado por la deformación (mecánica y térmica) y el efecto termo-óptico.
     */
    public double perturbedEffectiveIndex(double strain) {
        double dT = temperatureChange();
        double totalStrain = strain + thermalExpansionCoefficient() * dT;
        return parameters.initialRefractiveIndex()
                * (1.0 - effectivePhotoelastic * totalStrain + parameters.thermoOptic() * dT);
    }

    /**
     * Birrefringencia inducida por unidad de tensión transversal [Pa⁻¹].
     */
    public double stressBirefringenceCoefficient() {
        double n0 = parameters.initialRefractiveIndex();
        return (n0 * n0 * n0) / (2.0 * parameters.youngsModulus())
                * (1.0 + parameters.poissonsRatio())
                * (parameters.p12() - parameters.p11());
    }

    /**
     * Separación entre las longitudes de onda de Bragg de los dos ejes de polarización.
     *
     * @param braggWavelength Longitud de onda de Bragg local [nm].
     * @param stressMegapascals Tensión transversal [MPa].
     * @return Separación [nm], siempre &ge; 0.
     */
    public double polarizationSplit(double braggWavelength, double stressMegapascals) {
        double birefringence = stressBirefringenceCoefficient() * stressMegapascals * PASCALS_PER_MEGAPASCAL;
        return Math.abs(braggWavelength * birefringence / parameters.initialRefractiveIndex());
    }
}
