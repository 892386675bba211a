package fbgsimulator.domain.fiber;

import fbgsimulator.config.EmulationConfig;
import fbgsimulator.config.FiberConfig;
import fbgsimulator.exception.InvalidParameterException;

/**
 * Constantes físicas inmutables de la fibra y de su entorno para una ejecución.
 * <p>
 * El constructor canónico valida que todos los valores sean finitos y estén en
 * rango físico; una instancia de esta clase es siempre consistente.
 *
 * @param initialRefractiveIndex    Índice efectivo inicial n₀ (&gt; 0).
 * @param meanIndexChange           Modulación media del índice δn (&ge; 0).
 * @param fringeVisibility          Visibilidad de franjas v en [0, 1].
 * @param p11                       Constante fotoelástica p₁₁.
 * @param p12                       Constante fotoelástica p₁₂.
 * @param youngsModulus             Módulo de Young E [Pa] (&gt; 0).
 * @param poissonsRatio             Coeficiente de Poisson ν en (-1, 0.5).
 * @param fiberExpansionCoefficient Dilatación térmica de la fibra αf [K⁻¹].
 * @param hostExpansionCoefficient  Dilatación térmica del anfitrión αh [K⁻¹], o {@code null} si no hay anfitrión.
 * @param thermoOptic               Coeficiente termo-óptico ξ [K⁻¹].
 * @param ambientTemperature        Temperatura ambiente [K] (&gt; 0).
 * @param emulatedTemperature       Temperatura emulada [K], o {@code null} si no se emula.
 */
public record FiberParameters(
        double initialRefractiveIndex,
        double meanIndexChange,
        double fringeVisibility,
        double p11,
        double p12,
        double youngsModulus,
        double poissonsRatio,
        double fiberExpansionCoefficient,
        Double hostExpansionCoefficient,
        double thermoOptic,
        double ambientTemperature,
        Double emulatedTemperature
) {

    public FiberParameters {
        requireFinite("n0", initialRefractiveIndex);
        requireFinite("δn", meanIndexChange);
        requireFinite("v", fringeVisibility);
        requireFinite("p11", p11);
        requireFinite("p12", p12);
        requireFinite("E", youngsModulus);
        requireFinite("ν", poissonsRatio);
        requireFinite("αf", fiberExpansionCoefficient);
        requireFinite("ξ", thermoOptic);
        requireFinite("T_amb", ambientTemperature);
        if (hostExpansionCoefficient != null) {
            requireFinite("αh", hostExpansionCoefficient);
        }
        if (emulatedTemperature != null) {
            requireFinite("T_em", emulatedTemperature);
        }

        if (initialRefractiveIndex <= 0) {
            throw new InvalidParameterException("El índice de refracción inicial debe ser positivo (n0=" + initialRefractiveIndex + ").");
        }
        if (meanIndexChange < 0) {
            throw new InvalidParameterException("La variación media del índice no puede ser negativa (δn=" + meanIndexChange + ").");
        }
        if (fringeVisibility < 0 || fringeVisibility > 1) {
            throw new InvalidParameterException("La visibilidad de franjas debe estar en [0, 1] (v=" + fringeVisibility + ").");
        }
        if (youngsModulus <= 0) {
            throw new InvalidParameterException("El módulo de Young debe ser positivo (E=" + youngsModulus + ").");
        }
        if (poissonsRatio <= -1 || poissonsRatio >= 0.5) {
            throw new InvalidParameterException("El coeficiente de Poisson debe estar en (-1, 0.5) (ν=" + poissonsRatio + ").");
        }
        if (ambientTemperature <= 0) {
            throw new InvalidParameterException("La temperatura ambiente debe ser positiva en Kelvin (T=" + ambientTemperature + ").");
        }
        if (emulatedTemperature != null && emulatedTemperature <= 0) {
            throw new InvalidParameterException("La temperatura emulada debe ser positiva en Kelvin (T=" + emulatedTemperature + ").");
        }
    }

    /**
     * Construye los parámetros a partir de los valores del formulario.
     *
     * @throws InvalidParameterException si algún valor está fuera de rango.
     */
    public static FiberParameters from(FiberConfig fiber, EmulationConfig emulation) {
        if (fiber == null) {
            throw new InvalidParameterException("Faltan los atributos de la fibra.");
        }
        EmulationConfig env = emulation != null ? emulation : EmulationConfig.disabled();
        return new FiberParameters(
                fiber.initialRefractiveIndex(),
                fiber.meanIndexChange(),
                fiber.fringeVisibility(),
                fiber.directionalRefractiveP11(),
                fiber.directionalRefractiveP12(),
                fiber.youngsModulus(),
                fiber.poissonsCoefficient(),
                fiber.fiberExpansionCoefficient(),
                env.hostExpansionCoefficient(),
                fiber.thermoOptic(),
                fiber.ambientTemperature(),
                env.emulatedTemperature());
    }

    public boolean isTemperatureEmulated() {
        return emulatedTemperature != null;
    }

    public boolean isHostExpansionActive() {
        return hostExpansionCoefficient != null;
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidParameterException("El parámetro " + name + " debe ser un número finito (" + value + ").");
        }
    }
}
