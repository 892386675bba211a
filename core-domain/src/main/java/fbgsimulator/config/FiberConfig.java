package fbgsimulator.config;

import lombok.Builder;
import lombok.With;

/**
 * Valores crudos de los atributos de la fibra tal y como llegan del formulario
 * (modo avanzado). No se validan aquí: la validación ocurre al construir
 * {@link fbgsimulator.domain.fiber.FiberParameters} dentro de la ejecución.
 *
 * @param initialRefractiveIndex     Índice de refracción efectivo inicial n₀.
 * @param meanIndexChange            Variación media del índice de refracción δn.
 * @param fringeVisibility           Visibilidad de las franjas v (0-1).
 * @param directionalRefractiveP11   Constante fotoelástica normal (Pockels) p₁₁.
 * @param directionalRefractiveP12   Constante fotoelástica de cizalla (Pockels) p₁₂.
 * @param youngsModulus              Módulo de elasticidad de Young E [Pa].
 * @param poissonsCoefficient        Coeficiente de Poisson ν.
 * @param fiberExpansionCoefficient  Coeficiente de dilatación térmica de la fibra αf [K⁻¹].
 * @param thermoOptic                Coeficiente termo-óptico ξ [K⁻¹].
 * @param ambientTemperature         Temperatura ambiente [K].
 */
@Builder
@With
public record FiberConfig(
        double initialRefractiveIndex,
        double meanIndexChange,
        double fringeVisibility,
        double directionalRefractiveP11,
        double directionalRefractiveP12,
        double youngsModulus,
        double poissonsCoefficient,
        double fiberExpansionCoefficient,
        double thermoOptic,
        double ambientTemperature
) {

    /**
     * Fibra monomodo de sílice estándar: los valores por defecto del formulario.
     */
    public static FiberConfig getStandardSilicaFiber() {
        return FiberConfig.builder()
                .initialRefractiveIndex(1.46)
                .meanIndexChange(4.5e-4)
                .fringeVisibility(1.0)
                .directionalRefractiveP11(0.121)
                .directionalRefractiveP12(0.270)
                .youngsModulus(75e9)
                .poissonsCoefficient(0.17)
                .fiberExpansionCoefficient(0.55e-6)
                .thermoOptic(8.3e-6)
                .ambientTemperature(293.15)
                .build();
    }
}
