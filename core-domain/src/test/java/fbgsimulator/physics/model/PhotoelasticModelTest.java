package fbgsimulator.physics.model;

import fbgsimulator.config.EmulationConfig;
import fbgsimulator.config.FiberConfig;
import fbgsimulator.domain.fiber.FiberParameters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PhotoelasticModelTest {

    private static final double AMBIENT = 293.15;

    private static PhotoelasticModel model(EmulationConfig emulation) {
        return new PhotoelasticModel(FiberParameters.from(FiberConfig.getStandardSilicaFiber(), emulation));
    }

    @Test
    @DisplayName("El coeficiente fotoelástico efectivo de la sílice estándar es ≈ 0.2169")
    void effectivePhotoelasticCoefficient_standardSilica() {
        // Arrange
        PhotoelasticModel model = model(EmulationConfig.disabled());

        // Act
        double pe = model.effectivePhotoelasticCoefficient();

        // Assert: n0²/2 · [p12 − ν(p11 + p12)] = 1.0658 · 0.20353
        assertThat(pe).isCloseTo(0.216922, within(1e-5));
        assertThat(model.strainSensitivity()).isCloseTo(1.0 - pe, within(1e-15));
    }

    @Test
    @DisplayName("Sin perturbación ni emulación, el desplazamiento es exactamente cero")
    void fractionalBraggShift_zeroPerturbation_isExactlyZero() {
        PhotoelasticModel model = model(EmulationConfig.disabled());

        assertThat(model.temperatureChange()).isZero();
        assertThat(model.fractionalBraggShift(0.0)).isZero();
        assertThat(model.perturbedEffectiveIndex(0.0)).isEqualTo(1.46);
    }

    @Test
    @DisplayName("Una deformación de 100 µε a 1500 nm desplaza el pico ≈ 0.1175 nm")
    void fractionalBraggShift_uniformStrain() {
        PhotoelasticModel model = model(EmulationConfig.disabled());

        double shift = 1500.0 * model.fractionalBraggShift(1e-4);

        assertThat(shift).isCloseTo(0.11746, within(1e-4));
    }

    @Test
    @DisplayName("Emular +10 K sin anfitrión desplaza 1550 nm ≈ 0.135 nm")
    void thermalShift_withoutHost_usesFiberExpansion() {
        // Arrange
        PhotoelasticModel model = model(new EmulationConfig(AMBIENT + 10.0, null));

        // Act
        double shift = 1550.0 * model.fractionalBraggShift(0.0);

        // Assert: λ(ξ + αf(1 − pe))ΔT
        double expected = 1550.0 * (8.3e-6 + 0.55e-6 * model.strainSensitivity()) * 10.0;
        assertThat(model.temperatureChange()).isCloseTo(10.0, within(1e-9));
        assertThat(model.thermalExpansionCoefficient()).isEqualTo(0.55e-6);
        assertThat(shift).isCloseTo(expected, within(1e-12));
        assertThat(shift).isCloseTo(0.1353, within(5e-4));
    }

    @Test
    @DisplayName("Con anfitrión, su dilatación sustituye a la de la fibra")
    void thermalShift_withHost_usesHostExpansion() {
        PhotoelasticModel withHost = model(new EmulationConfig(AMBIENT + 10.0, 5e-5));
        PhotoelasticModel bare = model(new EmulationConfig(AMBIENT + 10.0, null));

        assertThat(withHost.thermalExpansionCoefficient()).isEqualTo(5e-5);
        assertThat(withHost.fractionalBraggShift(0.0)).isGreaterThan(bare.fractionalBraggShift(0.0));
    }

    @Test
    @DisplayName("El anfitrión no tiene efecto si no se emula la temperatura")
    void hostWithoutTemperature_hasNoEffect() {
        PhotoelasticModel model = model(new EmulationConfig(null, 5e-5));

        assertThat(model.fractionalBraggShift(0.0)).isZero();
    }

    @Test
    @DisplayName("El desdoblamiento de polarización crece linealmente con la tensión y es simétrico en signo")
    void polarizationSplit_isLinearInStress() {
        PhotoelasticModel model = model(EmulationConfig.disabled());

        double one = model.polarizationSplit(1550.0, 10.0);
        double two = model.polarizationSplit(1550.0, 20.0);

        assertThat(model.polarizationSplit(1550.0, 0.0)).isZero();
        assertThat(one).isPositive();
        assertThat(two).isCloseTo(2.0 * one, within(1e-12));
        assertThat(model.polarizationSplit(1550.0, -10.0)).isCloseTo(one, within(1e-15));
    }

    @Test
    @DisplayName("La birrefringencia por tensión sigue n0³/(2E)(1+ν)(p12−p11)")
    void stressBirefringenceCoefficient_matchesClosedForm() {
        PhotoelasticModel model = model(EmulationConfig.disabled());

        double expected = Math.pow(1.46, 3) / (2.0 * 75e9) * 1.17 * (0.270 - 0.121);

        assertThat(model.stressBirefringenceCoefficient()).isCloseTo(expected, within(1e-20));
    }
}
