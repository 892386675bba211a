package fbgsimulator.domain.fiber;

import fbgsimulator.config.EmulationConfig;
import fbgsimulator.config.FiberConfig;
import fbgsimulator.exception.InvalidParameterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FiberParametersTest {

    private final FiberConfig silica = FiberConfig.getStandardSilicaFiber();

    @Test
    @DisplayName("La fibra estándar sin emulación es válida y no emula nada")
    void standardFiber_isValid() {
        FiberParameters params = FiberParameters.from(silica, null);

        assertThat(params.initialRefractiveIndex()).isEqualTo(1.46);
        assertThat(params.isTemperatureEmulated()).isFalse();
        assertThat(params.isHostExpansionActive()).isFalse();
    }

    @Test
    @DisplayName("Las opciones de emulación se trasladan a los parámetros")
    void emulation_isCarriedOver() {
        FiberParameters params = FiberParameters.from(silica, new EmulationConfig(310.0, 5e-5));

        assertThat(params.emulatedTemperature()).isEqualTo(310.0);
        assertThat(params.hostExpansionCoefficient()).isEqualTo(5e-5);
        assertThat(params.isTemperatureEmulated()).isTrue();
        assertThat(params.isHostExpansionActive()).isTrue();
    }

    @Test
    @DisplayName("Valores no finitos o fuera de rango físico se rechazan")
    void invalidValues_throw() {
        assertThatThrownBy(() -> FiberParameters.from(silica.withInitialRefractiveIndex(Double.NaN), null))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> FiberParameters.from(silica.withYoungsModulus(0.0), null))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> FiberParameters.from(silica.withPoissonsCoefficient(0.5), null))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> FiberParameters.from(silica.withFringeVisibility(1.5), null))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> FiberParameters.from(silica.withAmbientTemperature(-1.0), null))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> FiberParameters.from(silica, new EmulationConfig(Double.POSITIVE_INFINITY, null)))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> FiberParameters.from(null, null))
                .isInstanceOf(InvalidParameterException.class);
    }
}
