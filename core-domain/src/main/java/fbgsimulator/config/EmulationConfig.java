package fbgsimulator.config;

import lombok.Builder;
import lombok.With;

/**
 * Opciones de emulación del entorno. Un campo nulo equivale a la casilla
 * desmarcada en el formulario.
 *
 * @param emulatedTemperature      Temperatura emulada del modelo [K], o {@code null}.
 * @param hostExpansionCoefficient Coeficiente de dilatación del material anfitrión [K⁻¹], o {@code null}.
 */
@Builder
@With
public record EmulationConfig(
        Double emulatedTemperature,
        Double hostExpansionCoefficient
) {

    public static EmulationConfig disabled() {
        return new EmulationConfig(null, null);
    }
}
