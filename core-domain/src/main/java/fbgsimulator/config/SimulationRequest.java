package fbgsimulator.config;

import fbgsimulator.domain.fiber.DistanceUnits;
import lombok.Builder;
import lombok.With;

/**
 * Petición completa de una ejecución del simulador: el registro que produce el
 * formulario de parámetros y que consume el orquestador.
 * <p>
 * Es un objeto de transporte (se lee desde JSON); ninguna de sus partes se valida
 * hasta que el orquestador entra en la etapa de carga, para que cualquier error
 * de entrada se reporte como un fallo de la ejecución y no como un cuelgue.
 *
 * @param fiber                     Atributos de la fibra.
 * @param emulation                 Opciones de emulación de temperatura y anfitrión.
 * @param deformation               Tipo de deformación y de tensión.
 * @param sensorArray               Configuración de la matriz de sensores.
 * @param spectrum                  Banda y resolución.
 * @param units                     Unidades de las distancias del fichero de datos.
 * @param includeUndeformedSpectrum Si se calcula también el espectro sin deformar.
 * @param dataFile                  Ruta del fichero de deformación/tensión.
 */
@Builder
@With
public record SimulationRequest(
        FiberConfig fiber,
        EmulationConfig emulation,
        DeformationConfig deformation,
        SensorArrayConfig sensorArray,
        SpectrumConfig spectrum,
        DistanceUnits units,
        boolean includeUndeformedSpectrum,
        String dataFile
) {

    /**
     * Petición con todos los valores por defecto del formulario sobre un fichero dado.
     */
    public static SimulationRequest withDefaults(String dataFile) {
        return SimulationRequest.builder()
                .fiber(FiberConfig.getStandardSilicaFiber())
                .emulation(EmulationConfig.disabled())
                .deformation(DeformationConfig.none())
                .sensorArray(SensorArrayConfig.getExampleArray())
                .spectrum(SpectrumConfig.getDefault())
                .units(DistanceUnits.MILLIMETERS)
                .includeUndeformedSpectrum(false)
                .dataFile(dataFile)
                .build();
    }
}
