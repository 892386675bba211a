package fbgsimulator.factory;

import fbgsimulator.config.SimulationConfig;
import fbgsimulator.config.SimulationRequest;
import fbgsimulator.domain.fiber.FiberParameters;
import fbgsimulator.domain.fiber.SensorArrayLayout;
import fbgsimulator.domain.spectrum.WavelengthGrid;
import fbgsimulator.exception.InvalidParameterException;
import fbgsimulator.physics.simulator.FbgSimulator;
import lombok.RequiredArgsConstructor;

/**
 * Construye un {@link FbgSimulator} validado a partir de la petición del formulario.
 * Cualquier parámetro incoherente se detecta aquí, antes de calcular nada.
 */
@RequiredArgsConstructor
public class FbgSimulatorFactory {

    private final SimulationConfig config;

    public FbgSimulatorFactory() {
        this(SimulationConfig.getDefault());
    }

    public FbgSimulator createSimulator(SimulationRequest request) {
        if (request == null) {
            throw new InvalidParameterException("La petición de simulación no puede ser nula.");
        }

        FiberParameters fiber = FiberParameters.from(request.fiber(), request.emulation());
        SensorArrayLayout layout = SensorArrayLayout.from(request.sensorArray());
        WavelengthGrid grid = WavelengthGrid.from(request.spectrum());
        return new FbgSimulator(fiber, layout, grid, config);
    }
}
