package fbgsimulator;

import fbgsimulator.config.SimulationRequest;
import fbgsimulator.domain.simulation.SimulationOutcome;
import fbgsimulator.domain.spectrum.PeakSummary;
import fbgsimulator.io.JsonFileHandler;
import fbgsimulator.physics.simulator.ProgressListener;
import fbgsimulator.service.SimulationWorker;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Punto de entrada por línea de comandos:
 * <pre>
 *   FbgSimulatorLauncher &lt;peticion.json&gt; [resultado.json]
 * </pre>
 * Lanza una única ejecución, registra el avance y escribe el resultado.
 */
@Slf4j
public class FbgSimulatorLauncher {

    public static void main(String[] args) {
        if (args.length < 1 || args.length > 2) {
            log.error("Uso: FbgSimulatorLauncher <peticion.json> [resultado.json]");
            System.exit(2);
        }
        System.exit(run(Path.of(args[0]), args.length == 2 ? Path.of(args[1]) : Path.of("fbg-result.json")));
    }

    static int run(Path requestFile, Path resultFile) {
        JsonFileHandler jsonHandler = new JsonFileHandler();
        SimulationOutcome outcome;

        try (SimulationWorker worker = new SimulationWorker()) {
            SimulationRequest request = jsonHandler.readRequest(requestFile);
            ProgressListener progress = percent -> log.info("Progreso: {}%", percent);

            Optional<CompletableFuture<SimulationOutcome>> submitted = worker.submit(request, progress);
            if (submitted.isEmpty()) {
                return 1;
            }
            outcome = submitted.get().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Ejecución interrumpida.");
            return 1;
        } catch (ExecutionException e) {
            log.error("Error inesperado en el hilo de simulación", e.getCause());
            return 1;
        } catch (RuntimeException e) {
            log.error("Simulation has failed, reason: {}", e.getMessage());
            return 1;
        }

        if (!outcome.isSuccess()) {
            log.error("Simulation has failed, reason: {}", outcome.errorMessage());
            return 1;
        }

        for (PeakSummary s : outcome.result().peakSummaries()) {
            log.info("Sensor {}: λ0 = {} nm, pico = {} nm, Δλ = {} nm, FWHM = {} nm",
                    s.sensorIndex(), s.originalWavelength(), s.peakWavelength(), s.shift(), s.fwhm());
        }
        try {
            jsonHandler.writeResult(outcome.result(), resultFile);
        } catch (RuntimeException e) {
            log.error("Simulation has failed, reason: {}", e.getMessage());
            return 1;
        }
        log.info("Resultado escrito en {}", resultFile.toAbsolutePath());
        return 0;
    }
}
