package fbgsimulator.physics.simulator;

import fbgsimulator.config.SimulationRequest;
import fbgsimulator.domain.deformation.PerturbationMode;
import fbgsimulator.domain.fiber.DistanceUnits;
import fbgsimulator.domain.simulation.PipelineStage;
import fbgsimulator.domain.simulation.SimulationOutcome;
import fbgsimulator.domain.simulation.SimulationResult;
import fbgsimulator.domain.spectrum.PeakSummary;
import fbgsimulator.domain.spectrum.ReflectanceSpectrum;
import fbgsimulator.exception.ErrorKind;
import fbgsimulator.exception.FbgSimulationException;
import fbgsimulator.exception.FileAccessException;
import fbgsimulator.factory.FbgSimulatorFactory;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;

/**
 * Orquestador de una ejecución completa del simulador.
 * <p>
 * Recorre secuencialmente las etapas
 * {@code LOADING → UNDEFORMED_COMPUTE (opcional) → DEFORMED_COMPUTE → SUMMARY_COMPUTE}
 * e informa del avance en los puntos de control 13, 21, 34, 55, 89 y 100.
 * Cualquier error corta la ejecución en {@link PipelineStage#FAILED} con un único
 * mensaje; los resultados parciales se descartan.
 */
@Slf4j
public class SimulationPipeline {

    public static final int PROGRESS_STARTED = 13;
    public static final int PROGRESS_LOADED = 21;
    public static final int PROGRESS_UNDEFORMED = 34;
    public static final int PROGRESS_DEFORMED_START = 55;
    public static final int PROGRESS_DEFORMED_DONE = 89;
    public static final int PROGRESS_DONE = 100;

    private final FbgSimulatorFactory simulatorFactory;

    private volatile PipelineStage stage = PipelineStage.IDLE;

    public SimulationPipeline(FbgSimulatorFactory simulatorFactory) {
        this.simulatorFactory = simulatorFactory;
    }

    public SimulationPipeline() {
        this(new FbgSimulatorFactory());
    }

    public SimulationOutcome run(SimulationRequest request) {
        return run(request, ProgressListener.NONE);
    }

    /**
     * Ejecuta la simulación. Nunca lanza excepciones: los errores se devuelven en el
     * {@link SimulationOutcome}.
     */
    public SimulationOutcome run(SimulationRequest request, ProgressListener listener) {
        ProgressListener progress = listener != null ? listener : ProgressListener.NONE;
        long startTime = System.currentTimeMillis();

        try {
            progress.onProgress(PROGRESS_STARTED);
            enter(PipelineStage.LOADING, progress);

            try (FbgSimulator simulator = simulatorFactory.createSimulator(request)) {
                PerturbationMode mode = PerturbationMode.from(request.deformation());
                loadConditions(simulator, request, mode);
                // Cobertura del fichero y banda se validan antes de lanzar el motor
                simulator.deformedProfiles(mode);
                progress.onProgress(PROGRESS_LOADED);

                ReflectanceSpectrum undeformed = null;
                if (request.includeUndeformedSpectrum()) {
                    enter(PipelineStage.UNDEFORMED_COMPUTE, progress);
                    undeformed = simulator.undeformedSpectrum();
                    progress.onProgress(PROGRESS_UNDEFORMED);
                }

                progress.onProgress(PROGRESS_DEFORMED_START);
                enter(PipelineStage.DEFORMED_COMPUTE, progress);
                ReflectanceSpectrum deformed = simulator.deformedSpectrum(mode);
                progress.onProgress(PROGRESS_DEFORMED_DONE);

                enter(PipelineStage.SUMMARY_COMPUTE, progress);
                List<PeakSummary> summaries = simulator.computeShiftsAndWidths(mode);

                SimulationResult result = new SimulationResult(simulator.getGrid(), undeformed, deformed, summaries,
                        System.currentTimeMillis() - startTime);
                progress.onProgress(PROGRESS_DONE);
                enter(PipelineStage.DONE, progress);
                log.info("Simulación completada en {} ms ({} sensores, {} puntos)",
                        result.executionTimeMs(), summaries.size(), simulator.getGrid().size());
                return SimulationOutcome.success(result);
            }
        } catch (FbgSimulationException e) {
            log.error("La simulación ha fallado en la etapa {} [{}]: {}", stage, e.getKind(), e.getMessage());
            return fail(e.getKind(), e.getMessage(), progress);
        } catch (RuntimeException e) {
            log.error("Error inesperado en la etapa {}", stage, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return fail(ErrorKind.INTERNAL, message, progress);
        }
    }

    private void loadConditions(FbgSimulator simulator, SimulationRequest request, PerturbationMode mode) {
        String dataFile = request.dataFile();
        if (dataFile == null || dataFile.isBlank()) {
            if (mode.requiresDataset()) {
                throw new FileAccessException("El modo seleccionado necesita un fichero de datos y no se ha indicado ninguno.");
            }
            log.debug("Sin fichero de datos: el modo {} no lo necesita.", mode);
            return;
        }
        DistanceUnits units = request.units() != null ? request.units() : DistanceUnits.MILLIMETERS;
        simulator.loadConditions(Path.of(dataFile), units);
    }

    private void enter(PipelineStage next, ProgressListener progress) {
        stage = next;
        log.debug("Etapa: {}", next);
        progress.onStageChanged(next);
    }

    private SimulationOutcome fail(ErrorKind kind, String message, ProgressListener progress) {
        stage = PipelineStage.FAILED;
        try {
            progress.onStageChanged(PipelineStage.FAILED);
        } catch (RuntimeException e) {
            log.warn("El observador de progreso ha fallado al notificar el error: {}", e.getMessage());
        }
        return SimulationOutcome.failure(kind, message);
    }

    /**
     * Etapa actual (o la última alcanzada si la ejecución terminó).
     */
    public PipelineStage getStage() {
        return stage;
    }
}
