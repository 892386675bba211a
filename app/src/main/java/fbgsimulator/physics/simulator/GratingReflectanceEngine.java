package fbgsimulator.physics.simulator;

import fbgsimulator.config.SimulationConfig;
import fbgsimulator.domain.fiber.FiberParameters;
import fbgsimulator.domain.fiber.SensorArrayLayout;
import fbgsimulator.domain.spectrum.BraggProfile;
import fbgsimulator.domain.spectrum.ReflectanceSpectrum;
import fbgsimulator.domain.spectrum.WavelengthGrid;
import fbgsimulator.exception.FbgSimulationException;
import fbgsimulator.exception.InvalidParameterException;
import fbgsimulator.physics.impl.ReflectanceChunkTask;
import fbgsimulator.physics.solver.CoupledModeSolver;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.DoubleUnaryOperator;

/**
 * Motor de reflectancia: evalúa la matriz de transferencia de toda la matriz
 * de sensores en cada punto de la rejilla.
 * <p>
 * La rejilla se trocea en tramos contiguos que se reparten en un pool de hilos
 * fijo. El resultado no depende del número de hilos: cada longitud de onda se
 * calcula siempre con las mismas operaciones.
 */
@Slf4j
public class GratingReflectanceEngine implements AutoCloseable {

    // Tramos por hilo, para equilibrar la carga entre zonas rápidas y lentas de la banda
    private static final int CHUNKS_PER_THREAD = 4;

    private final FiberParameters fiber;
    private final ExecutorService threadPool;
    private final int processorCount;

    public GratingReflectanceEngine(FiberParameters fiber, SimulationConfig config) {
        this.fiber = fiber;
        this.processorCount = Math.max(config.getCpuProcessorCount(), 1);
        this.threadPool = Executors.newFixedThreadPool(processorCount);
        log.info("GratingReflectanceEngine inicializado. (Hilos: {})", processorCount);
    }

    /**
     * Calcula el espectro de reflexión R(λ) de la matriz descrita por {@code profiles}.
     *
     * @param profiles Un perfil por sensor, en el orden físico de la fibra.
     */
    public ReflectanceSpectrum compute(WavelengthGrid grid, List<BraggProfile> profiles, SensorArrayLayout layout) {
        if (profiles.size() != layout.sensorCount()) {
            throw new InvalidParameterException(String.format(
                    "Se esperaban %d perfiles de Bragg y se recibieron %d.", layout.sensorCount(), profiles.size()));
        }
        long startTime = System.currentTimeMillis();
        double[] gaps = gaps(layout);

        int size = grid.size();
        int chunkCount = Math.min(size, processorCount * CHUNKS_PER_THREAD);
        int chunkSize = (size + chunkCount - 1) / chunkCount;

        List<ReflectanceChunkTask> tasks = new ArrayList<>(chunkCount);
        for (int from = 0; from < size; from += chunkSize) {
            tasks.add(new ReflectanceChunkTask(grid, from, Math.min(size, from + chunkSize), profiles, gaps,
                    fiber.initialRefractiveIndex(), fiber.meanIndexChange(), fiber.fringeVisibility()));
        }

        List<Future<ReflectanceChunkTask>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Cálculo de reflectancia interrumpido.", e);
        }

        double[] reflectance = new double[size];
        for (int i = 0; i < futures.size(); i++) {
            try {
                ReflectanceChunkTask task = futures.get(i).get();
                double[] chunk = task.getCalculatedReflectance();
                System.arraycopy(chunk, 0, reflectance, task.getFromIndex(), chunk.length);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException("Cálculo de reflectancia interrumpido.", e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof FbgSimulationException domainError) {
                    throw domainError;
                }
                throw new RuntimeException("Error en cálculo de reflectancia, tramo " + i, e.getCause());
            }
        }

        log.debug("Espectro de {} puntos calculado en {} ms ({} tramos)",
                size, System.currentTimeMillis() - startTime, tasks.size());
        return new ReflectanceSpectrum(reflectance);
    }

    /**
     * Reflectancia R(λ) de la matriz evaluada en el hilo que la invoca, para longitudes
     * de onda sueltas dentro o fuera de la rejilla.
     */
    public DoubleUnaryOperator reflectanceFunction(List<BraggProfile> profiles, SensorArrayLayout layout) {
        if (profiles.size() != layout.sensorCount()) {
            throw new InvalidParameterException(String.format(
                    "Se esperaban %d perfiles de Bragg y se recibieron %d.", layout.sensorCount(), profiles.size()));
        }
        List<BraggProfile> snapshot = List.copyOf(profiles);
        double[] gaps = gaps(layout);
        double n0 = fiber.initialRefractiveIndex();
        double dn = fiber.meanIndexChange();
        double visibility = fiber.fringeVisibility();
        return wavelength -> CoupledModeSolver.arrayReflectance(wavelength, snapshot, gaps, n0, dn, visibility);
    }

    private static double[] gaps(SensorArrayLayout layout) {
        double[] gaps = new double[layout.sensorCount()];
        for (int i = 0; i < gaps.length - 1; i++) {
            gaps[i] = layout.gapAfter(i);
        }
        return gaps;
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("GratingReflectanceEngine cerrado.");
    }
}
