package fbgsimulator.service;

import fbgsimulator.config.SimulationRequest;
import fbgsimulator.domain.simulation.SimulationOutcome;
import fbgsimulator.physics.simulator.ProgressListener;
import fbgsimulator.physics.simulator.SimulationPipeline;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ejecuta simulaciones en un hilo de fondo dedicado, de una en una.
 * <p>
 * Mientras hay una ejecución en curso, cualquier nueva petición se rechaza
 * (no se encola). No admite cancelación a mitad de ejecución, y cerrar el
 * worker con una ejecución activa es un error de programación.
 */
@Slf4j
public class SimulationWorker implements AutoCloseable {

    private final SimulationPipeline pipeline;
    private final ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile CompletableFuture<SimulationOutcome> lastRun;

    public SimulationWorker(SimulationPipeline pipeline) {
        this.pipeline = pipeline;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "fbg-simulation-worker");
            t.setDaemon(true);
            return t;
        });
    }

    public SimulationWorker() {
        this(new SimulationPipeline());
    }

    /**
     * Lanza una ejecución en segundo plano.
     *
     * @return El futuro con el desenlace, o vacío si ya hay una ejecución en curso.
     */
    public Optional<CompletableFuture<SimulationOutcome>> submit(SimulationRequest request, ProgressListener listener) {
        if (!running.compareAndSet(false, true)) {
            log.warn("A simulator session is already in progress.");
            return Optional.empty();
        }
        try {
            CompletableFuture<SimulationOutcome> future = CompletableFuture.supplyAsync(() -> {
                try {
                    return pipeline.run(request, listener);
                } finally {
                    running.set(false);
                }
            }, executor);
            lastRun = future;
            return Optional.of(future);
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
    }

    public boolean isBusy() {
        return running.get();
    }

    /**
     * Espera a que termine la ejecución en curso, si la hay.
     *
     * @return {@code true} si el worker quedó libre antes del plazo.
     */
    public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        CompletableFuture<SimulationOutcome> current = lastRun;
        if (current == null) {
            return true;
        }
        try {
            current.get(timeout, unit);
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            // El hilo queda libre igualmente; el error ya lo recibe quien tenga el futuro
            log.warn("La última ejecución terminó con error: {}", e.getCause().getMessage());
        }
        return true;
    }

    /**
     * Libera el hilo de fondo.
     *
     * @throws IllegalStateException si hay una ejecución en curso.
     */
    @Override
    public void close() {
        if (running.get()) {
            throw new IllegalStateException("Simulation thread is still in progress.");
        }
        executor.shutdown();
        log.info("SimulationWorker cerrado.");
    }
}
