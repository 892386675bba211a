package fbgsimulator.physics.simulator;

import fbgsimulator.domain.simulation.PipelineStage;

/**
 * Observador del avance de una ejecución. Se invoca desde el hilo de la
 * simulación; las implementaciones deben ser rápidas y no bloquear.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = percent -> {
    };

    /**
     * @param percent Porcentaje entero en [0, 100], nunca decreciente dentro de una ejecución.
     */
    void onProgress(int percent);

    default void onStageChanged(PipelineStage stage) {
    }
}
