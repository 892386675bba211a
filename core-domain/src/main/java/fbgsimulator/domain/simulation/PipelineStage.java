package fbgsimulator.domain.simulation;

/**
 * Etapas de una ejecución del simulador, en el orden en que se recorren.
 * <pre>
 * IDLE → LOADING → UNDEFORMED_COMPUTE (opcional) → DEFORMED_COMPUTE → SUMMARY_COMPUTE → DONE | FAILED
 * </pre>
 */
public enum PipelineStage {
    IDLE,
    LOADING,
    UNDEFORMED_COMPUTE,
    DEFORMED_COMPUTE,
    SUMMARY_COMPUTE,
    DONE,
    FAILED
}
