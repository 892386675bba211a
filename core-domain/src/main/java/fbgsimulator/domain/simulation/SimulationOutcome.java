package fbgsimulator.domain.simulation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import fbgsimulator.exception.ErrorKind;

import java.util.Optional;

/**
 * Resultado terminal de una ejecución: o bien un {@link SimulationResult}
 * completo, o bien un único mensaje de error. Nunca ambos.
 *
 * @param finalStage   {@link PipelineStage#DONE} o {@link PipelineStage#FAILED}.
 * @param result       Resultado, solo si la ejecución terminó bien.
 * @param errorKind    Categoría del error, solo si falló.
 * @param errorMessage Mensaje legible, solo si falló.
 */
public record SimulationOutcome(
        PipelineStage finalStage,
        SimulationResult result,
        ErrorKind errorKind,
        String errorMessage
) {

    public static SimulationOutcome success(SimulationResult result) {
        return new SimulationOutcome(PipelineStage.DONE, result, null, null);
    }

    public static SimulationOutcome failure(ErrorKind kind, String message) {
        return new SimulationOutcome(PipelineStage.FAILED, null, kind, message);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return finalStage == PipelineStage.DONE;
    }

    public Optional<SimulationResult> optionalResult() {
        return Optional.ofNullable(result);
    }
}
