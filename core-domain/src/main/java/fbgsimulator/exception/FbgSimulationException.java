package fbgsimulator.exception;

import lombok.Getter;

/**
 * Raíz de los errores de dominio del simulador FBG.
 * <p>
 * Todas las validaciones lanzan una subclase de esta excepción, de forma que el
 * orquestador puede convertir cualquier fallo en un único mensaje legible sin
 * perder la categoría del error.
 */
@Getter
public abstract class FbgSimulationException extends RuntimeException {

    private final ErrorKind kind;

    protected FbgSimulationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected FbgSimulationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
