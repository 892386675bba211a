package fbgsimulator.physics.model;

import fbgsimulator.domain.deformation.PerturbationMode;

import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * Función continua {@code x → (ε(x), σ(x))} sobre el eje longitudinal de la fibra.
 * Se construye con {@link fbgsimulator.factory.PerturbationProfileFactory}.
 */
public final class PerturbationProfile {

    private static final DoubleUnaryOperator ZERO = x -> 0.0;

    private final PerturbationMode mode;
    private final DoubleUnaryOperator strain;
    private final DoubleUnaryOperator stress;

    public PerturbationProfile(PerturbationMode mode, DoubleUnaryOperator strain, DoubleUnaryOperator stress) {
        this.mode = Objects.requireNonNull(mode);
        this.strain = strain != null ? strain : ZERO;
        this.stress = stress != null ? stress : ZERO;
    }

    /**
     * Perfil sin deformación ni tensión.
     */
    public static PerturbationProfile relaxed() {
        return new PerturbationProfile(PerturbationMode.none(), ZERO, ZERO);
    }

    public PerturbationMode getMode() {
        return mode;
    }

    public double strainAt(double position) {
        return strain.applyAsDouble(position);
    }

    public double stressAt(double position) {
        return stress.applyAsDouble(position);
    }

    public LocalCondition conditionAt(double position) {
        return new LocalCondition(strainAt(position), stressAt(position));
    }
}
