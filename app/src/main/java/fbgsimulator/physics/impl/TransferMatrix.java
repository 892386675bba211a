package fbgsimulator.physics.impl;

import org.apache.commons.math3.complex.Complex;

/**
 * Matriz de transferencia compleja 2×2 que relaciona las amplitudes de las
 * ondas progresiva (R) y regresiva (S) a ambos lados de un tramo de fibra:
 * <pre>
 *   [R(entrada)]   [a  b] [R(salida)]
 *   [S(entrada)] = [c  d] [S(salida)]
 * </pre>
 * Inmutable. El producto {@code A.multiply(B)} representa el tramo A seguido del tramo B.
 */
public final class TransferMatrix {

    private static final TransferMatrix IDENTITY =
            new TransferMatrix(Complex.ONE, Complex.ZERO, Complex.ZERO, Complex.ONE);

    private final Complex a;
    private final Complex b;
    private final Complex c;
    private final Complex d;

    public TransferMatrix(Complex a, Complex b, Complex c, Complex d) {
        this.a = a;
        this.b = b;
        this.c = c;
        this.d = d;
    }

    public static TransferMatrix identity() {
        return IDENTITY;
    }

    /**
     * Propagación libre por fibra sin red: acumula la fase {@code phase} en cada
     * sentido y no refleja nada.
     */
    public static TransferMatrix propagation(double phase) {
        Complex forward = new Complex(Math.cos(phase), -Math.sin(phase));
        return new TransferMatrix(forward, Complex.ZERO, Complex.ZERO, forward.conjugate());
    }

    public TransferMatrix multiply(TransferMatrix o) {
        return new TransferMatrix(
                a.multiply(o.a).add(b.multiply(o.c)),
                a.multiply(o.b).add(b.multiply(o.d)),
                c.multiply(o.a).add(d.multiply(o.c)),
                c.multiply(o.b).add(d.multiply(o.d)));
    }

    /**
     * Amplitud de reflexión {@code r = c / a}, inyectando luz solo por la entrada.
     */
    public Complex reflectionAmplitude() {
        return c.divide(a);
    }

    /**
     * Reflectancia en intensidad {@code |r|²}.
     */
    public double reflectance() {
        double modulus = reflectionAmplitude().abs();
        return modulus * modulus;
    }

    public Complex determinant() {
        return a.multiply(d).subtract(b.multiply(c));
    }

    public Complex getA() {
        return a;
    }

    public Complex getB() {
        return b;
    }

    public Complex getC() {
        return c;
    }

    public Complex getD() {
        return d;
    }
}
