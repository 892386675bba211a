package fbgsimulator.physics.solver;

import fbgsimulator.domain.spectrum.BraggProfile;
import fbgsimulator.exception.NumericalException;
import fbgsimulator.physics.impl.TransferMatrix;
import org.apache.commons.math3.complex.Complex;

import java.util.List;

/**
 * Método de la matriz de transferencia (teoría de modos acoplados) para redes
 * de Bragg no uniformes.
 * <p>
 * Cada sub-red uniforme de longitud Δz se describe con:
 * <ul>
 * <li>Auto-acoplamiento (desintonía): {@code σ̂ = 2π(n + δn)(1/λ − 1/λB)}. El término DC
 * 2πδn/λ se absorbe en el periodo de diseño para que la red sin perturbar refleje
 * exactamente en su longitud de onda nominal.</li>
 * <li>Acoplamiento AC: {@code κ = π·v·δn / λ}.</li>
 * </ul>
 * y su matriz es
 * <pre>
 *   [cosh(γΔz) − i(σ̂/γ)sinh(γΔz)      −i(κ/γ)sinh(γΔz)        ]
 *   [      i(κ/γ)sinh(γΔz)        cosh(γΔz) + i(σ̂/γ)sinh(γΔz) ],   γ² = κ² − σ̂²
 * </pre>
 * Todas las longitudes se pasan a nanómetros dentro de esta clase.
 * Es thread safe: no guarda estado.
 */
public final class CoupledModeSolver {

    /** Nanómetros por milímetro. */
    public static final double NM_PER_MM = 1e6;

    private static final double TWO_PI = 2.0 * Math.PI;
    // Por debajo de este |γ²·Δz²| se usa el límite γ → 0 (sinh(γz)/γ → z)
    private static final double DEGENERATE_GAMMA = 1e-18;

    /**
     * Prohibido construir esta clase utilidad
     */
    private CoupledModeSolver() {
    }

    /**
     * Matriz de una sub-red uniforme.
     *
     * @param wavelength      Longitud de onda evaluada [nm].
     * @param braggWavelength Longitud de onda de Bragg local [nm].
     * @param effectiveIndex  Índice efectivo local.
     * @param indexChange     Modulación media δn.
     * @param visibility      Visibilidad de franjas v.
     * @param lengthNm        Longitud de la sub-red [nm].
     */
    public static TransferMatrix segmentMatrix(double wavelength, double braggWavelength, double effectiveIndex,
                                               double indexChange, double visibility, double lengthNm) {
        if (!(lengthNm > 0)) {
            throw new NumericalException("Sub-red de longitud nula o negativa (" + lengthNm + " nm).");
        }

        double sigma = TWO_PI * (effectiveIndex + indexChange) * (1.0 / wavelength - 1.0 / braggWavelength);
        double kappa = Math.PI * visibility * indexChange / wavelength;
        double gammaSquared = kappa * kappa - sigma * sigma;

        // C = cosh(γΔz), S = sinh(γΔz)/γ, con continuación analítica para γ imaginario
        double cosh;
        double sinhOverGamma;
        if (Math.abs(gammaSquared) * lengthNm * lengthNm < DEGENERATE_GAMMA) {
            cosh = 1.0;
            sinhOverGamma = lengthNm;
        } else if (gammaSquared > 0) {
            double gamma = Math.sqrt(gammaSquared);
            cosh = Math.cosh(gamma * lengthNm);
            sinhOverGamma = Math.sinh(gamma * lengthNm) / gamma;
        } else {
            double g = Math.sqrt(-gammaSquared);
            cosh = Math.cos(g * lengthNm);
            sinhOverGamma = Math.sin(g * lengthNm) / g;
        }

        return new TransferMatrix(
                new Complex(cosh, -sigma * sinhOverGamma),
                new Complex(0.0, -kappa * sinhOverGamma),
                new Complex(0.0, kappa * sinhOverGamma),
                new Complex(cosh, sigma * sinhOverGamma));
    }

    /**
     * Matriz de un sensor completo: producto de sus sub-redes en orden físico.
     *
     * @param polarization -1 o +1 para el eje rápido/lento; 0 ignora el desdoblamiento.
     */
    public static TransferMatrix sensorMatrix(double wavelength, BraggProfile profile, int polarization,
                                              double indexChange, double visibility) {
        double lengthNm = profile.segmentLength() * NM_PER_MM;
        TransferMatrix total = TransferMatrix.identity();
        for (int j = 0; j < profile.segmentCount(); j++) {
            double localBragg = profile.braggWavelengthAt(j) + polarization * profile.polarizationSplitAt(j) / 2.0;
            total = total.multiply(segmentMatrix(wavelength, localBragg, profile.effectiveIndexAt(j),
                    indexChange, visibility, lengthNm));
        }
        return total;
    }

    /**
     * Reflectancia de toda la matriz de sensores en una longitud de onda.
     * <p>
     * Las matrices de los sensores se encadenan con tramos de propagación libre
     * (fase {@code 2π·n₀·d/λ}). Si algún sensor tiene birrefringencia, la luz no
     * polarizada se reparte a partes iguales entre los dos ejes y se promedia.
     *
     * @param gapsMm Fibra sin red tras cada sensor [mm] (el último se ignora).
     */
    public static double arrayReflectance(double wavelength, List<BraggProfile> profiles, double[] gapsMm,
                                          double initialIndex, double indexChange, double visibility) {
        boolean birefringent = false;
        for (BraggProfile p : profiles) {
            if (p.isBirefringent()) {
                birefringent = true;
                break;
            }
        }

        double reflectance;
        if (birefringent) {
            double slow = cascade(wavelength, profiles, gapsMm, initialIndex, indexChange, visibility, 1);
            double fast = cascade(wavelength, profiles, gapsMm, initialIndex, indexChange, visibility, -1);
            reflectance = 0.5 * (slow + fast);
        } else {
            reflectance = cascade(wavelength, profiles, gapsMm, initialIndex, indexChange, visibility, 0);
        }

        if (!Double.isFinite(reflectance)) {
            throw new NumericalException(String.format("Reflectancia no finita en λ=%.4f nm.", wavelength));
        }
        // |r|² puede exceder 1 en el último bit por redondeo
        return Math.min(1.0, Math.max(0.0, reflectance));
    }

    private static double cascade(double wavelength, List<BraggProfile> profiles, double[] gapsMm,
                                  double initialIndex, double indexChange, double visibility, int polarization) {
        double beta = TWO_PI * initialIndex / wavelength;
        TransferMatrix total = TransferMatrix.identity();
        int last = profiles.size() - 1;
        for (int i = 0; i <= last; i++) {
            total = total.multiply(sensorMatrix(wavelength, profiles.get(i), polarization, indexChange, visibility));
            if (i < last) {
                total = total.multiply(TransferMatrix.propagation(beta * gapsMm[i] * NM_PER_MM));
            }
        }
        return total.reflectance();
    }
}
