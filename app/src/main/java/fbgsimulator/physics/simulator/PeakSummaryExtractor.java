package fbgsimulator.physics.simulator;

import fbgsimulator.domain.fiber.SensorArrayLayout;
import fbgsimulator.domain.spectrum.PeakSummary;
import fbgsimulator.domain.spectrum.ReflectanceSpectrum;
import fbgsimulator.domain.spectrum.WavelengthGrid;
import fbgsimulator.exception.InvalidParameterException;
import fbgsimulator.utils.LinearInterpolator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * Extrae, para cada sensor, el pico de reflexión del espectro deformado.
 * <p>
 * Cada sensor busca su pico en una ventana centrada en su longitud de onda
 * original, de semiancho {@code max(τ, d/2)}, siendo d la distancia espectral
 * al sensor más cercano. Dentro de la ventana:
 * <ol>
 * <li>Si el máximo de las muestras no supera el umbral, el sensor se marca como no detectado (NaN).</li>
 * <li>El máximo se refina sobre una curva continua R(λ) con paso {@code resolución/20}.</li>
 * <li>Desde el máximo se avanza a cada lado con el mismo paso hasta bajar de la media altura,
 * y el cruce se ajusta con el método de Brent. El pico es el punto medio de los dos cruces
 * y el FWHM su distancia.</li>
 * <li>Si solo se encuentra un cruce, el pico es el máximo refinado y el FWHM el doble de la
 * distancia a ese cruce.</li>
 * </ol>
 * La curva es el modelo exacto de la matriz cuando se proporciona, y puede evaluarse fuera
 * de la rejilla; si no, un spline cúbico de las muestras limitado a la rejilla. Los lóbulos
 * laterales de las redes fuertes están a centésimas de nm del borde del lóbulo principal,
 * así que los cruces no se interpolan directamente entre muestras de la rejilla.
 */
@Slf4j
public class PeakSummaryExtractor {

    private static final double EPS = 1e-9;
    private static final int FINE_STEPS_PER_SAMPLE = 20;
    private static final double CROSSING_ACCURACY = 1e-7;
    private static final int MAX_SOLVER_EVALUATIONS = 100;

    private final double detectionThreshold;

    public PeakSummaryExtractor(double detectionThreshold) {
        if (!(detectionThreshold > 0 && detectionThreshold < 1)) {
            throw new InvalidParameterException("El umbral de detección debe estar en (0, 1) (recibido " + detectionThreshold + ").");
        }
        this.detectionThreshold = detectionThreshold;
    }

    public List<PeakSummary> extract(WavelengthGrid grid, ReflectanceSpectrum spectrum, SensorArrayLayout layout) {
        return extract(grid, spectrum, layout, null);
    }

    /**
     * @param model Reflectancia R(λ) de la matriz, evaluable en cualquier longitud de onda.
     *              Con {@code null} se interpolan las muestras del espectro.
     */
    public List<PeakSummary> extract(WavelengthGrid grid, ReflectanceSpectrum spectrum, SensorArrayLayout layout,
                                     DoubleUnaryOperator model) {
        if (spectrum.size() != grid.size()) {
            throw new InvalidParameterException("El espectro y la rejilla tienen longitudes distintas.");
        }
        DoubleUnaryOperator curve = model != null ? model : sampledCurve(grid, spectrum);
        List<PeakSummary> summaries = new ArrayList<>(layout.sensorCount());
        for (int i = 0; i < layout.sensorCount(); i++) {
            summaries.add(extractSensor(i, grid, spectrum, layout, curve, model == null));
        }
        return summaries;
    }

    private PeakSummary extractSensor(int sensor, WavelengthGrid grid, ReflectanceSpectrum spectrum,
                                      SensorArrayLayout layout, DoubleUnaryOperator curve, boolean clipToGrid) {
        double original = layout.originalWavelengthOf(sensor);
        double res = grid.getResolution();
        double min = grid.getMinBandwidth();

        double halfWidth = searchHalfWidth(sensor, layout, grid);
        int lo = Math.max(0, (int) Math.ceil((original - halfWidth - min) / res - EPS));
        int hi = Math.min(grid.size() - 1, (int) Math.floor((original + halfWidth - min) / res + EPS));

        int peak = argMax(spectrum, lo, hi);
        if (spectrum.valueAt(peak) < detectionThreshold) {
            log.warn("Sensor {}: no se detecta pico en [{}, {}] nm (máximo R = {})",
                    sensor, grid.wavelengthAt(lo), grid.wavelengthAt(hi), spectrum.valueAt(peak));
            return PeakSummary.undetected(sensor, original);
        }

        double lower = original - halfWidth;
        double upper = original + halfWidth;
        if (clipToGrid) {
            lower = Math.max(lower, grid.wavelengthAt(0));
            upper = Math.min(upper, grid.wavelengthAt(grid.size() - 1));
        }

        // Máximo refinado en torno a la muestra más alta
        double step = res / FINE_STEPS_PER_SAMPLE;
        double coarsePeak = grid.wavelengthAt(peak);
        double from = Math.max(lower, coarsePeak - res);
        int steps = (int) Math.floor((Math.min(upper, coarsePeak + res) - from) / step + EPS);
        double maxWavelength = coarsePeak;
        double maxReflectance = curve.applyAsDouble(coarsePeak);
        for (int k = 0; k <= steps; k++) {
            double wl = from + k * step;
            double r = curve.applyAsDouble(wl);
            if (r > maxReflectance) {
                maxReflectance = r;
                maxWavelength = wl;
            }
        }

        double half = maxReflectance / 2.0;
        double left = halfCrossing(curve, maxWavelength, -step, lower, half);
        double right = halfCrossing(curve, maxWavelength, step, upper, half);

        double peakWavelength;
        double fwhm;
        if (!Double.isNaN(left) && !Double.isNaN(right)) {
            peakWavelength = 0.5 * (left + right);
            fwhm = right - left;
        } else {
            // Pico cortado por el borde de la ventana
            peakWavelength = maxWavelength;
            double crossing = Double.isNaN(left) ? right : left;
            fwhm = Double.isNaN(crossing) ? Double.NaN : 2.0 * Math.abs(crossing - maxWavelength);
            log.debug("Sensor {}: pico cortado en [{}, {}] nm, FWHM reflejado = {}", sensor, lower, upper, fwhm);
        }

        return new PeakSummary(sensor, original, peakWavelength, peakWavelength - original, fwhm, maxReflectance);
    }

    /**
     * Semiancho de la ventana de búsqueda del sensor [nm], recortado a la banda.
     */
    double searchHalfWidth(int sensor, SensorArrayLayout layout, WavelengthGrid grid) {
        double res = grid.getResolution();
        double original = layout.originalWavelengthOf(sensor);
        double tolerance = Math.ceil(layout.tolerance() / res - EPS) * res;

        double nearest = Double.POSITIVE_INFINITY;
        for (int j = 0; j < layout.sensorCount(); j++) {
            if (j != sensor) {
                nearest = Math.min(nearest, Math.abs(layout.originalWavelengthOf(j) - original));
            }
        }
        double bandWidth = grid.getMaxBandwidth() - grid.getMinBandwidth();
        return Math.min(bandWidth, Math.max(tolerance, nearest / 2.0));
    }

    private static DoubleUnaryOperator sampledCurve(WavelengthGrid grid, ReflectanceSpectrum spectrum) {
        double[] wavelengths = grid.toArray();
        double[] reflectance = spectrum.toArray();
        if (wavelengths.length < 3) {
            return wl -> LinearInterpolator.interpolate(wavelengths, reflectance, wl);
        }
        PolynomialSplineFunction spline = new SplineInterpolator().interpolate(wavelengths, reflectance);
        double first = wavelengths[0];
        double last = wavelengths[wavelengths.length - 1];
        return wl -> spline.value(Math.max(first, Math.min(last, wl)));
    }

    /**
     * Primer cruce de media altura avanzando desde {@code start} en pasos de {@code step}
     * sin pasar de {@code limit}, o NaN si la curva no baja de la media altura antes.
     */
    private static double halfCrossing(DoubleUnaryOperator curve, double start, double step, double limit,
                                       double half) {
        double inside = start;
        while (step < 0 ? inside > limit : inside < limit) {
            double next = inside + step;
            if (step < 0 ? next < limit : next > limit) {
                next = limit;
            }
            if (curve.applyAsDouble(next) < half) {
                BrentSolver solver = new BrentSolver(CROSSING_ACCURACY);
                return solver.solve(MAX_SOLVER_EVALUATIONS, wl -> curve.applyAsDouble(wl) - half,
                        Math.min(inside, next), Math.max(inside, next));
            }
            inside = next;
        }
        return Double.NaN;
    }

    private static int argMax(ReflectanceSpectrum spectrum, int lo, int hi) {
        int peak = lo;
        for (int k = lo + 1; k <= hi; k++) {
            if (spectrum.valueAt(k) > spectrum.valueAt(peak)) {
                peak = k;
            }
        }
        return peak;
    }
}
