package fbgsimulator.utils;

/**
 * Interpolación lineal sobre una serie ordenada con extrapolación constante
 * (se recorta al extremo más cercano).
 */
public final class LinearInterpolator {

    private LinearInterpolator() {
    }

    /**
     * @param xs Abscisas en orden no decreciente (no vacío).
     * @param ys Ordenadas, misma longitud que {@code xs}.
     * @param x  Punto a evaluar.
     * @return El valor interpolado en {@code x}.
     */
    public static double interpolate(double[] xs, double[] ys, double x) {
        int n = xs.length;
        if (n == 0) {
            throw new IllegalArgumentException("No se puede interpolar sobre una serie vacía.");
        }
        if (x <= xs[0]) return ys[0];
        if (x >= xs[n - 1]) return ys[n - 1];

        // Búsqueda binaria del intervalo [xs[lo], xs[hi]] que contiene x
        int lo = 0;
        int hi = n - 1;
        while (hi - lo > 1) {
            int mid = (lo + hi) >>> 1;
            if (xs[mid] <= x) {
                lo = mid;
            } else {
                hi = mid;
            }
        }

        double dx = xs[hi] - xs[lo];
        if (dx <= 0) {
            return ys[lo];
        }
        double t = (x - xs[lo]) / dx;
        return ys[lo] + t * (ys[hi] - ys[lo]);
    }
}
