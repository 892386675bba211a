package fbgsimulator.domain.spectrum;

import java.util.Arrays;
import java.util.Objects;

/**
 * Perfil local de Bragg de un sensor: para cada una de sus M sub-redes, la
 * posición central, la longitud de onda de Bragg instantánea, el índice
 * efectivo perturbado y el desdoblamiento por birrefringencia.
 * <p>
 * Un perfil plano (todas las longitudes de onda iguales) representa una red
 * uniforme; uno variable representa una red con chirp.
 * <p>
 * Los accesores de los arrays devuelven copias. El cálculo espectral usa los
 * accesores por índice, que no copian.
 *
 * @param sensorIndex        Índice del sensor en la matriz.
 * @param segmentLength      Longitud de cada sub-red [mm].
 * @param positions          Posición central de cada sub-red [mm].
 * @param braggWavelengths   Longitud de onda de Bragg local [nm].
 * @param effectiveIndices   Índice efectivo local.
 * @param polarizationSplits Separación entre los dos ejes de polarización [nm] (0 sin tensión).
 */
public record BraggProfile(
        int sensorIndex,
        double segmentLength,
        double[] positions,
        double[] braggWavelengths,
        double[] effectiveIndices,
        double[] polarizationSplits
) {

    public BraggProfile {
        Objects.requireNonNull(positions, "El array de posiciones no puede ser nulo.");
        Objects.requireNonNull(braggWavelengths, "El array de longitudes de onda no puede ser nulo.");
        Objects.requireNonNull(effectiveIndices, "El array de índices efectivos no puede ser nulo.");
        Objects.requireNonNull(polarizationSplits, "El array de desdoblamientos no puede ser nulo.");

        int m = positions.length;
        if (m == 0 || braggWavelengths.length != m || effectiveIndices.length != m || polarizationSplits.length != m) {
            throw new IllegalArgumentException("Todos los arrays del perfil deben tener la misma longitud (> 0).");
        }

        positions = positions.clone();
        braggWavelengths = braggWavelengths.clone();
        effectiveIndices = effectiveIndices.clone();
        polarizationSplits = polarizationSplits.clone();
    }

    /**
     * Perfil plano en la longitud de onda original, sin perturbación alguna.
     */
    public static BraggProfile flat(int sensorIndex, double start, double gratingLength, int segmentCount,
                                    double wavelength, double effectiveIndex) {
        double dz = gratingLength / segmentCount;
        double[] pos = new double[segmentCount];
        double[] wl = new double[segmentCount];
        double[] idx = new double[segmentCount];
        for (int j = 0; j < segmentCount; j++) {
            pos[j] = start + (j + 0.5) * dz;
        }
        Arrays.fill(wl, wavelength);
        Arrays.fill(idx, effectiveIndex);
        return new BraggProfile(sensorIndex, dz, pos, wl, idx, new double[segmentCount]);
    }

    public int segmentCount() {
        return positions.length;
    }

    @Override
    public double[] positions() {
        return positions.clone();
    }

    @Override
    public double[] braggWavelengths() {
        return braggWavelengths.clone();
    }

    @Override
    public double[] effectiveIndices() {
        return effectiveIndices.clone();
    }

    @Override
    public double[] polarizationSplits() {
        return polarizationSplits.clone();
    }

    public double braggWavelengthAt(int segment) {
        return braggWavelengths[segment];
    }

    public double effectiveIndexAt(int segment) {
        return effectiveIndices[segment];
    }

    public double polarizationSplitAt(int segment) {
        return polarizationSplits[segment];
    }

    /**
     * Verdadero si alguna sub-red tiene desdoblamiento de polarización.
     */
    public boolean isBirefringent() {
        for (double split : polarizationSplits) {
            if (split != 0.0) return true;
        }
        return false;
    }

    public double meanBraggWavelength() {
        return Arrays.stream(braggWavelengths).average().orElse(Double.NaN);
    }

    public double minBraggWavelength() {
        double min = Double.POSITIVE_INFINITY;
        for (int j = 0; j < braggWavelengths.length; j++) {
            min = Math.min(min, braggWavelengths[j] - polarizationSplits[j] / 2.0);
        }
        return min;
    }

    public double maxBraggWavelength() {
        double max = Double.NEGATIVE_INFINITY;
        for (int j = 0; j < braggWavelengths.length; j++) {
            max = Math.max(max, braggWavelengths[j] + polarizationSplits[j] / 2.0);
        }
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BraggProfile that = (BraggProfile) o;
        return sensorIndex == that.sensorIndex &&
                Double.compare(segmentLength, that.segmentLength) == 0 &&
                Arrays.equals(positions, that.positions) &&
                Arrays.equals(braggWavelengths, that.braggWavelengths) &&
                Arrays.equals(effectiveIndices, that.effectiveIndices) &&
                Arrays.equals(polarizationSplits, that.polarizationSplits);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(sensorIndex, segmentLength);
        result = 31 * result + Arrays.hashCode(positions);
        result = 31 * result + Arrays.hashCode(braggWavelengths);
        result = 31 * result + Arrays.hashCode(effectiveIndices);
        result = 31 * result + Arrays.hashCode(polarizationSplits);
        return result;
    }

    @Override
    public String toString() {
        return String.format("BraggProfile[sensor=%d, M=%d, λ=[%.4f, %.4f] nm]",
                sensorIndex, segmentCount(), minBraggWavelength(), maxBraggWavelength());
    }
}
