package fbgsimulator.domain.deformation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Secuencia inmutable de muestras de deformación/tensión ordenada por posición.
 * <p>
 * Expone las columnas como arrays primitivos para que la interpolación no
 * tenga que recorrer objetos en el bucle caliente.
 */
public final class ConditionDataset {

    private static final ConditionDataset EMPTY = new ConditionDataset(List.of());

    private final double[] positions;
    private final double[] strains;
    private final double[] stresses;
    private final boolean stressAvailable;

    public ConditionDataset(List<RawConditionSample> samples) {
        List<RawConditionSample> sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparingDouble(RawConditionSample::position));

        int n = sorted.size();
        this.positions = new double[n];
        this.strains = new double[n];
        this.stresses = new double[n];
        boolean allStress = n > 0;
        for (int i = 0; i < n; i++) {
            RawConditionSample s = sorted.get(i);
            positions[i] = s.position();
            strains[i] = s.strain();
            stresses[i] = s.stress();
            allStress &= s.hasStress();
        }
        this.stressAvailable = allStress;
    }

    public static ConditionDataset empty() {
        return EMPTY;
    }

    public int size() {
        return positions.length;
    }

    public boolean isEmpty() {
        return positions.length == 0;
    }

    /**
     * Todas las filas traen la columna de tensión.
     */
    public boolean hasStress() {
        return stressAvailable;
    }

    public double firstPosition() {
        return positions[0];
    }

    public double lastPosition() {
        return positions[positions.length - 1];
    }

    /**
     * Indica si el intervalo {@code [from, to]} toca el rango de posiciones cubierto.
     */
    public boolean overlaps(double from, double to) {
        return !isEmpty() && to >= firstPosition() && from <= lastPosition();
    }

    public double[] clonePositions() {
        return positions.clone();
    }

    public double[] cloneStrains() {
        return strains.clone();
    }

    public double[] cloneStresses() {
        return stresses.clone();
    }
}
