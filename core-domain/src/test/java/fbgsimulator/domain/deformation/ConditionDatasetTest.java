package fbgsimulator.domain.deformation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConditionDatasetTest {

    @Test
    @DisplayName("Las muestras se ordenan por posición")
    void samples_areSortedByPosition() {
        ConditionDataset dataset = new ConditionDataset(List.of(
                RawConditionSample.strainOnly(30.0, 3.0),
                RawConditionSample.strainOnly(10.0, 1.0),
                RawConditionSample.strainOnly(20.0, 2.0)));

        assertThat(dataset.clonePositions()).containsExactly(10.0, 20.0, 30.0);
        assertThat(dataset.cloneStrains()).containsExactly(1.0, 2.0, 3.0);
        assertThat(dataset.firstPosition()).isEqualTo(10.0);
        assertThat(dataset.lastPosition()).isEqualTo(30.0);
    }

    @Test
    @DisplayName("El tamaño cuenta las muestras y el conjunto vacío no tiene ninguna")
    void size_countsSamples() {
        ConditionDataset dataset = new ConditionDataset(List.of(
                RawConditionSample.strainOnly(0.0, 0.0),
                RawConditionSample.strainOnly(10.0, 1.0)));

        assertThat(dataset.size()).isEqualTo(2);
        assertThat(dataset.isEmpty()).isFalse();
        assertThat(ConditionDataset.empty().size()).isZero();
        assertThat(ConditionDataset.empty().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("La tensión solo está disponible si todas las filas la traen")
    void hasStress_requiresAllRows() {
        ConditionDataset partial = new ConditionDataset(List.of(
                new RawConditionSample(0.0, 0.0, 1.0),
                RawConditionSample.strainOnly(10.0, 0.0)));
        ConditionDataset full = new ConditionDataset(List.of(
                new RawConditionSample(0.0, 0.0, 1.0),
                new RawConditionSample(10.0, 0.0, 2.0)));

        assertThat(partial.hasStress()).isFalse();
        assertThat(full.hasStress()).isTrue();
        assertThat(ConditionDataset.empty().hasStress()).isFalse();
    }

    @Test
    @DisplayName("overlaps detecta intervalos que tocan el rango cubierto")
    void overlaps_detectsIntersection() {
        ConditionDataset dataset = new ConditionDataset(List.of(
                RawConditionSample.strainOnly(10.0, 0.0),
                RawConditionSample.strainOnly(20.0, 0.0)));

        assertThat(dataset.overlaps(0.0, 10.0)).isTrue();
        assertThat(dataset.overlaps(15.0, 16.0)).isTrue();
        assertThat(dataset.overlaps(20.5, 30.0)).isFalse();
        assertThat(ConditionDataset.empty().overlaps(0.0, 100.0)).isFalse();
    }

    @Test
    @DisplayName("Los arrays devueltos son copias")
    void clones_areDefensive() {
        ConditionDataset dataset = new ConditionDataset(List.of(RawConditionSample.strainOnly(10.0, 1.0)));

        dataset.clonePositions()[0] = 99.0;

        assertThat(dataset.firstPosition()).isEqualTo(10.0);
    }
}
