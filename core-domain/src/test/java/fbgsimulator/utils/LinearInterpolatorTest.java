package fbgsimulator.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LinearInterpolatorTest {

    private final double[] xs = {0.0, 10.0, 20.0, 40.0};
    private final double[] ys = {0.0, 1.0, 1.0, -1.0};

    @Test
    @DisplayName("Interpola linealmente dentro de cada intervalo")
    void interpolate_insideRange() {
        assertThat(LinearInterpolator.interpolate(xs, ys, 5.0)).isCloseTo(0.5, within(1e-12));
        assertThat(LinearInterpolator.interpolate(xs, ys, 15.0)).isCloseTo(1.0, within(1e-12));
        assertThat(LinearInterpolator.interpolate(xs, ys, 30.0)).isCloseTo(0.0, within(1e-12));
    }

    @Test
    @DisplayName("Devuelve los valores exactos sobre las muestras")
    void interpolate_onSamples() {
        for (int i = 0; i < xs.length; i++) {
            assertThat(LinearInterpolator.interpolate(xs, ys, xs[i])).isEqualTo(ys[i]);
        }
    }

    @Test
    @DisplayName("Fuera del rango se recorta al extremo más cercano")
    void interpolate_outsideRange_isClamped() {
        assertThat(LinearInterpolator.interpolate(xs, ys, -5.0)).isEqualTo(0.0);
        assertThat(LinearInterpolator.interpolate(xs, ys, 100.0)).isEqualTo(-1.0);
    }

    @Test
    @DisplayName("Posiciones repetidas no producen divisiones por cero")
    void interpolate_duplicatedPositions() {
        double[] x = {0.0, 5.0, 5.0, 10.0};
        double[] y = {0.0, 1.0, 3.0, 3.0};

        double value = LinearInterpolator.interpolate(x, y, 5.0);

        assertThat(value).isFinite();
        assertThat(LinearInterpolator.interpolate(x, y, 7.5)).isCloseTo(3.0, within(1e-12));
    }

    @Test
    @DisplayName("Una serie vacía es un error")
    void interpolate_emptySeries_throws() {
        assertThatThrownBy(() -> LinearInterpolator.interpolate(new double[0], new double[0], 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
