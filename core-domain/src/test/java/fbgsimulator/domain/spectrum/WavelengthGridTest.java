package fbgsimulator.domain.spectrum;

import fbgsimulator.config.SpectrumConfig;
import fbgsimulator.exception.ErrorKind;
import fbgsimulator.exception.InvalidParameterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WavelengthGridTest {

    @Test
    @DisplayName("La banda por defecto 1500-1600 nm a 0.05 nm tiene 2001 puntos")
    void defaultBand_has2001Points() {
        // Act
        WavelengthGrid grid = WavelengthGrid.from(SpectrumConfig.getDefault());

        // Assert
        assertThat(grid.size()).isEqualTo(2001);
        assertThat(grid.wavelengthAt(0)).isEqualTo(1500.0);
        assertThat(grid.wavelengthAt(2000)).isCloseTo(1600.0, within(1e-9));
        assertThat(grid.toArray()).hasSize(2001);
    }

    @Test
    @DisplayName("Los puntos están equiespaciados y son crecientes")
    void grid_isUniformAndIncreasing() {
        WavelengthGrid grid = WavelengthGrid.of(1540.0, 1560.0, 0.1);

        double[] wl = grid.toArray();
        for (int k = 1; k < wl.length; k++) {
            assertThat(wl[k] - wl[k - 1]).isCloseTo(0.1, within(1e-9));
        }
    }

    @Test
    @DisplayName("Si la resolución no divide la banda, el último punto no supera el máximo")
    void nonDividingResolution_lastPointWithinBand() {
        WavelengthGrid grid = WavelengthGrid.of(1500.0, 1501.0, 0.3);

        assertThat(grid.size()).isEqualTo(4);
        assertThat(grid.wavelengthAt(grid.size() - 1)).isLessThanOrEqualTo(1501.0);
    }

    @Test
    @DisplayName("indexOfNearest recorta a los extremos de la rejilla")
    void indexOfNearest_isClamped() {
        WavelengthGrid grid = WavelengthGrid.of(1500.0, 1600.0, 0.05);

        assertThat(grid.indexOfNearest(1400.0)).isZero();
        assertThat(grid.indexOfNearest(1550.0)).isEqualTo(1000);
        assertThat(grid.indexOfNearest(1700.0)).isEqualTo(2000);
        assertThat(grid.contains(1600.0)).isTrue();
        assertThat(grid.contains(1600.01)).isFalse();
    }

    @Test
    @DisplayName("Banda vacía o resolución no positiva son parámetros inválidos")
    void invalidBand_throws() {
        assertThatThrownBy(() -> WavelengthGrid.of(1600.0, 1500.0, 0.05))
                .isInstanceOf(InvalidParameterException.class)
                .extracting("kind").isEqualTo(ErrorKind.INVALID_PARAMETER);
        assertThatThrownBy(() -> WavelengthGrid.of(1500.0, 1600.0, 0.0))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> WavelengthGrid.of(1500.0, 1600.0, Double.NaN))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> WavelengthGrid.from(null))
                .isInstanceOf(InvalidParameterException.class);
    }
}
