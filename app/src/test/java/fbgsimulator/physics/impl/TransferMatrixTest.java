package fbgsimulator.physics.impl;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TransferMatrixTest {

    @Test
    @DisplayName("La identidad es neutra en el producto")
    void identity_isNeutral() {
        TransferMatrix m = new TransferMatrix(new Complex(1, 2), new Complex(3, 4), new Complex(5, 6), new Complex(7, 8));

        TransferMatrix product = TransferMatrix.identity().multiply(m);

        assertThat(product.getA()).isEqualTo(m.getA());
        assertThat(product.getB()).isEqualTo(m.getB());
        assertThat(product.getC()).isEqualTo(m.getC());
        assertThat(product.getD()).isEqualTo(m.getD());
    }

    @Test
    @DisplayName("La propagación libre no refleja y conserva el determinante unidad")
    void propagation_doesNotReflect() {
        TransferMatrix p = TransferMatrix.propagation(1.234);

        assertThat(p.reflectance()).isZero();
        assertThat(p.determinant().getReal()).isCloseTo(1.0, within(1e-14));
        assertThat(p.determinant().getImaginary()).isCloseTo(0.0, within(1e-14));
        assertThat(p.getA().abs()).isCloseTo(1.0, within(1e-14));
    }

    @Test
    @DisplayName("Dos propagaciones encadenadas suman sus fases")
    void propagation_phasesAdd() {
        TransferMatrix combined = TransferMatrix.propagation(0.4).multiply(TransferMatrix.propagation(0.6));
        TransferMatrix direct = TransferMatrix.propagation(1.0);

        assertThat(combined.getA().getReal()).isCloseTo(direct.getA().getReal(), within(1e-14));
        assertThat(combined.getA().getImaginary()).isCloseTo(direct.getA().getImaginary(), within(1e-14));
        assertThat(combined.getD().getImaginary()).isCloseTo(direct.getD().getImaginary(), within(1e-14));
    }
}
