package fbgsimulator.factory;

import fbgsimulator.domain.deformation.ConditionDataset;
import fbgsimulator.domain.deformation.PerturbationMode;
import fbgsimulator.domain.deformation.RawConditionSample;
import fbgsimulator.domain.deformation.StrainType;
import fbgsimulator.domain.deformation.StressType;
import fbgsimulator.domain.fiber.SensorArrayLayout;
import fbgsimulator.exception.DataRangeException;
import fbgsimulator.exception.InvalidParameterException;
import fbgsimulator.physics.model.PerturbationProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PerturbationProfileFactoryTest {

    private PerturbationProfileFactory factory;
    private SensorArrayLayout layout;
    private ConditionDataset dataset;

    @BeforeEach
    void setUp() {
        factory = new PerturbationProfileFactory();
        layout = new SensorArrayLayout(2, 10.0, 0.01, List.of(20.0, 50.0), List.of(1530.0, 1550.0));
        // Rampa lineal de deformación y tensión constante entre 0 y 100 mm
        dataset = new ConditionDataset(List.of(
                new RawConditionSample(100.0, 1e-3, 5.0),
                new RawConditionSample(0.0, 0.0, 5.0),
                new RawConditionSample(50.0, 5e-4, 5.0)));
    }

    @Test
    @DisplayName("NONE/NONE produce un perfil nulo en cualquier punto y no necesita datos")
    void none_isZeroEverywhere() {
        PerturbationProfile profile = factory.create(ConditionDataset.empty(), PerturbationMode.none(), layout);

        assertThat(profile.strainAt(25.0)).isZero();
        assertThat(profile.stressAt(25.0)).isZero();
    }

    @Test
    @DisplayName("UNIFORM ignora el fichero y devuelve ε0 en todo el eje")
    void uniform_ignoresDataset() {
        PerturbationProfile profile = factory.create(dataset, PerturbationMode.uniformStrain(2e-4), layout);

        assertThat(profile.strainAt(-10.0)).isEqualTo(2e-4);
        assertThat(profile.strainAt(25.0)).isEqualTo(2e-4);
        assertThat(profile.strainAt(500.0)).isEqualTo(2e-4);
    }

    @Test
    @DisplayName("NON_UNIFORM interpola linealmente las muestras ordenadas")
    void nonUniform_interpolatesSamples() {
        PerturbationMode mode = new PerturbationMode(StrainType.NON_UNIFORM, 0.0, StressType.NONE);

        PerturbationProfile profile = factory.create(dataset, mode, layout);

        assertThat(profile.strainAt(25.0)).isCloseTo(2.5e-4, within(1e-15));
        assertThat(profile.strainAt(75.0)).isCloseTo(7.5e-4, within(1e-15));
        assertThat(profile.stressAt(25.0)).isZero();
    }

    @Test
    @DisplayName("Stress INCLUDED interpola la columna de tensión")
    void stressIncluded_interpolatesStress() {
        PerturbationMode mode = new PerturbationMode(StrainType.NONE, 0.0, StressType.INCLUDED);

        PerturbationProfile profile = factory.create(dataset, mode, layout);

        assertThat(profile.strainAt(25.0)).isZero();
        assertThat(profile.stressAt(25.0)).isCloseTo(5.0, within(1e-12));
    }

    @Test
    @DisplayName("Un modo que necesita datos con el fichero vacío es un error de rango")
    void emptyDataset_throwsDataRange() {
        PerturbationMode mode = new PerturbationMode(StrainType.NON_UNIFORM, 0.0, StressType.NONE);

        assertThatThrownBy(() -> factory.create(ConditionDataset.empty(), mode, layout))
                .isInstanceOf(DataRangeException.class);
    }

    @Test
    @DisplayName("Un sensor sin ninguna muestra en su tramo es un error de rango")
    void sensorOutsideData_throwsDataRange() {
        ConditionDataset shortData = new ConditionDataset(List.of(
                RawConditionSample.strainOnly(0.0, 0.0),
                RawConditionSample.strainOnly(30.0, 1e-4)));
        PerturbationMode mode = new PerturbationMode(StrainType.NON_UNIFORM, 0.0, StressType.NONE);

        assertThatThrownBy(() -> factory.create(shortData, mode, layout))
                .isInstanceOf(DataRangeException.class)
                .hasMessageContaining("sensor 1");
    }

    @Test
    @DisplayName("Tensión INCLUDED sin columna de tensión es un error de rango")
    void stressWithoutColumn_throwsDataRange() {
        ConditionDataset strainOnly = new ConditionDataset(List.of(
                RawConditionSample.strainOnly(0.0, 0.0),
                RawConditionSample.strainOnly(100.0, 1e-4)));
        PerturbationMode mode = new PerturbationMode(StrainType.NON_UNIFORM, 0.0, StressType.INCLUDED);

        assertThatThrownBy(() -> factory.create(strainOnly, mode, layout))
                .isInstanceOf(DataRangeException.class);
    }

    @Test
    @DisplayName("UNIFORM con ε0 no finito es un parámetro inválido")
    void uniformWithoutValue_throwsInvalidParameter() {
        assertThatThrownBy(() -> PerturbationMode.uniformStrain(Double.NaN))
                .isInstanceOf(InvalidParameterException.class);
    }
}
