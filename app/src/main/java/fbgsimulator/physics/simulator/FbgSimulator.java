package fbgsimulator.physics.simulator;

import fbgsimulator.config.SimulationConfig;
import fbgsimulator.domain.deformation.ConditionDataset;
import fbgsimulator.domain.deformation.PerturbationMode;
import fbgsimulator.domain.fiber.DistanceUnits;
import fbgsimulator.domain.fiber.FiberParameters;
import fbgsimulator.domain.fiber.SensorArrayLayout;
import fbgsimulator.domain.spectrum.BraggProfile;
import fbgsimulator.domain.spectrum.PeakSummary;
import fbgsimulator.domain.spectrum.ReflectanceSpectrum;
import fbgsimulator.domain.spectrum.WavelengthGrid;
import fbgsimulator.factory.PerturbationProfileFactory;
import fbgsimulator.io.ConditionDataLoader;
import fbgsimulator.physics.model.PerturbationProfile;
import fbgsimulator.physics.model.PhotoelasticModel;
import fbgsimulator.physics.solver.BraggConditionSolver;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Simulador de una matriz de redes de Bragg en fibra.
 * <p>
 * Reúne en un único objeto los parámetros validados de una ejecución y ofrece
 * las operaciones de alto nivel: cargar el fichero de condiciones, calcular el
 * espectro sin deformar, el deformado y el resumen de picos. No es thread safe:
 * cada ejecución usa su propia instancia.
 */
@Slf4j
public class FbgSimulator implements AutoCloseable {

    @Getter
    private final FiberParameters fiber;
    @Getter
    private final SensorArrayLayout layout;
    @Getter
    private final WavelengthGrid grid;

    private final ConditionDataLoader loader;
    private final PerturbationProfileFactory perturbationFactory;
    private final SpectrumAssembler assembler;
    private final GratingReflectanceEngine engine;
    private final PeakSummaryExtractor peakExtractor;

    @Getter
    private ConditionDataset conditions = ConditionDataset.empty();

    // No depende del fichero ni del modo: se calcula como mucho una vez
    private ReflectanceSpectrum cachedUndeformed;

    // Último espectro deformado y el modo que lo produjo
    private PerturbationMode cachedMode;
    private List<BraggProfile> cachedProfiles;
    private ReflectanceSpectrum cachedDeformed;

    public FbgSimulator(FiberParameters fiber, SensorArrayLayout layout, WavelengthGrid grid, SimulationConfig config) {
        this(fiber, layout, grid, config, new ConditionDataLoader());
    }

    public FbgSimulator(FiberParameters fiber, SensorArrayLayout layout, WavelengthGrid grid, SimulationConfig config,
                        ConditionDataLoader loader) {
        this.fiber = Objects.requireNonNull(fiber, "Los parámetros de la fibra no pueden ser nulos.");
        this.layout = Objects.requireNonNull(layout, "La disposición de sensores no puede ser nula.");
        this.grid = Objects.requireNonNull(grid, "La rejilla no puede ser nula.");
        this.loader = Objects.requireNonNull(loader, "El lector de datos no puede ser nulo.");
        layout.requireWithin(grid);

        BraggConditionSolver solver = new BraggConditionSolver(new PhotoelasticModel(fiber), config.getGratingSegmentCount());
        this.peakExtractor = new PeakSummaryExtractor(config.getPeakDetectionThreshold());
        this.perturbationFactory = new PerturbationProfileFactory();
        // El pool de hilos se crea el último, cuando ya no queda nada por validar
        this.engine = new GratingReflectanceEngine(fiber, config);
        this.assembler = new SpectrumAssembler(solver, engine);
    }

    /**
     * Carga el fichero de deformación/tensión que usarán los modos que lo necesitan.
     */
    public ConditionDataset loadConditions(Path file, DistanceUnits units) {
        setConditions(loader.load(file, units));
        return conditions;
    }

    public void setConditions(ConditionDataset dataset) {
        this.conditions = dataset != null ? dataset : ConditionDataset.empty();
        invalidateCache();
    }

    public ReflectanceSpectrum undeformedSpectrum() {
        if (cachedUndeformed == null) {
            cachedUndeformed = assembler.undeformed(layout, grid);
        }
        return cachedUndeformed;
    }

    /**
     * Perfiles de Bragg perturbados para el modo dado. Valida la cobertura del
     * fichero y la banda sin ejecutar el motor de reflectancia.
     */
    public List<BraggProfile> deformedProfiles(PerturbationMode mode) {
        Objects.requireNonNull(mode, "El modo de perturbación no puede ser nulo.");
        if (!mode.equals(cachedMode) || cachedProfiles == null) {
            PerturbationProfile perturbation = perturbationFactory.create(conditions, mode, layout);
            List<BraggProfile> profiles = assembler.deformedProfiles(layout, perturbation, grid);
            cachedMode = mode;
            cachedProfiles = profiles;
            cachedDeformed = null;
        }
        return cachedProfiles;
    }

    public ReflectanceSpectrum deformedSpectrum(PerturbationMode mode) {
        List<BraggProfile> profiles = deformedProfiles(mode);
        if (cachedDeformed == null) {
            cachedDeformed = assembler.deformed(layout, profiles, grid);
        }
        return cachedDeformed;
    }

    /**
     * Posición, desplazamiento y FWHM del pico de cada sensor. Reutiliza el
     * espectro deformado si ya se calculó con el mismo modo; los cruces de media
     * altura se ajustan sobre el modelo de la matriz, no sobre la rejilla.
     */
    public List<PeakSummary> computeShiftsAndWidths(PerturbationMode mode) {
        ReflectanceSpectrum spectrum = deformedSpectrum(mode);
        List<PeakSummary> summaries = peakExtractor.extract(grid, spectrum, layout,
                engine.reflectanceFunction(deformedProfiles(mode), layout));
        summaries.forEach(s -> log.debug("Sensor {}: λ0={} nm, pico={} nm, Δλ={} nm, FWHM={} nm",
                s.sensorIndex(), s.originalWavelength(), s.peakWavelength(), s.shift(), s.fwhm()));
        return summaries;
    }

    private void invalidateCache() {
        cachedMode = null;
        cachedProfiles = null;
        cachedDeformed = null;
    }

    @Override
    public void close() {
        engine.close();
    }
}
