package radiacool.physics.simulator;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import radiacool.config.RadiationConfig;
import radiacool.domain.balance.OperatingMode;
import radiacool.domain.balance.OpticalProperties;
import radiacool.domain.balance.RadiationReport;
import radiacool.domain.balance.SweepResult;
import radiacool.domain.balance.TheoreticalHeatingMap;
import radiacool.domain.spectrum.AngleGrid;
import radiacool.domain.spectrum.SpectralGrid;
import radiacool.domain.spectrum.SpectralInputs;
import radiacool.factory.SpectralGridFactory;
import radiacool.physics.model.BlackbodyRadiationModel;
import radiacool.physics.solver.ConvectionModel;
import radiacool.physics.solver.OpticalPropertiesCalculator;
import radiacool.physics.solver.RadiativeTermEvaluator;
import radiacool.physics.solver.SpectralInterpolator;
import radiacool.physics.solver.impl.ChurchillUsagiConvectionEstimator;
import radiacool.physics.solver.impl.PchipSpectralResampler;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Facade de alto nivel del cálculo de potencia radiativa.
 * <p>
 * Prepara los espectros (recorte de bandas, remuestreo sobre la rejilla infrarroja),
 * calcula las figuras de mérito escalares y delega el barrido intensivo al {@link PowerBalanceEngine}.
 * La rejilla angular depende solo de la configuración y se construye una única vez.
 */
@Slf4j
public class RadiationSimulator implements AutoCloseable {

    @Getter
    private final RadiationConfig config;
    private final SpectralInterpolator interpolator;
    private final OpticalPropertiesCalculator opticalCalculator;
    private final BlackbodyRadiationModel blackbody;
    private final AngleGrid angleGrid;
    private final PowerBalanceEngine engine;
    private final TheoreticalHeatingMapper heatingMapper;

    public RadiationSimulator(RadiationConfig config, int processorCount) {
        this(config, new PchipSpectralResampler(), new ChurchillUsagiConvectionEstimator(), processorCount);
    }

    public RadiationSimulator(RadiationConfig config,
                              SpectralInterpolator interpolator,
                              ConvectionModel convectionModel,
                              int processorCount) {
        this.config = config.validate();
        this.interpolator = interpolator;
        this.opticalCalculator = new OpticalPropertiesCalculator(config, interpolator);
        this.blackbody = BlackbodyRadiationModel.from(config);
        this.angleGrid = AngleGrid.build(config.angleCount());
        this.engine = new PowerBalanceEngine(config, convectionModel, processorCount);
        this.heatingMapper = new TheoreticalHeatingMapper(engine);

        log.info("RadiationSimulator listo. (Ángulos: {}, Banda IR: {}, Resolución: {} μm)",
                config.angleCount(), config.infraredBand(), config.spectralResolution());
    }

    public RadiationReport runCooling(SpectralInputs inputs) {
        return runCooling(inputs, null);
    }

    public RadiationReport runCooling(SpectralInputs inputs, BooleanSupplier cancellation) {
        return run(OperatingMode.COOLING, inputs, config.convectionCoefficients(), false, cancellation);
    }

    public RadiationReport runHeating(SpectralInputs inputs) {
        return runHeating(inputs, null);
    }

    public RadiationReport runHeating(SpectralInputs inputs, BooleanSupplier cancellation) {
        return run(OperatingMode.HEATING, inputs, config.convectionCoefficients(), false, cancellation);
    }

    /**
     * Vista de diagnóstico en modo enfriamiento: una única columna para el coeficiente indicado,
     * con el desglose completo de términos en cada celda.
     */
    public RadiationReport runComponents(SpectralInputs inputs, double coefficient) {
        return runComponents(inputs, coefficient, null);
    }

    public RadiationReport runComponents(SpectralInputs inputs, double coefficient, BooleanSupplier cancellation) {
        return run(OperatingMode.COOLING, inputs, List.of(coefficient), true, cancellation);
    }

    public TheoreticalHeatingMap theoreticalHeatingMap(SpectralInputs inputs) {
        return theoreticalHeatingMap(inputs, null);
    }

    public TheoreticalHeatingMap theoreticalHeatingMap(SpectralInputs inputs, BooleanSupplier cancellation) {
        OpticalProperties optics = opticalCalculator.calculate(inputs);
        RadiativeTermEvaluator evaluator = createEvaluator(inputs);
        return heatingMapper.map(evaluator, optics.solarAbsorptance(),
                TheoreticalHeatingMapper.DEFAULT_AMBIENT_TEMPERATURES,
                TheoreticalHeatingMapper.DEFAULT_IRRADIANCES,
                cancellation);
    }

    private RadiationReport run(OperatingMode mode,
                                SpectralInputs inputs,
                                List<Double> coefficients,
                                boolean diagnostic,
                                BooleanSupplier cancellation) {
        log.info("Iniciando cálculo {} (diagnóstico: {})...", mode, diagnostic);

        // 1. Figuras de mérito escalares
        OpticalProperties optics = opticalCalculator.calculate(inputs);

        // 2. Rejilla infrarroja y evaluador radiativo
        RadiativeTermEvaluator evaluator = createEvaluator(inputs);

        // 3. Barrido
        SweepResult sweep = engine.sweep(mode, evaluator, optics.solarAbsorptance(),
                coefficients, diagnostic, cancellation);

        // 4. Punto de operación ΔT ≈ 0
        int zeroIndex = sweep.zeroDeltaIndex();
        double[] power0Row = sweep.getRow(zeroIndex);

        log.info("Cálculo {} finalizado. Power_0 = {} W/m² a T_f = {} °C",
                mode, power0Row[0], sweep.getFilmTemperature(zeroIndex));

        return new RadiationReport(
                mode,
                optics.solarReflectance(),
                optics.visibleReflectance(),
                optics.solarAbsorptance(),
                optics.averageEmissivity(),
                zeroIndex,
                power0Row[0],
                power0Row,
                sweep);
    }

    private RadiativeTermEvaluator createEvaluator(SpectralInputs inputs) {
        SpectralGrid grid = SpectralGridFactory.createInfraredGrid(config, inputs, interpolator);
        return new RadiativeTermEvaluator(grid, angleGrid, blackbody);
    }

    @Override
    public void close() {
        engine.close();
        log.info("RadiationSimulator cerrado y recursos liberados.");
    }
}
