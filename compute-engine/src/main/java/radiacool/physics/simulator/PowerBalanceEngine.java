package radiacool.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import radiacool.config.RadiationConfig;
import radiacool.domain.balance.OperatingMode;
import radiacool.domain.balance.PowerComponents;
import radiacool.domain.balance.SweepResult;
import radiacool.domain.convection.ConvectionParameters;
import radiacool.physics.model.PhaseChangeModel;
import radiacool.physics.solver.ConvectionModel;
import radiacool.physics.solver.RadiativeTermEvaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;

/**
 * Orquestador del barrido de balance de potencia (temperatura de película × coeficiente de convección).
 * <p>
 * Responsabilidades:
 * 1. Evaluar P_atm una sola vez por barrido y P_rad una vez por temperatura de película,
 *    repartiendo el trabajo radiativo en un pool de hilos de tamaño fijo.
 * 2. Combinar los términos con convección, carga solar y cambio de fase en cada celda.
 * 3. Atender la comprobación de cancelación entre iteraciones del bucle externo.
 * <p>
 * No conserva estado entre barridos: el pool es el único recurso y se libera en {@link #close()}.
 */
@Slf4j
public class PowerBalanceEngine implements AutoCloseable {

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private final RadiationConfig config;
    private final ConvectionModel convectionModel;
    private final PhaseChangeModel phaseChangeModel;
    private final ExecutorService threadPool;

    public PowerBalanceEngine(RadiationConfig config, ConvectionModel convectionModel, int processorCount) {
        this.config = config;
        this.convectionModel = convectionModel;
        this.phaseChangeModel = PhaseChangeModel.from(config.phaseChange());
        this.threadPool = Executors.newFixedThreadPool(Math.max(processorCount, 1));
        log.info("PowerBalanceEngine inicializado. (Hilos: {}, Cambio de fase: {})",
                Math.max(processorCount, 1), phaseChangeModel.isEnabled());
    }

    public SweepResult sweep(OperatingMode mode,
                             RadiativeTermEvaluator evaluator,
                             double solarAbsorptance,
                             List<Double> coefficients,
                             boolean diagnostic,
                             BooleanSupplier cancellation) {
        final BooleanSupplier cancelled = cancellation == null ? NEVER_CANCELLED : cancellation;
        final long startTime = System.currentTimeMillis();

        final double[] films = config.filmTemperatures(mode);
        final double[] columns = coefficients.stream().mapToDouble(Double::doubleValue).toArray();
        final int rows = films.length;
        final double ambient = config.ambientTemperature();

        log.info("Iniciando barrido {}: {} temperaturas de película x {} coeficientes (T_a = {} °C).",
                mode, rows, columns.length, ambient);

        checkCancelled(cancelled);

        // 1. Términos que no dependen del coeficiente candidato
        final double atmospheric = evaluator.atmosphericAbsorption(config.ambientTemperatureKelvin());
        final double[] radiative = evaluate(evaluator, RadiativeTermTask.Term.SURFACE_EMISSION, films, cancelled);
        final double solar = solarAbsorptance * config.solarIrradiance();
        final double[] modelCoefficient = new double[rows];
        final double[] phase = new double[rows];
        for (int i = 0; i < rows; i++) {
            modelCoefficient[i] = modelCoefficient(films[i] - ambient);
            phase[i] = phaseChangeModel.power(films[i]);
        }
        log.debug("P_atm = {} W/m², Q_solar = {} W/m²", atmospheric, solar);

        // 2. Ensamblado de la matriz
        double[][] net = new double[rows][columns.length];
        PowerComponents[][] components = diagnostic ? new PowerComponents[rows][columns.length] : null;

        for (int j = 0; j < columns.length; j++) {
            checkCancelled(cancelled);
            final double candidate = columns[j];

            for (int i = 0; i < rows; i++) {
                final double delta = ambient - films[i];
                final double totalCoefficient = candidate + modelCoefficient[i];
                final double convective = totalCoefficient * delta;

                final double value = mode == OperatingMode.COOLING
                        ? radiative[i] - atmospheric - convective - solar + phase[i]
                        : solar + atmospheric + convective - radiative[i] - phase[i];
                net[i][j] = value;

                if (components != null) {
                    components[i][j] = PowerComponents.builder()
                            .filmTemperature(films[i])
                            .coefficient(candidate)
                            .radiativePower(radiative[i])
                            .atmosphericPower(atmospheric)
                            .convectivePower(convective)
                            .solarPower(solar)
                            .phaseChangePower(phase[i])
                            .netPower(value)
                            .modelConvectionCoefficient(modelCoefficient[i])
                            .totalConvectionCoefficient(totalCoefficient)
                            .modelConvectivePower(modelCoefficient[i] * delta)
                            .fixedConvectivePower(candidate * delta)
                            .build();
                }
            }
        }

        log.info("Barrido {} finalizado. Tiempo de cómputo: {}ms", mode, System.currentTimeMillis() - startTime);
        return new SweepResult(mode, ambient, films, columns, net, components);
    }

    /**
     * Evalúa un término radiativo para cada temperatura (°C) en el pool de hilos.
     * El resultado conserva el orden de entrada.
     */
    public double[] evaluate(RadiativeTermEvaluator evaluator,
                             RadiativeTermTask.Term term,
                             double[] temperatures,
                             BooleanSupplier cancellation) {
        checkCancelled(cancellation == null ? NEVER_CANCELLED : cancellation);

        List<RadiativeTermTask> tasks = new ArrayList<>(temperatures.length);
        for (int i = 0; i < temperatures.length; i++) {
            tasks.add(new RadiativeTermTask(i, temperatures[i], term, evaluator));
        }

        List<Future<RadiativeTermTask>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancellation("Cálculo radiativo interrumpido.", e);
        }

        double[] result = new double[temperatures.length];
        for (Future<RadiativeTermTask> future : futures) {
            try {
                RadiativeTermTask task = future.get();
                result[task.getIndex()] = task.getPower();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw cancellation("Cálculo radiativo interrumpido.", e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("Error en el cálculo radiativo (" + term + ")", e.getCause());
            }
        }
        return result;
    }

    private double modelCoefficient(double deltaT) {
        if (!config.naturalConvectionEnabled() && !config.forcedConvectionEnabled()) {
            return 0.0;
        }
        return convectionModel.estimateCoefficient(ConvectionParameters.builder()
                .characteristicLength(config.characteristicLength())
                .windSpeed(config.windSpeed())
                .deltaT(deltaT)
                .airTemperature(config.ambientTemperatureKelvin())
                .naturalEnabled(config.naturalConvectionEnabled())
                .forcedEnabled(config.forcedConvectionEnabled())
                .build());
    }

    private static void checkCancelled(BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) {
            log.info("Barrido cancelado por el llamante.");
            throw new CancellationException("Cálculo cancelado por el llamante.");
        }
    }

    private static CancellationException cancellation(String message, Throwable cause) {
        CancellationException exception = new CancellationException(message);
        exception.initCause(cause);
        return exception;
    }

    @Override
    public void close() {
        threadPool.shutdownNow();
        log.info("PowerBalanceEngine cerrado y pool de hilos liberado.");
    }
}
