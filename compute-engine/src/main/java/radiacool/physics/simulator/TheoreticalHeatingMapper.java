package radiacool.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import radiacool.domain.balance.TheoreticalHeatingMap;
import radiacool.physics.solver.RadiativeTermEvaluator;

import java.util.function.BooleanSupplier;

/**
 * Genera el mapa teórico de calentamiento: P_heat = α_s·S + P_atm(T_a) − P_rad(T_a)
 * con la película en equilibrio con el ambiente y sin convección.
 * <p>
 * Por defecto barre T_a ∈ [−100, 100] °C (21 muestras) y S ∈ [0, 1200] W/m² (49 muestras).
 */
@Slf4j
public class TheoreticalHeatingMapper {

    public static final double[] DEFAULT_AMBIENT_TEMPERATURES = linspace(-100.0, 100.0, 21);
    public static final double[] DEFAULT_IRRADIANCES = linspace(0.0, 1200.0, 49);

    private final PowerBalanceEngine engine;

    public TheoreticalHeatingMapper(PowerBalanceEngine engine) {
        this.engine = engine;
    }

    public TheoreticalHeatingMap map(RadiativeTermEvaluator evaluator, double solarAbsorptance) {
        return map(evaluator, solarAbsorptance, DEFAULT_AMBIENT_TEMPERATURES, DEFAULT_IRRADIANCES, null);
    }

    public TheoreticalHeatingMap map(RadiativeTermEvaluator evaluator,
                                     double solarAbsorptance,
                                     double[] ambientTemperatures,
                                     double[] irradiances,
                                     BooleanSupplier cancellation) {
        final long startTime = System.currentTimeMillis();
        log.info("Generando mapa teórico de calentamiento: {} temperaturas x {} irradiancias.",
                ambientTemperatures.length, irradiances.length);

        // Ambos términos dependen solo de T_a: una evaluación por fila
        double[] atmospheric = engine.evaluate(evaluator,
                RadiativeTermTask.Term.ATMOSPHERIC_ABSORPTION, ambientTemperatures, cancellation);
        double[] radiative = engine.evaluate(evaluator,
                RadiativeTermTask.Term.SURFACE_EMISSION, ambientTemperatures, cancellation);

        double[][] heating = new double[ambientTemperatures.length][irradiances.length];
        for (int i = 0; i < ambientTemperatures.length; i++) {
            final double radiativeBalance = atmospheric[i] - radiative[i];
            for (int j = 0; j < irradiances.length; j++) {
                heating[i][j] = solarAbsorptance * irradiances[j] + radiativeBalance;
            }
        }

        log.info("Mapa teórico generado en {}ms", System.currentTimeMillis() - startTime);
        return new TheoreticalHeatingMap(ambientTemperatures.clone(), irradiances.clone(), heating, solarAbsorptance);
    }

    static double[] linspace(double start, double end, int count) {
        double[] values = new double[count];
        final double step = (end - start) / (count - 1);
        for (int i = 0; i < count; i++) {
            values[i] = start + i * step;
        }
        values[count - 1] = end;
        return values;
    }
}
