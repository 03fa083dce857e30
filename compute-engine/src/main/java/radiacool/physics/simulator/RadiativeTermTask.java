package radiacool.physics.simulator;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import radiacool.config.RadiationConfig;
import radiacool.physics.solver.RadiativeTermEvaluator;

import java.util.concurrent.Callable;

/**
 * Tarea ejecutable que evalúa un término radiativo para una única temperatura.
 * Está diseñada para ejecutarse en el pool de hilos del {@link PowerBalanceEngine};
 * cada tarea escribe únicamente su propio resultado.
 */
@Getter
@RequiredArgsConstructor
public class RadiativeTermTask implements Callable<RadiativeTermTask> {

    public enum Term {
        SURFACE_EMISSION,
        ATMOSPHERIC_ABSORPTION
    }

    // --- Entradas para la tarea ---
    private final int index;
    private final double temperature; // °C
    private final Term term;
    private final RadiativeTermEvaluator evaluator; // Compartido, inmutable

    // --- Resultado de la tarea ---
    private double power;

    @Override
    public RadiativeTermTask call() {
        final double kelvin = temperature + RadiationConfig.KELVIN_OFFSET;
        this.power = term == Term.SURFACE_EMISSION
                ? evaluator.surfaceEmission(kelvin)
                : evaluator.atmosphericAbsorption(kelvin);
        return this;
    }
}
