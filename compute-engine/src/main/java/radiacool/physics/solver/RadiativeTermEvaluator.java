package radiacool.physics.solver;

import radiacool.domain.spectrum.AngleGrid;
import radiacool.domain.spectrum.SpectralGrid;
import radiacool.physics.model.AtmosphericEmissivityModel;
import radiacool.physics.model.BlackbodyRadiationModel;

/**
 * Evalúa los dos términos radiativos del balance sobre la rejilla infrarroja común:
 * <ul>
 * <li>P_rad(T): emisión térmica de la superficie, Σ_θ w(θ) · Σ_λ ε_s·I_BB(λ,T)·Δλ.</li>
 * <li>P_atm(T): radiación atmosférica absorbida, Σ_θ w(θ) · Σ_λ ε_s·ε_atm(λ,θ)·I_BB(λ,T)·Δλ.</li>
 * </ul>
 * En P_rad el sumatorio angular se factoriza (Σw · interior). P_atm requiere el sumatorio anidado
 * completo porque ε_atm depende del ángulo.
 * <p>
 * Inmutable y Thread-Safe: las rejillas se comparten entre tareas sin copia.
 */
public class RadiativeTermEvaluator {

    private final SpectralGrid grid;
    private final AngleGrid angles;
    private final BlackbodyRadiationModel blackbody;

    public RadiativeTermEvaluator(SpectralGrid grid, AngleGrid angles, BlackbodyRadiationModel blackbody) {
        this.grid = grid;
        this.angles = angles;
        this.blackbody = blackbody;
    }

    /**
     * @param temperature Temperatura de la superficie (K).
     * @return P_rad (W/m²).
     */
    public double surfaceEmission(double temperature) {
        final double[] radiance = blackbody.spectralRadiance(grid.wavelengths(), temperature);
        final double[] emissivity = grid.emissivity();
        final double[] widths = grid.cellWidths();

        double inner = 0.0;
        for (int i = 0; i < radiance.length; i++) {
            inner += emissivity[i] * radiance[i] * widths[i];
        }
        return angles.getTotalWeight() * inner;
    }

    /**
     * @param temperature Temperatura del aire (K).
     * @return P_atm (W/m²).
     */
    public double atmosphericAbsorption(double temperature) {
        final double[] radiance = blackbody.spectralRadiance(grid.wavelengths(), temperature);
        final double[] emissivity = grid.emissivity();
        final double[] widths = grid.cellWidths();
        final double[] logTau = grid.logTransmittance();
        final int n = radiance.length;

        // Parte independiente del ángulo, calculada una sola vez
        double[] base = new double[n];
        for (int i = 0; i < n; i++) {
            base[i] = emissivity[i] * radiance[i] * widths[i];
        }

        double total = 0.0;
        for (int a = 0; a < angles.size(); a++) {
            final double weight = angles.weightAt(a);
            if (weight == 0.0) {
                continue;
            }
            final double secant = angles.secantAt(a);
            double inner = 0.0;
            for (int i = 0; i < n; i++) {
                if (base[i] == 0.0) continue;
                inner += base[i] * AtmosphericEmissivityModel.effectiveEmissivityFromLog(logTau[i], secant);
            }
            total += weight * inner;
        }
        return total;
    }
}
