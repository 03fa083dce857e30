package radiacool.physics.model;

/**
 * Emisividad efectiva de la atmósfera a partir de su transmitancia espectral:
 * ε_atm(λ,θ) = 1 − τ(λ)^sec(θ).
 * <p>
 * τ se acota a [{@link #MIN_TRANSMITTANCE}, 1] antes de usarse. Clase de utilidad sin estado.
 */
public final class AtmosphericEmissivityModel {

    public static final double MIN_TRANSMITTANCE = 1e-12;

    private AtmosphericEmissivityModel() {}

    public static double clampTransmittance(double transmittance) {
        return Math.min(1.0, Math.max(MIN_TRANSMITTANCE, transmittance));
    }

    public static double effectiveEmissivity(double transmittance, double secant) {
        return 1.0 - Math.pow(clampTransmittance(transmittance), secant);
    }

    /**
     * Precalcula ln τ (acotado) para toda la rejilla; así τ^secθ = exp(secθ·ln τ)
     * se evalúa en el bucle angular sin repetir el logaritmo.
     */
    public static double[] logTransmittance(double[] transmittance) {
        double[] logs = new double[transmittance.length];
        for (int i = 0; i < transmittance.length; i++) {
            logs[i] = Math.log(clampTransmittance(transmittance[i]));
        }
        return logs;
    }

    public static double effectiveEmissivityFromLog(double logTransmittance, double secant) {
        return 1.0 - Math.exp(logTransmittance * secant);
    }
}
