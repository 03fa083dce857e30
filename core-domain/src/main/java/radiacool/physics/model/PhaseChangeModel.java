package radiacool.physics.model;

import radiacool.config.PhaseChangeConfig;

/**
 * Contribución de calor latente P_phase(T_film):
 * <ul>
 * <li>0 en o por debajo de la temperatura de disparo.</li>
 * <li>Rampa lineal a lo largo de {@code rampWidth} °C.</li>
 * <li>Meseta en {@code maxPower} a partir de disparo + anchura.</li>
 * </ul>
 * Sin configuración, o con anchura ≤ 0, la contribución es siempre 0.
 */
public final class PhaseChangeModel {

    private static final PhaseChangeModel DISABLED = new PhaseChangeModel(0.0, 0.0, 0.0, false);

    private final double triggerTemperature;
    private final double maxPower;
    private final double rampWidth;
    private final boolean enabled;

    private PhaseChangeModel(double triggerTemperature, double maxPower, double rampWidth, boolean enabled) {
        this.triggerTemperature = triggerTemperature;
        this.maxPower = maxPower;
        this.rampWidth = rampWidth;
        this.enabled = enabled;
    }

    public static PhaseChangeModel disabled() {
        return DISABLED;
    }

    public static PhaseChangeModel from(PhaseChangeConfig config) {
        if (config == null || !(config.rampWidth() > 0.0)) {
            return DISABLED;
        }
        return new PhaseChangeModel(config.triggerTemperature(), config.maxPower(), config.rampWidth(), true);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @param filmTemperature Temperatura de película (°C).
     * @return Potencia de cambio de fase (W/m²).
     */
    public double power(double filmTemperature) {
        if (!enabled || filmTemperature <= triggerTemperature) {
            return 0.0;
        }
        final double progress = (filmTemperature - triggerTemperature) / rampWidth;
        return maxPower * Math.min(1.0, progress);
    }
}
