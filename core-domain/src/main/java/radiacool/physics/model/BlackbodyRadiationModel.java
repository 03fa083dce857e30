package radiacool.physics.model;

import radiacool.config.RadiationConfig;
import radiacool.domain.exception.PhysicalDomainException;

/**
 * Radiancia espectral de cuerpo negro (ley de Planck).
 * <p>
 * I_BB(λ,T) = 2hc²/λ⁵ · 1/(exp(hc/(λ·k_B·T)) − 1), con λ en metros y T en kelvin.
 * Las constantes físicas se toman de la configuración, nunca de valores globales.
 * <p>
 * Estabilidad numérica: si el exponente supera {@link #MAX_EXPONENT} la radiancia es
 * despreciable y se devuelve 0 sin evaluar la exponencial. No se lanza ningún error.
 * <p>
 * Inmutable y Thread-Safe.
 */
public final class BlackbodyRadiationModel {

    public static final double MAX_EXPONENT = 700.0;

    private final double firstConstant;  // C1 = 2hc²
    private final double secondConstant; // C2 = hc/k_B

    public BlackbodyRadiationModel(double planckConstant, double speedOfLight, double boltzmannConstant) {
        this.firstConstant = 2.0 * planckConstant * speedOfLight * speedOfLight;
        this.secondConstant = planckConstant * speedOfLight / boltzmannConstant;
    }

    public static BlackbodyRadiationModel from(RadiationConfig config) {
        return new BlackbodyRadiationModel(config.planckConstant(), config.speedOfLight(), config.boltzmannConstant());
    }

    /**
     * @param wavelength  Longitud de onda en metros (> 0).
     * @param temperature Temperatura absoluta en kelvin.
     * @return Radiancia espectral en W/(m²·sr·m).
     */
    public double spectralRadiance(double wavelength, double temperature) {
        requirePositiveTemperature(temperature);
        return radiance(wavelength, temperature);
    }

    /**
     * Versión vectorial: un único chequeo de dominio para toda la rejilla.
     */
    public double[] spectralRadiance(double[] wavelengths, double temperature) {
        requirePositiveTemperature(temperature);
        double[] result = new double[wavelengths.length];
        for (int i = 0; i < wavelengths.length; i++) {
            result[i] = radiance(wavelengths[i], temperature);
        }
        return result;
    }

    private double radiance(double wavelength, double temperature) {
        final double exponent = secondConstant / (wavelength * temperature);
        if (exponent > MAX_EXPONENT) {
            return 0.0;
        }
        final double lambda5 = Math.pow(wavelength, 5);
        return firstConstant / lambda5 / Math.expm1(exponent);
    }

    private static void requirePositiveTemperature(double temperature) {
        if (!(temperature > 0.0) || Double.isInfinite(temperature)) {
            throw new PhysicalDomainException("temperature",
                    "la temperatura absoluta debe ser positiva y finita: " + temperature + " K");
        }
    }
}
