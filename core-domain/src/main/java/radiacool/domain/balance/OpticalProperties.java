package radiacool.domain.balance;

/**
 * Figuras de mérito escalares de la superficie.
 *
 * @param solarReflectance   R_sol ponderada por el espectro solar.
 * @param visibleReflectance R_vis ponderada por el espectro solar en la banda visible.
 * @param solarAbsorptance   α_s = 1 − R_sol.
 * @param averageEmissivity  Emisividad media ponderada por cuerpo negro a la temperatura ambiente.
 */
public record OpticalProperties(
        double solarReflectance,
        double visibleReflectance,
        double solarAbsorptance,
        double averageEmissivity
) {
}
