package radiacool.domain.balance;

/**
 * Resultado completo de una ejecución de enfriamiento o calentamiento.
 *
 * @param mode               Convención de signo aplicada.
 * @param solarReflectance   R_sol ponderada por el espectro solar.
 * @param visibleReflectance R_vis ponderada por el espectro solar en la banda visible.
 * @param solarAbsorptance   α_s = 1 − R_sol.
 * @param averageEmissivity  Emisividad media ponderada por cuerpo negro a T_ambiente.
 * @param zeroDeltaIndex     Fila cuya temperatura de película es la más cercana a la ambiente.
 * @param power0             Potencia de esa fila en la primera columna (Power_0).
 * @param power0Row          Fila completa de Power_0 (una entrada por coeficiente).
 * @param sweep              Matriz del barrido.
 */
public record RadiationReport(
        OperatingMode mode,
        double solarReflectance,
        double visibleReflectance,
        double solarAbsorptance,
        double averageEmissivity,
        int zeroDeltaIndex,
        double power0,
        double[] power0Row,
        SweepResult sweep
) {
}
