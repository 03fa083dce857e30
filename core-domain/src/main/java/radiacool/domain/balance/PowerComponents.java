package radiacool.domain.balance;

import lombok.Builder;

/**
 * Desglose de todos los términos del balance en una celda (temperatura de película, coeficiente).
 * Solo se rellena en modo diagnóstico. Potencias en W/m², coeficientes en W/m²K.
 *
 * @param filmTemperature            Temperatura de película (°C).
 * @param coefficient                Coeficiente candidato del barrido.
 * @param radiativePower             P_rad: emisión térmica de la superficie.
 * @param atmosphericPower           P_atm: radiación atmosférica absorbida.
 * @param convectivePower            Q_conv total = h_total·(T_a − T_f).
 * @param solarPower                 Q_solar = α_s·S.
 * @param phaseChangePower           P_phase de la rampa de cambio de fase.
 * @param netPower                   Valor del balance según el modo.
 * @param modelConvectionCoefficient h estimado por el modelo de convección (0 si desactivado).
 * @param totalConvectionCoefficient Candidato + h del modelo.
 * @param modelConvectivePower       Parte de Q_conv atribuible al h del modelo.
 * @param fixedConvectivePower       Parte de Q_conv atribuible al candidato.
 */
@Builder
public record PowerComponents(
        double filmTemperature,
        double coefficient,
        double radiativePower,
        double atmosphericPower,
        double convectivePower,
        double solarPower,
        double phaseChangePower,
        double netPower,
        double modelConvectionCoefficient,
        double totalConvectionCoefficient,
        double modelConvectivePower,
        double fixedConvectivePower
) {
}
