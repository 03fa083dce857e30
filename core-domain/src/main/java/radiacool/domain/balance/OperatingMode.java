package radiacool.domain.balance;

/**
 * Convención de signo del balance de potencia.
 */
public enum OperatingMode {
    /**
     * P_net = P_rad − P_atm − Q_conv − Q_solar + P_phase. Positivo = enfriamiento neto.
     */
    COOLING,
    /**
     * P_heat = Q_solar + P_atm + Q_conv − P_rad − P_phase. Positivo = calentamiento neto.
     */
    HEATING
}
