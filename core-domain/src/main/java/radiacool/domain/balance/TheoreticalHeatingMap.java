package radiacool.domain.balance;

/**
 * Mapa teórico de potencia de calentamiento sobre una rejilla (temperatura ambiente × irradiancia),
 * suponiendo película en equilibrio con el ambiente y sin convección.
 *
 * @param ambientTemperatures Temperaturas ambiente (°C), filas.
 * @param irradiances         Irradiancias solares (W/m²), columnas.
 * @param heatingPower        P_heat = α_s·S + P_atm(T_a) − P_rad(T_a) por celda.
 * @param solarAbsorptance    α_s utilizada.
 */
public record TheoreticalHeatingMap(
        double[] ambientTemperatures,
        double[] irradiances,
        double[][] heatingPower,
        double solarAbsorptance
) {

    public double valueAt(int temperatureIndex, int irradianceIndex) {
        return heatingPower[temperatureIndex][irradianceIndex];
    }
}
