package radiacool.config;

import lombok.Builder;
import lombok.With;

/**
 * Parámetros del término de cambio de fase (calor latente).
 *
 * @param triggerTemperature Temperatura de transición en °C. Por debajo o en ella la contribución es nula.
 * @param maxPower           Contribución máxima (W/m²) alcanzada en la meseta.
 * @param rampWidth          Anchura en °C de la rampa lineal entre el disparo y la meseta.
 */
@Builder
@With
public record PhaseChangeConfig(
        double triggerTemperature,
        double maxPower,
        double rampWidth
) {
}
