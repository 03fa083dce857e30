package radiacool.domain.convection;

import lombok.Builder;
import lombok.With;

/**
 * Entrada de una estimación de coeficiente convectivo.
 *
 * @param characteristicLength Longitud característica L (m).
 * @param windSpeed            Velocidad del viento (m/s).
 * @param deltaT               T_superficie − T_aire (K).
 * @param airTemperature       Temperatura del aire (K).
 * @param naturalEnabled       Considera convección natural.
 * @param forcedEnabled        Considera convección forzada.
 */
@Builder
@With
public record ConvectionParameters(
        double characteristicLength,
        double windSpeed,
        double deltaT,
        double airTemperature,
        boolean naturalEnabled,
        boolean forcedEnabled
) {
}
