package radiacool.domain.exception;

import lombok.Getter;
import radiacool.domain.spectrum.SpectralQuantity;

/**
 * Datos espectrales mal formados: columnas ausentes, valores no numéricos
 * o longitudes de onda insuficientes tras ordenar y eliminar duplicados.
 */
@Getter
public class SpectralDataFormatException extends RadiationEngineException {

    /**
     * Magnitud espectral afectada (puede ser null si aún no se conoce).
     */
    private final SpectralQuantity quantity;

    public SpectralDataFormatException(SpectralQuantity quantity, String message) {
        super(formatMessage(quantity, message));
        this.quantity = quantity;
    }

    public SpectralDataFormatException(SpectralQuantity quantity, String message, Throwable cause) {
        super(formatMessage(quantity, message), cause);
        this.quantity = quantity;
    }

    private static String formatMessage(SpectralQuantity quantity, String message) {
        return quantity == null ? message : "[" + quantity.getLabel() + "] " + message;
    }
}
