package radiacool.domain.spectrum;

import lombok.Builder;
import radiacool.domain.exception.SpectralDataFormatException;

/**
 * Los cuatro espectros que consume un cálculo de balance de potencia.
 *
 * @param reflectance   Reflectancia de la superficie (banda solar/visible).
 * @param solarSpectrum Espectro solar de referencia (AM1.5), usado como peso.
 * @param emissivity    Emisividad espectral de la superficie (infrarrojo).
 * @param transmittance Transmitancia atmosférica (infrarrojo).
 */
@Builder
public record SpectralInputs(
        SpectralDataset reflectance,
        SpectralDataset solarSpectrum,
        SpectralDataset emissivity,
        SpectralDataset transmittance
) {

    public SpectralInputs {
        requireQuantity(reflectance, SpectralQuantity.REFLECTANCE);
        requireQuantity(solarSpectrum, SpectralQuantity.SOLAR_IRRADIANCE);
        requireQuantity(emissivity, SpectralQuantity.EMISSIVITY);
        requireQuantity(transmittance, SpectralQuantity.TRANSMITTANCE);
    }

    private static void requireQuantity(SpectralDataset dataset, SpectralQuantity expected) {
        if (dataset == null) {
            throw new SpectralDataFormatException(expected, "Falta el espectro.");
        }
        if (dataset.getQuantity() != expected) {
            throw new SpectralDataFormatException(expected,
                    "Se esperaba " + expected.getLabel() + " pero se recibió " + dataset.getQuantity().getLabel());
        }
    }
}
