package radiacool.compute.api.dto;

import lombok.Builder;
import radiacool.config.RadiationConfig;

/**
 * Contenido de los cuatro ficheros espectrales de dos columnas tal como llegan del cliente,
 * sin normalizar, más una configuración opcional.
 */
@Builder
public record SpectralTextUpload(
        String reflectance,
        String solarSpectrum,
        String emissivity,
        String transmittance,
        RadiationConfig config
) {
}
