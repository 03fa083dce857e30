package radiacool.compute.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import radiacool.config.RadiationConfig;

/**
 * Cuerpo de las peticiones de cálculo: los cuatro espectros como filas {@code [λ, valor]}
 * y una configuración opcional (si falta se usa la de referencia).
 */
@Builder
public record RadiationRequest(
        @Schema(description = "Reflectancia de la superficie, filas [λ, valor]")
        double[][] reflectance,
        @Schema(description = "Espectro solar de referencia (AM1.5), filas [λ, W/m²/μm]")
        double[][] solarSpectrum,
        @Schema(description = "Emisividad de la superficie, filas [λ, valor]")
        double[][] emissivity,
        @Schema(description = "Transmitancia atmosférica, filas [λ, valor]")
        double[][] transmittance,
        @Schema(description = "Configuración numérica; null para usar la de referencia")
        RadiationConfig config
) {
}
