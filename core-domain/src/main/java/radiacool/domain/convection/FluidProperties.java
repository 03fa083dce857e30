package radiacool.domain.convection;

/**
 * Propiedades del aire evaluadas a la temperatura de película de la capa límite.
 *
 * @param referenceTemperature  Temperatura de evaluación (K).
 * @param density               ρ (kg/m³).
 * @param dynamicViscosity      μ (Pa·s).
 * @param conductivity          k (W/m·K).
 * @param kinematicViscosity    ν = μ/ρ (m²/s).
 * @param thermalDiffusivity    α = k/(ρ·cp) (m²/s).
 * @param prandtl               Número de Prandtl acotado a [0.68, 0.75].
 * @param expansionCoefficient  β = 1/T (1/K), gas ideal.
 */
public record FluidProperties(
        double referenceTemperature,
        double density,
        double dynamicViscosity,
        double conductivity,
        double kinematicViscosity,
        double thermalDiffusivity,
        double prandtl,
        double expansionCoefficient
) {
}
