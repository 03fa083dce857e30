package radiacool.physics.model;

import radiacool.domain.convection.FluidProperties;

/**
 * Propiedades del aire seco a presión atmosférica mediante leyes de potencia
 * alrededor de 0 °C. Suficiente para correlaciones de convección de placa plana.
 */
public final class AirPropertiesModel {

    public static final double GRAVITY = 9.81;
    public static final double MIN_REFERENCE_TEMPERATURE = 150.0;

    private static final double T0 = 273.15;
    private static final double RHO_0 = 1.225;
    private static final double MU_0 = 1.81e-5;
    private static final double K_0 = 0.024;
    private static final double CP = 1005.0;
    private static final double PR_MIN = 0.68;
    private static final double PR_MAX = 0.75;

    private AirPropertiesModel() {}

    /**
     * Temperatura de película de la capa límite: media entre aire y superficie,
     * con un suelo de 150 K.
     *
     * @param airTemperature Temperatura del aire (K).
     * @param deltaT         T_superficie − T_aire (K).
     */
    public static double filmReferenceTemperature(double airTemperature, double deltaT) {
        return Math.max(MIN_REFERENCE_TEMPERATURE, airTemperature + deltaT / 2.0);
    }

    public static FluidProperties evaluate(double referenceTemperature) {
        final double ratio = referenceTemperature / T0;
        final double density = RHO_0 * (T0 / referenceTemperature);
        final double viscosity = MU_0 * Math.pow(ratio, 0.7);
        final double conductivity = K_0 * Math.pow(ratio, 0.8);

        final double kinematic = viscosity / density;
        final double diffusivity = conductivity / (density * CP);
        final double prandtl = Math.min(PR_MAX, Math.max(PR_MIN, kinematic / diffusivity));

        return new FluidProperties(
                referenceTemperature,
                density,
                viscosity,
                conductivity,
                kinematic,
                diffusivity,
                prandtl,
                1.0 / referenceTemperature);
    }
}
