package radiacool.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import radiacool.domain.convection.ConvectionParameters;
import radiacool.domain.convection.FluidProperties;
import radiacool.physics.model.AirPropertiesModel;
import radiacool.physics.solver.ConvectionModel;

/**
 * Estimación de h para una placa plana horizontal expuesta al aire.
 * <ul>
 * <li><b>Natural:</b> Nu = 0.54·Ra^¼ (laminar, Ra &lt; 10⁷) o 0.15·Ra^⅓ (turbulento).</li>
 * <li><b>Forzada:</b> Nu = 0.664·Re^½·Pr^⅓ (laminar, Re &lt; 5·10⁵) o 0.037·Re^0.8·Pr^⅓.</li>
 * <li><b>Mezcla:</b> Churchill–Usagi con n = 3: h = (h_nat³ + h_forz³)^⅓.</li>
 * </ul>
 * El resultado nunca baja de {@link #MIN_COEFFICIENT}.
 */
@Slf4j
public class ChurchillUsagiConvectionEstimator implements ConvectionModel {

    public static final double MIN_COEFFICIENT = 1.0;

    private static final double MIN_DELTA_T = 1e-3;
    private static final double MIN_WIND_SPEED = 1e-3;
    private static final double MIN_RAYLEIGH = 1e-9;
    private static final double MIN_REYNOLDS = 1.0;
    private static final double TURBULENT_RAYLEIGH = 1e7;
    private static final double TURBULENT_REYNOLDS = 5e5;
    private static final double BLEND_EXPONENT = 3.0;

    @Override
    public double estimateCoefficient(ConvectionParameters p) {
        if (!isValid(p)) {
            log.warn("Parámetros de convección inválidos ({}). Se usa h = {} W/m²K.", p, MIN_COEFFICIENT);
            return MIN_COEFFICIENT;
        }

        FluidProperties air = AirPropertiesModel.evaluate(
                AirPropertiesModel.filmReferenceTemperature(p.airTemperature(), p.deltaT()));
        if (!(air.kinematicViscosity() > 0.0) || !(air.thermalDiffusivity() > 0.0)) {
            log.warn("Propiedades del aire no físicas a T = {} K. Se usa h = {} W/m²K.",
                    air.referenceTemperature(), MIN_COEFFICIENT);
            return MIN_COEFFICIENT;
        }

        double hNatural = p.naturalEnabled() ? naturalCoefficient(p, air) : 0.0;
        double hForced = p.forcedEnabled() ? forcedCoefficient(p, air) : 0.0;

        double blended = Math.cbrt(Math.pow(hNatural, BLEND_EXPONENT) + Math.pow(hForced, BLEND_EXPONENT));
        if (!Double.isFinite(blended)) {
            log.warn("Coeficiente combinado no finito (nat={}, forz={}). Se usa el suelo.", hNatural, hForced);
            return MIN_COEFFICIENT;
        }
        return Math.max(MIN_COEFFICIENT, blended);
    }

    /**
     * h por convección natural; 0 si |ΔT| es despreciable.
     */
    public double naturalCoefficient(ConvectionParameters p, FluidProperties air) {
        final double absDelta = Math.abs(p.deltaT());
        if (absDelta <= MIN_DELTA_T) {
            return 0.0;
        }
        final double length = p.characteristicLength();
        double rayleigh = AirPropertiesModel.GRAVITY * air.expansionCoefficient() * absDelta
                * length * length * length
                / (air.kinematicViscosity() * air.thermalDiffusivity());
        rayleigh = Math.max(MIN_RAYLEIGH, rayleigh);

        final double nusselt = rayleigh < TURBULENT_RAYLEIGH
                ? 0.54 * Math.pow(rayleigh, 0.25)
                : 0.15 * Math.cbrt(rayleigh);
        return nusselt * air.conductivity() / length;
    }

    /**
     * h por convección forzada; 0 si no hay viento apreciable.
     */
    public double forcedCoefficient(ConvectionParameters p, FluidProperties air) {
        if (p.windSpeed() <= MIN_WIND_SPEED) {
            return 0.0;
        }
        final double length = p.characteristicLength();
        final double reynolds = Math.max(MIN_REYNOLDS, p.windSpeed() * length / air.kinematicViscosity());
        final double prandtlTerm = Math.cbrt(air.prandtl());

        final double nusselt = reynolds < TURBULENT_REYNOLDS
                ? 0.664 * Math.sqrt(reynolds) * prandtlTerm
                : 0.037 * Math.pow(reynolds, 0.8) * prandtlTerm;
        return nusselt * air.conductivity() / length;
    }

    private static boolean isValid(ConvectionParameters p) {
        return p != null
                && Double.isFinite(p.characteristicLength()) && p.characteristicLength() > 0.0
                && Double.isFinite(p.windSpeed())
                && Double.isFinite(p.deltaT())
                && Double.isFinite(p.airTemperature()) && p.airTemperature() > 0.0;
    }
}
