package radiacool.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import radiacool.domain.convection.ConvectionParameters;
import radiacool.domain.convection.FluidProperties;
import radiacool.physics.model.AirPropertiesModel;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class ChurchillUsagiConvectionEstimatorTest {

    private static final double AIR_TEMPERATURE = 298.15;

    private final ChurchillUsagiConvectionEstimator estimator = new ChurchillUsagiConvectionEstimator();

    private final ConvectionParameters base = ConvectionParameters.builder()
            .characteristicLength(1.0)
            .windSpeed(0.0)
            .deltaT(20.0)
            .airTemperature(AIR_TEMPERATURE)
            .naturalEnabled(true)
            .forcedEnabled(true)
            .build();

    private FluidProperties airFor(ConvectionParameters p) {
        return AirPropertiesModel.evaluate(AirPropertiesModel.filmReferenceTemperature(p.airTemperature(), p.deltaT()));
    }

    @Test
    @DisplayName("Sin viento: la mezcla se reduce a la convección natural")
    void estimate_noWind_shouldEqualNatural() {
        // ARRANGE
        ConvectionParameters p = base;

        // ACT
        double h = estimator.estimateCoefficient(p);
        double hNatural = estimator.naturalCoefficient(p, airFor(p));

        // ASSERT
        log.info("h (v=0, ΔT=20 K) = {} W/m²K", h);
        assertTrue(hNatural > 1.0, "El caso de prueba debe quedar por encima del suelo");
        assertEquals(hNatural, h, 1e-9);
    }

    @Test
    @DisplayName("Natural desactivada: la mezcla se reduce a la convección forzada")
    void estimate_naturalDisabled_shouldEqualForced() {
        ConvectionParameters p = base.withNaturalEnabled(false).withWindSpeed(3.0);

        double h = estimator.estimateCoefficient(p);
        double hForced = estimator.forcedCoefficient(p, airFor(p));

        log.info("h (v=3 m/s, solo forzada) = {} W/m²K", h);
        assertTrue(hForced > 1.0);
        assertEquals(hForced, h, 1e-9);
    }

    @Test
    @DisplayName("Mezcla: con ambos mecanismos h supera a cada uno por separado (n = 3)")
    void estimate_bothMechanisms_shouldBlendCubically() {
        ConvectionParameters p = base.withWindSpeed(2.0);
        FluidProperties air = airFor(p);

        double hNatural = estimator.naturalCoefficient(p, air);
        double hForced = estimator.forcedCoefficient(p, air);
        double h = estimator.estimateCoefficient(p);

        assertEquals(Math.cbrt(Math.pow(hNatural, 3) + Math.pow(hForced, 3)), h, 1e-9);
        assertTrue(h >= Math.max(hNatural, hForced));
    }

    @Test
    @DisplayName("Monotonía: h no decrece al aumentar ΔT (Ra) ni la velocidad del viento (Re)")
    void estimate_shouldBeNonDecreasingInRayleighAndReynolds() {
        double previous = 0.0;
        for (double deltaT = 1.0; deltaT <= 60.0; deltaT += 1.0) {
            double h = estimator.estimateCoefficient(base.withForcedEnabled(false).withDeltaT(deltaT));
            assertTrue(h >= previous, "h decreció en ΔT = " + deltaT);
            previous = h;
        }

        previous = 0.0;
        for (double wind = 0.5; wind <= 20.0; wind += 0.5) {
            double h = estimator.estimateCoefficient(base.withNaturalEnabled(false).withWindSpeed(wind));
            assertTrue(h >= previous, "h decreció en v = " + wind);
            previous = h;
        }
    }

    @Test
    @DisplayName("Suelo: ΔT ≈ 0 sin viento, mecanismos desactivados o entradas inválidas devuelven 1 W/m²K")
    void estimate_degenerateInputs_shouldReturnFloor() {
        final double floor = ChurchillUsagiConvectionEstimator.MIN_COEFFICIENT;

        assertEquals(floor, estimator.estimateCoefficient(base.withDeltaT(0.0)));
        assertEquals(floor, estimator.estimateCoefficient(base.withNaturalEnabled(false).withForcedEnabled(false)));
        assertEquals(floor, estimator.estimateCoefficient(base.withCharacteristicLength(0.0)));
        assertEquals(floor, estimator.estimateCoefficient(base.withWindSpeed(Double.NaN)));
        assertEquals(floor, estimator.estimateCoefficient(base.withAirTemperature(-5.0)));
        assertEquals(floor, estimator.estimateCoefficient(null));
    }
}
