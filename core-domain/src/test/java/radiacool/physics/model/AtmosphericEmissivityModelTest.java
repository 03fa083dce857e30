package radiacool.physics.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AtmosphericEmissivityModelTest {

    @Test
    @DisplayName("Incidencia normal: ε_atm = 1 − τ exactamente")
    void effectiveEmissivity_normalIncidence_shouldBeOneMinusTau() {
        for (double tau : new double[]{0.1, 0.35, 0.8, 0.999}) {
            assertEquals(1.0 - tau, AtmosphericEmissivityModel.effectiveEmissivity(tau, 1.0));
        }
    }

    @Test
    @DisplayName("Transmisión perfecta: τ = 1 ⇒ ε_atm = 0 para cualquier ángulo")
    void effectiveEmissivity_perfectTransmission_shouldBeZero() {
        for (double secant : new double[]{1.0, 2.0, 50.0, 1e6}) {
            assertEquals(0.0, AtmosphericEmissivityModel.effectiveEmissivity(1.0, secant));
        }
    }

    @Test
    @DisplayName("Incidencia rasante: ε_atm → 1 cuando sec θ → ∞ y τ < 1")
    void effectiveEmissivity_grazing_shouldApproachOne() {
        assertEquals(1.0, AtmosphericEmissivityModel.effectiveEmissivity(0.9, 1e4), 1e-12);
    }

    @Test
    @DisplayName("Acotación: τ ≤ 0 o τ > 1 se llevan a [1e-12, 1] antes de usarse")
    void clampTransmittance_shouldKeepDomain() {
        assertEquals(AtmosphericEmissivityModel.MIN_TRANSMITTANCE, AtmosphericEmissivityModel.clampTransmittance(0.0));
        assertEquals(AtmosphericEmissivityModel.MIN_TRANSMITTANCE, AtmosphericEmissivityModel.clampTransmittance(-0.3));
        assertEquals(1.0, AtmosphericEmissivityModel.clampTransmittance(1.4));
        assertTrue(Double.isFinite(AtmosphericEmissivityModel.logTransmittance(new double[]{0.0})[0]));
    }

    @Test
    @DisplayName("Forma logarítmica: equivale a la directa")
    void effectiveEmissivityFromLog_shouldMatchDirectForm() {
        double[] taus = {0.05, 0.5, 0.95};
        double[] logs = AtmosphericEmissivityModel.logTransmittance(taus);

        for (int i = 0; i < taus.length; i++) {
            assertEquals(AtmosphericEmissivityModel.effectiveEmissivity(taus[i], 1.7),
                    AtmosphericEmissivityModel.effectiveEmissivityFromLog(logs[i], 1.7), 1e-12);
        }
    }
}
