package radiacool.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import radiacool.domain.balance.OperatingMode;
import radiacool.domain.exception.PhysicalDomainException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RadiationConfigTest {

    private final RadiationConfig reference = RadiationConfig.getReferenceConfig();

    @Test
    @DisplayName("Referencia: la configuración por defecto es físicamente válida")
    void referenceConfig_shouldValidate() {
        assertSame(reference, reference.validate());
        assertEquals(298.15, reference.ambientTemperatureKelvin(), 1e-12);
        assertEquals(List.of(0.0, 5.0, 10.0), reference.convectionCoefficients());
        assertNull(reference.phaseChange());
    }

    @Test
    @DisplayName("Barrido: temperaturas crecientes de min (incluido) a max (excluido) por modo")
    void filmTemperatures_shouldBeHalfOpenAndIncreasing() {
        double[] cooling = reference.filmTemperatures(OperatingMode.COOLING);
        double[] heating = reference.filmTemperatures(OperatingMode.HEATING);

        assertEquals(50, cooling.length);
        assertEquals(-10.0, cooling[0]);
        assertEquals(39.0, cooling[cooling.length - 1], 1e-12);

        assertEquals(60, heating.length);
        assertEquals(0.0, heating[0]);
        assertEquals(59.0, heating[heating.length - 1], 1e-12);

        double[] fine = reference.withFilmTemperatureStep(0.5).filmTemperatures(OperatingMode.COOLING);
        assertEquals(100, fine.length);
        for (int i = 1; i < fine.length; i++) {
            assertTrue(fine[i] > fine[i - 1]);
        }
    }

    @Test
    @DisplayName("Constantes de radiación: C1 = 2hc² y C2 = hc/k_B")
    void radiationConstants_shouldDeriveFromPhysicalConstants() {
        assertEquals(1.191042972e-16, reference.firstRadiationConstant(), 1e-24);
        assertEquals(1.438776877e-2, reference.secondRadiationConstant(), 1e-10);
    }

    @Test
    @DisplayName("Validación: cada parámetro inválido se identifica por su nombre")
    void validate_invalidParameters_shouldNameTheParameter() {
        assertEquals("filmTemperatureStep", assertThrows(PhysicalDomainException.class,
                () -> reference.withFilmTemperatureStep(0.0).validate()).getParameter());
        assertEquals("ambientTemperature", assertThrows(PhysicalDomainException.class,
                () -> reference.withAmbientTemperature(-300.0).validate()).getParameter());
        assertEquals("angleCount", assertThrows(PhysicalDomainException.class,
                () -> reference.withAngleCount(0).validate()).getParameter());
        assertEquals("convectionCoefficients", assertThrows(PhysicalDomainException.class,
                () -> reference.withConvectionCoefficients(List.of()).validate()).getParameter());
        assertEquals("coolingFilmMax", assertThrows(PhysicalDomainException.class,
                () -> reference.withCoolingFilmMax(-20.0).validate()).getParameter());
        assertEquals("spectralResolution", assertThrows(PhysicalDomainException.class,
                () -> reference.withSpectralResolution(-0.1).validate()).getParameter());
    }

    @Test
    @DisplayName("Inmutabilidad: la lista de coeficientes no se puede modificar")
    void convectionCoefficients_shouldBeImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> reference.convectionCoefficients().add(1.0));
    }
}
