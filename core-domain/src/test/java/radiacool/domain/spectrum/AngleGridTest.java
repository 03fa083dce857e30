package radiacool.domain.spectrum;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import radiacool.domain.exception.PhysicalDomainException;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class AngleGridTest {

    @Test
    @DisplayName("Pesos lambertianos: la suma debe aproximar π (ángulo sólido proyectado del hemisferio)")
    void build_weightsShouldSumToPi() {
        // ARRANGE & ACT
        AngleGrid grid = AngleGrid.build(2000);

        // ASSERT
        log.info("Σw = {} (π = {})", grid.getTotalWeight(), Math.PI);
        assertEquals(2000, grid.size());
        assertEquals(Math.PI, grid.getTotalWeight(), 1e-4);
    }

    @Test
    @DisplayName("Rejilla: θ_i = i·dθ con dθ = (π/2)/N, cubriendo [0, π/2)")
    void build_anglesShouldBeUniformOnHalfOpenQuarter() {
        // ARRANGE
        final int n = 90;

        // ACT
        AngleGrid grid = AngleGrid.build(n);

        // ASSERT
        assertEquals(Math.PI / 2.0 / n, grid.getStep(), 1e-15);
        assertEquals(0.0, grid.angleAt(0));
        assertEquals(1.0, grid.secantAt(0), "sec(0) debe ser exactamente 1");
        assertEquals(0.0, grid.weightAt(0), "sin(0) = 0 anula el peso de la incidencia normal");
        assertTrue(grid.angleAt(n - 1) < Math.PI / 2.0);
        for (int i = 1; i < n; i++) {
            assertEquals(i * grid.getStep(), grid.angleAt(i), 1e-12);
            assertTrue(grid.secantAt(i) > grid.secantAt(i - 1), "La secante crece con θ");
        }
    }

    @Test
    @DisplayName("Error: sin muestras angulares debe lanzar PhysicalDomainException")
    void build_zeroAngles_shouldThrow() {
        PhysicalDomainException ex = assertThrows(PhysicalDomainException.class, () -> AngleGrid.build(0));
        assertEquals("angleCount", ex.getParameter());
    }
}
