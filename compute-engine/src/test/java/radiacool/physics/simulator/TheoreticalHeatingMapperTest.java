package radiacool.physics.simulator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import radiacool.config.RadiationConfig;
import radiacool.domain.balance.TheoreticalHeatingMap;
import radiacool.physics.solver.ConvectionModel;
import radiacool.physics.solver.RadiativeTermEvaluator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TheoreticalHeatingMapperTest {

    @Mock
    private RadiativeTermEvaluator evaluator;

    @Mock
    private ConvectionModel convectionModel;

    @Test
    @DisplayName("Celda: P_heat = α_s·S + P_atm(T_a) − P_rad(T_a), sin convección")
    void map_shouldCombineTermsPerCell() {
        // ARRANGE: P_rad = 2·T y P_atm = T (T en K)
        when(evaluator.surfaceEmission(anyDouble())).thenAnswer(inv -> 2.0 * inv.<Double>getArgument(0));
        when(evaluator.atmosphericAbsorption(anyDouble())).thenAnswer(inv -> inv.<Double>getArgument(0));

        try (PowerBalanceEngine engine = new PowerBalanceEngine(RadiationConfig.getReferenceConfig(), convectionModel, 2)) {
            TheoreticalHeatingMapper mapper = new TheoreticalHeatingMapper(engine);

            // ACT
            TheoreticalHeatingMap map = mapper.map(evaluator, 0.2,
                    new double[]{0.0, 20.0}, new double[]{0.0, 500.0, 1000.0}, null);

            // ASSERT
            assertEquals(-273.15, map.valueAt(0, 0), 1e-9);
            assertEquals(0.2 * 1000.0 - 293.15, map.valueAt(1, 2), 1e-9);
            assertEquals(0.2, map.solarAbsorptance());
            verifyNoInteractions(convectionModel);
        }
    }

    @Test
    @DisplayName("Rejilla por defecto: T_a ∈ [−100, 100] °C (21) y S ∈ [0, 1200] W/m² (49)")
    void defaultAxes_shouldMatchReferenceRanges() {
        assertEquals(21, TheoreticalHeatingMapper.DEFAULT_AMBIENT_TEMPERATURES.length);
        assertEquals(-100.0, TheoreticalHeatingMapper.DEFAULT_AMBIENT_TEMPERATURES[0]);
        assertEquals(10.0, TheoreticalHeatingMapper.DEFAULT_AMBIENT_TEMPERATURES[11], 1e-12);
        assertEquals(100.0, TheoreticalHeatingMapper.DEFAULT_AMBIENT_TEMPERATURES[20]);

        assertEquals(49, TheoreticalHeatingMapper.DEFAULT_IRRADIANCES.length);
        assertEquals(25.0, TheoreticalHeatingMapper.DEFAULT_IRRADIANCES[1], 1e-12);
        assertEquals(1200.0, TheoreticalHeatingMapper.DEFAULT_IRRADIANCES[48]);
    }
}
