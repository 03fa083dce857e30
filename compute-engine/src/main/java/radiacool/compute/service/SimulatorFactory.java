package radiacool.compute.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import radiacool.compute.config.EngineProperties;
import radiacool.config.RadiationConfig;
import radiacool.physics.simulator.RadiationSimulator;

@Component
@RequiredArgsConstructor
public class SimulatorFactory {

    private final EngineProperties properties;

    public RadiationSimulator createRadiationSimulator(RadiationConfig config) {
        return new RadiationSimulator(config, properties.cpuProcessorCount());
    }

    public RadiationConfig referenceConfig() {
        return RadiationConfig.getReferenceConfig().withAngleCount(properties.defaultAngleCount());
    }
}
