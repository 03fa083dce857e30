package radiacool.compute.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import radiacool.compute.api.dto.RadiationRequest;
import radiacool.compute.api.dto.SpectralTextUpload;
import radiacool.config.RadiationConfig;
import radiacool.domain.balance.RadiationReport;
import radiacool.domain.balance.TheoreticalHeatingMap;
import radiacool.domain.spectrum.SpectralInputs;
import radiacool.domain.spectrum.SpectralQuantity;
import radiacool.factory.SpectralDatasetFactory;
import radiacool.io.SpectralTextParser;
import radiacool.physics.simulator.RadiationSimulator;

@Service
@Slf4j
@RequiredArgsConstructor
public class RadiationService {

    private final SimulatorFactory simulatorFactory;

    public RadiationReport runCooling(RadiationRequest request) {
        return execute("cooling", request.config(), toInputs(request), RadiationSimulator::runCooling);
    }

    public RadiationReport runHeating(RadiationRequest request) {
        return execute("heating", request.config(), toInputs(request), RadiationSimulator::runHeating);
    }

    /**
     * Variante para ficheros de texto de dos columnas: se parsean y normalizan antes de simular.
     */
    public RadiationReport runCooling(SpectralTextUpload upload) {
        return execute("cooling-files", upload.config(), toInputs(upload), RadiationSimulator::runCooling);
    }

    public RadiationReport runHeating(SpectralTextUpload upload) {
        return execute("heating-files", upload.config(), toInputs(upload), RadiationSimulator::runHeating);
    }

    public RadiationReport runComponents(RadiationRequest request, double coefficient) {
        return execute("components", request.config(), toInputs(request),
                (simulator, inputs) -> simulator.runComponents(inputs, coefficient));
    }

    public TheoreticalHeatingMap theoreticalHeating(RadiationRequest request) {
        return execute("theoretical-heating", request.config(), toInputs(request),
                RadiationSimulator::theoreticalHeatingMap);
    }

    public RadiationConfig referenceConfig() {
        return simulatorFactory.referenceConfig();
    }

    /**
     * Crea un simulador y lo libera siempre al terminar. Las entradas ya llegan normalizadas,
     * de modo que un espectro mal formado nunca llega a reservar el pool de hilos.
     * Los errores de dominio se propagan tal cual para que el controlador los traduzca.
     */
    private <T> T execute(String operation, RadiationConfig requested, SpectralInputs inputs, SimulatorCall<T> call) {
        RadiationConfig config = requested != null ? requested : simulatorFactory.referenceConfig();

        log.info("Starting radiation service '{}' (T_a: {} °C, coefficients: {})",
                operation, config.ambientTemperature(), config.convectionCoefficients());
        long start = System.currentTimeMillis();

        T result;
        try (RadiationSimulator simulator = simulatorFactory.createRadiationSimulator(config)) {
            result = call.apply(simulator, inputs);
        }

        log.info("Radiation service '{}' completed in {}ms.", operation, System.currentTimeMillis() - start);
        return result;
    }

    private static SpectralInputs toInputs(RadiationRequest request) {
        return SpectralInputs.builder()
                .reflectance(SpectralDatasetFactory.fromRows(SpectralQuantity.REFLECTANCE, request.reflectance()))
                .solarSpectrum(SpectralDatasetFactory.fromRows(SpectralQuantity.SOLAR_IRRADIANCE, request.solarSpectrum()))
                .emissivity(SpectralDatasetFactory.fromRows(SpectralQuantity.EMISSIVITY, request.emissivity()))
                .transmittance(SpectralDatasetFactory.fromRows(SpectralQuantity.TRANSMITTANCE, request.transmittance()))
                .build();
    }

    private static SpectralInputs toInputs(SpectralTextUpload upload) {
        return SpectralInputs.builder()
                .reflectance(SpectralTextParser.parse(SpectralQuantity.REFLECTANCE, upload.reflectance()))
                .solarSpectrum(SpectralTextParser.parse(SpectralQuantity.SOLAR_IRRADIANCE, upload.solarSpectrum()))
                .emissivity(SpectralTextParser.parse(SpectralQuantity.EMISSIVITY, upload.emissivity()))
                .transmittance(SpectralTextParser.parse(SpectralQuantity.TRANSMITTANCE, upload.transmittance()))
                .build();
    }

    @FunctionalInterface
    private interface SimulatorCall<T> {
        T apply(RadiationSimulator simulator, SpectralInputs inputs);
    }
}
