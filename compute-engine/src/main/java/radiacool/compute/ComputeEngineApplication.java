package radiacool.compute;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import radiacool.compute.config.EngineProperties;
import radiacool.physics.model.BlackbodyRadiationModel;
import radiacool.config.RadiationConfig;

/**
 * Punto de entrada principal del Compute Engine.
 * <p>
 * Responsabilidades:
 * 1. Arrancar el contexto de Spring Boot (Web, OpenAPI).
 * 2. Verificar que la configuración de referencia es físicamente válida antes de aceptar tráfico.
 */
@Slf4j
@SpringBootApplication(scanBasePackages = "radiacool")
@EnableConfigurationProperties(EngineProperties.class)
public class ComputeEngineApplication {

    public static void main(String[] args) {
        // El puerto se puede configurar vía args: --server.port=9090
        SpringApplication.run(ComputeEngineApplication.class, args);
    }

    /**
     * Chequeo de arranque ("Fail Fast"): valida la configuración de referencia y evalúa
     * una radiancia de prueba. Un error aquí detiene el arranque del contexto.
     */
    @Bean
    public CommandLineRunner engineIntegrityCheck(EngineProperties properties) {
        return args -> {
            log.info(">>> BOOTSTRAP: Verificando el motor radiativo (hilos: {}, ángulos por defecto: {})...",
                    properties.cpuProcessorCount(), properties.defaultAngleCount());

            RadiationConfig reference = RadiationConfig.getReferenceConfig()
                    .withAngleCount(properties.defaultAngleCount())
                    .validate();
            double probe = BlackbodyRadiationModel.from(reference).spectralRadiance(10e-6, 300.0);

            log.info(">>> BOOTSTRAP: I_BB(10 μm, 300 K) = {} W/(m²·sr·m). SISTEMA LISTO PARA CÓMPUTO.", probe);
        };
    }
}
