package radiacool.compute.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Ajustes de servicio del motor, enlazados desde {@code application.yml}.
 *
 * @param cpuProcessorCount Tamaño del pool de hilos de cada simulador.
 * @param defaultAngleCount Muestras angulares cuando la petición no trae configuración.
 */
@ConfigurationProperties(prefix = "radiacool.engine")
public record EngineProperties(
        @DefaultValue("4") int cpuProcessorCount,
        @DefaultValue("2000") int defaultAngleCount
) {
}
