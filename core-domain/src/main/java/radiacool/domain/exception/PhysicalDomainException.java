package radiacool.domain.exception;

import lombok.Getter;

/**
 * Configuración físicamente inválida (temperatura absoluta negativa, banda vacía,
 * rejilla angular sin muestras, absortancia fuera de [0,1]...).
 */
@Getter
public class PhysicalDomainException extends RadiationEngineException {

    /**
     * Nombre del parámetro que viola el dominio físico.
     */
    private final String parameter;

    public PhysicalDomainException(String parameter, String message) {
        super(parameter + ": " + message);
        this.parameter = parameter;
    }
}
