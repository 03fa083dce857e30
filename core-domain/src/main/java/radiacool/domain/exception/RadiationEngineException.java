package radiacool.domain.exception;

/**
 * Raíz de la taxonomía de errores del motor radiativo.
 * <p>
 * Todas las excepciones son no comprobadas: un error de datos o de dominio aborta
 * el cálculo solicitado completo y nunca se devuelven resultados parciales.
 */
public abstract class RadiationEngineException extends RuntimeException {

    protected RadiationEngineException(String message) {
        super(message);
    }

    protected RadiationEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
