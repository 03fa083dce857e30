package radiacool.compute.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import radiacool.domain.exception.PhysicalDomainException;
import radiacool.domain.exception.SpectralDataFormatException;
import radiacool.domain.exception.SpectralIntegrationException;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.CancellationException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Espectros mal formados (columnas ausentes, valores no numéricos, menos de dos longitudes de onda).
     * Log: WARN (error del cliente, no del sistema).
     */
    @ExceptionHandler(SpectralDataFormatException.class)
    public ResponseEntity<Object> handleSpectralDataFormat(SpectralDataFormatException ex) {
        log.warn("Invalid spectral data: {}", ex.getMessage());
        return badRequest("Invalid Spectral Data", ex.getMessage());
    }

    /**
     * Dominio de integración degenerado (banda sin puntos, peso nulo).
     */
    @ExceptionHandler(SpectralIntegrationException.class)
    public ResponseEntity<Object> handleSpectralIntegration(SpectralIntegrationException ex) {
        log.warn("Degenerate integration domain: {}", ex.getMessage());
        return badRequest("Degenerate Integration Domain", ex.getMessage());
    }

    /**
     * Configuración físicamente inválida.
     */
    @ExceptionHandler(PhysicalDomainException.class)
    public ResponseEntity<Object> handlePhysicalDomain(PhysicalDomainException ex) {
        log.warn("Physical domain violation on '{}': {}", ex.getParameter(), ex.getMessage());
        return badRequest("Invalid Physical Configuration", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Object> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return badRequest("Malformed Request", "The request body could not be parsed.");
    }

    /**
     * Falta un fichero espectral o un parámetro obligatorio.
     */
    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Object> handleMissingInput(Exception ex) {
        log.warn("Incomplete request: {}", ex.getMessage());
        return badRequest("Malformed Request", ex.getMessage());
    }

    /**
     * Cálculo cancelado o interrumpido (p. ej. apagado del servidor).
     * Log: WARN.
     */
    @ExceptionHandler(CancellationException.class)
    public ResponseEntity<Object> handleCancellation(CancellationException ex) {
        log.warn("Computation cancelled: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                "timestamp", LocalDateTime.now(),
                "status", 503,
                "error", "Computation Cancelled",
                "message", String.valueOf(ex.getMessage())
        ));
    }

    /**
     * Maneja todo lo demás.
     * Log: ERROR (Incluye StackTrace completo).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("Unexpected System Error occurred", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "timestamp", LocalDateTime.now(),
                "status", 500,
                "error", "Internal Server Error",
                "message", "An unexpected error occurred. Please contact support referencing this timestamp."
        ));
    }

    private static ResponseEntity<Object> badRequest(String error, String message) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "timestamp", LocalDateTime.now(),
                "status", 400,
                "error", error,
                "message", message
        ));
    }
}
