package radiacool.physics.solver;

import radiacool.domain.convection.ConvectionParameters;

/**
 * Estimador del coeficiente de transferencia de calor por convección h (W/m²K).
 */
@FunctionalInterface
public interface ConvectionModel {

    /**
     * Nunca lanza excepción: ante entradas inválidas devuelve un valor de suelo físicamente razonable.
     */
    double estimateCoefficient(ConvectionParameters parameters);
}
