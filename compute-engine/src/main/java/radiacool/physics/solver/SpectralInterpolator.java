package radiacool.physics.solver;

import radiacool.domain.spectrum.SpectralDataset;

/**
 * Estrategia de remuestreo de una serie espectral sobre una rejilla de destino.
 * <p>
 * Las implementaciones deben ser puras: mismas entradas, mismo resultado, sin estado compartido.
 */
@FunctionalInterface
public interface SpectralInterpolator {

    /**
     * @param sourceWavelengths Abscisas de origen, estrictamente crecientes.
     * @param sourceValues      Valores de origen.
     * @param targetWavelengths Rejilla de destino (cualquier orden).
     * @return Valores interpolados, uno por punto de destino.
     */
    double[] resample(double[] sourceWavelengths, double[] sourceValues, double[] targetWavelengths);

    default double[] resample(SpectralDataset dataset, double[] targetWavelengths) {
        return resample(dataset.getWavelengths(), dataset.getValues(), targetWavelengths);
    }
}
