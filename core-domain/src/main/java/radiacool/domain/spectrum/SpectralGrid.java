package radiacool.domain.spectrum;

/**
 * Rejilla infrarroja común sobre la que se integran emisión y absorción.
 * <p>
 * Todas las columnas están alineadas punto a punto. Las longitudes de onda y las anchuras
 * de celda ya están en metros, listas para la ley de Planck.
 *
 * @param wavelengths       Longitudes de onda (m), estrictamente crecientes.
 * @param cellWidths        Δλ por punto (m): anchuras de celda del trapecio.
 * @param emissivity        Emisividad de la superficie remuestreada.
 * @param transmittance     Transmitancia atmosférica remuestreada.
 * @param logTransmittance  ln τ con τ acotado a (0,1].
 */
public record SpectralGrid(
        double[] wavelengths,
        double[] cellWidths,
        double[] emissivity,
        double[] transmittance,
        double[] logTransmittance
) {

    public int size() {
        return wavelengths.length;
    }
}
