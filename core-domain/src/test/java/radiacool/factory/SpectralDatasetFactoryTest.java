package radiacool.factory;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import radiacool.domain.exception.SpectralDataFormatException;
import radiacool.domain.spectrum.SpectralDataset;
import radiacool.domain.spectrum.SpectralQuantity;
import radiacool.domain.spectrum.WavelengthBand;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class SpectralDatasetFactoryTest {

    @Test
    @DisplayName("Unidades: reflectancia con longitudes de onda > 100 se interpreta como nm y pasa a μm")
    void fromRows_nanometers_shouldConvertToMicrons() {
        // ARRANGE
        double[][] rows = {{300.0, 0.9}, {1000.0, 0.9}, {2500.0, 0.9}};

        // ACT
        SpectralDataset dataset = SpectralDatasetFactory.fromRows(SpectralQuantity.REFLECTANCE, rows);

        // ASSERT
        log.info("Dataset normalizado: {}", dataset);
        assertThat(dataset.getWavelengths()).containsExactly(new double[]{0.3, 1.0, 2.5}, within(1e-12));
    }

    @Test
    @DisplayName("Unidades: transmitancia en μm hasta 100 μm conserva sus longitudes de onda")
    void fromRows_infraredMicrons_shouldNotBeRescaled() {
        // ARRANGE: cubre la banda infrarroja de referencia [2.5, 100] μm
        double[][] rows = {{2.5, 0.2}, {10.0, 0.5}, {100.0, 0.9}};

        // ACT
        SpectralDataset dataset = SpectralDatasetFactory.fromRows(SpectralQuantity.TRANSMITTANCE, rows);

        // ASSERT
        log.info("Transmitancia normalizada: {}", dataset);
        assertEquals(100.0, dataset.maxWavelength());
        assertThat(dataset.getWavelengths()).containsExactly(2.5, 10.0, 100.0);
        assertThat(dataset.getValues()).containsExactly(0.2, 0.5, 0.9);
    }

    @Test
    @DisplayName("Unidades: emisividad en nm (por encima de 1000) pasa a μm")
    void fromRows_infraredNanometers_shouldConvertToMicrons() {
        double[][] rows = {{8000.0, 0.9}, {13000.0, 0.95}};

        SpectralDataset dataset = SpectralDatasetFactory.fromRows(SpectralQuantity.EMISSIVITY, rows);

        assertThat(dataset.getWavelengths()).containsExactly(new double[]{8.0, 13.0}, within(1e-12));
    }

    @Test
    @DisplayName("Porcentajes: fracciones con máximo > 1.5 se dividen entre 100 y se recortan a [0,1]")
    void fromRows_percentages_shouldRescaleFractions() {
        double[][] rows = {{8.0, 90.0}, {10.0, 95.0}, {12.0, 104.0}, {13.0, -2.0}};

        SpectralDataset dataset = SpectralDatasetFactory.fromRows(SpectralQuantity.EMISSIVITY, rows);

        assertThat(dataset.getValues()).containsExactly(new double[]{0.90, 0.95, 1.0, 0.0}, within(1e-12));
    }

    @Test
    @DisplayName("Irradiancia solar: es un peso, no una fracción; no se reescala")
    void fromRows_solarIrradiance_shouldKeepMagnitude() {
        double[][] rows = {{0.3, 0.0}, {0.5, 1500.0}, {2.5, 10.0}};

        SpectralDataset dataset = SpectralDatasetFactory.fromRows(SpectralQuantity.SOLAR_IRRADIANCE, rows);

        assertEquals(1500.0, dataset.valueAt(1));
    }

    @Test
    @DisplayName("Orden: filas desordenadas se ordenan y ante duplicados se conserva la primera")
    void fromRows_unsortedWithDuplicates_shouldSortAndKeepFirst() {
        List<double[]> rows = List.of(
                new double[]{10.0, 0.3},
                new double[]{8.0, 0.1},
                new double[]{10.0, 0.7},
                new double[]{9.0, 0.2});

        SpectralDataset dataset = SpectralDatasetFactory.fromRows(SpectralQuantity.TRANSMITTANCE, rows);

        assertThat(dataset.getWavelengths()).containsExactly(8.0, 9.0, 10.0);
        assertThat(dataset.getValues()).containsExactly(0.1, 0.2, 0.3);
    }

    @Test
    @DisplayName("Filas no numéricas: se descartan antes de normalizar")
    void fromColumns_nonFiniteRows_shouldBeDropped() {
        SpectralDataset dataset = SpectralDatasetFactory.fromColumns(SpectralQuantity.REFLECTANCE,
                new double[]{0.3, Double.NaN, 1.0, 2.5},
                new double[]{0.5, 0.5, Double.POSITIVE_INFINITY, 0.6});

        assertEquals(2, dataset.size());
        assertThat(dataset.getWavelengths()).containsExactly(0.3, 2.5);
    }

    @Test
    @DisplayName("Error: menos de dos longitudes de onda distintas tras normalizar")
    void fromRows_singleDistinctWavelength_shouldThrow() {
        double[][] rows = {{10.0, 0.5}, {10.0, 0.6}};

        SpectralDataFormatException ex = assertThrows(SpectralDataFormatException.class,
                () -> SpectralDatasetFactory.fromRows(SpectralQuantity.EMISSIVITY, rows));

        assertEquals(SpectralQuantity.EMISSIVITY, ex.getQuantity());
        assertThat(ex.getMessage()).contains("emissivity");
    }

    @Test
    @DisplayName("Error: columnas ausentes")
    void fromRows_missingColumn_shouldThrow() {
        double[][] rows = {{10.0, 0.5}, {11.0}};

        assertThrows(SpectralDataFormatException.class,
                () -> SpectralDatasetFactory.fromRows(SpectralQuantity.REFLECTANCE, rows));
        assertThrows(SpectralDataFormatException.class,
                () -> SpectralDatasetFactory.fromRows(SpectralQuantity.REFLECTANCE, (double[][]) null));
    }

    @Test
    @DisplayName("Constante: muestreo uniforme incluyendo ambos extremos de la banda")
    void constant_shouldCoverBand() {
        SpectralDataset dataset = SpectralDatasetFactory.constant(
                SpectralQuantity.EMISSIVITY, WavelengthBand.of(8.0, 13.0), 0.95, 11);

        assertEquals(11, dataset.size());
        assertEquals(8.0, dataset.minWavelength());
        assertEquals(13.0, dataset.maxWavelength());
        for (double v : dataset.getValues()) {
            assertEquals(0.95, v);
        }
    }
}
