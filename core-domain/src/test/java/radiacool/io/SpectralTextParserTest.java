package radiacool.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import radiacool.domain.exception.SpectralDataFormatException;
import radiacool.domain.spectrum.SpectralDataset;
import radiacool.domain.spectrum.SpectralQuantity;

import java.io.StringReader;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

class SpectralTextParserTest {

    @Test
    @DisplayName("Formato mixto: cabeceras, comentarios y separadores variados")
    void parse_mixedSeparators_shouldReadTwoColumns() {
        // ARRANGE
        String text = """
                # Reflectancia medida, espectrofotómetro
                Wavelength(nm), Reflectance(%)
                ; comentario alternativo
                300\t90
                400, 91.5
                500;92
                600   93   extra-col

                """;

        // ACT
        SpectralDataset dataset = SpectralTextParser.parse(SpectralQuantity.REFLECTANCE, text);

        // ASSERT: nm → μm y % → fracción
        assertThat(dataset.getWavelengths()).containsExactly(new double[]{0.3, 0.4, 0.5, 0.6}, within(1e-12));
        assertThat(dataset.getValues()).containsExactly(new double[]{0.90, 0.915, 0.92, 0.93}, within(1e-12));
    }

    @Test
    @DisplayName("Filas crudas: se devuelven sin normalizar")
    void parseRows_shouldNotNormalize() {
        List<double[]> rows = SpectralTextParser.parseRows(SpectralQuantity.EMISSIVITY,
                new StringReader("8.0 95\n9.0 96\n"));

        assertEquals(2, rows.size());
        assertArrayEquals(new double[]{8.0, 95.0}, rows.get(0));
    }

    @Test
    @DisplayName("Error: fila de datos sin segunda columna numérica indica el número de línea")
    void parse_missingSecondColumn_shouldReportLine() {
        String text = "lambda value\n8.0 0.9\n9.0 n/a\n";

        SpectralDataFormatException ex = assertThrows(SpectralDataFormatException.class,
                () -> SpectralTextParser.parse(SpectralQuantity.EMISSIVITY, text));

        assertThat(ex.getMessage()).contains("Línea 3");
        assertEquals(SpectralQuantity.EMISSIVITY, ex.getQuantity());
    }

    @Test
    @DisplayName("Error: texto sin datos numéricos")
    void parse_emptyText_shouldThrow() {
        assertThrows(SpectralDataFormatException.class,
                () -> SpectralTextParser.parse(SpectralQuantity.TRANSMITTANCE, "# nada\n"));
    }
}
