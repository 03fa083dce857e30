package radiacool.io;

import lombok.extern.slf4j.Slf4j;
import radiacool.domain.exception.SpectralDataFormatException;
import radiacool.domain.spectrum.SpectralDataset;
import radiacool.domain.spectrum.SpectralQuantity;
import radiacool.factory.SpectralDatasetFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Lector de ficheros espectrales de texto de dos columnas (λ, valor).
 * <p>
 * Separadores admitidos: espacios, tabuladores, comas y punto y coma. Se ignoran líneas vacías,
 * comentarios ({@code #} o {@code ;}) y cabeceras no numéricas. Las columnas extra se descartan.
 */
@Slf4j
public class SpectralTextParser {

    private static final Pattern SEPARATOR = Pattern.compile("[\\s,;]+");

    private SpectralTextParser() {}

    public static SpectralDataset parse(SpectralQuantity quantity, String text) {
        return parse(quantity, new StringReader(text == null ? "" : text));
    }

    public static SpectralDataset parse(SpectralQuantity quantity, Reader reader) {
        return SpectralDatasetFactory.fromRows(quantity, parseRows(quantity, reader));
    }

    /**
     * Extrae las filas numéricas sin normalizar.
     *
     * @throws SpectralDataFormatException si una fila de datos no tiene segunda columna numérica.
     */
    public static List<double[]> parseRows(SpectralQuantity quantity, Reader reader) {
        List<double[]> rows = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader in = new BufferedReader(reader)) {
            String line;
            int lineNumber = 0;
            while ((line = in.readLine()) != null) {
                lineNumber++;
                String trimmed = line.strip();
                if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith(";")) {
                    continue;
                }
                String[] tokens = SEPARATOR.split(trimmed);
                Double wavelength = parseNumber(tokens[0]);
                if (wavelength == null) {
                    // Cabecera o texto libre
                    skipped++;
                    continue;
                }
                Double value = tokens.length > 1 ? parseNumber(tokens[1]) : null;
                if (value == null) {
                    throw new SpectralDataFormatException(quantity,
                            "Línea " + lineNumber + ": falta la segunda columna numérica en '" + trimmed + "'");
                }
                rows.add(new double[]{wavelength, value});
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error leyendo datos espectrales de " + quantity.getLabel(), e);
        }
        if (skipped > 0) {
            log.debug("[{}] {} líneas de cabecera ignoradas.", quantity.getLabel(), skipped);
        }
        return rows;
    }

    private static Double parseNumber(String token) {
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
