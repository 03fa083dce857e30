package radiacool.domain.balance;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.util.Arrays;

/**
 * Matriz de potencia neta de un barrido: filas = temperaturas de película (crecientes),
 * columnas = coeficientes de convección en el orden recibido.
 * <p>
 * En modo diagnóstico también conserva el {@link PowerComponents} de cada celda.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SweepResult {

    @Getter
    private final OperatingMode mode;
    @Getter
    private final double ambientTemperature;
    private final double[] filmTemperatures;
    private final double[] coefficients;
    private final double[][] netPower;
    private final PowerComponents[][] components;

    public SweepResult(OperatingMode mode,
                       double ambientTemperature,
                       double[] filmTemperatures,
                       double[] coefficients,
                       double[][] netPower,
                       PowerComponents[][] components) {
        if (netPower.length != filmTemperatures.length) {
            throw new IllegalArgumentException("Filas de potencia (" + netPower.length
                    + ") distintas de temperaturas de película (" + filmTemperatures.length + ")");
        }
        for (double[] row : netPower) {
            if (row.length != coefficients.length) {
                throw new IllegalArgumentException("Columnas de potencia distintas del número de coeficientes");
            }
        }
        this.mode = mode;
        this.ambientTemperature = ambientTemperature;
        this.filmTemperatures = filmTemperatures.clone();
        this.coefficients = coefficients.clone();
        this.netPower = deepCopy(netPower);
        this.components = components == null ? null : copyComponents(components);
    }

    public int rows() {
        return filmTemperatures.length;
    }

    public int columns() {
        return coefficients.length;
    }

    public double getFilmTemperature(int row) {
        return filmTemperatures[row];
    }

    public double getCoefficient(int column) {
        return coefficients[column];
    }

    public double[] getFilmTemperatures() {
        return filmTemperatures.clone();
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public double getNetPower(int row, int column) {
        return netPower[row][column];
    }

    public double[] getRow(int row) {
        return netPower[row].clone();
    }

    public double[][] getNetPower() {
        return deepCopy(netPower);
    }

    public boolean isDiagnostic() {
        return components != null;
    }

    /**
     * @return Desglose completo por celda, o null si el barrido no es de diagnóstico.
     */
    public PowerComponents[][] getComponents() {
        if (components == null) {
            return null;
        }
        return copyComponents(components);
    }

    public PowerComponents getComponents(int row, int column) {
        if (components == null) {
            throw new IllegalStateException("El barrido no se ejecutó en modo diagnóstico");
        }
        return components[row][column];
    }

    /**
     * Índice de la primera temperatura de película que minimiza |T_f − T_a|.
     */
    public int zeroDeltaIndex() {
        int best = 0;
        double bestDelta = Double.POSITIVE_INFINITY;
        for (int i = 0; i < filmTemperatures.length; i++) {
            double delta = Math.abs(filmTemperatures[i] - ambientTemperature);
            if (delta < bestDelta) {
                bestDelta = delta;
                best = i;
            }
        }
        return best;
    }

    private static PowerComponents[][] copyComponents(PowerComponents[][] source) {
        return Arrays.stream(source).map(PowerComponents[]::clone).toArray(PowerComponents[][]::new);
    }

    private static double[][] deepCopy(double[][] source) {
        return Arrays.stream(source).map(double[]::clone).toArray(double[][]::new);
    }
}
