package radiacool.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.With;
import radiacool.domain.balance.OperatingMode;
import radiacool.domain.exception.PhysicalDomainException;
import radiacool.domain.spectrum.WavelengthBand;

import java.util.List;

/**
 * Objeto de valor inmutable con toda la configuración numérica de un cálculo de balance
 * de potencia radiativa. Se pasa explícitamente a cada punto de entrada: no hay estado global.
 * <p>
 * Las temperaturas de configuración se expresan en °C; el motor convierte a kelvin internamente.
 *
 * @param planckConstant           Constante de Planck h (J·s).
 * @param speedOfLight             Velocidad de la luz c (m/s).
 * @param boltzmannConstant        Constante de Boltzmann k_B (J/K).
 * @param solarBand                Banda de integración solar (μm), p. ej. [0.3, 2.5].
 * @param visibleBand              Banda visible (μm), p. ej. [0.38, 0.78].
 * @param infraredBand             Banda de la rejilla infrarroja común (μm) donde se integran emisión y absorción.
 * @param spectralResolution       Paso de la rejilla infrarroja (μm).
 * @param angleCount               Número de muestras angulares del hemisferio.
 * @param ambientTemperature       Temperatura ambiente (°C).
 * @param coolingFilmMin           Temperatura mínima de película en modo enfriamiento (°C, incluida).
 * @param coolingFilmMax           Temperatura máxima de película en modo enfriamiento (°C, excluida).
 * @param heatingFilmMin           Temperatura mínima de película en modo calentamiento (°C, incluida).
 * @param heatingFilmMax           Temperatura máxima de película en modo calentamiento (°C, excluida).
 * @param filmTemperatureStep      Paso del barrido de temperatura de película (°C).
 * @param solarIrradiance          Irradiancia solar incidente S_solar (W/m²).
 * @param convectionCoefficients   Coeficientes de convección candidatos (W/m²K) que se barren como columnas.
 * @param naturalConvectionEnabled Suma la estimación de convección natural a cada candidato.
 * @param forcedConvectionEnabled  Suma la estimación de convección forzada (viento) a cada candidato.
 * @param windSpeed                Velocidad del viento (m/s) para la convección forzada.
 * @param characteristicLength     Longitud característica de la superficie (m).
 * @param phaseChange              Configuración del cambio de fase, o null si no aplica.
 */
@Builder
@With
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RadiationConfig(
        // --- Constantes físicas ---
        double planckConstant,
        double speedOfLight,
        double boltzmannConstant,

        // --- Bandas espectrales ---
        WavelengthBand solarBand,
        WavelengthBand visibleBand,
        WavelengthBand infraredBand,
        double spectralResolution,

        // --- Integración angular ---
        int angleCount,

        // --- Barrido térmico ---
        double ambientTemperature,
        double coolingFilmMin,
        double coolingFilmMax,
        double heatingFilmMin,
        double heatingFilmMax,
        double filmTemperatureStep,

        // --- Cargas externas ---
        double solarIrradiance,
        List<Double> convectionCoefficients,
        boolean naturalConvectionEnabled,
        boolean forcedConvectionEnabled,
        double windSpeed,
        double characteristicLength,

        // --- Cambio de fase (opcional) ---
        PhaseChangeConfig phaseChange
) {

    public static final double KELVIN_OFFSET = 273.15;

    public RadiationConfig {
        convectionCoefficients = convectionCoefficients == null ? List.of() : List.copyOf(convectionCoefficients);
    }

    public double ambientTemperatureKelvin() {
        return ambientTemperature + KELVIN_OFFSET;
    }

    /**
     * Primera constante de radiación C1 = 2hc² (W·m²/sr).
     */
    public double firstRadiationConstant() {
        return 2.0 * planckConstant * speedOfLight * speedOfLight;
    }

    /**
     * Segunda constante de radiación C2 = hc/k_B (m·K).
     */
    public double secondRadiationConstant() {
        return planckConstant * speedOfLight / boltzmannConstant;
    }

    /**
     * Temperaturas de película (°C) del barrido para el modo indicado: desde el mínimo (incluido)
     * hasta el máximo (excluido) con el paso configurado, en orden creciente.
     */
    public double[] filmTemperatures(OperatingMode mode) {
        final double min = mode == OperatingMode.HEATING ? heatingFilmMin : coolingFilmMin;
        final double max = mode == OperatingMode.HEATING ? heatingFilmMax : coolingFilmMax;
        // Tolerancia relativa al paso para no perder el último punto por redondeo
        int count = (int) Math.ceil((max - min) / filmTemperatureStep - 1e-9);
        double[] temps = new double[Math.max(count, 0)];
        for (int i = 0; i < temps.length; i++) {
            temps[i] = min + i * filmTemperatureStep;
        }
        return temps;
    }

    /**
     * Comprueba la coherencia física de la configuración. Se invoca en los límites
     * de carga (simulador, servicio), nunca dentro del barrido.
     *
     * @throws PhysicalDomainException con el nombre del parámetro inválido.
     */
    public RadiationConfig validate() {
        requirePositive("planckConstant", planckConstant);
        requirePositive("speedOfLight", speedOfLight);
        requirePositive("boltzmannConstant", boltzmannConstant);
        requireNonNull("solarBand", solarBand);
        requireNonNull("visibleBand", visibleBand);
        requireNonNull("infraredBand", infraredBand);
        if (infraredBand.lower() <= 0) {
            throw new PhysicalDomainException("infraredBand", "la longitud de onda debe ser positiva: " + infraredBand);
        }
        requirePositive("spectralResolution", spectralResolution);
        if (spectralResolution >= infraredBand.width()) {
            throw new PhysicalDomainException("spectralResolution",
                    "la resolución " + spectralResolution + " no cabe en la banda " + infraredBand);
        }
        if (angleCount < 1) {
            throw new PhysicalDomainException("angleCount", "se requiere al menos un ángulo, recibido " + angleCount);
        }
        requireAbsolute("ambientTemperature", ambientTemperature);
        requireAbsolute("coolingFilmMin", coolingFilmMin);
        requireAbsolute("heatingFilmMin", heatingFilmMin);
        requirePositive("filmTemperatureStep", filmTemperatureStep);
        if (coolingFilmMax <= coolingFilmMin) {
            throw new PhysicalDomainException("coolingFilmMax", "rango de película vacío en modo enfriamiento");
        }
        if (heatingFilmMax <= heatingFilmMin) {
            throw new PhysicalDomainException("heatingFilmMax", "rango de película vacío en modo calentamiento");
        }
        if (!Double.isFinite(solarIrradiance) || solarIrradiance < 0) {
            throw new PhysicalDomainException("solarIrradiance", "debe ser finita y no negativa: " + solarIrradiance);
        }
        if (convectionCoefficients.isEmpty()) {
            throw new PhysicalDomainException("convectionCoefficients", "se requiere al menos un coeficiente");
        }
        for (Double h : convectionCoefficients) {
            if (h == null || !Double.isFinite(h) || h < 0) {
                throw new PhysicalDomainException("convectionCoefficients", "coeficiente inválido: " + h);
            }
        }
        if (!Double.isFinite(windSpeed) || windSpeed < 0) {
            throw new PhysicalDomainException("windSpeed", "debe ser finita y no negativa: " + windSpeed);
        }
        requirePositive("characteristicLength", characteristicLength);
        if (phaseChange != null && (!Double.isFinite(phaseChange.maxPower()) || phaseChange.rampWidth() < 0)) {
            throw new PhysicalDomainException("phaseChange", "parámetros de cambio de fase inválidos: " + phaseChange);
        }
        return this;
    }

    private static void requirePositive(String name, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new PhysicalDomainException(name, "debe ser finito y positivo: " + value);
        }
    }

    private static void requireAbsolute(String name, double celsius) {
        if (!Double.isFinite(celsius) || celsius + KELVIN_OFFSET <= 0) {
            throw new PhysicalDomainException(name, "temperatura por debajo del cero absoluto: " + celsius + " °C");
        }
    }

    private static void requireNonNull(String name, Object value) {
        if (value == null) {
            throw new PhysicalDomainException(name, "es obligatorio");
        }
    }

    /**
     * Configuración de referencia: constantes CODATA, AM1.5 en [0.3, 2.5] μm,
     * ambiente a 25 °C y tres coeficientes de convección.
     */
    public static RadiationConfig getReferenceConfig() {
        return RadiationConfig.builder()
                .planckConstant(6.62607015e-34)
                .speedOfLight(2.99792458e8)
                .boltzmannConstant(1.380649e-23)
                .solarBand(WavelengthBand.of(0.3, 2.5))
                .visibleBand(WavelengthBand.of(0.38, 0.78))
                .infraredBand(WavelengthBand.of(2.5, 100.0))
                .spectralResolution(0.02)
                .angleCount(2000)
                .ambientTemperature(25.0)
                .coolingFilmMin(-10.0)
                .coolingFilmMax(40.0)
                .heatingFilmMin(0.0)
                .heatingFilmMax(60.0)
                .filmTemperatureStep(1.0)
                .solarIrradiance(1000.0)
                .convectionCoefficients(List.of(0.0, 5.0, 10.0))
                .naturalConvectionEnabled(true)
                .forcedConvectionEnabled(false)
                .windSpeed(0.0)
                .characteristicLength(1.0)
                .phaseChange(null)
                .build();
    }
}
