package radiacool.config;

public final class ApiRoutes {

    private ApiRoutes() {}

    // Versión base
    public static final String CURRENT_VERSION = "/v1";

    // Rutas específicas
    public static final String RADIATION = CURRENT_VERSION + "/radiation";
    public static final String COOLING = "/cooling";
    public static final String HEATING = "/heating";
    public static final String COOLING_FILES = COOLING + "/files";
    public static final String HEATING_FILES = HEATING + "/files";
    public static final String COMPONENTS = "/components";
    public static final String THEORETICAL_HEATING = "/theoretical-heating";
    public static final String REFERENCE_CONFIG = "/config/reference";
}
