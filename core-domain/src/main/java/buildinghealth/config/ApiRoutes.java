package buildinghealth.config;

public final class ApiRoutes {

    private ApiRoutes() {}

    // Versión base
    public static final String CURRENT_VERSION = "/v1";

    // Rutas específicas
    public static final String SAMPLES = CURRENT_VERSION + "/samples";
    public static final String DATA = CURRENT_VERSION + "/data";
    public static final String MODELS = CURRENT_VERSION + "/models";
    public static final String ALERTS = CURRENT_VERSION + "/alerts";
    public static final String ADMIN = CURRENT_VERSION + "/admin";

    // Compatibilidad con los clientes del simulador antiguo
    public static final String LEGACY_SENSOR_DATA = "/sensor_data";

    // Rutas públicas
    public static final String METRICS = "/metrics";
    public static final String WEBSOCKET = "/ws";
    public static final String API_DOCS = CURRENT_VERSION + "/api-docs";
    public static final String SWAGGER_UI = CURRENT_VERSION + "/swagger-ui";
}
