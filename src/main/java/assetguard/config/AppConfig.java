package assetguard.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

/**
 * Typed view over {@code config.properties}. Every getter falls back to a built-in default
 * so a partial properties file is still usable.
 */
public final class AppConfig {

    private static final String CONFIG_RESOURCE = "/config.properties";

    private final Properties properties;
    private final Function<String, String> environment;

    private AppConfig(Properties properties, Function<String, String> environment) {
        this.properties = properties;
        this.environment = environment;
    }

    public static AppConfig load() throws IOException {
        Properties properties = new Properties();
        try (InputStream input = AppConfig.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (input == null) {
                throw new IOException("Unable to find config.properties in resources.");
            }
            properties.load(input);
        }
        return new AppConfig(properties, System::getenv);
    }

    public static AppConfig from(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new AppConfig(copy, System::getenv);
    }

    /**
     * Returns a copy of this configuration with the given keys replaced.
     */
    public AppConfig withOverrides(Map<String, String> overrides) {
        Properties copy = new Properties();
        copy.putAll(properties);
        copy.putAll(overrides);
        return new AppConfig(copy, environment);
    }

    public AppConfig withEnvironment(Function<String, String> environment) {
        return new AppConfig(properties, environment);
    }

    public String getDatabaseUrl() {
        return properties.getProperty("db.url", "jdbc:h2:mem:assetguard;DB_CLOSE_DELAY=-1");
    }

    public String getDatabaseUser() {
        return properties.getProperty("db.user", "sa");
    }

    public String getDatabasePassword() {
        return properties.getProperty("db.password", "");
    }

    public int getMaximumPoolSize() {
        return getInt("db.pool.max", 10);
    }

    public Duration getOverdueThreshold() {
        return Duration.ofDays(getInt("alerts.overdue.days", 7));
    }

    public int getQrSize() {
        return getInt("qr.size", 400);
    }

    public int getQrMargin() {
        return getInt("qr.margin", 1);
    }

    public String getQrFolder() {
        return properties.getProperty("qr.folder", "asset_qrs");
    }

    public int getQrThreads() {
        return Math.max(1, getInt("qr.threads", 4));
    }

    public int getSignatureHeight() {
        return getInt("signature.height", 200);
    }

    public int getSignatureDefaultWidth() {
        return getInt("signature.default.width", 300);
    }

    /**
     * The AI collaborator credential. An explicit {@code insight.api.key} property wins over the
     * environment variable named by {@code insight.api.key.env}. A missing key is a normal state.
     */
    public Optional<String> getInsightApiKey() {
        String explicit = properties.getProperty("insight.api.key");
        if (explicit != null && !explicit.isBlank()) {
            return Optional.of(explicit.trim());
        }
        String variable = properties.getProperty("insight.api.key.env", "API_KEY");
        String fromEnv = environment.apply(variable);
        if (fromEnv == null || fromEnv.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(fromEnv.trim());
    }

    public String getInsightModel() {
        return properties.getProperty("insight.model", "gemini-3-flash-preview");
    }

    public String getInsightEndpoint() {
        String template = properties.getProperty("insight.endpoint",
                "https://generativelanguage.googleapis.com/v1beta/models/%s:generateContent");
        return String.format(template, getInsightModel());
    }

    public String getAdminDefaultPassword() {
        return properties.getProperty("admin.default.password", "123456");
    }

    private int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration key '" + key + "' is not a number: " + value, e);
        }
    }
}
