package de.mirkosertic.docmirror.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Central configuration for DocMirror.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.docmirror/config.yaml, or the file given on the command line)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    static final String ENV_SOURCE_FILE = "DOCMIRROR_SOURCE_FILE";
    static final String ENV_DESTINATION_ROOT = "DOCMIRROR_DESTINATION_ROOT";
    static final String ENV_STATE_DIR = "DOCMIRROR_STATE_DIR";
    static final String ENV_RENDERER_TOKEN = "DOCMIRROR_RENDERER_TOKEN";
    private static final String CONFIG_DIR = ".docmirror";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    public enum RendererType {
        PDFBOX,
        HTTP;

        static RendererType parse(final String value) {
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "pdfbox" -> PDFBOX;
                case "http" -> HTTP;
                default -> throw new IllegalArgumentException("Unknown renderer type: " + value);
            };
        }
    }

    private final UnaryOperator<String> environment;

    // Source and destination
    private @Nullable String sourceFile;
    private @Nullable String destinationRoot;
    private @Nullable String stateDirectory;

    // Renderer settings
    private RendererType rendererType = RendererType.PDFBOX;
    private @Nullable String exportUrl;
    private @Nullable String authToken;
    private String artifactExtension = ".pdf";
    private long requestTimeoutMs = 60000;

    // Sync settings
    private long delayBetweenExportsMs = 2500;
    private int maxRetries = 3;
    private long initialBackoffMs = 1500;
    private double backoffMultiplier = 2.0;
    private long lockTimeoutMs = 540000;
    private int maxDepth = 64;

    // Schedule and audit
    private long scheduleIntervalMs = 60000;
    private boolean auditEnabled = true;
    private @Nullable String auditFile;

    private ApplicationConfig(final UnaryOperator<String> environment) {
        this.environment = environment;
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        return load(null);
    }

    /**
     * @param userConfig config file to use instead of ~/.docmirror/config.yaml; null for the default
     */
    public static ApplicationConfig load(final @Nullable Path userConfig) {
        return load(userConfig, System::getenv);
    }

    static ApplicationConfig load(final @Nullable Path userConfig, final UnaryOperator<String> environment) {
        final ApplicationConfig config = new ApplicationConfig(environment);

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromFile(userConfig != null ? userConfig : getUserConfigPath(), userConfig != null);

        // Step 3: Apply system properties and environment variables (highest priority)
        config.applyOverrides();

        logger.info("Configuration loaded: source={}, destination={}, renderer={}",
                config.sourceFile, config.destinationRoot, config.rendererType);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException | YAMLException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromFile(final Path configPath, final boolean required) {
        if (!Files.exists(configPath)) {
            if (required) {
                throw new IllegalArgumentException("Config file does not exist: " + configPath);
            }
            return;
        }
        try (final InputStream is = Files.newInputStream(configPath)) {
            final Map<String, Object> config = new Yaml().load(is);
            if (config != null) {
                applyYamlConfig(config);
                logger.debug("Loaded user config from: {}", configPath);
            }
        } catch (final IOException | YAMLException e) {
            if (required) {
                throw new IllegalArgumentException("Failed to load config file " + configPath + ": " + e.getMessage(), e);
            }
            logger.warn("Failed to load user config from: {}", configPath, e);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        if (!(config.get("docmirror") instanceof final Map<?, ?> root)) {
            return;
        }
        final Map<String, Object> rootConfig = (Map<String, Object>) root;

        final Map<String, Object> source = section(rootConfig, "source");
        if (source.containsKey("file")) {
            this.sourceFile = stringValue(source.get("file"));
        }

        final Map<String, Object> destination = section(rootConfig, "destination");
        if (destination.containsKey("root")) {
            this.destinationRoot = stringValue(destination.get("root"));
        }

        final Map<String, Object> state = section(rootConfig, "state");
        if (state.containsKey("directory")) {
            this.stateDirectory = stringValue(state.get("directory"));
        }

        applyRendererConfig(section(rootConfig, "renderer"));
        applySyncConfig(section(rootConfig, "sync"));

        final Map<String, Object> schedule = section(rootConfig, "schedule");
        if (schedule.containsKey("interval-ms")) {
            this.scheduleIntervalMs = ((Number) schedule.get("interval-ms")).longValue();
        }

        final Map<String, Object> audit = section(rootConfig, "audit");
        if (audit.containsKey("enabled")) {
            this.auditEnabled = (Boolean) audit.get("enabled");
        }
        if (audit.containsKey("file")) {
            this.auditFile = stringValue(audit.get("file"));
        }
    }

    private void applyRendererConfig(final Map<String, Object> rendererConfig) {
        if (rendererConfig.containsKey("type")) {
            this.rendererType = RendererType.parse(String.valueOf(rendererConfig.get("type")));
        }
        if (rendererConfig.containsKey("export-url")) {
            this.exportUrl = stringValue(rendererConfig.get("export-url"));
        }
        if (rendererConfig.containsKey("auth-token")) {
            this.authToken = stringValue(rendererConfig.get("auth-token"));
        }
        if (rendererConfig.containsKey("artifact-extension")) {
            this.artifactExtension = String.valueOf(rendererConfig.get("artifact-extension"));
        }
        if (rendererConfig.containsKey("request-timeout-ms")) {
            this.requestTimeoutMs = ((Number) rendererConfig.get("request-timeout-ms")).longValue();
        }
    }

    private void applySyncConfig(final Map<String, Object> syncConfig) {
        if (syncConfig.containsKey("delay-between-exports-ms")) {
            this.delayBetweenExportsMs = ((Number) syncConfig.get("delay-between-exports-ms")).longValue();
        }
        if (syncConfig.containsKey("max-retries")) {
            this.maxRetries = ((Number) syncConfig.get("max-retries")).intValue();
        }
        if (syncConfig.containsKey("initial-backoff-ms")) {
            this.initialBackoffMs = ((Number) syncConfig.get("initial-backoff-ms")).longValue();
        }
        if (syncConfig.containsKey("backoff-multiplier")) {
            this.backoffMultiplier = ((Number) syncConfig.get("backoff-multiplier")).doubleValue();
        }
        if (syncConfig.containsKey("lock-timeout-ms")) {
            this.lockTimeoutMs = ((Number) syncConfig.get("lock-timeout-ms")).longValue();
        }
        if (syncConfig.containsKey("max-depth")) {
            this.maxDepth = ((Number) syncConfig.get("max-depth")).intValue();
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(final Map<String, Object> parent, final String name) {
        if (parent.get(name) instanceof final Map<?, ?> child) {
            return (Map<String, Object>) child;
        }
        return Map.of();
    }

    private @Nullable String stringValue(final @Nullable Object value) {
        if (value == null) {
            return null;
        }
        final String resolved = resolveVariables(value.toString()).trim();
        return resolved.isEmpty() ? null : resolved;
    }

    private void applyOverrides() {
        final String propSource = System.getProperty("docmirror.source.file");
        if (propSource != null && !propSource.isBlank()) {
            this.sourceFile = propSource.trim();
        }
        final String propDestination = System.getProperty("docmirror.destination.root");
        if (propDestination != null && !propDestination.isBlank()) {
            this.destinationRoot = propDestination.trim();
        }
        final String propState = System.getProperty("docmirror.state.dir");
        if (propState != null && !propState.isBlank()) {
            this.stateDirectory = propState.trim();
        }

        final String envSource = environment.apply(ENV_SOURCE_FILE);
        if (envSource != null && !envSource.isBlank()) {
            this.sourceFile = envSource.trim();
            logger.info("Source file from environment: {}", this.sourceFile);
        }
        final String envDestination = environment.apply(ENV_DESTINATION_ROOT);
        if (envDestination != null && !envDestination.isBlank()) {
            this.destinationRoot = envDestination.trim();
            logger.info("Destination root from environment: {}", this.destinationRoot);
        }
        final String envState = environment.apply(ENV_STATE_DIR);
        if (envState != null && !envState.isBlank()) {
            this.stateDirectory = envState.trim();
        }
        final String envToken = environment.apply(ENV_RENDERER_TOKEN);
        if (envToken != null && !envToken.isBlank()) {
            this.authToken = envToken.trim();
        }

        // Default state directory if not set
        if (this.stateDirectory == null) {
            this.stateDirectory = getConfigDirectory().resolve("state").toString();
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (!value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = environment.apply(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    /**
     * Fails with a readable message when a setting required for a run is missing.
     */
    public void validate() {
        if (sourceFile == null) {
            throw new IllegalStateException("No source file configured (docmirror.source.file or " + ENV_SOURCE_FILE + ")");
        }
        if (destinationRoot == null) {
            throw new IllegalStateException("No destination root configured (docmirror.destination.root or "
                    + ENV_DESTINATION_ROOT + ")");
        }
        if (rendererType == RendererType.HTTP && exportUrl == null) {
            throw new IllegalStateException("Renderer type 'http' requires docmirror.renderer.export-url");
        }
    }

    public static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public @Nullable String getSourceFile() {
        return sourceFile;
    }

    public @Nullable String getDestinationRoot() {
        return destinationRoot;
    }

    public String getStateDirectory() {
        return stateDirectory;
    }

    public Path getStateFile() {
        return Paths.get(getStateDirectory(), "properties.yaml");
    }

    public RendererType getRendererType() {
        return rendererType;
    }

    public @Nullable String getExportUrl() {
        return exportUrl;
    }

    public @Nullable String getAuthToken() {
        return authToken;
    }

    public String getArtifactExtension() {
        return artifactExtension;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public long getDelayBetweenExportsMs() {
        return delayBetweenExportsMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getInitialBackoffMs() {
        return initialBackoffMs;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public long getLockTimeoutMs() {
        return lockTimeoutMs;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public long getScheduleIntervalMs() {
        return scheduleIntervalMs;
    }

    public boolean isAuditEnabled() {
        return auditEnabled;
    }

    /** Configured audit file, or {@code audit.csv} in the state directory. */
    public Path getAuditFile() {
        return auditFile != null ? Paths.get(auditFile) : Paths.get(getStateDirectory(), "audit.csv");
    }
}
