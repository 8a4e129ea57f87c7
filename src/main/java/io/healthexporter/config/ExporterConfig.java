package io.healthexporter.config;

import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

import static io.healthexporter.config.Constants.*;

/**
 * Configuration for the exporter.
 * Loads configuration from application.yml with fallbacks to constants.
 * <p>
 * The {@code server} and {@code web} sections are read by Spring through {@code @Value};
 * they are only declared here so the YAML model accepts them.
 */
@Slf4j
@Getter
public class ExporterConfig {

    private final URI targetUri;
    private final Duration timeout;
    private final boolean insecureSkipVerify;
    private final String caCertFile;
    private final String namespace;

    public ExporterConfig() {
        this(loadYamlConfig());
    }

    ExporterConfig(ConfigModel config) {
        this.targetUri = parseTargetUri(config);
        this.timeout = parseTimeout(config);
        this.insecureSkipVerify = parseInsecureSkipVerify(config);
        this.caCertFile = parseCaCertFile(config);
        this.namespace = parseNamespace(config);

        log.info("Loaded exporter config - target: {}, timeout: {}s, namespace: {}",
                redact(targetUri), timeout.getSeconds(), namespace);
    }

    private static ConfigModel loadYamlConfig() {
        return load(System.getenv(EXTERNAL_CONFIG_ENV_VAR));
    }

    /**
     * Resolves the YAML model: the external file when it is readable, else the bundled
     * classpath file, else an empty model that yields the defaults.
     */
    static ConfigModel load(String externalConfigPath) {
        Path external = readableExternalFile(externalConfigPath);
        if (external != null) {
            try (InputStream in = Files.newInputStream(external)) {
                return parseOrDefaults(in, "external file " + external);
            } catch (IOException | SecurityException e) {
                log.warn("Cannot read external config file {} ({}), falling back to classpath", external, e.getMessage());
            }
        }

        try (InputStream in = ExporterConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH)) {
            if (in == null) {
                log.warn("No {} on classpath, using built-in defaults", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
            return parseOrDefaults(in, "classpath " + DEFAULT_CONFIG_FILE_CLASSPATH);
        } catch (IOException e) {
            log.warn("Cannot read classpath config {} ({}), using built-in defaults", DEFAULT_CONFIG_FILE_CLASSPATH, e.getMessage());
            return new ConfigModel();
        }
    }

    private static Path readableExternalFile(String externalConfigPath) {
        if (externalConfigPath == null || externalConfigPath.isBlank()) {
            log.debug("{} not set, using classpath config", EXTERNAL_CONFIG_ENV_VAR);
            return null;
        }
        try {
            Path path = Paths.get(externalConfigPath.trim());
            if (Files.isRegularFile(path)) {
                return path;
            }
            log.warn("{} points at {}, which is not a file, falling back to classpath", EXTERNAL_CONFIG_ENV_VAR, path);
        } catch (InvalidPathException | SecurityException e) {
            log.warn("{} value '{}' is unusable ({}), falling back to classpath", EXTERNAL_CONFIG_ENV_VAR,
                externalConfigPath, e.getMessage());
        }
        return null;
    }

    private static ConfigModel parseOrDefaults(InputStream in, String source) {
        try {
            ConfigModel config = parse(in);
            log.info("Loaded exporter configuration from {}", source);
            return config;
        } catch (YAMLException e) {
            log.warn("Malformed configuration in {} ({}), using built-in defaults", source, e.getMessage());
            return new ConfigModel();
        }
    }

    static ConfigModel parse(InputStream inputStream) {
        Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
        ConfigModel config = yaml.load(inputStream);
        return config != null ? config : new ConfigModel();
    }

    private URI parseTargetUri(ConfigModel config) {
        String url = DEFAULT_TARGET_URL;
        if (config.getTarget() != null && config.getTarget().getUrl() != null
                && !config.getTarget().getUrl().isBlank()) {
            url = config.getTarget().getUrl().trim();
        }
        try {
            URI uri = new URI(url);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("Target URL must be absolute with a host: " + url);
            }
            if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
                throw new IllegalArgumentException("Target URL scheme must be http or https: " + url);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid target URL: " + url, e);
        }
    }

    private Duration parseTimeout(ConfigModel config) {
        try {
            if (config.getTarget() != null && config.getTarget().getTimeoutSeconds() != null) {
                long seconds = config.getTarget().getTimeoutSeconds();
                if (seconds > 0) {
                    return Duration.ofSeconds(seconds);
                }
                log.warn("Ignoring non-positive target timeout {}s, using default", seconds);
            }
        } catch (Exception e) {
            log.warn("Failed to parse target timeout from config, using default: {}", e.getMessage());
        }
        return Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS);
    }

    private boolean parseInsecureSkipVerify(ConfigModel config) {
        return config.getTarget() != null && Boolean.TRUE.equals(config.getTarget().getInsecureSkipVerify());
    }

    private String parseCaCertFile(ConfigModel config) {
        if (config.getTarget() != null && config.getTarget().getCaCertFile() != null
                && !config.getTarget().getCaCertFile().isBlank()) {
            return config.getTarget().getCaCertFile().trim();
        }
        return null;
    }

    private String parseNamespace(ConfigModel config) {
        if (config.getMetrics() != null && config.getMetrics().getNamespace() != null) {
            return config.getMetrics().getNamespace().trim();
        }
        return DEFAULT_NAMESPACE;
    }

    /**
     * Renders a URI without its user-info so credentials never reach the logs.
     */
    public static String redact(URI uri) {
        if (uri.getUserInfo() == null) {
            return uri.toString();
        }
        return uri.toString().replace(uri.getRawUserInfo() + "@", "***@");
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Target target;
        private Metrics metrics;
        private Map<String, Object> web;     // used by Spring @Value
        private Map<String, Object> server;  // used by Spring Boot
        private Map<String, Object> logging; // used by Spring Boot
    }

    @Data
    public static class Target {
        private String url;
        private Long timeoutSeconds;
        private Boolean insecureSkipVerify;
        private String caCertFile;
    }

    @Data
    public static class Metrics {
        private String namespace;
    }
}
