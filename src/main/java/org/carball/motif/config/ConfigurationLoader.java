package org.carball.motif.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads settings using the hierarchy: CLI args > env vars > YAML file > defaults.
     * The YAML file is named by {@code --config <file>}.
     */
    public EngineSettings loadConfiguration(String[] args) throws IOException {
        log.debug("Loading configuration");

        // Start with defaults
        EngineSettings.EngineSettingsBuilder builder = EngineSettings.builder();

        // 1. Apply settings file
        String configFile = findOption(args, "--config");
        if (configFile != null) {
            loadSettingsFile(Path.of(configFile)).applyTo(builder);
        }

        // 2. Apply environment variables
        applyEnvironmentVariables(builder);

        // 3. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        EngineSettings settings = builder.build();
        settings.validate();

        log.info("Configuration loaded: {}", settings.getConfigurationSummary());
        return settings;
    }

    public EngineSettingsFile loadSettingsFile(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Configuration file not found: " + file);
        }
        EngineSettingsFile settingsFile = yamlMapper.readValue(file.toFile(), EngineSettingsFile.class);
        log.debug("Read settings file {}", file);
        return settingsFile == null ? new EngineSettingsFile() : settingsFile;
    }

    private void applyEnvironmentVariables(EngineSettings.EngineSettingsBuilder builder) {
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            String name = entry.getKey();
            String value = entry.getValue();

            try {
                switch (name) {
                    case "MOTIF_STORAGE_DIR":
                        builder.storageDirectory(value);
                        break;
                    case "MOTIF_CACHE_TTL_MINUTES":
                        builder.cacheTtlMinutes(Integer.parseInt(value));
                        break;
                    case "MOTIF_CACHE_MAX_SIZE":
                        builder.cacheMaximumSize(Long.parseLong(value));
                        break;
                    case "MOTIF_RECENT_ACTIVITY_DAYS":
                        builder.recentActivityDays(Integer.parseInt(value));
                        break;
                    case "MOTIF_TRENDING_WINDOW_DAYS":
                        builder.trendingWindowDays(Integer.parseInt(value));
                        break;
                    case "MOTIF_DEFAULT_LIMIT":
                        builder.defaultLimit(Integer.parseInt(value));
                        break;
                    case "MOTIF_SIMILAR_LIMIT":
                        builder.similarLimit(Integer.parseInt(value));
                        break;
                    case "MOTIF_AUTO_EVALUATE":
                        builder.autoEvaluate(Boolean.parseBoolean(value));
                        break;
                    default:
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", name, value);
            }
        }
    }

    private void applyCLIArguments(EngineSettings.EngineSettingsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--storage":
                        builder.storageDirectory(value);
                        break;
                    case "--cache-ttl":
                        builder.cacheTtlMinutes(Integer.parseInt(value));
                        break;
                    case "--cache-size":
                        builder.cacheMaximumSize(Long.parseLong(value));
                        break;
                    case "--recent-days":
                        builder.recentActivityDays(Integer.parseInt(value));
                        break;
                    case "--trending-days":
                        builder.trendingWindowDays(Integer.parseInt(value));
                        break;
                    case "--limit":
                        builder.defaultLimit(Integer.parseInt(value));
                        break;
                    case "--similar-limit":
                        builder.similarLimit(Integer.parseInt(value));
                        break;
                    case "--auto-evaluate":
                        builder.autoEvaluate(Boolean.parseBoolean(value));
                        break;
                    default:
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    private static String findOption(String[] args, String option) {
        for (int i = 0; i < args.length - 1; i++) {
            if (option.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --storage <dir>            Solution storage directory
              --config <file>            YAML settings file
              --cache-ttl <minutes>      Recommendation cache TTL
              --cache-size <num>         Maximum cached recommendation lists
              --recent-days <num>        Window for recent activity in preferences
              --trending-days <num>      Window for trending solutions
              --limit <num>              Default result limit
              --similar-limit <num>      Similar-solution result limit
              --auto-evaluate <bool>     Score solutions when they are added

            Environment Variables:
              MOTIF_STORAGE_DIR          Same as --storage
              MOTIF_CACHE_TTL_MINUTES    Same as --cache-ttl
              MOTIF_CACHE_MAX_SIZE       Same as --cache-size
              MOTIF_RECENT_ACTIVITY_DAYS Same as --recent-days
              MOTIF_TRENDING_WINDOW_DAYS Same as --trending-days
              MOTIF_DEFAULT_LIMIT        Same as --limit
              MOTIF_SIMILAR_LIMIT        Same as --similar-limit
              MOTIF_AUTO_EVALUATE        Same as --auto-evaluate

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML settings file
              4. Built-in defaults
            """;
    }
}
