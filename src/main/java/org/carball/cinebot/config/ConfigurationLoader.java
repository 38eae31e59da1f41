package org.carball.cinebot.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads settings using the hierarchy: CLI args > env vars > settings file > matching profile > defaults
     */
    public AgentSettings loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        SettingsFile settingsFile = loadSettingsFile(findOption(args, "--config"));

        // 1. Matching profile, picked by the highest-priority source that names one
        String profileName = "balanced";
        if (settingsFile != null && settingsFile.getMatchingProfile() != null) {
            profileName = settingsFile.getMatchingProfile();
        }
        if (environment.containsKey("CINEBOT_MATCHING_PROFILE")) {
            profileName = environment.get("CINEBOT_MATCHING_PROFILE");
        }
        String cliProfile = findOption(args, "--profile");
        if (cliProfile != null) {
            profileName = cliProfile;
        }
        AgentSettings.AgentSettingsBuilder builder =
                MatchingProfile.fromName(profileName).applyTo(AgentSettings.defaults()).toBuilder();

        // 2. Settings file
        if (settingsFile != null) {
            settingsFile.applyTo(builder);
        }

        // 3. Environment variables
        applyEnvironmentVariables(builder);

        // 4. CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        AgentSettings settings = builder.build();
        settings.validate();

        log.info("Configuration loaded: {}", settings.getConfigurationSummary());
        return settings;
    }

    /**
     * Reads a YAML settings file, or returns null when no usable file is given.
     */
    public SettingsFile loadSettingsFile(String path) {
        if (path == null || path.trim().isEmpty()) {
            return null;
        }

        File file = new File(path);
        if (!file.exists()) {
            log.warn("Settings file not found: {}, using defaults", path);
            return null;
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            SettingsFile settingsFile = mapper.readValue(file, SettingsFile.class);
            log.info("Loaded settings from: {}", path);
            return settingsFile;
        } catch (IOException e) {
            log.error("Failed to load settings from {}: {}, using defaults", path, e.getMessage());
            return null;
        }
    }

    private void applyEnvironmentVariables(AgentSettings.AgentSettingsBuilder builder) {
        Map<String, String> env = environment;

        try {
            if (env.containsKey("CINEBOT_MAX_STEPS")) {
                builder.maxSteps(Integer.parseInt(env.get("CINEBOT_MAX_STEPS")));
            }
            if (env.containsKey("CINEBOT_HISTORY_WINDOW")) {
                builder.historyWindow(Integer.parseInt(env.get("CINEBOT_HISTORY_WINDOW")));
            }
            if (env.containsKey("CINEBOT_FUZZY_THRESHOLD")) {
                builder.acceptanceThreshold(Double.parseDouble(env.get("CINEBOT_FUZZY_THRESHOLD")));
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value in environment: {}", e.getMessage());
        }

        if (env.containsKey("OPENAI_MODEL")) {
            builder.model(env.get("OPENAI_MODEL"));
        }
        if (env.containsKey("OPENAI_API_KEY")) {
            builder.openAiApiKey(env.get("OPENAI_API_KEY"));
        }
        if (env.containsKey("OMDB_API_KEY")) {
            builder.omdbApiKey(env.get("OMDB_API_KEY"));
        }
        if (env.containsKey("CINEBOT_CATALOG_DB")) {
            builder.catalogPath(env.get("CINEBOT_CATALOG_DB"));
        }
        if (env.containsKey("CINEBOT_MEMORY_FILE")) {
            builder.memoryFile(env.get("CINEBOT_MEMORY_FILE"));
        }
    }

    private void applyCLIArguments(AgentSettings.AgentSettingsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--settings.max-steps":
                        builder.maxSteps(Integer.parseInt(value));
                        break;
                    case "--settings.history-window":
                        builder.historyWindow(Integer.parseInt(value));
                        break;
                    case "--settings.model":
                        builder.model(value);
                        break;
                    case "--settings.temperature":
                        builder.temperature(Double.parseDouble(value));
                        break;
                    case "--settings.edit-weight":
                        builder.editWeight(Double.parseDouble(value));
                        break;
                    case "--settings.token-weight":
                        builder.tokenWeight(Double.parseDouble(value));
                        break;
                    case "--settings.metadata-weight":
                        builder.metadataWeight(Double.parseDouble(value));
                        break;
                    case "--settings.threshold":
                        builder.acceptanceThreshold(Double.parseDouble(value));
                        break;
                    case "--settings.result-limit":
                        builder.defaultResultLimit(Integer.parseInt(value));
                        break;
                    case "--api-key":
                        builder.openAiApiKey(value);
                        break;
                    case "--omdb-key":
                        builder.omdbApiKey(value);
                        break;
                    case "--catalog":
                        builder.catalogPath(value);
                        break;
                    case "--memory":
                        builder.memoryFile(value);
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
     * Returns help text for the settings options.
     */
    public static String getSettingsHelp() {
        return """
            Settings Options:

            CLI Arguments:
              --config <file>                   YAML settings file
              --profile <name>                  Matching profile: strict|balanced|lenient
              --settings.max-steps <num>        Model decisions allowed per turn
              --settings.history-window <num>   Past dialogue messages shown to the model
              --settings.model <name>           OpenAI chat model
              --settings.temperature <num>      Sampling temperature
              --settings.edit-weight <num>      Weight of edit-distance similarity
              --settings.token-weight <num>     Weight of title word overlap
              --settings.metadata-weight <num>  Weight of plot/genre/cast word overlap
              --settings.threshold <num>        Minimum hybrid score for a fuzzy match
              --settings.result-limit <num>     Default number of rows in list answers
              --api-key <key>                   OpenAI API key
              --omdb-key <key>                  OMDb API key
              --catalog <file>                  SQLite catalog (or IMDb CSV) path
              --memory <file>                   User profile JSON file

            Environment Variables:
              OPENAI_API_KEY                    Same as --api-key
              OPENAI_MODEL                      Same as --settings.model
              OMDB_API_KEY                      Same as --omdb-key
              CINEBOT_MATCHING_PROFILE          Same as --profile
              CINEBOT_MAX_STEPS                 Same as --settings.max-steps
              CINEBOT_HISTORY_WINDOW            Same as --settings.history-window
              CINEBOT_FUZZY_THRESHOLD           Same as --settings.threshold
              CINEBOT_CATALOG_DB                Same as --catalog
              CINEBOT_MEMORY_FILE               Same as --memory

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Settings file
              4. Matching profile
              5. Built-in defaults
            """;
    }
}
