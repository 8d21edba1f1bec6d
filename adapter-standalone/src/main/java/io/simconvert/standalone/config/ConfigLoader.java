package io.simconvert.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.simconvert.core.engine.StepFailurePolicy;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link StandaloneConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code simdoc-convert.yaml} from the current directory if it exists,
 * otherwise starts from the built-in defaults</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path, which must exist</li>
 * </ul>
 *
 * <p>
 * Every key can be overridden via a {@code SIMDOC_*} environment variable. Env vars take
 * precedence over YAML values. An env var is considered "set" if and only if it is defined AND its
 * trimmed value is non-empty.
 *
 * <pre>
 * convert:
 *   backup: true                 # SIMDOC_BACKUP
 *   backup-suffix: .bak          # SIMDOC_BACKUP_SUFFIX
 *   dry-run: false               # SIMDOC_DRY_RUN
 *   include-glob: "*.apsimx"     # SIMDOC_INCLUDE_GLOB
 *   step-failure-policy: skip    # SIMDOC_STEP_FAILURE_POLICY (skip | abort)
 *   xml-declaration: true        # SIMDOC_XML_DECLARATION
 * logging:
 *   format: text                 # SIMDOC_LOG_FORMAT (text | json)
 *   level: INFO                  # SIMDOC_LOG_LEVEL
 * </pre>
 */
public final class ConfigLoader {

    static final String CONFIG_FLAG = "--config";
    static final String DEFAULT_CONFIG_FILE = "simdoc-convert.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link StandaloneConfig} from the given YAML file path, applying environment variable
     * overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return a fully constructed {@link StandaloneConfig} with defaults applied
     * @throws ConfigLoadException if the file is missing, contains invalid YAML or an invalid value
     */
    public static StandaloneConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link StandaloneConfig} from the given YAML file path, applying environment variable
     * overrides from the supplied lookup function. Returning {@code null} from {@code envLookup}
     * means the variable is not defined.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return a fully constructed {@link StandaloneConfig} with env overrides applied
     * @throws ConfigLoadException if the file is missing, contains invalid YAML or an invalid value
     */
    public static StandaloneConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? MissingNode.getInstance() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (Exception e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Builds a configuration from the built-in defaults and the environment only.
     *
     * @param envLookup environment variable lookup function
     * @return defaults with env overrides applied
     * @throws ConfigLoadException if an environment variable holds an invalid value
     */
    public static StandaloneConfig fromEnvironment(Function<String, String> envLookup) {
        try {
            return mapToConfig(MissingNode.getInstance(), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfigLoadException("Failed to load configuration from environment", e);
        }
    }

    /**
     * Resolves the configuration for a command line. An explicit {@code --config} file must exist;
     * the default file is optional.
     *
     * @param args      command-line arguments
     * @param envLookup environment variable lookup function
     * @return the resolved configuration
     */
    public static StandaloneConfig loadForArgs(String[] args, Function<String, String> envLookup) {
        Path configPath = resolveConfigPath(args);
        if (!hasConfigFlag(args) && !Files.exists(configPath)) {
            return fromEnvironment(envLookup);
        }
        return load(configPath, envLookup);
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if (CONFIG_FLAG.equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static boolean hasConfigFlag(String[] args) {
        for (String arg : args) {
            if (CONFIG_FLAG.equals(arg)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Maps a parsed YAML tree to a {@link StandaloneConfig} via the builder, then overlays
     * environment variable overrides.
     */
    private static StandaloneConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        StandaloneConfig.Builder builder = StandaloneConfig.builder();

        // --- YAML mapping ---

        JsonNode convert = root.path("convert");
        if (convert.has("backup")) builder.backup(convert.get("backup").asBoolean());
        if (convert.has("backup-suffix")) builder.backupSuffix(convert.get("backup-suffix").asText());
        if (convert.has("dry-run")) builder.dryRun(convert.get("dry-run").asBoolean());
        if (convert.has("include-glob")) builder.includeGlob(convert.get("include-glob").asText());
        if (convert.has("step-failure-policy"))
            builder.stepFailurePolicy(parsePolicy(convert.get("step-failure-policy").asText()));
        if (convert.has("xml-declaration"))
            builder.xmlDeclaration(convert.get("xml-declaration").asBoolean());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Env var overlay ---

        envBool(envLookup, "SIMDOC_BACKUP", builder::backup);
        envString(envLookup, "SIMDOC_BACKUP_SUFFIX", builder::backupSuffix);
        envBool(envLookup, "SIMDOC_DRY_RUN", builder::dryRun);
        envString(envLookup, "SIMDOC_INCLUDE_GLOB", builder::includeGlob);
        envString(envLookup, "SIMDOC_STEP_FAILURE_POLICY", v -> builder.stepFailurePolicy(parsePolicy(v)));
        envBool(envLookup, "SIMDOC_XML_DECLARATION", builder::xmlDeclaration);
        envString(envLookup, "SIMDOC_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "SIMDOC_LOG_LEVEL", builder::loggingLevel);

        return builder.build();
    }

    private static StepFailurePolicy parsePolicy(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "skip" -> StepFailurePolicy.SKIP;
            case "abort" -> StepFailurePolicy.ABORT;
            default -> throw new ConfigLoadException(
                    "Invalid step-failure-policy '" + value + "': expected skip or abort");
        };
    }

    // --- Env helpers ---

    /** An env var is "set" if defined and its trimmed value is non-empty. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    /** Applies a boolean env var override if set. */
    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
