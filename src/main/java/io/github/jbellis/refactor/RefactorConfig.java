package io.github.jbellis.refactor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Tunables for one project. Defaults apply unless {@code .refactor/refactor.properties} under the project
 * root overrides them; a malformed value is logged and replaced by its default.
 *
 * @param findLimit            maximum number of matches a find returns
 * @param suggestionLimit      maximum number of "did you mean" candidates
 * @param suggestionDistance   maximum edit distance of a candidate
 * @param maxScanFiles         files a project-wide scan reads before reporting a partial result
 * @param scanTimeout          time a project-wide scan may take before reporting a partial result
 * @param backupDir            directory holding backups
 * @param longFunctionLines    functions longer than this get an extraction suggestion from analyze
 */
public record RefactorConfig(int findLimit,
                             int suggestionLimit,
                             int suggestionDistance,
                             int maxScanFiles,
                             Duration scanTimeout,
                             Path backupDir,
                             int longFunctionLines) {
    private static final Logger logger = LogManager.getLogger(RefactorConfig.class);

    public static final String STATE_DIRECTORY = ".refactor";
    public static final String PROPERTIES_FILE = "refactor.properties";

    public static final int DEFAULT_FIND_LIMIT = 100;
    public static final int DEFAULT_SUGGESTION_LIMIT = 5;
    public static final int DEFAULT_SUGGESTION_DISTANCE = 2;
    public static final int DEFAULT_MAX_SCAN_FILES = 10_000;
    public static final long DEFAULT_SCAN_TIMEOUT_MILLIS = 30_000;
    public static final int DEFAULT_LONG_FUNCTION_LINES = 15;

    public static RefactorConfig defaults(Path root) {
        return new RefactorConfig(DEFAULT_FIND_LIMIT,
                                  DEFAULT_SUGGESTION_LIMIT,
                                  DEFAULT_SUGGESTION_DISTANCE,
                                  DEFAULT_MAX_SCAN_FILES,
                                  Duration.ofMillis(DEFAULT_SCAN_TIMEOUT_MILLIS),
                                  root.resolve(STATE_DIRECTORY).resolve("backups"),
                                  DEFAULT_LONG_FUNCTION_LINES);
    }

    /**
     * Loads the configuration for a project root, falling back to defaults for anything not configured.
     */
    public static RefactorConfig load(Path root) {
        var propertiesFile = root.resolve(STATE_DIRECTORY).resolve(PROPERTIES_FILE);
        var props = new Properties();
        if (Files.exists(propertiesFile)) {
            try (var reader = Files.newBufferedReader(propertiesFile)) {
                props.load(reader);
            } catch (IOException e) {
                logger.error("Error loading project properties from {}: {}", propertiesFile, e.getMessage());
            }
        }
        return fromProperties(root, props);
    }

    static RefactorConfig fromProperties(Path root, Properties props) {
        var defaults = defaults(root);
        var backupDir = props.getProperty("backup.dir");
        return new RefactorConfig(
                intProperty(props, "find.limit", defaults.findLimit()),
                intProperty(props, "suggestions.limit", defaults.suggestionLimit()),
                intProperty(props, "suggestions.maxDistance", defaults.suggestionDistance()),
                intProperty(props, "scan.maxFiles", defaults.maxScanFiles()),
                Duration.ofMillis(intProperty(props, "scan.timeoutMillis", (int) defaults.scanTimeout().toMillis())),
                backupDir == null || backupDir.isBlank() ? defaults.backupDir() : root.resolve(backupDir.strip()).normalize(),
                intProperty(props, "analysis.longFunctionLines", defaults.longFunctionLines()));
    }

    private static int intProperty(Properties props, String key, int defaultValue) {
        var raw = props.getProperty(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.strip());
            if (value >= 0) {
                return value;
            }
            logger.warn("Negative value {} for {}, using default {}", value, key, defaultValue);
        } catch (NumberFormatException e) {
            logger.warn("Invalid value '{}' for {}, using default {}", raw, key, defaultValue);
        }
        return defaultValue;
    }
}
