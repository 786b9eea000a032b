package de.mirkosertic.imagebatch.config;

import de.mirkosertic.imagebatch.processing.ConflictMode;
import de.mirkosertic.imagebatch.processing.EligibilityFilter;
import de.mirkosertic.imagebatch.processing.EnlargeReduce;
import de.mirkosertic.imagebatch.processing.OutputFormat;
import de.mirkosertic.imagebatch.processing.ProcessingSettings;
import de.mirkosertic.imagebatch.processing.ResizeMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Central configuration of the image batch processor.
 * Loads configuration from YAML files, environment variables and system properties.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. System properties
 * 2. Environment variables
 * 3. User config file (~/.imagebatch/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 * <p>
 * Invalid values, e.g. an unknown output format or a quality outside [0, 1], fail
 * loading with an {@link IllegalArgumentException}.
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_VAULT_PATH = "IMAGEBATCH_VAULT_PATH";
    private static final String PROP_VAULT_PATH = "imagebatch.vault.path";
    private static final String CONFIG_DIR = ".imagebatch";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    static final ProcessingSettings DEFAULT_SETTINGS = new ProcessingSettings(
            OutputFormat.JPEG, 0.75, ResizeMode.NONE, 600, 800, 800, EnlargeReduce.AUTO,
            false, List.of(), true);

    // Vault settings
    private String vaultPath;
    private boolean includeUnreferencedImages = false;
    private List<String> excludePatterns = List.of(".obsidian/**", ".trash/**", ".git/**", "**/.git/**");

    // Run settings
    private ConflictMode conflictMode = ConflictMode.INCREMENT;
    private long statusDismissDelayMs = 5000;
    private boolean notificationsEnabled = true;
    private long maxImageBytes = -1;
    private ProcessingSettings noteSettings = DEFAULT_SETTINGS;
    private ProcessingSettings vaultSettings = DEFAULT_SETTINGS;

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadFromClasspath();
        config.loadFromUserConfig();
        config.applyEnvironmentOverrides();
        config.determineProfile();

        logger.info("Configuration loaded: vaultPath={}, conflictMode={}, deployedMode={}",
                config.vaultPath, config.conflictMode, config.deployedMode);

        return config;
    }

    /**
     * Configuration from a single YAML document on top of the built-in defaults,
     * without consulting files, environment or system properties.
     */
    static ApplicationConfig fromYaml(final String yamlContent) {
        final ApplicationConfig config = new ApplicationConfig();
        final Map<String, Object> yaml = new Yaml().load(yamlContent);
        if (yaml != null) {
            config.applyYamlConfig(yaml);
        }
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> batchConfig = (Map<String, Object>) config.get("imagebatch");
        if (batchConfig == null) {
            return;
        }

        if (batchConfig.containsKey("notifications-enabled")) {
            this.notificationsEnabled = (Boolean) batchConfig.get("notifications-enabled");
        }
        if (batchConfig.containsKey("conflict-mode")) {
            this.conflictMode = ConflictMode.fromSetting(String.valueOf(batchConfig.get("conflict-mode")));
        }
        if (batchConfig.containsKey("max-image-bytes")) {
            this.maxImageBytes = ((Number) batchConfig.get("max-image-bytes")).longValue();
        }

        final Map<String, Object> vaultConfig = (Map<String, Object>) batchConfig.get("vault");
        if (vaultConfig != null) {
            applyVaultConfig(vaultConfig);
        }

        final Map<String, Object> statusConfig = (Map<String, Object>) batchConfig.get("status");
        if (statusConfig != null && statusConfig.containsKey("dismiss-delay-ms")) {
            this.statusDismissDelayMs = ((Number) statusConfig.get("dismiss-delay-ms")).longValue();
        }

        final Map<String, Object> noteConfig = (Map<String, Object>) batchConfig.get("note");
        if (noteConfig != null) {
            this.noteSettings = applyProcessingSettings(noteConfig, noteSettings);
        }
        final Map<String, Object> vaultWideConfig = (Map<String, Object>) batchConfig.get("vault-wide");
        if (vaultWideConfig != null) {
            this.vaultSettings = applyProcessingSettings(vaultWideConfig, vaultSettings);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyVaultConfig(final Map<String, Object> vaultConfig) {
        final Object path = vaultConfig.get("path");
        if (path != null) {
            this.vaultPath = resolveVariables(path.toString());
        }
        if (vaultConfig.containsKey("include-unreferenced-images")) {
            this.includeUnreferencedImages = (Boolean) vaultConfig.get("include-unreferenced-images");
        }
        if (vaultConfig.containsKey("exclude-patterns")) {
            final Object patterns = vaultConfig.get("exclude-patterns");
            if (patterns instanceof List) {
                this.excludePatterns = new ArrayList<>((List<String>) patterns);
            }
        }
    }

    /**
     * Overlay the keys present in {@code section} onto {@code base}.
     */
    private static ProcessingSettings applyProcessingSettings(final Map<String, Object> section,
                                                              final ProcessingSettings base) {
        OutputFormat outputFormat = base.outputFormat();
        double quality = base.quality();
        ResizeMode resizeMode = base.resizeMode();
        int desiredWidth = base.desiredWidth();
        int desiredHeight = base.desiredHeight();
        int desiredLength = base.desiredLength();
        EnlargeReduce enlargeOrReduce = base.enlargeOrReduce();
        boolean allowLargerFiles = base.allowLargerFiles();
        List<String> skipFormats = base.skipFormats();
        boolean skipImagesInTargetFormat = base.skipImagesInTargetFormat();

        if (section.containsKey("convert-to")) {
            outputFormat = OutputFormat.fromSetting(String.valueOf(section.get("convert-to")));
        }
        if (section.containsKey("quality")) {
            quality = toDouble("quality", section.get("quality"));
        }
        if (section.containsKey("resize-mode")) {
            resizeMode = ResizeMode.fromSetting(String.valueOf(section.get("resize-mode")));
        }
        if (section.containsKey("desired-width")) {
            desiredWidth = ((Number) section.get("desired-width")).intValue();
        }
        if (section.containsKey("desired-height")) {
            desiredHeight = ((Number) section.get("desired-height")).intValue();
        }
        if (section.containsKey("desired-length")) {
            desiredLength = ((Number) section.get("desired-length")).intValue();
        }
        if (section.containsKey("enlarge-or-reduce")) {
            enlargeOrReduce = EnlargeReduce.fromSetting(String.valueOf(section.get("enlarge-or-reduce")));
        }
        if (section.containsKey("allow-larger-files")) {
            allowLargerFiles = (Boolean) section.get("allow-larger-files");
        }
        if (section.containsKey("skip-formats")) {
            final Object value = section.get("skip-formats");
            skipFormats = EligibilityFilter.parseSkipFormats(value == null ? "" : value.toString());
        }
        if (section.containsKey("skip-images-in-target-format")) {
            skipImagesInTargetFormat = (Boolean) section.get("skip-images-in-target-format");
        }

        return new ProcessingSettings(outputFormat, quality, resizeMode, desiredWidth, desiredHeight,
                desiredLength, enlargeOrReduce, allowLargerFiles, skipFormats, skipImagesInTargetFormat);
    }

    private static double toDouble(final String key, final Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    private void applyEnvironmentOverrides() {
        final String envVaultPath = System.getenv(ENV_VAULT_PATH);
        if (envVaultPath != null && !envVaultPath.trim().isEmpty()) {
            this.vaultPath = envVaultPath.trim();
            logger.info("Vault path from environment: {}", this.vaultPath);
        }

        final String propVaultPath = System.getProperty(PROP_VAULT_PATH);
        if (propVaultPath != null && !propVaultPath.isEmpty()) {
            this.vaultPath = propVaultPath;
        }

        if (this.vaultPath == null || this.vaultPath.isEmpty()) {
            this.vaultPath = Paths.get(System.getProperty("user.home"), "vault").toString();
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty("profile", "default");
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
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

            // environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public String getVaultPath() {
        return vaultPath;
    }

    public boolean isIncludeUnreferencedImages() {
        return includeUnreferencedImages;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public ConflictMode getConflictMode() {
        return conflictMode;
    }

    public long getStatusDismissDelayMs() {
        return statusDismissDelayMs;
    }

    public boolean isNotificationsEnabled() {
        return notificationsEnabled;
    }

    /**
     * Largest image the processor will read, {@code -1} for no limit.
     */
    public long getMaxImageBytes() {
        return maxImageBytes;
    }

    /**
     * Parameters for runs over a single note or a folder.
     */
    public ProcessingSettings getNoteSettings() {
        return noteSettings;
    }

    /**
     * Parameters for runs over the whole vault.
     */
    public ProcessingSettings getVaultSettings() {
        return vaultSettings;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
