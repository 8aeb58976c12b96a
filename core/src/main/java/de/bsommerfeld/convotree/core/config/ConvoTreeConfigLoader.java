package de.bsommerfeld.convotree.core.config;

import de.bsommerfeld.convotree.core.util.StorageUtils;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Builds a {@link ConvoTreeConfig} from the standard source chain:
 * <ol>
 * <li>explicit overrides (tests, embedding applications)</li>
 * <li>system properties</li>
 * <li>environment variables ({@code CONVOTREE_DATABASE_PATH}, ...)</li>
 * <li>{@code convotree.properties} in the app data directory, if present</li>
 * <li>{@code META-INF/microprofile-config.properties} on the classpath</li>
 * <li>{@code @WithDefault} values of the mapping</li>
 * </ol>
 */
public final class ConvoTreeConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConvoTreeConfigLoader.class);

    public static final String APP_NAME = "convotree";
    public static final String PROPERTIES_FILE = "convotree.properties";

    private static final int OVERRIDE_ORDINAL = 500;
    private static final int FILE_ORDINAL = 250;

    private ConvoTreeConfigLoader() {
    }

    /** Loads the configuration including the user's properties file. */
    public static ConvoTreeConfig load() {
        return load(StorageUtils.getAppDataDir(APP_NAME).resolve(PROPERTIES_FILE), Map.of());
    }

    /** Loads the configuration without a properties file. */
    public static ConvoTreeConfig load(Map<String, String> overrides) {
        return load(null, overrides);
    }

    /**
     * @param propertiesFile optional user file, skipped when {@code null} or
     *                       missing
     * @param overrides      highest-priority values, keyed like
     *                       {@code convotree.tree.default-depth}
     */
    public static ConvoTreeConfig load(Path propertiesFile, Map<String, String> overrides) {
        SmallRyeConfigBuilder builder = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .addDefaultInterceptors()
                .withMapping(ConvoTreeConfig.class);

        if (propertiesFile != null && Files.isRegularFile(propertiesFile)) {
            LOG.info("Loading configuration from: {}", propertiesFile.toAbsolutePath());
            builder.withSources(new PropertiesConfigSource(readProperties(propertiesFile),
                    propertiesFile.toString(), FILE_ORDINAL));
        }
        if (!overrides.isEmpty()) {
            builder.withSources(new PropertiesConfigSource(overrides, "overrides", OVERRIDE_ORDINAL));
        }

        SmallRyeConfig config = builder.build();
        return config.getConfigMapping(ConvoTreeConfig.class);
    }

    private static Map<String, String> readProperties(Path file) {
        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration file " + file, e);
        }
        Map<String, String> values = new HashMap<>();
        for (String key : properties.stringPropertyNames()) {
            values.put(key, properties.getProperty(key));
        }
        return values;
    }
}
