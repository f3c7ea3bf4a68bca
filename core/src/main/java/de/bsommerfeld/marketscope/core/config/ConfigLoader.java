package de.bsommerfeld.marketscope.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link GlobalConfig} from a TOML file. A missing file is created
 * with the defaults so the user has something to edit; keys the current
 * version no longer knows are ignored.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /**
     * @throws IOException if the file exists but cannot be parsed, or the
     *                     defaults cannot be written
     */
    public static GlobalConfig load(Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            LOG.info("No configuration at {}, writing defaults.", configFile.toAbsolutePath());
            GlobalConfig defaults = new GlobalConfig();
            save(defaults, configFile);
            return defaults;
        }
        LOG.info("Loading configuration from {}", configFile.toAbsolutePath());
        return MAPPER.readValue(configFile.toFile(), GlobalConfig.class);
    }

    public static void save(GlobalConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(configFile.toFile(), config);
    }
}
