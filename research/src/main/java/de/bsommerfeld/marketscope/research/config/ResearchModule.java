package de.bsommerfeld.marketscope.research.config;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.marketscope.core.config.ApplicationMode;
import de.bsommerfeld.marketscope.core.config.ConfigLoader;
import de.bsommerfeld.marketscope.core.config.GlobalConfig;
import de.bsommerfeld.marketscope.core.config.ResearchConfig;
import de.bsommerfeld.marketscope.core.config.StoreConfig;
import de.bsommerfeld.marketscope.core.util.StorageUtils;
import de.bsommerfeld.marketscope.db.ResearchDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Guice wiring for the research store and its workflows.
 *
 * <p>
 * Configuration is read from {@code config.toml} in the data directory and
 * the database file lives next to it. Components not bound here are
 * {@code @Singleton} classes picked up just-in-time.
 */
public class ResearchModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(ResearchModule.class);
    public static final String CONFIG_FILE = "config.toml";

    private final Path dataDir;

    /** Uses the data directory of the current {@link ApplicationMode}. */
    public ResearchModule() {
        this(resolveDataDir());
    }

    public ResearchModule(Path dataDir) {
        this.dataDir = dataDir;
    }

    private static Path resolveDataDir() {
        ApplicationMode mode = ApplicationMode.get();
        LOG.info("Application mode: {}", mode);
        return StorageUtils.resolveDataDir(mode);
    }

    @Override
    protected void configure() {
        GlobalConfig config;
        try {
            config = ConfigLoader.load(dataDir.resolve(CONFIG_FILE));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load configuration from " + dataDir, e);
        }

        bind(GlobalConfig.class).toInstance(config);
        bind(StoreConfig.class).toInstance(config.getStore());
        bind(ResearchConfig.class).toInstance(config.getResearch());
        bind(Clock.class).toInstance(Clock.systemUTC());
    }

    @Provides
    @Singleton
    ResearchDatabase provideResearchDatabase(StoreConfig storeConfig) {
        return new ResearchDatabase(dataDir.resolve(storeConfig.getDatabaseFile()));
    }

    public Path dataDir() {
        return dataDir;
    }
}
