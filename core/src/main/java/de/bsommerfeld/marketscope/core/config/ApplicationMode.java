package de.bsommerfeld.marketscope.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Running mode of the application. {@link #TEST} keeps the database and the
 * configuration in a throwaway directory; {@link #PROD} uses the user's
 * application data directory.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    public static final String PROPERTY = "marketscope.mode";
    public static final String ENV_VARIABLE = "MARKETSCOPE_MODE";

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the mode from the {@value #PROPERTY} system property, then the
     * {@value #ENV_VARIABLE} environment variable. Anything unset or unknown
     * resolves to {@link #PROD}.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty(PROPERTY);
        if (mode == null || mode.isBlank()) {
            mode = System.getenv(ENV_VARIABLE);
        }
        if (mode == null || mode.isBlank()) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}', falling back to PROD.", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
