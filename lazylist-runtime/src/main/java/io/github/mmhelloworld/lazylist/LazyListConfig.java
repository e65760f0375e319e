package io.github.mmhelloworld.lazylist;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import static java.lang.String.format;

public final class LazyListConfig {
    public static final String EVALUATION_MODE_PROPERTY = "lazylist.evaluation.mode";
    public static final String EVALUATION_MODE_ENV = "LAZYLIST_EVALUATION_MODE";

    private static final Logger LOGGER = LogManager.getLogger(LazyListConfig.class);
    private static volatile EvaluationMode defaultMode;

    private LazyListConfig() {
    }

    /**
     * The mode used by the {@link LazyList} factories that don't take one. Resolved once, from the
     * {@value #EVALUATION_MODE_PROPERTY} system property, then the {@value #EVALUATION_MODE_ENV} environment variable,
     * then {@link EvaluationMode#CONCURRENT}.
     */
    public static EvaluationMode getDefaultEvaluationMode() {
        EvaluationMode mode = defaultMode;
        if (mode == null) {
            synchronized (LazyListConfig.class) {
                mode = defaultMode;
                if (mode == null) {
                    mode = resolveEvaluationMode(System.getProperty(EVALUATION_MODE_PROPERTY),
                        System.getenv(EVALUATION_MODE_ENV));
                    LOGGER.debug("Default evaluation mode: {}", mode);
                    defaultMode = mode;
                }
            }
        }
        return mode;
    }

    public static void setDefaultEvaluationMode(EvaluationMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("Evaluation mode must not be null");
        }
        synchronized (LazyListConfig.class) {
            defaultMode = mode;
        }
    }

    static EvaluationMode resolveEvaluationMode(String property, String environment) {
        return Optional.ofNullable(property)
            .or(() -> Optional.ofNullable(environment))
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .map(LazyListConfig::parseEvaluationMode)
            .orElse(EvaluationMode.CONCURRENT);
    }

    static EvaluationMode parseEvaluationMode(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return EvaluationMode.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(format("Unknown evaluation mode '%s', expected one of %s", value,
                Arrays.toString(EvaluationMode.values())), e);
        }
    }
}
