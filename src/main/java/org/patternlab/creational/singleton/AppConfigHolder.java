package org.patternlab.creational.singleton;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Process-wide owner of the single {@link AppConfig} instance.
 *
 * <p>The config is installed at most once, either explicitly through {@link #initialize(AppConfig)}
 * or lazily with {@link AppConfig#defaults()} on the first {@link #get()}. Every later
 * {@link #get()} returns the same instance. Not thread-safe; initialize from one thread at startup.</p>
 */
@Slf4j
@UtilityClass
public final class AppConfigHolder {
    private static AppConfig instance;

    /**
     * Installs the process-wide config.
     *
     * @throws IllegalStateException when a config is already installed.
     */
    public static void initialize(AppConfig config) {
        AppConfig nonNullConfig = Objects.requireNonNull(config, "config");
        if (instance != null) {
            throw new IllegalStateException("AppConfig is already initialized");
        }
        log.info("Installing application config for {}", nonNullConfig.getUrl());
        instance = nonNullConfig;
    }

    /**
     * Returns the installed config, loading defaults on first access.
     */
    public static AppConfig get() {
        if (instance == null) {
            log.info("Loading from files...");
            instance = AppConfig.defaults();
        }
        return instance;
    }

    public static boolean isInitialized() {
        return instance != null;
    }

    // Test hook.
    static void reset() {
        instance = null;
    }
}
