package ca.jonathanfritz.zkbcat.config;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

/**
 * Guice module that makes the loaded {@link AppConfig} available to every other module
 */
public class ConfigModule extends AbstractModule {

    private final AppConfig appConfig;

    public ConfigModule(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @Provides
    @Singleton
    public AppConfig provideAppConfig() {
        return appConfig;
    }
}
