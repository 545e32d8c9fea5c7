package ca.jonathanfritz.zkbcat.secure;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

/**
 * Guice module for the secure document gateway and the platform capabilities that it relies on
 */
public class SecureFileModule extends AbstractModule {

    @Provides
    @Singleton
    public StorageProtection provideStorageProtection() {
        // use the strongest protection that the platform offers
        return PosixStorageProtection.isSupported() ? new PosixStorageProtection() : new NoOpStorageProtection();
    }

    @Provides
    @Singleton
    public AccessScopeProvider provideAccessScopeProvider() {
        return new LocalFileAccessScopeProvider();
    }
}
