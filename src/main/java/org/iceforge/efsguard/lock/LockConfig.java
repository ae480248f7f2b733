package org.iceforge.efsguard.lock;

import org.iceforge.efsguard.jdbc.EfsGuardJdbcProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LockConfig {

    private static final Logger log = LoggerFactory.getLogger(LockConfig.class);

    /**
     * Single-JVM store. Only safe when every writer runs in this process.
     */
    @Bean
    @ConditionalOnProperty(prefix = "efsguard.lock", name = "store", havingValue = "local")
    public LockStore inMemoryLockStore() {
        log.warn("Using in-process lock store; locks are not shared with other processes");
        return new InMemoryLockStore();
    }

    @Bean
    public LockManagerFactory lockManagerFactory(LockProperties lockProps,
                                                 EfsGuardJdbcProperties jdbcProps,
                                                 LockStore lockStore) {
        String path = jdbcProps.getDatabasePath();
        LockSettings settings = LockSettings.forDatabase(path, lockProps);
        CrashMarker marker = new JournalFileCrashMarker(path, lockProps.getMarkerSuffix());
        log.info("Guarding database '{}' with lock key '{}' (expiration={}, waitTimeout={}, maxAttempts={})",
                path, settings.resourceKey(), settings.expiration(), settings.waitTimeout(), settings.maxAttempts());
        return new LockManagerFactory(settings, lockStore, marker);
    }
}
