package com.valkyrlabs.thordrive.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import com.valkyrlabs.thordrive.store.EntityStore;

/**
 * Wires the hierarchy core: configuration properties and proxying for the
 * access guard aspect. The EntityStore implementation is picked by
 * {@code thordrive.store.type}.
 */
@Configuration
@EnableAspectJAutoProxy
@EnableConfigurationProperties(ThorDriveProperties.class)
public class ThorDriveConfig implements InitializingBean {

    private static final Logger logger = LoggerFactory.getLogger(ThorDriveConfig.class);

    private final ThorDriveProperties properties;
    private final EntityStore entityStore;

    public ThorDriveConfig(ThorDriveProperties properties, EntityStore entityStore) {
        this.properties = properties;
        this.entityStore = entityStore;
    }

    @Override
    public void afterPropertiesSet() {
        logger.info("ThorDrive hierarchy store: {} ({}), fair lock: {}", properties.getStore().getType(),
                entityStore.getClass().getSimpleName(), properties.getLock().isFair());
    }
}
