package com.valkyrlabs.thordrive.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * <p>
 * ThorDriveProperties class, bound from the {@code thordrive.*} keys.
 * </p>
 */
@ConfigurationProperties(prefix = "thordrive")
public class ThorDriveProperties {

    public static final String STORE_JPA = "jpa";
    public static final String STORE_MEMORY = "memory";

    private final Store store = new Store();

    private final Lock lock = new Lock();

    public Store getStore() {
        return store;
    }

    public Lock getLock() {
        return lock;
    }

    public static class Store {

        /** Which EntityStore backs the hierarchy: "jpa" or "memory". */
        private String type = STORE_JPA;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }

    public static class Lock {

        /** Fair ordering for the hierarchy read/write lock. */
        private boolean fair = true;

        public boolean isFair() {
            return fair;
        }

        public void setFair(boolean fair) {
            this.fair = fair;
        }
    }
}
