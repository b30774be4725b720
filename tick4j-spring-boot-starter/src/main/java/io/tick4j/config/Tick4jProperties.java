package io.tick4j.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring-bound scheduler configuration under the {@code tick4j} prefix.
 */
@ConfigurationProperties(prefix = "tick4j")
public class Tick4jProperties extends SchedulerProperties {

    public enum StoreType {MEMORY, MONGO, POSTGRES}

    private boolean enabled = true;
    private StoreType store = StoreType.MEMORY;
    private boolean ensureIndexesOnStartup = false;
    private final Mongo mongo = new Mongo();
    private final Postgres postgres = new Postgres();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Mongo getMongo() {
        return mongo;
    }

    public Postgres getPostgres() {
        return postgres;
    }

    public static class Mongo {
        private String collection = "tick4j_jobs";

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }
    }

    public static class Postgres {
        private String table = "tick4j_jobs";
        private boolean initTables = true; // CREATE TABLE IF NOT EXISTS on init

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public boolean isInitTables() {
            return initTables;
        }

        public void setInitTables(boolean initTables) {
            this.initTables = initTables;
        }
    }
}
