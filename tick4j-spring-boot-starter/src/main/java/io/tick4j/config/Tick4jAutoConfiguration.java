package io.tick4j.config;

import io.tick4j.JobScheduler;
import io.tick4j.internal.TickScheduler;
import io.tick4j.internal.mongo.MongoMetadataStore;
import io.tick4j.internal.postgres.PostgresMetadataStore;
import io.tick4j.store.InMemoryMetadataStore;
import io.tick4j.store.MetadataStore;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Spring Boot auto-configuration entrypoint for tick4j components.
 *
 * <p>The metadata store is picked by {@code tick4j.store}: {@code memory} (default),
 * {@code mongo} (needs a {@link MongoTemplate} bean) or {@code postgres} (needs a
 * {@link JdbcTemplate} bean). A user-defined {@link MetadataStore} bean always wins.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration",
        "org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration"
})
@ConditionalOnClass(JobScheduler.class)
@EnableConfigurationProperties(Tick4jProperties.class)
@ConditionalOnProperty(prefix = "tick4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class Tick4jAutoConfiguration {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({MongoTemplate.class, MongoMetadataStore.class})
    @ConditionalOnProperty(prefix = "tick4j", name = "store", havingValue = "mongo")
    static class MongoStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean(MetadataStore.class)
        MongoMetadataStore tick4jMongoMetadataStore(MongoTemplate mongoTemplate, Tick4jProperties props) {
            return new MongoMetadataStore(mongoTemplate, props.getMongo().getCollection());
        }

        @Bean
        @ConditionalOnMissingBean
        Tick4jMongoIndexConfig tick4jMongoIndexConfig(MongoTemplate mongoTemplate, Tick4jProperties props) {
            return new Tick4jMongoIndexConfig(mongoTemplate, props.getMongo().getCollection());
        }

        @Bean
        @ConditionalOnProperty(prefix = "tick4j", name = "ensure-indexes-on-startup", havingValue = "true")
        SmartInitializingSingleton tick4jIndexesInitializer(Tick4jMongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({JdbcTemplate.class, PostgresMetadataStore.class})
    @ConditionalOnProperty(prefix = "tick4j", name = "store", havingValue = "postgres")
    static class PostgresStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean(MetadataStore.class)
        PostgresMetadataStore tick4jPostgresMetadataStore(JdbcTemplate jdbcTemplate, Tick4jProperties props) {
            return new PostgresMetadataStore(jdbcTemplate, props.getPostgres().getTable(),
                    props.getPostgres().isInitTables());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "tick4j", name = "store", havingValue = "memory", matchIfMissing = true)
    static class InMemoryStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean(MetadataStore.class)
        InMemoryMetadataStore tick4jInMemoryMetadataStore() {
            return new InMemoryMetadataStore();
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(Tick4jProperties props, MetadataStore store) {
        return new TickScheduler(props, store);
    }

    @Bean
    @ConditionalOnMissingBean
    public Tick4jLifecycle tick4jLifecycle(JobScheduler scheduler, Tick4jProperties props) {
        return new Tick4jLifecycle(scheduler, props.getShutdownTimeout());
    }
}
