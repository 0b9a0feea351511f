package com.myorg.cafe.eventing.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.cafe.eventing.*;
import com.myorg.cafe.eventing.idempotency.IdempotencyStoreCheck;
import com.myorg.cafe.eventing.idempotency.InMemoryProcessingRecordStore;
import com.myorg.cafe.eventing.idempotency.JdbcProcessingRecordStore;
import com.myorg.cafe.eventing.idempotency.ProcessingRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.*;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.time.Clock;

@Slf4j
@AutoConfiguration(
        after = CafeEventingRedisAutoConfiguration.class,
        afterName = {
                "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
                "org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration",
                "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration"
        })
@EnableConfigurationProperties(CafeEventingProperties.class)
public class CafeEventingAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper cafeObjectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock cafeClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public HandlerRegistry handlerRegistry(ObjectMapper mapper, ObjectProvider<ProjectionRegistration> registrations) {
        HandlerRegistry registry = new HandlerRegistry(mapper);
        registrations.orderedStream().forEach(r -> r.register(registry));
        log.info("Registered projection groups {}", registry.groups());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public AggregateIdExtractor aggregateIdExtractor(HandlerRegistry registry) {
        return new AggregateIdExtractor(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public JacksonEnvelopeCodec jacksonEnvelopeCodec(ObjectMapper mapper) {
        return new JacksonEnvelopeCodec(mapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public CafeDispatcher cafeDispatcher(HandlerRegistry registry,
                                         CafeEventingProperties props,
                                         AggregateIdExtractor idExtractor,
                                         ObjectProvider<ProcessingRecordStore> storeProvider,
                                         ObjectProvider<PlatformTransactionManager> txManager,
                                         Clock clock) {

        CafeDispatcher base = new DefaultCafeDispatcher(registry, props.isIgnoreUnknownEventType());

        ProcessingRecordStore store = storeProvider.getIfAvailable();
        if (store != null && props.getIdempotency().isEnabled()) {
            PlatformTransactionManager tm = txManager.getIfAvailable();
            TransactionTemplate tx = (tm != null && store.transactional()) ? new TransactionTemplate(tm) : null;
            return new IdempotentCafeDispatcher(base, store, idExtractor, tx, clock);
        }
        return base;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(CafePublisher.class)
    public InProcessEventPublisher cafePublisher(HandlerRegistry registry,
                                                 CafeDispatcher dispatcher,
                                                 CafeEventingProperties props) {
        var delivery = props.getDelivery();
        return new InProcessEventPublisher(registry, dispatcher, delivery.getMode(), delivery.getShutdownTimeout());
    }

    @Bean
    @ConditionalOnProperty(prefix = "cafe.eventing.idempotency", name = "enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnBean(ProcessingRecordStore.class)
    public IdempotencyStoreCheck idempotencyStoreCheck(CafeEventingProperties props,
                                                       Environment env,
                                                       ProcessingRecordStore store) {
        return new IdempotencyStoreCheck(props, env, store);
    }

    // ---------------- Processing record store ----------------

    /**
     * store=redis but Redis is not on classpath -> fail fast.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "cafe.eventing.idempotency", name = "store", havingValue = "redis")
    @ConditionalOnMissingClass("org.springframework.data.redis.connection.RedisConnectionFactory")
    static class MissingRedisDependencyFailFastConfig {
        @Bean
        public Object failFastRedisMissing() {
            throw new IllegalStateException(
                    "cafe.eventing.idempotency.store=redis requires spring-boot-starter-data-redis on the classpath");
        }
    }

    /**
     * store=jdbc or store=auto with a JdbcTemplate -> records share the read model's database.
     */
    @Configuration
    @ConditionalOnClass(JdbcTemplate.class)
    @ConditionalOnProperty(prefix = "cafe.eventing.idempotency", name = "enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnExpression("'${cafe.eventing.idempotency.store:auto}'.toLowerCase() == 'auto' " +
            "|| '${cafe.eventing.idempotency.store:auto}'.toLowerCase() == 'jdbc'")
    static class JdbcProcessingRecordConfig {

        @Bean
        @ConditionalOnBean(JdbcTemplate.class)
        @ConditionalOnMissingBean(ProcessingRecordStore.class)
        public ProcessingRecordStore processingRecordStore(JdbcTemplate jdbc,
                                                           JacksonEnvelopeCodec codec,
                                                           CafeEventingProperties props) {
            return new JdbcProcessingRecordStore(jdbc, codec, props.getIdempotency().getTable());
        }
    }

    /**
     * store=memory, or store=auto without a database -> in-memory records with TTL.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "cafe.eventing.idempotency", name = "enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnExpression("'${cafe.eventing.idempotency.store:auto}'.toLowerCase() == 'auto' " +
            "|| '${cafe.eventing.idempotency.store:auto}'.toLowerCase() == 'memory'")
    static class MemoryFallbackProcessingRecordConfig {

        @Bean(destroyMethod = "close")
        @ConditionalOnMissingBean(ProcessingRecordStore.class)
        public ProcessingRecordStore processingRecordStore(CafeEventingProperties props, Environment env) {
            var idem = props.getIdempotency();
            return new InMemoryProcessingRecordStore(
                    effectiveKeyPrefix(idem.getKeyPrefix(), resolveNamespace(props, env)),
                    idem.getTtl(),
                    idem.getMaxEntries(),
                    idem.getCleanupInterval()
            );
        }
    }

    static String resolveNamespace(CafeEventingProperties props, Environment env) {
        String ns = props.getProducerName();
        if (!StringUtils.hasText(ns)) ns = env.getProperty("spring.application.name");
        if (!StringUtils.hasText(ns)) ns = "cafe";
        // Redis key friendly
        return ns.trim().replaceAll("\\s+", "_");
    }

    static String effectiveKeyPrefix(String configuredPrefix, String namespace) {
        String base = StringUtils.hasText(configuredPrefix) ? configuredPrefix.trim() : "cafe:processed";
        if (!base.endsWith(":")) base = base + ":";

        if (base.contains("{namespace}")) {
            String replaced = base.replace("{namespace}", namespace);
            return replaced.endsWith(":") ? replaced : (replaced + ":");
        }
        if (base.endsWith(namespace + ":")) return base;
        return base + namespace + ":";
    }
}
