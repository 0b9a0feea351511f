package com.myorg.cafe.eventstore.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.cafe.eventing.CafeDispatcher;
import com.myorg.cafe.eventing.CafeEventingProperties;
import com.myorg.cafe.eventing.CafePublisher;
import com.myorg.cafe.eventing.HandlerRegistry;
import com.myorg.cafe.eventing.JacksonEnvelopeCodec;
import com.myorg.cafe.eventing.autoconfig.CafeEventingAutoConfiguration;
import com.myorg.cafe.eventstore.*;
import com.myorg.cafe.eventstore.aggregate.AggregateEngineFactory;
import com.myorg.cafe.eventstore.aggregate.EventCountSnapshotPolicy;
import com.myorg.cafe.eventstore.aggregate.SnapshotPolicy;
import com.myorg.cafe.eventstore.aggregate.Snapshotter;
import com.myorg.cafe.eventstore.replay.ProjectionReplayer;
import com.myorg.cafe.eventstore.upcast.EventUpcaster;
import com.myorg.cafe.eventstore.upcast.UpcasterChain;
import com.myorg.cafe.eventstore.upcast.UpcastingEventStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.concurrent.Executor;

@Slf4j
@AutoConfiguration(
        after = CafeEventingAutoConfiguration.class,
        afterName = {
                "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
                "org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration",
                "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration"
        })
@EnableConfigurationProperties(CafeEventStoreProperties.class)
public class CafeEventStoreAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public UpcasterChain upcasterChain(ObjectProvider<EventUpcaster> upcasters) {
        return new UpcasterChain(upcasters.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public EventStore eventStore(CafeEventStoreProperties props,
                                 UpcasterChain chain,
                                 JacksonEnvelopeCodec codec,
                                 ObjectProvider<JdbcTemplate> jdbcProvider,
                                 ObjectProvider<PlatformTransactionManager> txManager) {
        return new UpcastingEventStore(rawStore(props, codec, jdbcProvider, txManager), chain);
    }

    private static EventStore rawStore(CafeEventStoreProperties props,
                                       JacksonEnvelopeCodec codec,
                                       ObjectProvider<JdbcTemplate> jdbcProvider,
                                       ObjectProvider<PlatformTransactionManager> txManager) {
        String mode = props.getStore() == null ? "auto" : props.getStore().trim().toLowerCase();
        if ("memory".equals(mode)) return new InMemoryEventStore();

        JdbcTemplate jdbc = jdbcProvider.getIfAvailable();
        if (jdbc == null) {
            if ("jdbc".equals(mode)) {
                throw new IllegalStateException("cafe.eventstore.store=jdbc but no JdbcTemplate is available");
            }
            log.warn("No JdbcTemplate found; events are kept in memory only");
            return new InMemoryEventStore();
        }

        PlatformTransactionManager tm = txManager.getIfAvailable();
        return new JdbcEventStore(jdbc, codec, tm == null ? null : new TransactionTemplate(tm),
                props.getEventTable(), props.getSnapshotTable());
    }

    @Bean
    @ConditionalOnMissingBean
    public SnapshotPolicy snapshotPolicy(CafeEventStoreProperties props) {
        var snap = props.getSnapshot();
        if (!snap.isEnabled()) return SnapshotPolicy.never();
        return new EventCountSnapshotPolicy(snap.getThresholds(), snap.getDefaultThreshold());
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "cafe.eventstore.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    public EventStoreMetrics eventStoreMetrics(MeterRegistry registry) {
        EventStoreMetrics m = new EventStoreMetrics(registry);
        m.preRegister();
        return m;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Snapshotter snapshotter(EventStore eventStore,
                                   ObjectMapper mapper,
                                   SnapshotPolicy policy,
                                   CafeEventStoreProperties props,
                                   Clock clock,
                                   ObjectProvider<EventStoreMetrics> metrics) {
        Executor executor = props.getSnapshot().isAsync() ? Snapshotter.asyncExecutor() : Runnable::run;
        return new Snapshotter(eventStore, mapper, policy, executor, clock, metrics.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public AggregateEngineFactory aggregateEngineFactory(EventStore eventStore,
                                                         CafePublisher publisher,
                                                         Snapshotter snapshotter,
                                                         ObjectMapper mapper,
                                                         CafeEventingProperties eventingProps,
                                                         Environment env,
                                                         ObjectProvider<EventStoreMetrics> metrics) {
        String producer = eventingProps.getProducerName();
        if (!StringUtils.hasText(producer)) {
            producer = env.getProperty("spring.application.name", "unknown-service");
        }
        return new AggregateEngineFactory(eventStore, publisher, snapshotter, mapper, producer, metrics.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public ProjectionReplayer projectionReplayer(EventStore eventStore,
                                                 HandlerRegistry registry,
                                                 CafeDispatcher dispatcher,
                                                 CafePublisher publisher) {
        return new ProjectionReplayer(eventStore, registry, dispatcher, publisher);
    }
}
