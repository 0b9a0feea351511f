package com.myorg.cafe.deadletter.autoconfig;

import com.myorg.cafe.deadletter.*;
import com.myorg.cafe.eventing.AggregateIdExtractor;
import com.myorg.cafe.eventing.CafeDispatcher;
import com.myorg.cafe.eventing.HandlerRegistry;
import com.myorg.cafe.eventing.JacksonEnvelopeCodec;
import com.myorg.cafe.eventing.autoconfig.CafeEventingAutoConfiguration;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Slf4j
@AutoConfiguration(
        after = CafeEventingAutoConfiguration.class,
        afterName = {
                "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
                "org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration"
        })
@ConditionalOnProperty(prefix = "cafe.deadletter", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CafeDeadLetterProperties.class)
public class CafeDeadLetterAutoConfiguration {

    /** Runs before the observability wrapper so sequencing sits inside it. */
    public static final int DISPATCHER_WRAP_ORDER = Ordered.HIGHEST_PRECEDENCE + 100;

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterQueue deadLetterQueue(CafeDeadLetterProperties props,
                                           JacksonEnvelopeCodec codec,
                                           ObjectProvider<JdbcTemplate> jdbcProvider) {
        String mode = props.getStore() == null ? "auto" : props.getStore().trim().toLowerCase();
        if ("memory".equals(mode)) return new InMemoryDeadLetterQueue();

        JdbcTemplate jdbc = jdbcProvider.getIfAvailable();
        if (jdbc == null) {
            if ("jdbc".equals(mode)) {
                throw new IllegalStateException("cafe.deadletter.store=jdbc but no JdbcTemplate is available");
            }
            log.warn("No JdbcTemplate found; dead letters are kept in memory only");
            return new InMemoryDeadLetterQueue();
        }
        return new JdbcDeadLetterQueue(jdbc, codec, props.getTable());
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "cafe.deadletter.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    public DeadLetterMetrics deadLetterMetrics(MeterRegistry registry, DeadLetterQueue queue) {
        DeadLetterMetrics m = new DeadLetterMetrics(registry, queue);
        m.preRegister();
        return m;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public DeadLetterSequencer deadLetterSequencer(DeadLetterQueue queue,
                                                   CafeDeadLetterProperties props,
                                                   Clock clock,
                                                   ObjectProvider<DeadLetterHooks> hooks,
                                                   ObjectProvider<DeadLetterMetrics> metrics) {
        return new DeadLetterSequencer(queue, props, clock, hooks.getIfAvailable(), metrics.getIfAvailable());
    }

    @Bean
    public static BeanPostProcessor sequencingDispatcherBpp(
            ObjectProvider<DeadLetterSequencer> sequencerProvider,
            ObjectProvider<AggregateIdExtractor> idExtractorProvider
    ) {
        return new SequencingDispatcherPostProcessor(sequencerProvider, idExtractorProvider);
    }

    static final class SequencingDispatcherPostProcessor implements BeanPostProcessor, Ordered {
        private final ObjectProvider<DeadLetterSequencer> sequencerProvider;
        private final ObjectProvider<AggregateIdExtractor> idExtractorProvider;

        SequencingDispatcherPostProcessor(ObjectProvider<DeadLetterSequencer> sequencerProvider,
                                          ObjectProvider<AggregateIdExtractor> idExtractorProvider) {
            this.sequencerProvider = sequencerProvider;
            this.idExtractorProvider = idExtractorProvider;
        }

        @Override
        public Object postProcessAfterInitialization(Object bean, String beanName) {
            if (!(bean instanceof CafeDispatcher dispatcher)) return bean;
            if (bean instanceof SequencingCafeDispatcher) return bean;

            DeadLetterSequencer sequencer = sequencerProvider.getObject();
            sequencer.attach(dispatcher);
            return new SequencingCafeDispatcher(dispatcher, sequencer, idExtractorProvider.getObject());
        }

        @Override
        public int getOrder() {
            return DISPATCHER_WRAP_ORDER;
        }
    }

    @Bean("cafeDeadLetterSchedule")
    @ConditionalOnMissingBean(name = "cafeDeadLetterSchedule")
    public DeadLetterScheduleValues cafeDeadLetterSchedule(CafeDeadLetterProperties props) {
        return new DeadLetterScheduleValues(props);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "cafe.deadletter.processor", name = "enabled", havingValue = "true", matchIfMissing = true)
    public DeadLetterProcessor deadLetterProcessor(DeadLetterSequencer sequencer,
                                                   HandlerRegistry registry,
                                                   CafeDeadLetterProperties props) {
        return new DeadLetterProcessor(sequencer, registry, props);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "cafe.deadletter.processor", name = "scheduling-enabled", havingValue = "true", matchIfMissing = true)
    @EnableScheduling
    static class SchedulingConfig {
    }
}
