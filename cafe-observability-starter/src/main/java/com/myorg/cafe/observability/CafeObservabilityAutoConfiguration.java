package com.myorg.cafe.observability;

import com.myorg.cafe.eventing.CafeDispatcher;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.core.Ordered;
import org.springframework.core.env.Environment;

@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(CafeDispatcher.class)
@EnableConfigurationProperties(CafeObservabilityProperties.class)
public class CafeObservabilityAutoConfiguration {

    @Bean
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    public CafeMetrics cafeMetrics(MeterRegistry registry, Environment env, CafeObservabilityProperties props) {
        String app = env.getProperty("spring.application.name", "unknown-service");
        return new CafeMetrics(registry, app, props);
    }

    /**
     * Pre-register meters at startup so /actuator/metrics/<name> never returns 404.
     */
    @Bean
    public SmartLifecycle cafeMetricsPreRegisterLifecycle(
            CafeObservabilityProperties props,
            ObjectProvider<CafeMetrics> metricsProvider
    ) {
        return new SmartLifecycle() {
            private boolean running = false;

            @Override public void start() {
                if (props.isEnabled() && props.isMetricsEnabled()) {
                    CafeMetrics m = metricsProvider.getIfAvailable();
                    if (m != null) m.preRegisterBaseMeters();
                }
                running = true;
            }

            @Override public void stop() { running = false; }
            @Override public boolean isRunning() { return running; }
            @Override public int getPhase() { return Integer.MIN_VALUE; } // start very early
        };
    }

    @Bean
    public static BeanPostProcessor observingDispatcherBpp(
            ObjectProvider<CafeObservabilityProperties> propsProvider,
            ObjectProvider<CafeMetrics> metricsProvider
    ) {
        return new ObservingDispatcherPostProcessor(propsProvider, metricsProvider);
    }

    // wraps last, i.e. outside idempotency and dead-letter sequencing
    static final class ObservingDispatcherPostProcessor implements BeanPostProcessor, Ordered {
        private final ObjectProvider<CafeObservabilityProperties> propsProvider;
        private final ObjectProvider<CafeMetrics> metricsProvider;

        ObservingDispatcherPostProcessor(ObjectProvider<CafeObservabilityProperties> propsProvider,
                                         ObjectProvider<CafeMetrics> metricsProvider) {
            this.propsProvider = propsProvider;
            this.metricsProvider = metricsProvider;
        }

        @Override
        public Object postProcessAfterInitialization(Object bean, String beanName) {
            if (!(bean instanceof CafeDispatcher dispatcher)) return bean;
            if (bean instanceof ObservingCafeDispatcher) return bean;

            CafeObservabilityProperties props = propsProvider.getObject();
            if (!props.isEnabled()) return bean;
            return new ObservingCafeDispatcher(dispatcher, props, metricsProvider.getIfAvailable());
        }

        @Override
        public int getOrder() {
            return Ordered.LOWEST_PRECEDENCE - 100;
        }
    }
}
