package com.myorg.cafe.eventstore.autoconfig;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.cafe.eventing.autoconfig.CafeEventingAutoConfiguration;
import com.myorg.cafe.eventstore.EventStore;
import com.myorg.cafe.eventstore.EventStoreMetrics;
import com.myorg.cafe.eventstore.aggregate.AggregateEngineFactory;
import com.myorg.cafe.eventstore.aggregate.EventCountSnapshotPolicy;
import com.myorg.cafe.eventstore.aggregate.SnapshotPolicy;
import com.myorg.cafe.eventstore.replay.ProjectionReplayer;
import com.myorg.cafe.eventstore.upcast.EventUpcaster;
import com.myorg.cafe.eventstore.upcast.UpcasterChain;
import com.myorg.cafe.eventstore.upcast.UpcastingEventStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class CafeEventStoreAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    CafeEventingAutoConfiguration.class,
                    CafeEventStoreAutoConfiguration.class
            ))
            .withPropertyValues("cafe.eventing.delivery.mode=sync");

    @Test
    void memoryStoreIsWrappedByTheUpcasterChain() {
        runner.withUserConfiguration(UpcasterConfig.class)
                .run(ctx -> {
                    assertThat(ctx.getBean(EventStore.class)).isInstanceOf(UpcastingEventStore.class);
                    assertThat(ctx.getBean(UpcasterChain.class).size()).isEqualTo(1);
                    assertThat(ctx).hasSingleBean(AggregateEngineFactory.class);
                    assertThat(ctx).hasSingleBean(ProjectionReplayer.class);
                    assertThat(ctx).doesNotHaveBean(EventStoreMetrics.class);
                });
    }

    @Test
    void thresholdsComeFromProperties() {
        runner.withPropertyValues("cafe.eventstore.snapshot.thresholds.order=3")
                .run(ctx -> {
                    EventCountSnapshotPolicy policy = (EventCountSnapshotPolicy) ctx.getBean(SnapshotPolicy.class);
                    assertThat(policy.thresholdFor("order")).isEqualTo(3);
                    assertThat(policy.thresholdFor("payment")).isEqualTo(25);
                });
    }

    @Test
    void metricsRegisterWhenARegistryExists() {
        runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(EventStoreMetrics.class);
                    assertThat(ctx.getBean(MeterRegistry.class).find("cafe.eventstore.appended").counter()).isNotNull();
                });
    }

    @Configuration
    static class UpcasterConfig {
        @Bean
        EventUpcaster demoUpcaster() {
            return new EventUpcaster() {
                @Override
                public String eventType() {
                    return "demo.any";
                }

                @Override
                public int sourceRevision() {
                    return 1;
                }

                @Override
                public JsonNode upcast(ObjectNode payload) {
                    return payload;
                }
            };
        }
    }
}
