package com.myorg.cafe.eventing.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventing.*;
import com.myorg.cafe.eventing.idempotency.InMemoryProcessingRecordStore;
import com.myorg.cafe.eventing.idempotency.JdbcProcessingRecordStore;
import com.myorg.cafe.eventing.idempotency.ProcessingRecordStore;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CafeEventingAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    CafeEventingRedisAutoConfiguration.class,
                    CafeEventingAutoConfiguration.class
            ))
            .withPropertyValues("cafe.eventing.delivery.mode=sync");

    @Test
    void registrationsFillTheRegistryAndDeliveryReachesHandlers() {
        runner.withUserConfiguration(DemoProjectionConfig.class)
                .run(ctx -> {
                    HandlerRegistry registry = ctx.getBean(HandlerRegistry.class);
                    assertThat(registry.handles("demo", "demo.created")).isTrue();
                    assertThat(registry.resetHandler("demo")).isNotNull();

                    assertThat(ctx.getBean(CafeDispatcher.class)).isInstanceOf(IdempotentCafeDispatcher.class);
                    assertThat(ctx.getBean(ProcessingRecordStore.class)).isInstanceOf(InMemoryProcessingRecordStore.class);

                    EventEnvelope env = EventEnvelope.builder()
                            .eventId("E1")
                            .eventType("demo.created")
                            .aggregateId("D-1")
                            .payload(new ObjectMapper().createObjectNode().put("id", "D-1"))
                            .build();
                    CafePublisher publisher = ctx.getBean(CafePublisher.class);
                    publisher.publish(List.of(env));
                    publisher.publish(List.of(env));

                    assertThat(ctx.getBean(DemoProjectionConfig.class).seen).containsExactly("D-1");
                });
    }

    @Test
    void autoStorePrefersJdbcWhenADatabaseIsPresent() {
        runner.withUserConfiguration(JdbcConfig.class)
                .run(ctx -> assertThat(ctx.getBean(ProcessingRecordStore.class))
                        .isInstanceOf(JdbcProcessingRecordStore.class));
    }

    @Test
    void forcedMemoryStoreIgnoresTheDatabase() {
        runner.withUserConfiguration(JdbcConfig.class)
                .withPropertyValues("cafe.eventing.idempotency.store=memory")
                .run(ctx -> assertThat(ctx.getBean(ProcessingRecordStore.class))
                        .isInstanceOf(InMemoryProcessingRecordStore.class));
    }

    @Test
    void disabledIdempotencyLeavesThePlainDispatcher() {
        runner.withPropertyValues("cafe.eventing.idempotency.enabled=false")
                .run(ctx -> {
                    assertThat(ctx).doesNotHaveBean(ProcessingRecordStore.class);
                    assertThat(ctx.getBean(CafeDispatcher.class)).isInstanceOf(DefaultCafeDispatcher.class);
                });
    }

    @Test
    void keyPrefixIsNamespacedOnce() {
        assertThat(CafeEventingAutoConfiguration.effectiveKeyPrefix("cafe:processed", "shop")).isEqualTo("cafe:processed:shop:");
        assertThat(CafeEventingAutoConfiguration.effectiveKeyPrefix("cafe:processed:shop:", "shop")).isEqualTo("cafe:processed:shop:");
        assertThat(CafeEventingAutoConfiguration.effectiveKeyPrefix("x:{namespace}", "shop")).isEqualTo("x:shop:");
    }

    @Configuration
    static class DemoProjectionConfig {
        final List<String> seen = new ArrayList<>();

        @Bean
        ProjectionRegistration demoProjection() {
            return registry -> {
                registry.register("demo", "demo.created", Map.class, (env, p) -> seen.add(String.valueOf(p.get("id"))));
                registry.registerReset("demo", seen::clear);
            };
        }
    }

    @Configuration
    static class JdbcConfig {
        @Bean
        JdbcTemplate jdbcTemplate() {
            JdbcDataSource ds = new JdbcDataSource();
            ds.setURL("jdbc:h2:mem:autoconfig;DB_CLOSE_DELAY=-1");
            return new JdbcTemplate(ds);
        }
    }
}
