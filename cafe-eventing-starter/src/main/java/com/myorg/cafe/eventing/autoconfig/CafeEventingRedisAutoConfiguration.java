package com.myorg.cafe.eventing.autoconfig;

import com.myorg.cafe.eventing.CafeEventingProperties;
import com.myorg.cafe.eventing.idempotency.ProcessingRecordStore;
import com.myorg.cafe.eventing.idempotency.RedisProcessingRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.StringUtils;

/**
 * Redis-backed processing records, kept apart from {@link CafeEventingAutoConfiguration}
 * so applications without Redis on the classpath still load the starter.
 */
@Slf4j
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration")
@EnableConfigurationProperties(CafeEventingProperties.class)
@ConditionalOnClass(RedisConnectionFactory.class)
@ConditionalOnProperty(prefix = "cafe.eventing.idempotency", name = "store", havingValue = "redis")
public class CafeEventingRedisAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(StringRedisTemplate.class)
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory cf) {
        return new StringRedisTemplate(cf);
    }

    @Bean
    @ConditionalOnMissingBean(ProcessingRecordStore.class)
    public ProcessingRecordStore processingRecordStore(CafeEventingProperties props,
                                                       StringRedisTemplate redis,
                                                       Environment env) {
        var idem = props.getIdempotency();
        if (!idem.isEnabled() || !idem.getRedis().isEnabled()) {
            throw new IllegalStateException("store=redis but cafe.eventing.idempotency(.redis).enabled=false");
        }

        // redis.keyPrefix wins, falls back to idempotency.keyPrefix
        String rawPrefix = StringUtils.hasText(idem.getRedis().getKeyPrefix())
                ? idem.getRedis().getKeyPrefix()
                : idem.getKeyPrefix();
        String prefix = CafeEventingAutoConfiguration.effectiveKeyPrefix(
                rawPrefix, CafeEventingAutoConfiguration.resolveNamespace(props, env));

        log.info("Processing records in Redis under prefix {}", prefix);
        return new RedisProcessingRecordStore(redis, idem.getTtl(), prefix);
    }
}
