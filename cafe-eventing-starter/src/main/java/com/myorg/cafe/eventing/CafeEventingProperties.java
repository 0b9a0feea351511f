package com.myorg.cafe.eventing;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@NoArgsConstructor
@AllArgsConstructor
@ConfigurationProperties(prefix = "cafe.eventing")
public class CafeEventingProperties {
    // falls back to spring.application.name
    private String producerName;
    // event type without handler in a group: true=log+skip, false=throw
    private boolean ignoreUnknownEventType = true;

    private Delivery delivery = new Delivery();
    private Idempotency idempotency = new Idempotency();

    public enum DeliveryMode { SYNC, ASYNC }

    @Data
    public static class Delivery {
        // SYNC: projections run on the committing thread; ASYNC: one ordered worker per processing group
        private DeliveryMode mode = DeliveryMode.ASYNC;
        private Duration shutdownTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Idempotency {
        private boolean enabled = true;

        // auto: jdbc when a DataSource exists, otherwise memory
        // jdbc / memory / redis: forced
        private String store = "auto";

        private String table = "cafe_processing_record";

        // memory and redis only; jdbc records are kept
        private Duration ttl = Duration.ofDays(7);
        private int maxEntries = 500_000;
        private Duration cleanupInterval = Duration.ofMinutes(5);

        private String keyPrefix = "cafe:processed:";

        // fail startup when the store cannot share a transaction with the read model
        private boolean requireTransactional = false;

        private Redis redis = new Redis();

        @Data
        public static class Redis {
            private boolean enabled = true;
            private String keyPrefix = "cafe:processed:";
        }
    }
}
