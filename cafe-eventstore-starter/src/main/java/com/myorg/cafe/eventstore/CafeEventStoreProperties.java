package com.myorg.cafe.eventstore;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "cafe.eventstore")
public class CafeEventStoreProperties {

    // auto: jdbc when a JdbcTemplate exists, otherwise memory
    private String store = "auto";

    private String eventTable = "cafe_domain_event";
    private String snapshotTable = "cafe_snapshot";

    private Snapshot snapshot = new Snapshot();
    private Metrics metrics = new Metrics();

    @Data
    public static class Snapshot {
        private boolean enabled = true;
        // false: snapshot on the command thread (tests)
        private boolean async = true;
        private int defaultThreshold = 100;
        private Map<String, Integer> thresholds = new LinkedHashMap<>(Map.of(
                "order", 50,
                "product", 200,
                "payment", 25
        ));
    }

    @Data
    public static class Metrics {
        private boolean enabled = true;
    }
}
