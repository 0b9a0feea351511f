package com.myorg.cafe.deadletter;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "cafe.deadletter")
public class CafeDeadLetterProperties {

    private boolean enabled = true;

    // auto: jdbc when a JdbcTemplate exists, otherwise memory
    private String store = "auto";
    private String table = "cafe_dead_letter";

    // 0 = handlers may run as long as they like
    private Duration handlerTimeout = Duration.ZERO;

    private int maxRetries = 10;
    private Duration backoffBase = Duration.ofSeconds(1);
    private Duration backoffMax = Duration.ofMinutes(10);

    // groups the scheduled loop visits; empty = every registered group
    private List<String> groups = new ArrayList<>();

    private Processor processor = new Processor();
    private Metrics metrics = new Metrics();

    @Data
    public static class Processor {
        private boolean enabled = true;
        private boolean schedulingEnabled = true;
        private Duration initialDelay = Duration.ofSeconds(60);
        private Duration fixedDelay = Duration.ofSeconds(60);
    }

    @Data
    public static class Metrics {
        private boolean enabled = true;
    }
}
