package com.myorg.cafe.observability;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "cafe.observability")
public class CafeObservabilityProperties {
    private boolean enabled = true;

    private boolean mdcEnabled = true;
    private boolean metricsEnabled = true;

    // low-cardinality tags only; eventId is never a tag
    private boolean tagProcessingGroup = true;
    private boolean tagEventType = true;
    private boolean tagOutcome = true;
}
