package com.myorg.evbus.observability;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "evbus.observability")
public class ObservabilityProperties {
    private boolean enabled = true;

    private boolean metricsEnabled = true;
    private boolean healthEnabled = true;

    // topic names are bounded; never tag payload values
    private boolean tagTopic = true;
    private boolean tagException = true;
}
