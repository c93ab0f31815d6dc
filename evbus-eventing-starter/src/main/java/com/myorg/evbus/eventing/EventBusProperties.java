package com.myorg.evbus.eventing;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

@Data
@ConfigurationProperties(prefix = "evbus")
public class EventBusProperties {

    public static final String DEFAULT_CLIENT_ID = "evbus-client";

    // read once at startup; EVBUS_MODE=durable switches to the broker
    private TransportMode mode = TransportMode.STUB;

    // if empty -> spring.application.name, then DEFAULT_CLIENT_ID
    private String clientId;

    // start the bus (producer warm-up, annotated consumers) with the application context
    private boolean autoStart = true;

    private final Stub stub = new Stub();

    @Data
    public static class Stub {
        /**
         * true: publish hands the message synchronously to the handlers registered in this process.
         * false: publish accepts and discards.
         */
        private boolean loopback = true;
    }

    public String effectiveClientId(Environment env) {
        if (StringUtils.hasText(clientId)) return clientId.trim();
        String app = env.getProperty("spring.application.name");
        return StringUtils.hasText(app) ? app.trim() : DEFAULT_CLIENT_ID;
    }
}
