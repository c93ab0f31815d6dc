package com.myorg.evbus.contracts.core.envelope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record BusHealth(boolean ok, Map<String, Object> details) {

    public BusHealth {
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static BusHealth up(Map<String, Object> details) {
        return new BusHealth(true, details);
    }

    public static BusHealth down(Throwable error) {
        Map<String, Object> details = new LinkedHashMap<>();
        String msg = error.getMessage();
        details.put("error", msg != null ? msg : error.toString());
        return new BusHealth(false, details);
    }
}
