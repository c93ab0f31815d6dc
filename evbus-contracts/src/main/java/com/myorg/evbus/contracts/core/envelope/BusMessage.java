package com.myorg.evbus.contracts.core.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusMessage {
    private String topic;
    private JsonNode payload; // business data, exactly as published

    // trace context / correlation only, never business data
    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    public String header(String name) {
        return headers == null ? null : headers.get(name);
    }
}
