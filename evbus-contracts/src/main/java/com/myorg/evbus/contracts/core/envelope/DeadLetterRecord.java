package com.myorg.evbus.contracts.core.envelope;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Body of a record published to a dead-letter topic once a message permanently failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"error", "original", "attempts", "ts"})
public class DeadLetterRecord {
    private String error;
    private JsonNode original; // original payload; a text node when it could not be parsed
    private int attempts;
    private String ts; // ISO-8601

    public static DeadLetterRecord of(Throwable error, JsonNode original, int attempts, Instant at) {
        return DeadLetterRecord.builder()
                .error(describe(error))
                .original(original)
                .attempts(attempts)
                .ts(at.toString())
                .build();
    }

    private static String describe(Throwable error) {
        if (error == null) return "unknown error";
        String msg = error.getMessage();
        return (msg == null || msg.isBlank()) ? error.getClass().getName() : msg;
    }
}
