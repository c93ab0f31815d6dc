package com.myorg.evbus.eventing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.evbus.contracts.core.bus.MessageHandler;
import com.myorg.evbus.contracts.core.bus.PayloadHandler;
import com.myorg.evbus.contracts.core.envelope.BusMessage;
import com.myorg.evbus.contracts.core.exception.NonRetryableException;
import lombok.EqualsAndHashCode;

/**
 * Adapts a {@link PayloadHandler} to the raw {@link MessageHandler} contract.
 * Equal for the same (type, delegate) pair so that re-registration stays a no-op.
 */
@EqualsAndHashCode(of = {"payloadType", "delegate"})
public class TypedMessageHandler<T> implements MessageHandler {

    private final Class<T> payloadType;
    private final PayloadHandler<T> delegate;
    private final ObjectMapper mapper;

    public TypedMessageHandler(Class<T> payloadType, PayloadHandler<T> delegate, ObjectMapper mapper) {
        this.payloadType = payloadType;
        this.delegate = delegate;
        this.mapper = mapper;
    }

    @Override
    public void handle(BusMessage message) throws Exception {
        delegate.handle(convert(mapper, message.getPayload(), payloadType));
    }

    /**
     * A payload that does not map to the expected type will not map on the next attempt either.
     */
    static <T> T convert(ObjectMapper mapper, JsonNode payload, Class<T> type) {
        if (type.isInstance(payload)) return type.cast(payload);
        try {
            return mapper.treeToValue(payload, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new NonRetryableException("PAYLOAD_MAPPING",
                    "Cannot map payload to " + type.getName() + ": " + e.getMessage(), e);
        }
    }
}
