package com.myorg.evbus.eventing;

import java.lang.annotation.*;

/**
 * Marks a method of a Spring component as the consumer of a topic.
 * Supported signatures: {@code (Payload)} or {@code (BusMessage, Payload)}.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EventConsumer {
    String topic();

    // JsonNode = raw payload, anything else is converted with Jackson
    Class<?> payload() default com.fasterxml.jackson.databind.JsonNode.class;
}
