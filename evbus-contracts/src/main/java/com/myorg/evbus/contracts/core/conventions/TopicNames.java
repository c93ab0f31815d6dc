package com.myorg.evbus.contracts.core.conventions;

public final class TopicNames {
    private TopicNames() {}

    public static final String DEFAULT_DLQ_SUFFIX = ".DLQ";

    public static String requireValid(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
        return topic;
    }

    public static String deadLetterTopic(String topic, String suffix) {
        return requireValid(topic) + (suffix == null ? DEFAULT_DLQ_SUFFIX : suffix);
    }

    /**
     * Consumer group shared by every instance of one service reading one topic.
     */
    public static String consumerGroup(String clientId, String topic) {
        return clientId + "-" + requireValid(topic);
    }
}
