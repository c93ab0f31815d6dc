package com.myorg.evbus.eventing;

import com.myorg.evbus.contracts.core.bus.MessageHandler;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * topic -> handlers, in registration order. Shared by every transport.
 */
public class HandlerRegistry {
    private final Map<String, CopyOnWriteArrayList<MessageHandler>> handlers = new ConcurrentHashMap<>();

    /**
     * @return false when this handler was already registered for the topic
     */
    public boolean register(String topic, MessageHandler handler) {
        return handlers.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).addIfAbsent(handler);
    }

    public List<MessageHandler> get(String topic) {
        List<MessageHandler> list = handlers.get(topic);
        return list == null ? List.of() : list;
    }

    public Set<String> topics() {
        return Set.copyOf(handlers.keySet());
    }

    public void clear() {
        handlers.clear();
    }
}
