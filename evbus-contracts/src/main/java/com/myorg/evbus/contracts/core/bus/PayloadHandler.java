package com.myorg.evbus.contracts.core.bus;

@FunctionalInterface
public interface PayloadHandler<T> {
    void handle(T payload) throws Exception;
}
